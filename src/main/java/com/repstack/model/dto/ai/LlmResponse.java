package com.repstack.model.dto.ai;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * Outcome of one generative call. Failures are values, not exceptions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LlmResponse {

    private boolean success;

    private String text;

    private ToolCall toolCall;

    private String error;

    public static LlmResponse text(String text) {
        return new LlmResponse(true, text, null, null);
    }

    public static LlmResponse toolCall(ToolCall call) {
        return new LlmResponse(true, null, call, null);
    }

    public static LlmResponse failure(String error) {
        return new LlmResponse(false, null, null, error);
    }

    public boolean isToolCall() {
        return success && toolCall != null;
    }

    public boolean hasText() {
        return success && StringUtils.isNotBlank(text);
    }
}
