package com.repstack.model.dto.ai;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One conversation turn. A turn carries either plain text, a tool call made by the assistant,
 * or the result of a tool call sent back as a user turn.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LlmMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String role;

    private String text;

    private ToolCall toolCall;

    private String toolResultId;

    private String toolResult;

    public static LlmMessage user(String text) {
        return new LlmMessage(ROLE_USER, text, null, null, null);
    }

    public static LlmMessage assistantToolCall(ToolCall call) {
        return new LlmMessage(ROLE_ASSISTANT, null, call, null, null);
    }

    public static LlmMessage toolResult(String toolCallId, String result) {
        return new LlmMessage(ROLE_USER, null, null, toolCallId, result);
    }
}
