package com.repstack.model.dto.ai;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class LlmRequest {

    private String system;

    @Builder.Default
    private List<LlmMessage> messages = new ArrayList<>();

    /**
     * null or empty disables function calling
     */
    private List<ToolSpec> tools;

    /**
     * tools stay declared (earlier turns reference them) but the model may not call any
     */
    private boolean toolsDisabled;

    /**
     * overrides the configured model when set
     */
    private String model;

    private Integer maxTokens;

    private Double temperature;

    public static LlmRequest of(String system, String prompt) {
        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.user(prompt));
        return LlmRequest.builder().system(system).messages(messages).build();
    }
}
