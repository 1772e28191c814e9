package com.repstack.service.component;

import com.repstack.model.dto.ai.LlmMessage;
import com.repstack.model.dto.ai.LlmRequest;
import com.repstack.model.dto.ai.LlmResponse;
import com.repstack.model.dto.ai.RoutinePromptContext;
import com.repstack.model.dto.ai.ToolCall;
import com.repstack.service.manager.RoutinePromptManager;
import com.repstack.util.LlmGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded tool-use conversation: at most maxIterations tool-enabled calls,
 * then one forced call without tools.
 */
@Slf4j
@Component
public class ToolCallingLoop {

    private final LlmGateway llmGateway;
    private final RoutineToolExecutor toolExecutor;
    private final int maxIterations;

    public ToolCallingLoop(LlmGateway llmGateway,
                           RoutineToolExecutor toolExecutor,
                           @Value("${engine.generation.max-tool-iterations:10}") int maxIterations) {
        this.llmGateway = llmGateway;
        this.toolExecutor = toolExecutor;
        this.maxIterations = Math.max(1, maxIterations);
    }

    /**
     * @return the final text response, or the first failed response
     */
    public LlmResponse run(String systemPrompt, String userPrompt, RoutinePromptContext ctx) {
        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.user(userPrompt));

        int iterations = 0;
        while (iterations < maxIterations) {
            LlmResponse response = llmGateway.generate(LlmRequest.builder()
                    .system(systemPrompt)
                    .messages(messages)
                    .tools(toolExecutor.toolSpecs())
                    .build());
            iterations++;

            if (!response.isSuccess()) {
                log.warn("Tool loop invocation {} failed: {}", iterations, response.getError());
                return response;
            }
            if (!response.isToolCall()) {
                if (response.hasText()) {
                    log.info("Tool loop finished after {} invocation(s)", iterations);
                    return response;
                }
                // blank answer, force a final one below
                log.warn("Model stalled with an empty answer after {} invocation(s)", iterations);
                break;
            }

            ToolCall call = response.getToolCall();
            String result = toolExecutor.execute(call, ctx);
            log.debug("Tool {} executed, iteration={}", call.getName(), iterations);
            messages.add(LlmMessage.assistantToolCall(call));
            messages.add(LlmMessage.toolResult(call.getId(), result));
        }

        log.info("Forcing final answer without tools after {} invocation(s)", iterations);
        messages.add(LlmMessage.user(RoutinePromptManager.FINAL_ANSWER_INSTRUCTION));
        return llmGateway.generate(LlmRequest.builder()
                .system(systemPrompt)
                .messages(messages)
                .tools(toolExecutor.toolSpecs())
                .toolsDisabled(true)
                .build());
    }
}
