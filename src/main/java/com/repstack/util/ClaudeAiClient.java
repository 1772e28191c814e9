package com.repstack.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.model.dto.ai.LlmMessage;
import com.repstack.model.dto.ai.LlmRequest;
import com.repstack.model.dto.ai.LlmResponse;
import com.repstack.model.dto.ai.ToolCall;
import com.repstack.model.dto.ai.ToolSpec;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Anthropic Messages API client
 */
@Slf4j
@Component
public class ClaudeAiClient implements LlmGateway {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json; charset=utf-8");
    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1/messages";
    private static final String API_VERSION = "2023-06-01";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String defaultModel;
    private final int defaultMaxTokens;
    private final double defaultTemperature;

    @Autowired
    public ClaudeAiClient(@Value("${engine.llm.api-key:}") String apiKeyFromConfig,
                          @Value("${engine.llm.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl,
                          @Value("${engine.llm.model:claude-3-5-sonnet-20241022}") String defaultModel,
                          @Value("${engine.llm.max-tokens:4096}") int defaultMaxTokens,
                          @Value("${engine.llm.temperature:0.7}") double defaultTemperature,
                          @Value("${engine.llm.timeout.connect-ms:5000}") long connectTimeoutMs,
                          @Value("${engine.llm.timeout.read-ms:60000}") long readTimeoutMs,
                          @Value("${engine.llm.timeout.write-ms:20000}") long writeTimeoutMs,
                          @Value("${engine.llm.timeout.call-ms:90000}") long callTimeoutMs,
                          ObjectMapper objectMapper) {
        this(apiKeyFromConfig, baseUrl, defaultModel, defaultMaxTokens, defaultTemperature,
                connectTimeoutMs, readTimeoutMs, writeTimeoutMs, callTimeoutMs, objectMapper, System::getenv);
    }

    /**
     * @param env environment lookup used when no key is configured
     */
    ClaudeAiClient(String apiKeyFromConfig, String baseUrl, String defaultModel,
                   int defaultMaxTokens, double defaultTemperature,
                   long connectTimeoutMs, long readTimeoutMs, long writeTimeoutMs, long callTimeoutMs,
                   ObjectMapper objectMapper, UnaryOperator<String> env) {
        this.objectMapper = objectMapper;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(writeTimeoutMs, TimeUnit.MILLISECONDS)
                .callTimeout(callTimeoutMs, TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();
        String finalKey = StringUtils.firstNonBlank(apiKeyFromConfig, env.apply("ANTHROPIC_API_KEY"));
        this.apiKey = StringUtils.trimToNull(finalKey);
        this.baseUrl = StringUtils.defaultIfBlank(baseUrl, DEFAULT_BASE_URL);
        this.defaultModel = defaultModel;
        this.defaultMaxTokens = defaultMaxTokens;
        this.defaultTemperature = defaultTemperature;
        if (this.apiKey == null) {
            log.warn("ClaudeAiClient has no API key (engine.llm.api-key / ANTHROPIC_API_KEY); generation will use fallbacks");
        } else {
            log.info("ClaudeAiClient initialized, baseUrl={}, model={}", this.baseUrl, this.defaultModel);
        }
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null;
    }

    @Override
    public LlmResponse generate(LlmRequest request) {
        if (!isConfigured()) {
            return LlmResponse.failure("LLM backend not configured");
        }
        String jsonBody;
        try {
            jsonBody = objectMapper.writeValueAsString(buildPayload(request));
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to build LLM request body", e);
            return LlmResponse.failure("request build failed: " + e.getMessage());
        }

        Request httpRequest = new Request.Builder()
                .url(baseUrl)
                .addHeader("x-api-key", apiKey)
                .addHeader("anthropic-version", API_VERSION)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(jsonBody, JSON_MEDIA_TYPE))
                .build();

        try (Response response = httpClient.newCall(httpRequest).execute()) {
            String responseText = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.error("LLM call failed, code={}, body={}", response.code(), StringUtils.abbreviate(responseText, 500));
                return LlmResponse.failure("HTTP " + response.code());
            }
            return parseResponse(responseText);
        } catch (IOException e) {
            // timeouts land here too; the caller falls back, there is no retry
            log.error("LLM call error: {}", e.toString());
            return LlmResponse.failure("LLM call error: " + e.getMessage());
        }
    }

    Map<String, Object> buildPayload(LlmRequest request) {
        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", StringUtils.defaultIfBlank(request.getModel(), defaultModel));
        payload.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : defaultMaxTokens);
        payload.put("temperature", request.getTemperature() != null ? request.getTemperature() : defaultTemperature);
        if (StringUtils.isNotBlank(request.getSystem())) {
            payload.put("system", request.getSystem());
        }

        List<Map<String, Object>> messages = new ArrayList<>();
        for (LlmMessage message : request.getMessages()) {
            messages.add(toApiMessage(message));
        }
        payload.put("messages", messages);

        if (request.getTools() != null && !request.getTools().isEmpty()) {
            List<Map<String, Object>> tools = new ArrayList<>();
            for (ToolSpec tool : request.getTools()) {
                Map<String, Object> t = new LinkedHashMap<>();
                t.put("name", tool.getName());
                t.put("description", tool.getDescription());
                t.put("input_schema", tool.getInputSchema());
                tools.add(t);
            }
            payload.put("tools", tools);
            if (request.isToolsDisabled()) {
                payload.put("tool_choice", Map.of("type", "none"));
            }
        }
        return payload;
    }

    private Map<String, Object> toApiMessage(LlmMessage message) {
        Map<String, Object> block = new LinkedHashMap<>();
        if (message.getToolCall() != null) {
            ToolCall call = message.getToolCall();
            block.put("type", "tool_use");
            block.put("id", call.getId());
            block.put("name", call.getName());
            block.put("input", call.getInput() != null ? call.getInput() : objectMapper.createObjectNode());
        } else if (message.getToolResultId() != null) {
            block.put("type", "tool_result");
            block.put("tool_use_id", message.getToolResultId());
            block.put("content", StringUtils.defaultString(message.getToolResult()));
        } else {
            block.put("type", "text");
            block.put("text", StringUtils.defaultString(message.getText()));
        }
        Map<String, Object> apiMessage = new LinkedHashMap<>();
        apiMessage.put("role", message.getRole());
        apiMessage.put("content", List.of(block));
        return apiMessage;
    }

    private LlmResponse parseResponse(String responseText) {
        try {
            JsonNode root = objectMapper.readTree(responseText);
            JsonNode errorNode = root.get("error");
            if (errorNode != null && !errorNode.isNull()) {
                String errorMessage = errorNode.has("message") ? errorNode.get("message").asText() : errorNode.toString();
                return LlmResponse.failure("LLM returned error: " + errorMessage);
            }
            JsonNode content = root.path("content");
            if (!content.isArray() || content.isEmpty()) {
                return LlmResponse.failure("LLM returned no content");
            }
            StringBuilder text = new StringBuilder();
            for (JsonNode block : content) {
                String type = block.path("type").asText();
                if ("tool_use".equals(type)) {
                    // a tool call wins over any accompanying text
                    return LlmResponse.toolCall(new ToolCall(
                            block.path("id").asText(),
                            block.path("name").asText(),
                            block.path("input")));
                }
                if ("text".equals(type)) {
                    text.append(block.path("text").asText());
                }
            }
            return LlmResponse.text(text.toString());
        } catch (IOException e) {
            log.error("Unparsable LLM response: {}", StringUtils.abbreviate(responseText, 500));
            return LlmResponse.failure("unparsable response");
        }
    }
}
