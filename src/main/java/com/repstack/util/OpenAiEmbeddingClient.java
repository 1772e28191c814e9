package com.repstack.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI embeddings endpoint client
 */
@Slf4j
@Component
public class OpenAiEmbeddingClient implements EmbeddingClient {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json; charset=utf-8");
    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1/embeddings";
    private static final int MAX_INPUT_CHARS = 8000;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;

    public OpenAiEmbeddingClient(@Value("${engine.embedding.api-key:}") String apiKeyFromConfig,
                                 @Value("${engine.embedding.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl,
                                 @Value("${engine.embedding.model:text-embedding-3-small}") String model,
                                 @Value("${engine.embedding.timeout-ms:10000}") long timeoutMs,
                                 ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
        this.apiKey = StringUtils.trimToNull(StringUtils.firstNonBlank(apiKeyFromConfig, System.getenv("OPENAI_API_KEY")));
        this.baseUrl = StringUtils.defaultIfBlank(baseUrl, DEFAULT_BASE_URL);
        this.model = model;
        log.info("OpenAiEmbeddingClient configured={}", isConfigured());
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null;
    }

    @Override
    public float[] embed(String text) {
        if (!isConfigured() || StringUtils.isBlank(text)) {
            return null;
        }
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("model", model);
            payload.put("input", StringUtils.left(text, MAX_INPUT_CHARS));
            Request request = new Request.Builder()
                    .url(baseUrl)
                    .addHeader("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON_MEDIA_TYPE))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    log.warn("Embedding call failed, code={}", response.code());
                    return null;
                }
                JsonNode vector = objectMapper.readTree(body).path("data").path(0).path("embedding");
                if (!vector.isArray() || vector.isEmpty()) {
                    log.warn("Embedding response carried no vector");
                    return null;
                }
                float[] result = new float[vector.size()];
                for (int i = 0; i < result.length; i++) {
                    result[i] = (float) vector.get(i).asDouble();
                }
                return result;
            }
        } catch (IOException e) {
            log.warn("Embedding call error: {}", e.getMessage());
            return null;
        }
    }
}
