package com.repstack.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repstack.model.dto.ai.LlmMessage;
import com.repstack.model.dto.ai.LlmRequest;
import com.repstack.model.dto.ai.LlmResponse;
import com.repstack.model.dto.ai.ToolCall;
import com.repstack.model.dto.ai.ToolSpec;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;

class ClaudeAiClientTest {

    final ObjectMapper objectMapper = new ObjectMapper();

    MockWebServer server;

    ClaudeAiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = newClient("test-key");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private ClaudeAiClient newClient(String key) {
        return newClient(key, name -> null);
    }

    private ClaudeAiClient newClient(String key, UnaryOperator<String> env) {
        return new ClaudeAiClient(key, server.url("/v1/messages").toString(), "test-model", 1024, 0.5,
                1000, 2000, 1000, 3000, objectMapper, env);
    }

    @Test
    void text_blocks_are_concatenated() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"content": [{"type": "text", "text": "{\\"exercises\\""}, {"type": "text", "text": ": []}"}]}"""));

        LlmResponse response = client.generate(LlmRequest.of("system prompt", "make a routine"));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getText()).isEqualTo("{\"exercises\": []}");
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getHeader("x-api-key")).isEqualTo("test-key");
        assertThat(recorded.getHeader("anthropic-version")).isEqualTo("2023-06-01");
        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("test-model");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(1024);
        assertThat(body.path("system").asText()).isEqualTo("system prompt");
        assertThat(body.path("messages").get(0).path("content").get(0).path("text").asText()).isEqualTo("make a routine");
        assertThat(body.has("tools")).isFalse();
    }

    @Test
    void tool_use_block_becomes_a_tool_call() {
        server.enqueue(new MockResponse().setBody("""
                {"content": [
                  {"type": "text", "text": "Let me check the pool."},
                  {"type": "tool_use", "id": "toolu_1", "name": "search_exercises", "input": {"muscle": "chest"}}
                ]}"""));

        LlmResponse response = client.generate(LlmRequest.of("s", "u"));

        assertThat(response.isToolCall()).isTrue();
        assertThat(response.getToolCall().getId()).isEqualTo("toolu_1");
        assertThat(response.getToolCall().getName()).isEqualTo("search_exercises");
        assertThat(response.getToolCall().getInput().path("muscle").asText()).isEqualTo("chest");
    }

    @Test
    void tool_history_and_disabled_tools_are_serialized() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"content\": [{\"type\": \"text\", \"text\": \"done\"}]}"));
        ToolCall call = new ToolCall("toolu_1", "get_exercise_pool", objectMapper.createObjectNode());
        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.user("u"));
        messages.add(LlmMessage.assistantToolCall(call));
        messages.add(LlmMessage.toolResult("toolu_1", "{\"exercises\":[]}"));
        LlmRequest request = LlmRequest.builder()
                .system("s")
                .messages(messages)
                .tools(List.of(new ToolSpec("get_exercise_pool", "pool", Map.of("type", "object"))))
                .toolsDisabled(true)
                .build();

        client.generate(request);

        JsonNode body = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("tools").get(0).path("name").asText()).isEqualTo("get_exercise_pool");
        assertThat(body.path("tool_choice").path("type").asText()).isEqualTo("none");
        JsonNode toolUse = body.path("messages").get(1);
        assertThat(toolUse.path("role").asText()).isEqualTo("assistant");
        assertThat(toolUse.path("content").get(0).path("type").asText()).isEqualTo("tool_use");
        JsonNode toolResult = body.path("messages").get(2).path("content").get(0);
        assertThat(toolResult.path("type").asText()).isEqualTo("tool_result");
        assertThat(toolResult.path("tool_use_id").asText()).isEqualTo("toolu_1");
    }

    @Test
    void http_error_is_a_failure_value() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\": {\"message\": \"overloaded\"}}"));

        LlmResponse response = client.generate(LlmRequest.of("s", "u"));

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getError()).isEqualTo("HTTP 500");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void error_body_and_garbage_are_failures() {
        server.enqueue(new MockResponse().setBody("{\"error\": {\"message\": \"bad model\"}}"));
        server.enqueue(new MockResponse().setBody("<html>gateway</html>"));

        assertThat(client.generate(LlmRequest.of("s", "u")).getError()).contains("bad model");
        assertThat(client.generate(LlmRequest.of("s", "u")).getError()).isEqualTo("unparsable response");
    }

    @Test
    void missing_key_fails_without_a_request() {
        ClaudeAiClient unconfigured = newClient("");

        LlmResponse response = unconfigured.generate(LlmRequest.of("s", "u"));

        assertThat(unconfigured.isConfigured()).isFalse();
        assertThat(response.isSuccess()).isFalse();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void environment_key_is_used_when_none_is_configured() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"content\": [{\"type\": \"text\", \"text\": \"ok\"}]}"));
        ClaudeAiClient fromEnv = newClient(" ", name -> "ANTHROPIC_API_KEY".equals(name) ? "env-key" : null);

        assertThat(fromEnv.isConfigured()).isTrue();
        assertThat(fromEnv.generate(LlmRequest.of("s", "u")).getText()).isEqualTo("ok");
        assertThat(server.takeRequest().getHeader("x-api-key")).isEqualTo("env-key");
    }
}
