package com.repstack.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiEmbeddingClientTest {

    MockWebServer server;

    OpenAiEmbeddingClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new OpenAiEmbeddingClient("test-key", server.url("/v1/embeddings").toString(),
                "text-embedding-3-small", 2000, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void returns_the_first_vector() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"data\": [{\"embedding\": [0.25, -0.5, 1.0]}]}"));

        float[] vector = client.embed("hip hinge");

        assertThat(vector).containsExactly(0.25f, -0.5f, 1.0f);
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer test-key");
        assertThat(recorded.getBody().readUtf8()).contains("\"input\":\"hip hinge\"");
    }

    @Test
    void http_error_yields_null() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThat(client.embed("anything")).isNull();
    }

    @Test
    void blank_text_is_not_sent() {
        assertThat(client.embed("  ")).isNull();
        assertThat(server.getRequestCount()).isZero();
    }
}
