package com.example.notebookengine.invoker;

import com.example.notebookengine.config.EngineProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class LlmClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private EngineProperties properties;
    private LlmClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new EngineProperties();
        properties.getLlm().setBaseUrl(server.url("/v1/").toString());
        properties.getLlm().setApiKey("test-key");
        properties.getLlm().setModel("default-model");
        client = new LlmClient(properties, objectMapper, new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void postsChatCompletionAndReturnsContent() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"42 rows\"}}]}"));

        String text = client.complete("be brief", "count rows", null);

        assertEquals("42 rows", text);
        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/chat/completions", request.getPath());
        assertEquals("Bearer test-key", request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("default-model", body.get("model").asText());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
        assertEquals("count rows", body.get("messages").get(1).get("content").asText());
    }

    @Test
    void explicitModelOverridesDefault() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"choices\":[]}"));

        assertEquals("", client.complete(null, "hi", "critic-model"));
        JsonNode body = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals("critic-model", body.get("model").asText());
        assertEquals(1, body.get("messages").size());
    }

    @Test
    void errorStatusRaisesIOException() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"rate limited\"}"));

        IOException e = assertThrows(IOException.class, () -> client.complete(null, "hi", null));
        assertTrue(e.getMessage().contains("429"));
    }

    @Test
    void configuredOnlyWithApiKey() {
        assertTrue(client.isConfigured());
        properties.getLlm().setApiKey("  ");
        assertFalse(client.isConfigured());
    }
}
