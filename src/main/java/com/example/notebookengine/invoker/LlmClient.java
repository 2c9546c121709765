package com.example.notebookengine.invoker;

import com.example.notebookengine.config.EngineProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Minimal client for an OpenAI-compatible chat completions endpoint.
 * One system message, one user message, text back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClient {

    private static final MediaType JSON = MediaType.get("application/json");

    private final EngineProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    public boolean isConfigured() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Send a single-turn completion request.
     *
     * @param model model name, or null for the configured default
     * @return the assistant's text, empty if the response carried none
     * @throws IOException on transport failure or a non-2xx response
     */
    public String complete(String systemPrompt, String prompt, String model) throws IOException {
        String requestBody = buildRequestBody(systemPrompt, prompt, model);
        Request request = new Request.Builder()
                .url(getApiUrl())
                .addHeader("Authorization", "Bearer " + properties.getLlm().getApiKey())
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(requestBody, JSON))
                .build();

        log.debug("LLM request: model={}, prompt {} chars", model, prompt.length());
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.error("LLM API error: {} - {}", response.code(), body);
                throw new IOException("LLM API returned " + response.code());
            }
            return parseResponse(body);
        }
    }

    private String getApiUrl() {
        String baseUrl = properties.getLlm().getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + "/chat/completions";
    }

    private String buildRequestBody(String systemPrompt, String prompt, String model) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model != null && !model.isBlank() ? model : properties.getLlm().getModel());
        root.put("temperature", properties.getLlm().getTemperature());
        root.put("max_tokens", properties.getLlm().getMaxTokens());

        ArrayNode messages = root.putArray("messages");
        if (systemPrompt != null) {
            messages.addObject().put("role", "system").put("content", systemPrompt);
        }
        messages.addObject().put("role", "user").put("content", prompt);
        return objectMapper.writeValueAsString(root);
    }

    private String parseResponse(String responseBody) throws IOException {
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode choices = root.get("choices");
        if (choices == null || choices.isEmpty()) {
            return "";
        }
        JsonNode message = choices.get(0).get("message");
        if (message == null || !message.has("content") || message.get("content").isNull()) {
            return "";
        }
        return message.get("content").asText();
    }
}
