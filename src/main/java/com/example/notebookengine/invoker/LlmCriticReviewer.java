package com.example.notebookengine.invoker;

import com.example.notebookengine.config.EngineProperties;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.engine.CriticReview;
import com.example.notebookengine.engine.CriticReviewer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Critic backed by the language model. Enabled with {@code notebook-engine.critic.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "notebook-engine.critic", name = "enabled", havingValue = "true")
public class LlmCriticReviewer implements CriticReviewer {

    private final LlmClient llmClient;
    private final TemplateRenderer renderer;
    private final ObjectMapper objectMapper;
    private final EngineProperties properties;

    @Override
    public CriticReview review(NotebookCell cell, Object output) {
        String prompt = "Cell type: " + cell.getCellType() + "\n"
                + "Request:\n" + (cell.getContent() != null ? cell.getContent() : "") + "\n\n"
                + "Output:\n" + asText(output);
        try {
            String text = llmClient.complete(CellPrompts.CRITIC, prompt, properties.getCritic().getModel());
            return parseReview(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Critic request failed", e);
        }
    }

    /**
     * Parse the model's JSON verdict. Confidence is clamped to 0..100.
     *
     * @throws IllegalArgumentException if the text carries no JSON object
     */
    CriticReview parseReview(String text) {
        JsonNode root = renderer.extractJson(text)
                .map(json -> (JsonNode) objectMapper.valueToTree(json))
                .filter(JsonNode::isObject)
                .orElseThrow(() -> new IllegalArgumentException("Critic response is not a JSON object"));

        return CriticReview.builder()
                .approved(root.path("approved").asBoolean(false))
                .confidence(Math.max(0, Math.min(100, root.path("confidence").asInt(0))))
                .issues(strings(root.path("issues")))
                .suggestions(strings(root.path("suggestions")))
                .reasoning(root.path("reasoning").isMissingNode() ? null : root.path("reasoning").asText())
                .build();
    }

    private List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> values.add(n.asText()));
        }
        return values;
    }

    private String asText(Object output) {
        if (output == null) {
            return "(no output)";
        }
        if (output instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(output);
        } catch (IOException e) {
            log.debug("Could not serialize output for review: {}", e.getMessage());
            return String.valueOf(output);
        }
    }
}
