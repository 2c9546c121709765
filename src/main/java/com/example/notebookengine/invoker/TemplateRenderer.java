package com.example.notebookengine.invoker;

import com.example.notebookengine.engine.VariableContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{key}}} placeholders in cell content against the run's variables.
 * {@code {{prev}}} is the previous cell's output; unknown keys are left as they are.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateRenderer {

    public static final String PREV = "prev";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*}}");
    private static final Pattern JSON_BLOCK = Pattern.compile("```json\\s*([\\s\\S]*?)\\s*```");

    private final ObjectMapper objectMapper;

    public String render(String content, Map<String, Object> variables) {
        if (content == null || content.isEmpty() || variables == null || variables.isEmpty()) {
            return content;
        }
        Matcher matcher = PLACEHOLDER.matcher(content);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String lookup = PREV.equals(key) ? VariableContext.LAST_OUTPUT : key;
            Object value = variables.get(lookup);
            String replacement = value != null ? stringify(value) : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Extract structured data from model text: a fenced json block, or the whole
     * text when it looks like a JSON object or array.
     */
    public Optional<Object> extractJson(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String candidate = null;
        Matcher block = JSON_BLOCK.matcher(text);
        if (block.find()) {
            candidate = block.group(1);
        } else {
            String trimmed = text.trim();
            if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
                candidate = trimmed;
            }
        }
        if (candidate == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(candidate, Object.class));
        } catch (JsonProcessingException e) {
            log.debug("Output is not valid JSON, keeping text: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String stringify(Object value) {
        if (value instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize variable of type {}: {}", value.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(value);
        }
    }
}
