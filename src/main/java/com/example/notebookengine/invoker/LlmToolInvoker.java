package com.example.notebookengine.invoker;

import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.engine.InvocationResult;
import com.example.notebookengine.engine.ToolInvoker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Default tool invoker: renders the cell content against the variables and sends it
 * to the language model with a system prompt chosen by cell type. Query and transform
 * cells get their output parsed as JSON when the model returns JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmToolInvoker implements ToolInvoker {

    private static final Set<String> JSON_CELL_TYPES = Set.of("query", "transform");

    private final LlmClient llmClient;
    private final TemplateRenderer renderer;

    @Override
    public InvocationResult execute(NotebookCell cell, Map<String, Object> variables) {
        if (!llmClient.isConfigured()) {
            return InvocationResult.failure("No LLM API key configured (notebook-engine.llm.api-key)");
        }
        String content = renderer.render(cell.getContent() != null ? cell.getContent() : "", variables);

        String text;
        try {
            text = llmClient.complete(CellPrompts.forCellType(cell.getCellType()), content, null);
        } catch (IOException e) {
            log.warn("LLM call for cell {} [{}] failed: {}", cell.getId(), cell.getCellIndex(), e.getMessage());
            return InvocationResult.failure("LLM request failed: " + e.getMessage());
        }

        Object output = text;
        String outputType = "text";
        if (JSON_CELL_TYPES.contains(cell.getCellType())) {
            Optional<Object> json = renderer.extractJson(text);
            if (json.isPresent()) {
                output = json.get();
                outputType = "json";
            }
        }

        return InvocationResult.builder()
                .output(output)
                .outputType(outputType)
                .reasoning(String.format("Processed %s cell with %d chars input", cell.getCellType(), content.length()))
                .toolsUsed(new ArrayList<>())
                .build();
    }
}
