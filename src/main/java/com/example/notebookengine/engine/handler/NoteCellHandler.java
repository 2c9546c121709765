package com.example.notebookengine.engine.handler;

import com.example.notebookengine.domain.NotebookCell;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Markdown note. Nothing to execute; completes without output.
 */
@Component
public class NoteCellHandler implements CellHandler {

    @Override
    public String getCellType() {
        return "note";
    }

    @Override
    public String getDescription() {
        return "Markdown note (no execution)";
    }

    @Override
    public CellOutcome handle(NotebookCell cell, Map<String, Object> variables) {
        return CellOutcome.completed(null);
    }
}
