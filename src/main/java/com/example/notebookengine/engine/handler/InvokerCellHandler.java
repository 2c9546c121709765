package com.example.notebookengine.engine.handler;

import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.engine.InvocationResult;
import com.example.notebookengine.engine.ToolInvoker;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Delegates the cell's work to the {@link ToolInvoker}. Invoker exceptions are
 * turned into an error outcome for the cell.
 */
@Slf4j
public class InvokerCellHandler implements CellHandler {

    private final String cellType;
    private final String description;
    private final ToolInvoker toolInvoker;

    public InvokerCellHandler(String cellType, String description, ToolInvoker toolInvoker) {
        this.cellType = cellType;
        this.description = description;
        this.toolInvoker = toolInvoker;
    }

    @Override
    public String getCellType() {
        return cellType;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public CellOutcome handle(NotebookCell cell, Map<String, Object> variables) {
        InvocationResult result;
        try {
            result = toolInvoker.execute(cell, variables);
        } catch (RuntimeException e) {
            log.warn("Tool invoker failed on cell {} [{}]: {}", cell.getId(), cell.getCellIndex(), e.getMessage());
            return CellOutcome.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        if (result == null) {
            return CellOutcome.error("Tool invoker returned no result");
        }
        return CellOutcome.from(result);
    }
}
