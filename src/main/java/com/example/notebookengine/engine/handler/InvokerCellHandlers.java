package com.example.notebookengine.engine.handler;

import com.example.notebookengine.engine.ToolInvoker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The cell types whose work is done by the {@link ToolInvoker}.
 */
@Configuration
public class InvokerCellHandlers {

    @Bean
    public CellHandler commandCellHandler(ToolInvoker toolInvoker) {
        return new InvokerCellHandler("command", "Natural language command to execute", toolInvoker);
    }

    @Bean
    public CellHandler queryCellHandler(ToolInvoker toolInvoker) {
        return new InvokerCellHandler("query", "Data retrieval query", toolInvoker);
    }

    @Bean
    public CellHandler transformCellHandler(ToolInvoker toolInvoker) {
        return new InvokerCellHandler("transform", "Data transformation", toolInvoker);
    }

    @Bean
    public CellHandler visualizeCellHandler(ToolInvoker toolInvoker) {
        return new InvokerCellHandler("visualize", "Chart, table or document generation", toolInvoker);
    }

    @Bean
    public CellHandler conditionCellHandler(ToolInvoker toolInvoker) {
        return new InvokerCellHandler("condition", "Condition evaluated to true or false", toolInvoker);
    }
}
