package com.example.notebookengine.engine.handler;

import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.engine.InvocationResult;
import com.example.notebookengine.engine.ToolInvoker;
import com.example.notebookengine.exception.StateException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CellHandlerRegistryTest {

    private final CellHandlerRegistry registry = new CellHandlerRegistry();

    @Test
    void registersAndListsHandlersSortedByType() {
        ToolInvoker invoker = mock(ToolInvoker.class);
        registry.register(new InvokerCellHandler("query", "Query data", invoker));
        registry.register(new ApprovalCellHandler());
        registry.register(new NoteCellHandler());

        assertEquals(3, registry.getHandlerCount());
        assertEquals(List.of("approve", "note", "query"), List.copyOf(registry.listCellTypes().keySet()));
        assertTrue(registry.supports("query"));
        assertFalse(registry.supports("sql"));
        assertFalse(registry.supports(null));
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        NoteCellHandler first = new NoteCellHandler();
        NoteCellHandler second = new NoteCellHandler();
        registry.register(first);
        registry.register(second);

        assertSame(second, registry.getHandler("note").orElseThrow());
        assertEquals(1, registry.getHandlerCount());
    }

    @Test
    void unregisterRemovesType() {
        registry.register(new NoteCellHandler());
        registry.unregister("note");

        assertTrue(registry.getHandler("note").isEmpty());
    }

    @Test
    void approvalHandlerSuspendsAndIsNeverHandled() {
        ApprovalCellHandler handler = new ApprovalCellHandler();

        assertTrue(handler.suspendsRun());
        assertThrows(StateException.class, () -> handler.handle(new NotebookCell(), Map.of()));
    }

    @Test
    void invokerHandlerMapsResults() {
        ToolInvoker invoker = mock(ToolInvoker.class);
        InvokerCellHandler handler = new InvokerCellHandler("command", "Run a command", invoker);
        NotebookCell cell = NotebookCell.builder().id("c1").content("ls").build();

        when(invoker.execute(any(), anyMap())).thenReturn(InvocationResult.success("done"));
        CellOutcome ok = handler.handle(cell, Map.of());
        assertTrue(ok.isSuccess());
        assertEquals("done", ok.getOutput());

        when(invoker.execute(any(), anyMap())).thenReturn(InvocationResult.failure("bad input"));
        CellOutcome failed = handler.handle(cell, Map.of());
        assertFalse(failed.isSuccess());
        assertEquals("bad input", failed.getError());
    }

    @Test
    void invokerExceptionsAndMissingResultsBecomeErrors() {
        ToolInvoker invoker = mock(ToolInvoker.class);
        InvokerCellHandler handler = new InvokerCellHandler("command", "Run a command", invoker);
        NotebookCell cell = NotebookCell.builder().id("c1").content("ls").build();

        when(invoker.execute(any(), anyMap())).thenThrow(new IllegalStateException("boom"));
        assertEquals("boom", handler.handle(cell, Map.of()).getError());

        InvokerCellHandler nullHandler = new InvokerCellHandler("command", "Run a command", (c, vars) -> null);
        assertEquals("Tool invoker returned no result", nullHandler.handle(cell, Map.of()).getError());
    }

    @Test
    void noteCellCompletesWithoutOutput() {
        CellOutcome outcome = new NoteCellHandler().handle(new NotebookCell(), Map.of());

        assertTrue(outcome.isSuccess());
        assertNull(outcome.getOutput());
    }
}
