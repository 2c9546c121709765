package com.example.notebookengine.support;

import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.engine.InvocationResult;
import com.example.notebookengine.engine.ToolInvoker;
import com.example.notebookengine.invoker.TemplateRenderer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Deterministic tool invoker for tests. Behaviour is driven by the cell content:
 * <ul>
 *   <li>{@code FAIL...} reports a failure with the content as message</li>
 *   <li>{@code THROW...} throws an IllegalStateException</li>
 *   <li>{@code BLOCK} signals {@link #awaitBlocked()} and waits for {@link #release()}</li>
 *   <li>anything else succeeds with {@code "out:" + rendered content}</li>
 * </ul>
 * The variables seen by each cell index are recorded.
 */
public class ScriptedToolInvoker implements ToolInvoker {

    private final TemplateRenderer renderer;
    private final Map<Integer, Map<String, Object>> seenVariables = new ConcurrentHashMap<>();
    private volatile CountDownLatch blocked = new CountDownLatch(1);
    private volatile CountDownLatch released = new CountDownLatch(1);

    public ScriptedToolInvoker(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public InvocationResult execute(NotebookCell cell, Map<String, Object> variables) {
        seenVariables.put(cell.getCellIndex(), variables);
        String content = cell.getContent() != null ? cell.getContent() : "";
        if (content.startsWith("FAIL")) {
            return InvocationResult.failure(content);
        }
        if (content.startsWith("THROW")) {
            throw new IllegalStateException("invoker exploded");
        }
        if (content.equals("BLOCK")) {
            blocked.countDown();
            try {
                if (!released.await(10, TimeUnit.SECONDS)) {
                    return InvocationResult.failure("never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return InvocationResult.failure("interrupted");
            }
            return InvocationResult.success("out:BLOCK");
        }
        return InvocationResult.success("out:" + renderer.render(content, variables));
    }

    public Map<String, Object> variablesSeenBy(int cellIndex) {
        return seenVariables.get(cellIndex);
    }

    public boolean awaitBlocked() throws InterruptedException {
        return blocked.await(10, TimeUnit.SECONDS);
    }

    public void release() {
        released.countDown();
    }

    public void reset() {
        seenVariables.clear();
        released.countDown();
        blocked = new CountDownLatch(1);
        released = new CountDownLatch(1);
    }
}
