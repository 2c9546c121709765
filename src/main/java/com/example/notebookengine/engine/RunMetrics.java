package com.example.notebookengine.engine;

import com.example.notebookengine.domain.NotebookCell.CellStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for notebook runs and cell executions.
 */
@Component
@RequiredArgsConstructor
public class RunMetrics {

    static final String RUNS_TOTAL = "notebook.runs.total";
    static final String RUN_DURATION = "notebook.run.duration";
    static final String CELLS_TOTAL = "notebook.cells.total";
    static final String CELL_DURATION = "notebook.cell.duration";

    private final MeterRegistry meterRegistry;

    public void recordRun(RunOutcome outcome, String triggerType, long durationMs) {
        Counter.builder(RUNS_TOTAL)
                .tag("outcome", outcome.name())
                .tag("trigger", triggerType != null ? triggerType : "unknown")
                .register(meterRegistry)
                .increment();
        Timer.builder(RUN_DURATION)
                .tag("outcome", outcome.name())
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordCell(String cellType, CellStatus status, long durationMs) {
        Counter.builder(CELLS_TOTAL)
                .tag("type", cellType)
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
        Timer.builder(CELL_DURATION)
                .tag("type", cellType)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
