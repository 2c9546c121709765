package com.example.notebookengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * History record of one run invocation, from its start (or resume) to the
 * point it paused or finished. Never consulted for control flow.
 */
@Entity
@Table(name = "notebook_runs", indexes = {
        @Index(name = "idx_run_notebook", columnList = "notebook_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotebookRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "notebook_id", nullable = false)
    private String notebookId;

    @Column(name = "run_number", nullable = false)
    private int runNumber;

    /** "manual", "api", "job" */
    @Column(name = "trigger_type")
    @Builder.Default
    private String triggerType = "manual";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private RunStatus status = RunStatus.RUNNING;

    @Column(name = "start_from_cell")
    private int startFromCell;

    @Column(name = "stop_on_error")
    @Builder.Default
    private boolean stopOnError = true;

    @Column(name = "cells_total")
    private int cellsTotal;

    @Column(name = "cells_completed")
    private int cellsCompleted;

    @Column(name = "cells_failed")
    private int cellsFailed;

    @Column(name = "cells_skipped")
    private int cellsSkipped;

    @Column(name = "error_cell_id")
    private String errorCellId;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    public enum RunStatus {
        RUNNING, PAUSED, COMPLETED, PARTIAL, FAILED, CANCELLED
    }

    @PrePersist
    protected void onCreate() {
        if (startedAt == null) startedAt = Instant.now();
    }
}
