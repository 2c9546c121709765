package com.example.notebookengine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A notebook owned by one caller. Besides its descriptive fields it carries the
 * durable state of the current run, so a paused run can be resumed by any process.
 */
@Entity
@Table(name = "notebooks", indexes = {
        @Index(name = "idx_notebook_owner", columnList = "owner_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notebook {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(nullable = false)
    @Builder.Default
    private String title = "Untitled Notebook";

    @Column(length = 4096)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private NotebookStatus status = NotebookStatus.IDLE;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "last_run_duration_ms")
    private Long lastRunDurationMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /** The approval cell the current run is suspended at, null once decided */
    @Column(name = "paused_at_cell_id")
    private String pausedAtCellId;

    /** Set by a rejected approval; a new run requires a reset first */
    @Column(name = "rejected_at_cell_id")
    private String rejectedAtCellId;

    /** Index the run continues from after an approval */
    @Column(name = "resume_from_index")
    private Integer resumeFromIndex;

    @Column(name = "cancel_requested")
    @Builder.Default
    private boolean cancelRequested = false;

    @JsonIgnore
    @Column(name = "run_variables", columnDefinition = "TEXT")
    private String runVariablesJson;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public enum NotebookStatus {
        IDLE, RUNNING, PAUSED, COMPLETED, FAILED, CANCELLED
    }

    /** Whether a run is in flight: executing, or suspended at an approval gate. */
    @JsonIgnore
    public boolean isRunInFlight() {
        return status == NotebookStatus.RUNNING || status == NotebookStatus.PAUSED;
    }

    /** Paused, with the gate already approved and the resume not yet started. */
    @JsonIgnore
    public boolean isAwaitingResume() {
        return status == NotebookStatus.PAUSED && pausedAtCellId == null;
    }

    public Map<String, Object> getRunVariables() {
        return JsonColumns.read(runVariablesJson, new TypeReference<LinkedHashMap<String, Object>>() {},
                new LinkedHashMap<>());
    }

    public void setRunVariables(Map<String, Object> variables) {
        this.runVariablesJson = variables == null || variables.isEmpty() ? null : JsonColumns.write(variables);
    }

    /** Clear all run state, returning the notebook to a fresh, runnable state. */
    public void clearRunState() {
        status = NotebookStatus.IDLE;
        errorMessage = null;
        pausedAtCellId = null;
        rejectedAtCellId = null;
        resumeFromIndex = null;
        cancelRequested = false;
        runVariablesJson = null;
    }
}
