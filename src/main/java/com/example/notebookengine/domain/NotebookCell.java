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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One unit of work within a notebook, ordered by a dense zero-based index.
 * Output, tools used and the execution log are stored as JSON text columns.
 */
@Entity
@Table(name = "notebook_cells", indexes = {
        @Index(name = "idx_cell_notebook", columnList = "notebook_id, cell_index")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotebookCell {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "notebook_id", nullable = false)
    private String notebookId;

    @Column(name = "cell_index", nullable = false)
    private int cellIndex;

    /** Type tag: "command", "query", "transform", "visualize", "condition", "approve", "note", ... */
    @Column(name = "cell_type", nullable = false)
    @Builder.Default
    private String cellType = "command";

    private String title;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private CellStatus status = CellStatus.IDLE;

    @JsonIgnore
    @Column(name = "output", columnDefinition = "TEXT")
    private String outputJson;

    /** "text" or "json" */
    @Column(name = "output_type")
    private String outputType;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "duration_ms")
    private Long durationMs;

    /**
     * Cells this one is documented to depend on. Informational: execution order is
     * always the cell index.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "notebook_cell_dependencies", joinColumns = @JoinColumn(name = "cell_id"))
    @Column(name = "depends_on")
    @Builder.Default
    private Set<String> dependencies = new LinkedHashSet<>();

    @JsonIgnore
    @Column(name = "execution_log", columnDefinition = "TEXT")
    private String executionLogJson;

    @Column(columnDefinition = "TEXT")
    private String reasoning;

    @JsonIgnore
    @Column(name = "tools_used", length = 2048)
    private String toolsUsedJson;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public enum CellStatus {
        IDLE, QUEUED, RUNNING, COMPLETED, ERROR, PAUSED, SKIPPED
    }

    public Object getOutput() {
        return JsonColumns.read(outputJson, new TypeReference<Object>() {}, null);
    }

    public void setOutput(Object output) {
        this.outputJson = JsonColumns.write(output);
    }

    public List<ExecutionLogEntry> getExecutionLog() {
        return JsonColumns.read(executionLogJson, new TypeReference<List<ExecutionLogEntry>>() {},
                new ArrayList<>());
    }

    public void appendLog(ExecutionLogEntry entry) {
        List<ExecutionLogEntry> entries = getExecutionLog();
        entries.add(entry);
        this.executionLogJson = JsonColumns.write(entries);
    }

    public List<String> getToolsUsed() {
        return JsonColumns.read(toolsUsedJson, new TypeReference<List<String>>() {}, new ArrayList<>());
    }

    public void setToolsUsed(List<String> toolsUsed) {
        this.toolsUsedJson = toolsUsed == null || toolsUsed.isEmpty() ? null : JsonColumns.write(toolsUsed);
    }

    /** Drop every trace of a previous execution: output, error, timing and log. */
    public void clearExecution() {
        outputJson = null;
        outputType = null;
        errorMessage = null;
        durationMs = null;
        reasoning = null;
        toolsUsedJson = null;
        executionLogJson = null;
        startedAt = null;
        completedAt = null;
    }
}
