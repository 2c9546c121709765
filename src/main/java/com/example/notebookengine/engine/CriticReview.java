package com.example.notebookengine.engine;

import com.example.notebookengine.domain.ExecutionLogEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Advisory quality review of a completed cell's output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CriticReview {

    private boolean approved;

    /** 0 to 100 */
    private int confidence;

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    @Builder.Default
    private List<String> suggestions = new ArrayList<>();

    private String reasoning;

    public ExecutionLogEntry toLogEntry() {
        return ExecutionLogEntry.builder()
                .type(ExecutionLogEntry.CRITIC_REVIEW)
                .timestamp(Instant.now())
                .approved(approved)
                .confidence(Math.max(0, Math.min(100, confidence)))
                .issues(issues != null ? List.copyOf(issues) : List.of())
                .suggestions(suggestions != null ? List.copyOf(suggestions) : List.of())
                .reasoning(reasoning)
                .build();
    }
}
