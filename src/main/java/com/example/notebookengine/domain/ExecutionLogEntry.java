package com.example.notebookengine.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Structured trace record attached to a cell: critic reviews and human decisions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionLogEntry {

    public static final String CRITIC_REVIEW = "critic_review";
    public static final String HUMAN_REVIEW = "human_review";

    private String type;
    private Instant timestamp;

    // critic_review
    private Boolean approved;
    private Integer confidence;
    private List<String> issues;
    private List<String> suggestions;
    private String reasoning;

    // human_review
    private String action; // "approved", "rejected"
    private String feedback;

    public static ExecutionLogEntry humanReview(String action, String feedback) {
        return ExecutionLogEntry.builder()
                .type(HUMAN_REVIEW)
                .timestamp(Instant.now())
                .action(action)
                .feedback(feedback)
                .build();
    }
}
