package com.example.notebookengine.engine;

import com.example.notebookengine.domain.Notebook;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of an approve or reject decision on a paused approval cell.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApprovalDecision {

    public static final String APPROVED = "approved";
    public static final String REJECTED = "rejected";

    private String cellId;

    /** "approved" or "rejected" */
    private String action;

    /** Index to pass as startFromCell to continue the run; null when nothing is left to run. */
    private Integer continueFrom;

    private Notebook.NotebookStatus notebookStatus;
}
