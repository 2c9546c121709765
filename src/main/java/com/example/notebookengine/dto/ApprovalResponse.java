package com.example.notebookengine.dto;

import com.example.notebookengine.engine.ApprovalDecision;
import com.example.notebookengine.engine.RunResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApprovalResponse {

    private ApprovalDecision decision;

    /** Present when the approve auto-resumed the run */
    private RunResult resumedRun;
}
