package com.example.notebookengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalActionRequest {

    private String cellId;

    /** "approve" or "reject" */
    @Builder.Default
    private String action = "approve";

    private String feedback;

    /** After an approve, continue the run from the next cell in the same call */
    private boolean autoResume;
}
