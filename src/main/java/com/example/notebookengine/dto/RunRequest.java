package com.example.notebookengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

    @Builder.Default
    private Map<String, Object> variables = new HashMap<>();

    private int startFromCell;

    /** Null means the configured default */
    private Boolean stopOnError;

    /** Run in the background job host and return the job instead of the result */
    private boolean async;
}
