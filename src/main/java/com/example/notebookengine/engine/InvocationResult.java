package com.example.notebookengine.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What a {@link ToolInvoker} reports back for one cell. A non-null
 * {@code errorMessage} marks the invocation as failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvocationResult {

    private Object output;

    @Builder.Default
    private String outputType = "text";

    private String errorMessage;
    private String reasoning;

    @Builder.Default
    private List<String> toolsUsed = new ArrayList<>();

    public boolean isSuccess() {
        return errorMessage == null;
    }

    public static InvocationResult success(Object output) {
        return InvocationResult.builder().output(output).build();
    }

    public static InvocationResult failure(String errorMessage) {
        return InvocationResult.builder()
                .errorMessage(errorMessage != null ? errorMessage : "Execution failed")
                .build();
    }
}
