package com.example.notebookengine.engine.handler;

import com.example.notebookengine.engine.InvocationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What a {@link CellHandler} decided for one cell.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CellOutcome {

    public enum Kind {
        COMPLETED,
        ERROR
    }

    private Kind kind;
    private Object output;
    private String outputType;
    private String error;
    private String reasoning;

    @Builder.Default
    private List<String> toolsUsed = new ArrayList<>();

    public static CellOutcome completed(Object output) {
        return CellOutcome.builder().kind(Kind.COMPLETED).output(output).build();
    }

    public static CellOutcome error(String message) {
        return CellOutcome.builder().kind(Kind.ERROR).error(message).build();
    }

    public boolean isSuccess() {
        return kind == Kind.COMPLETED;
    }

    public static CellOutcome from(InvocationResult result) {
        if (!result.isSuccess()) {
            return error(result.getErrorMessage());
        }
        return CellOutcome.builder()
                .kind(Kind.COMPLETED)
                .output(result.getOutput())
                .outputType(result.getOutputType())
                .reasoning(result.getReasoning())
                .toolsUsed(result.getToolsUsed() != null ? result.getToolsUsed() : new ArrayList<>())
                .build();
    }
}
