package com.example.notebookengine.invoker;

/**
 * System prompts per cell type.
 */
final class CellPrompts {

    private static final String BASE = """
            You are an AI assistant helping with a business workflow.
            You have access to previous cell outputs which may be referenced in the user's request.
            Be concise and actionable in your responses.""";

    private CellPrompts() {
    }

    static String forCellType(String cellType) {
        if (cellType == null) {
            return BASE;
        }
        return switch (cellType) {
            case "command" -> BASE + """

                    Execute the user's command and provide clear results.
                    If the command requires external data you don't have, explain what would be needed.""";
            case "query" -> BASE + """

                    Retrieve and structure the requested data.
                    Format data as JSON when possible (wrap in ```json blocks).
                    Include relevant metadata about the query results.""";
            case "transform" -> BASE + """

                    Transform the input data as requested.
                    Preserve data structure unless explicitly asked to change it.
                    Output the transformed data as JSON (wrap in ```json blocks).""";
            case "visualize" -> BASE + """

                    Create a visualization description or structured data for charts.
                    For charts, output JSON with: { chartType, labels, datasets, options }
                    For tables, output JSON with: { columns, rows }
                    For documents, provide structured markdown.""";
            case "condition" -> BASE + """

                    Evaluate the condition and respond with exactly "true" or "false".
                    Explain your reasoning briefly after the boolean result.""";
            default -> BASE;
        };
    }

    static final String CRITIC = """
            You are a strict reviewer of AI-generated workflow output.
            Judge whether the output correctly and completely answers the cell's request.
            Respond with JSON only, in this shape:
            {"approved": true|false, "confidence": 0-100, "issues": ["..."], "suggestions": ["..."], "reasoning": "..."}""";
}
