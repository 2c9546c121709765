package com.example.notebookengine.invoker;

import com.example.notebookengine.config.EngineProperties;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.engine.CriticReview;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmCriticReviewerTest {

    private final LlmClient llmClient = mock(LlmClient.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LlmCriticReviewer reviewer = new LlmCriticReviewer(
            llmClient, new TemplateRenderer(objectMapper), objectMapper, new EngineProperties());

    @Test
    void parsesFencedVerdict() {
        CriticReview review = reviewer.parseReview("""
                Verdict:
                ```json
                {"approved": true, "confidence": 85, "issues": [], "suggestions": ["add units"], "reasoning": "fine"}
                ```
                """);

        assertTrue(review.isApproved());
        assertEquals(85, review.getConfidence());
        assertEquals(List.of("add units"), review.getSuggestions());
        assertEquals("fine", review.getReasoning());
    }

    @Test
    void clampsConfidence() {
        assertEquals(100, reviewer.parseReview("{\"approved\": true, \"confidence\": 140}").getConfidence());
        assertEquals(0, reviewer.parseReview("{\"approved\": false, \"confidence\": -3}").getConfidence());
    }

    @Test
    void missingFieldsDefaultToRejection() {
        CriticReview review = reviewer.parseReview("{}");

        assertFalse(review.isApproved());
        assertEquals(0, review.getConfidence());
        assertTrue(review.getIssues().isEmpty());
        assertNull(review.getReasoning());
    }

    @Test
    void nonObjectResponsesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> reviewer.parseReview("looks good to me"));
        assertThrows(IllegalArgumentException.class, () -> reviewer.parseReview("[1, 2]"));
    }

    @Test
    void reviewSendsCellAndOutputToTheModel() throws IOException {
        NotebookCell cell = NotebookCell.builder().cellType("query").content("top customers").build();
        when(llmClient.complete(eq(CellPrompts.CRITIC), contains("top customers"), any()))
                .thenReturn("{\"approved\": true, \"confidence\": 70, \"issues\": [\"no totals\"]}");

        CriticReview review = reviewer.review(cell, List.of("acme", "globex"));

        assertEquals(70, review.getConfidence());
        assertEquals(List.of("no totals"), review.getIssues());
    }

    @Test
    void transportFailureIsRaisedUnchecked() throws IOException {
        NotebookCell cell = NotebookCell.builder().cellType("command").content("x").build();
        when(llmClient.complete(anyString(), anyString(), any())).thenThrow(new IOException("timeout"));

        assertThrows(UncheckedIOException.class, () -> reviewer.review(cell, "out"));
    }
}
