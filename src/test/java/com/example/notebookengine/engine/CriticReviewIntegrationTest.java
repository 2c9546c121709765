package com.example.notebookengine.engine;

import com.example.notebookengine.domain.ExecutionLogEntry;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.service.NotebookService;
import com.example.notebookengine.store.CellStore;
import com.example.notebookengine.support.ScriptedToolInvokerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.util.List;

import static com.example.notebookengine.support.NotebookFixtures.OWNER;
import static com.example.notebookengine.support.NotebookFixtures.notebook;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import({ScriptedToolInvokerConfig.class, CriticReviewIntegrationTest.StubCriticConfig.class})
class CriticReviewIntegrationTest {

    @TestConfiguration
    static class StubCriticConfig {

        @Bean
        CriticReviewer stubCritic() {
            return (cell, output) -> {
                if (cell.getContent().contains("critic-down")) {
                    throw new IllegalStateException("critic unavailable");
                }
                return CriticReview.builder()
                        .approved(true)
                        .confidence(cell.getContent().contains("shaky") ? 30 : 90)
                        .issues(List.of())
                        .reasoning("reviewed " + output)
                        .build();
            };
        }
    }

    @Autowired
    private ExecutionEngine engine;

    @Autowired
    private NotebookService notebookService;

    @Autowired
    private CellStore store;

    @Test
    void completedCellsCarryACriticReview() {
        String id = create("command:solid", "command:shaky numbers");

        RunResult result = engine.run(id, OWNER, RunOptions.defaults());

        assertEquals(RunOutcome.COMPLETED, result.getStatus());
        List<NotebookCell> cells = store.loadCells(id);
        ExecutionLogEntry first = cells.get(0).getExecutionLog().get(0);
        assertEquals(ExecutionLogEntry.CRITIC_REVIEW, first.getType());
        assertEquals(90, first.getConfidence());
        assertEquals("reviewed out:solid", first.getReasoning());
        assertEquals(30, cells.get(1).getExecutionLog().get(0).getConfidence());
    }

    @Test
    void failedCellsAreNotReviewed() {
        String id = create("command:FAIL");

        engine.run(id, OWNER, RunOptions.defaults());

        assertTrue(store.loadCells(id).get(0).getExecutionLog().isEmpty());
    }

    @Test
    void criticFailureDoesNotFailTheCell() {
        String id = create("command:critic-down");

        RunResult result = engine.run(id, OWNER, RunOptions.defaults());

        assertEquals(RunOutcome.COMPLETED, result.getStatus());
        NotebookCell cell = store.loadCells(id).get(0);
        assertEquals(NotebookCell.CellStatus.COMPLETED, cell.getStatus());
        assertTrue(cell.getExecutionLog().isEmpty());
    }

    private String create(String... cells) {
        return notebookService.createNotebook(OWNER, notebook("critic", cells)).getNotebook().getId();
    }
}
