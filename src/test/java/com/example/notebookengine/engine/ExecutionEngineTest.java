package com.example.notebookengine.engine;

import com.example.notebookengine.domain.Notebook;
import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.domain.NotebookCell.CellStatus;
import com.example.notebookengine.domain.NotebookRun;
import com.example.notebookengine.dto.NotebookDetails;
import com.example.notebookengine.exception.ConflictException;
import com.example.notebookengine.exception.NotFoundException;
import com.example.notebookengine.exception.StateException;
import com.example.notebookengine.service.NotebookService;
import com.example.notebookengine.store.CellStore;
import com.example.notebookengine.support.ScriptedToolInvoker;
import com.example.notebookengine.support.ScriptedToolInvokerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.example.notebookengine.support.NotebookFixtures.OWNER;
import static com.example.notebookengine.support.NotebookFixtures.notebook;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(ScriptedToolInvokerConfig.class)
class ExecutionEngineTest {

    @Autowired
    private ExecutionEngine engine;

    @Autowired
    private NotebookService notebookService;

    @Autowired
    private CellStore store;

    @Autowired
    private RunHistory runHistory;

    @Autowired
    private ScriptedToolInvoker invoker;

    @BeforeEach
    void setUp() {
        invoker.reset();
    }

    @AfterEach
    void tearDown() {
        invoker.release();
    }

    @Test
    void runsAllCellsAndPropagatesOutputs() {
        String id = create("command:alpha", "command:beta {{prev}}", "transform:gamma {{cell_0_output}}");

        RunResult result = engine.run(id, OWNER, RunOptions.defaults());

        assertEquals(RunOutcome.COMPLETED, result.getStatus());
        assertEquals(3, result.getCellsTotal());
        assertEquals(3, result.getCellsCompleted());
        assertEquals(0, result.getCellsFailed());
        assertEquals(0, result.getCellsSkipped());
        assertEquals("out:beta out:alpha", result.getResults().get(1).getOutput());
        assertEquals("out:gamma out:alpha", result.getResults().get(2).getOutput());
        assertEquals("out:gamma out:alpha", result.getVariables().get("last_output"));
        assertEquals("out:alpha", result.getVariables().get("cell_0_output"));

        cells(id).forEach(c -> assertEquals(CellStatus.COMPLETED, c.getStatus()));
        Notebook notebook = load(id);
        assertEquals(Notebook.NotebookStatus.COMPLETED, notebook.getStatus());
        assertNull(notebook.getErrorMessage());
        assertNotNull(notebook.getLastRunAt());
        assertNotNull(notebook.getLastRunDurationMs());
    }

    @Test
    void callerVariablesAreVisibleToEveryCell() {
        String id = create("command:report for {{region}}", "command:again {{region}}");

        RunResult result = engine.run(id, OWNER, RunOptions.builder()
                .variables(Map.of("region", "EMEA"))
                .build());

        assertEquals("out:report for EMEA", result.getResults().get(0).getOutput());
        assertEquals("out:again EMEA", result.getResults().get(1).getOutput());
        assertEquals("EMEA", invoker.variablesSeenBy(1).get("region"));
        assertEquals("out:report for EMEA", invoker.variablesSeenBy(1).get("cell_0_output"));
    }

    @Test
    void approvalCellPausesTheRun() {
        String id = create("command:one", "approve:check", "command:three");

        RunResult result = engine.run(id, OWNER, RunOptions.defaults());

        List<NotebookCell> cells = cells(id);
        assertEquals(RunOutcome.PAUSED, result.getStatus());
        assertEquals(cells.get(1).getId(), result.getPausedAtCellId());
        assertEquals(1, result.getCellsCompleted());
        assertEquals(CellStatus.COMPLETED, cells.get(0).getStatus());
        assertEquals(CellStatus.PAUSED, cells.get(1).getStatus());
        assertEquals(CellStatus.QUEUED, cells.get(2).getStatus());
        assertNull(invoker.variablesSeenBy(2), "cell after the gate must not run");

        Notebook notebook = load(id);
        assertEquals(Notebook.NotebookStatus.PAUSED, notebook.getStatus());
        assertEquals(cells.get(1).getId(), notebook.getPausedAtCellId());
        assertEquals("out:one", notebook.getRunVariables().get("last_output"));
    }

    @Test
    void runWhilePausedAtGateConflicts() {
        String id = create("approve:gate", "command:after");
        engine.run(id, OWNER, RunOptions.defaults());

        assertThrows(ConflictException.class, () -> engine.run(id, OWNER, RunOptions.defaults()));
    }

    @Test
    void stopOnErrorSkipsTheRemainingCells() {
        String id = create("command:one", "command:FAIL boom", "command:three");

        RunResult result = engine.run(id, OWNER, RunOptions.defaults());

        assertEquals(RunOutcome.FAILED, result.getStatus());
        assertEquals(1, result.getCellsCompleted());
        assertEquals(1, result.getCellsFailed());
        assertEquals(1, result.getCellsSkipped());
        assertEquals("FAIL boom", result.getError());

        List<NotebookCell> cells = cells(id);
        assertEquals(CellStatus.COMPLETED, cells.get(0).getStatus());
        assertEquals(CellStatus.ERROR, cells.get(1).getStatus());
        assertEquals("FAIL boom", cells.get(1).getErrorMessage());
        assertEquals(CellStatus.SKIPPED, cells.get(2).getStatus());

        Notebook notebook = load(id);
        assertEquals(Notebook.NotebookStatus.FAILED, notebook.getStatus());
        assertEquals("FAIL boom", notebook.getErrorMessage());
    }

    @Test
    void continueOnErrorReportsPartial() {
        String id = create("command:one", "command:FAIL boom", "command:three {{prev}}");

        RunResult result = engine.run(id, OWNER, RunOptions.builder().stopOnError(false).build());

        assertEquals(RunOutcome.PARTIAL, result.getStatus());
        assertEquals(2, result.getCellsCompleted());
        assertEquals(1, result.getCellsFailed());
        assertEquals(0, result.getCellsSkipped());
        // the failed cell does not replace last_output
        assertEquals("out:three out:one", result.getResults().get(2).getOutput());

        Notebook notebook = load(id);
        assertEquals(Notebook.NotebookStatus.COMPLETED, notebook.getStatus());
        assertTrue(notebook.getErrorMessage().startsWith("1 of 3 cells failed"));
        assertEquals(CellStatus.COMPLETED, cells(id).get(2).getStatus());
    }

    @Test
    void invokerExceptionBecomesCellError() {
        String id = create("command:THROW", "command:never");

        RunResult result = engine.run(id, OWNER, RunOptions.defaults());

        assertEquals(RunOutcome.FAILED, result.getStatus());
        assertEquals("invoker exploded", result.getResults().get(0).getError());
        assertEquals(CellStatus.ERROR, cells(id).get(0).getStatus());
    }

    @Test
    void unknownCellTypeErrors() {
        String id = create("bogus:whatever");

        RunResult result = engine.run(id, OWNER, RunOptions.defaults());

        assertEquals(RunOutcome.FAILED, result.getStatus());
        assertEquals("Unsupported cell type: bogus", cells(id).get(0).getErrorMessage());
    }

    @Test
    void noteCellRecordsNullOutputWithoutTouchingLastOutput() {
        String id = create("command:one", "note:just a note", "command:{{prev}}");

        RunResult result = engine.run(id, OWNER, RunOptions.defaults());

        assertEquals(RunOutcome.COMPLETED, result.getStatus());
        assertNull(result.getResults().get(1).getOutput());
        assertEquals("out:out:one", result.getResults().get(2).getOutput());
        assertTrue(result.getVariables().containsKey("cell_1_output"));
        assertNull(result.getVariables().get("cell_1_output"));
        assertEquals("out:out:one", result.getVariables().get("last_output"));
    }

    @Test
    void longCellErrorIsStoredWhenStoppingOnError() {
        String error = "FAIL" + "x".repeat(5000);
        String id = create("command:a", "command:" + error, "command:c");

        RunResult result = engine.run(id, OWNER, RunOptions.defaults());

        assertEquals(RunOutcome.FAILED, result.getStatus());
        List<NotebookCell> cells = cells(id);
        assertEquals(CellStatus.COMPLETED, cells.get(0).getStatus());
        assertEquals(CellStatus.ERROR, cells.get(1).getStatus());
        assertEquals(error, cells.get(1).getErrorMessage());
        assertEquals(CellStatus.SKIPPED, cells.get(2).getStatus());

        Notebook notebook = load(id);
        assertEquals(Notebook.NotebookStatus.FAILED, notebook.getStatus());
        assertEquals(error, notebook.getErrorMessage());
    }

    @Test
    void longCellErrorIsStoredWhenContinuingOnError() {
        String error = "FAIL" + "x".repeat(5000);
        String id = create("command:a", "command:" + error, "command:c");

        RunResult result = engine.run(id, OWNER, RunOptions.builder().stopOnError(false).build());

        assertEquals(RunOutcome.PARTIAL, result.getStatus());
        List<NotebookCell> cells = cells(id);
        assertEquals(CellStatus.COMPLETED, cells.get(0).getStatus());
        assertEquals(CellStatus.ERROR, cells.get(1).getStatus());
        assertEquals(error, cells.get(1).getErrorMessage());
        assertEquals(CellStatus.COMPLETED, cells.get(2).getStatus());

        Notebook notebook = load(id);
        assertEquals(Notebook.NotebookStatus.COMPLETED, notebook.getStatus());
        assertTrue(notebook.getErrorMessage().startsWith("1 of 3 cells failed"));
        assertTrue(notebook.getErrorMessage().endsWith(error));
    }

    @Test
    void secondRunWhileRunningConflicts() throws Exception {
        String id = create("command:BLOCK", "command:two");
        CompletableFuture<RunResult> first = CompletableFuture.supplyAsync(
                () -> engine.run(id, OWNER, RunOptions.defaults()));
        assertTrue(invoker.awaitBlocked());

        assertThrows(ConflictException.class, () -> engine.run(id, OWNER, RunOptions.defaults()));
        assertEquals(Notebook.NotebookStatus.RUNNING, load(id).getStatus());

        invoker.release();
        assertEquals(RunOutcome.COMPLETED, first.get(10, TimeUnit.SECONDS).getStatus());
    }

    @Test
    void cancellationStopsAtTheNextCellBoundary() throws Exception {
        String id = create("command:BLOCK", "command:two", "command:three");
        CompletableFuture<RunResult> run = CompletableFuture.supplyAsync(
                () -> engine.run(id, OWNER, RunOptions.defaults()));
        assertTrue(invoker.awaitBlocked());

        engine.requestCancel(id, OWNER);
        invoker.release();
        RunResult result = run.get(10, TimeUnit.SECONDS);

        assertEquals(RunOutcome.CANCELLED, result.getStatus());
        assertEquals(1, result.getCellsCompleted());
        assertEquals(2, result.getCellsSkipped());
        List<NotebookCell> cells = cells(id);
        assertEquals(CellStatus.COMPLETED, cells.get(0).getStatus());
        assertEquals(CellStatus.SKIPPED, cells.get(1).getStatus());
        assertEquals(CellStatus.SKIPPED, cells.get(2).getStatus());
        Notebook notebook = load(id);
        assertEquals(Notebook.NotebookStatus.CANCELLED, notebook.getStatus());
        assertFalse(notebook.isCancelRequested());
    }

    @Test
    void cancelWhenNotRunningIsAStateError() {
        String id = create("command:one");
        assertThrows(StateException.class, () -> engine.requestCancel(id, OWNER));
    }

    @Test
    void finishedNotebookCanRunAgain() {
        String id = create("command:FAIL once");
        assertEquals(RunOutcome.FAILED, engine.run(id, OWNER, RunOptions.defaults()).getStatus());

        RunResult again = engine.run(id, OWNER, RunOptions.defaults());

        assertEquals(RunOutcome.FAILED, again.getStatus());
        assertEquals(2, runHistory.list(id).size());
    }

    @Test
    void startFromCellOutOfRangeIsAStateError() {
        String id = create("command:one", "command:two");
        assertThrows(StateException.class,
                () -> engine.run(id, OWNER, RunOptions.builder().startFromCell(2).build()));
        assertThrows(StateException.class,
                () -> engine.run(id, OWNER, RunOptions.builder().startFromCell(-1).build()));
        assertEquals(Notebook.NotebookStatus.IDLE, load(id).getStatus());
    }

    @Test
    void otherOwnersCannotSeeTheNotebook() {
        String id = create("command:one");
        assertThrows(NotFoundException.class, () -> engine.run(id, "someone-else", RunOptions.defaults()));
        assertThrows(NotFoundException.class, () -> engine.run("missing", OWNER, RunOptions.defaults()));
    }

    @Test
    void runCellExecutesOneCellAndRestoresNotebookStatus() {
        String id = create("command:one", "command:two {{prev}}");
        engine.run(id, OWNER, RunOptions.defaults());
        String second = cells(id).get(1).getId();

        CellResult result = engine.runCell(id, OWNER, second);

        assertEquals(CellStatus.COMPLETED, result.getStatus());
        assertEquals("out:two out:one", result.getOutput());
        assertEquals(Notebook.NotebookStatus.COMPLETED, load(id).getStatus());
    }

    @Test
    void approvalCellCannotBeRunAlone() {
        String id = create("approve:gate");
        String gate = cells(id).get(0).getId();
        assertThrows(StateException.class, () -> engine.runCell(id, OWNER, gate));
    }

    @Test
    void runHistoryRecordsEachInvocation() {
        String id = create("command:one", "command:FAIL two");

        engine.run(id, OWNER, RunOptions.builder().triggerType("manual").build());

        List<NotebookRun> runs = runHistory.list(id);
        assertEquals(1, runs.size());
        NotebookRun run = runs.get(0);
        assertEquals(1, run.getRunNumber());
        assertEquals(NotebookRun.RunStatus.FAILED, run.getStatus());
        assertEquals(1, run.getCellsCompleted());
        assertEquals(1, run.getCellsFailed());
        assertEquals(cells(id).get(1).getId(), run.getErrorCellId());
        assertNotNull(run.getCompletedAt());
    }

    private String create(String... cells) {
        NotebookDetails details = notebookService.createNotebook(OWNER, notebook("test", cells));
        return details.getNotebook().getId();
    }

    private List<NotebookCell> cells(String notebookId) {
        return store.loadCells(notebookId);
    }

    private Notebook load(String notebookId) {
        return store.loadNotebook(notebookId).orElseThrow();
    }
}
