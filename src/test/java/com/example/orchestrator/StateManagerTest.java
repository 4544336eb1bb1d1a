package com.example.orchestrator;

import com.example.orchestrator.model.AggregateTestException;
import com.example.orchestrator.model.PendingTestException;
import com.example.orchestrator.model.Task;
import com.example.orchestrator.model.TaskMode;
import com.example.orchestrator.model.TaskResult;
import com.example.orchestrator.model.TaskResultPack;
import com.example.orchestrator.model.TaskState;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.model.UnhandledError;
import com.example.orchestrator.model.UserConsoleLog;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateManagerTest {
    @Test
    void keepsLogsStreamedBeforeCollection() throws Exception {
        Path root = Files.createTempDirectory("state-root");
        Path file = TestProjects.write(root, "a.test.ts", "");
        Project project = TestProjects.project("unit", root);
        StateManager state = new StateManager();

        state.clearFiles(project, List.of(file));
        String fileId = TestFile.create(file, root, "unit").getId();
        state.updateUserLog(UserConsoleLog.stdout(fileId, "early output"));

        TestFile collected = TestFile.create(file, root, "unit");
        Task test = collected.addTest("works");
        state.collectFiles(List.of(collected));

        List<TestFile> files = state.getFiles(List.of(file));
        assertEquals(1, files.size());
        assertSame(collected, files.get(0));
        assertEquals(1, collected.getLogs().size());
        assertEquals("early output", collected.getLogs().get(0).content());
        assertSame(test, state.getTask(test.getId()).orElseThrow());
    }

    @Test
    void keepsResultsOfOtherProjectsForTheSamePath() throws Exception {
        Path root = Files.createTempDirectory("state-root");
        Path file = TestProjects.write(root, "shared.test.ts", "");
        StateManager state = new StateManager();

        state.collectFiles(List.of(TestFile.create(file, root, "unit"), TestFile.create(file, root, "e2e")));
        state.clearFiles(TestProjects.project("unit", root), List.of(file));

        List<TestFile> files = state.getFiles(List.of(file));
        assertEquals(2, files.size());
        assertEquals(List.of(file), state.getFilepaths());
    }

    @Test
    void ignoresUpdatesForUnknownTasks() {
        StateManager state = new StateManager();

        state.updateTasks(List.of(new TaskResultPack("missing", TaskResult.of(TaskState.FAIL), Map.of())));
        state.updateUserLog(UserConsoleLog.stdout("missing", "lost"));

        assertTrue(state.getFiles().isEmpty());
        assertEquals(0L, state.getCountOfFailedTests());
    }

    @Test
    void appliesUpdatesInDeliveryOrder() throws Exception {
        Path root = Files.createTempDirectory("state-root");
        Path file = TestProjects.write(root, "a.test.ts", "");
        StateManager state = new StateManager();
        TestFile collected = TestFile.create(file, root, "");
        Task test = collected.addTest("works");
        state.collectFiles(List.of(collected));

        state.updateTasks(List.of(TaskResultPack.of(test, TaskResult.of(TaskState.RUN))));
        state.updateTasks(List.of(TaskResultPack.of(test, new TaskResult(TaskState.FAIL, 12L, List.of("boom")))));
        state.updateTasks(List.of(TaskResultPack.of(collected, TaskResult.of(TaskState.FAIL))));

        assertEquals(TaskState.FAIL, test.getResult().state());
        assertEquals(List.of("boom"), test.getResult().errors());
        assertEquals(List.of(file), state.getFailedFilepaths());
        assertEquals(2L, state.getCountOfFailedTests());
    }

    @Test
    void splitsAggregateErrors() {
        StateManager state = new StateManager();

        state.catchError(new CompletionException(new AggregateTestException("two failures",
                List.of(new IllegalStateException("first"), new IllegalArgumentException("second")))), "Unhandled Error");

        List<UnhandledError> errors = state.getUnhandledErrors();
        assertEquals(2, errors.size());
        assertEquals("first", errors.get(0).message());
        assertEquals(IllegalArgumentException.class.getName(), errors.get(1).name());
        assertEquals("Unhandled Error", errors.get(1).type());
    }

    @Test
    void pendingSignalSkipsTaskInsteadOfRecordingError() throws Exception {
        Path root = Files.createTempDirectory("state-root");
        Path file = TestProjects.write(root, "a.test.ts", "");
        StateManager state = new StateManager();
        TestFile collected = TestFile.create(file, root, "");
        Task test = collected.addTest("later");
        state.collectFiles(List.of(collected));

        state.catchError(new PendingTestException(test.getId(), "not yet"), "Unhandled Error");

        assertTrue(state.getUnhandledErrors().isEmpty());
        assertEquals(TaskMode.SKIP, test.getMode());
        assertEquals(TaskState.SKIP, test.getResult().state());
    }

    @Test
    void removeFileForgetsTaskIds() throws Exception {
        Path root = Files.createTempDirectory("state-root");
        Path file = TestProjects.write(root, "a.test.ts", "");
        StateManager state = new StateManager();
        TestFile collected = TestFile.create(file, root, "");
        Task test = collected.addTest("works");
        state.collectFiles(List.of(collected));

        state.removeFile(file);

        assertFalse(state.hasFile(file));
        assertTrue(state.getTask(test.getId()).isEmpty());
    }
}
