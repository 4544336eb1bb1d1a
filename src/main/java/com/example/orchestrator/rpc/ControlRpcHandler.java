package com.example.orchestrator.rpc;

import com.example.orchestrator.CancelReason;
import com.example.orchestrator.Project;
import com.example.orchestrator.Reporter;
import com.example.orchestrator.StateManager;
import com.example.orchestrator.graph.TransformMode;
import com.example.orchestrator.graph.TransformResult;
import com.example.orchestrator.model.TaskResultPack;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.model.UserConsoleLog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Control-side implementation of {@link RuntimeRpc} for one project.
 */
public final class ControlRpcHandler implements RuntimeRpc {
    private final Project project;
    private final ControlLoop loop;
    private final StateManager state;
    private final Reporter reporter;
    private final Consumer<CancelReason> canceller;

    public ControlRpcHandler(Project project,
                             ControlLoop loop,
                             StateManager state,
                             Reporter reporter,
                             Consumer<CancelReason> canceller) {
        this.project = project;
        this.loop = loop;
        this.state = state;
        this.reporter = reporter;
        this.canceller = canceller;
    }

    @Override
    public CompletableFuture<TransformResult> fetchModule(Path id, TransformMode mode) {
        return loop.call("fetchModule", () -> {
            try {
                return project.moduleServer().fetchModule(id, mode);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        });
    }

    @Override
    public CompletableFuture<Optional<Path>> resolveId(String id, Path importer, TransformMode mode) {
        return loop.call("resolveId", () -> project.moduleServer().resolveId(id, importer, mode));
    }

    @Override
    public void onPathsCollected(List<Path> paths) {
        List<Path> copy = List.copyOf(paths);
        loop.post("onPathsCollected", () -> {
            state.collectPaths(copy);
            reporter.onPathsCollected(copy);
        });
    }

    @Override
    public void onCollected(List<TestFile> files) {
        List<TestFile> copy = List.copyOf(files);
        loop.post("onCollected", () -> {
            state.collectFiles(copy);
            reporter.onCollected(copy);
        });
    }

    @Override
    public void onTaskUpdate(List<TaskResultPack> packs) {
        List<TaskResultPack> copy = List.copyOf(packs);
        loop.post("onTaskUpdate", () -> {
            state.updateTasks(copy);
            reporter.onTaskUpdate(copy);
        });
    }

    @Override
    public void onUserConsoleLog(UserConsoleLog log) {
        loop.post("onUserConsoleLog", () -> {
            state.updateUserLog(log);
            reporter.onUserConsoleLog(log);
        });
    }

    @Override
    public void onUnhandledError(Throwable error, String type) {
        loop.post("onUnhandledError", () -> state.catchError(error, type));
    }

    @Override
    public void onFinished(List<TestFile> files) {
        List<TestFile> copy = List.copyOf(files);
        loop.post("onFinished", () -> reporter.onFilesFinished(copy));
    }

    @Override
    public void onCancel(CancelReason reason) {
        canceller.accept(reason);
    }

    @Override
    public CompletableFuture<Long> getCountOfFailedTests() {
        return loop.call("getCountOfFailedTests", state::getCountOfFailedTests);
    }

    public Project project() {
        return project;
    }
}
