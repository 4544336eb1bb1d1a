package com.example.orchestrator.rpc;

import com.example.orchestrator.CancelReason;
import com.example.orchestrator.graph.TransformMode;
import com.example.orchestrator.graph.TransformResult;
import com.example.orchestrator.model.TaskResultPack;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.model.UserConsoleLog;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Everything a worker may ask of, or report to, the control side. Workers never touch shared
 * state directly; each call becomes a message applied in order on the control loop.
 */
public interface RuntimeRpc {
    CompletableFuture<TransformResult> fetchModule(Path id, TransformMode mode);

    CompletableFuture<Optional<Path>> resolveId(String id, Path importer, TransformMode mode);

    void onPathsCollected(List<Path> paths);

    /**
     * Submits file skeletons before their tests execute.
     */
    void onCollected(List<TestFile> files);

    void onTaskUpdate(List<TaskResultPack> packs);

    void onUserConsoleLog(UserConsoleLog log);

    void onUnhandledError(Throwable error, String type);

    void onFinished(List<TestFile> files);

    /**
     * Asks for the whole run to be cancelled. Takes effect immediately, ahead of queued
     * messages.
     */
    void onCancel(CancelReason reason);

    CompletableFuture<Long> getCountOfFailedTests();
}
