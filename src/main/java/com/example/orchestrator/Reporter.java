package com.example.orchestrator;

import com.example.orchestrator.model.TaskResultPack;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.model.UnhandledError;
import com.example.orchestrator.model.UserConsoleLog;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Observer of orchestration events. Every callback is optional.
 * <p>
 * Callbacks are invoked on the control loop, so they see state consistent with the event
 * and must not block for long.
 */
public interface Reporter {
    default void onInit(Orchestrator orchestrator) {
    }

    default void onPathsCollected(List<Path> paths) {
    }

    default void onSpecsCollected(List<WorkspaceSpec> specs) {
    }

    default void onCollected(List<TestFile> files) {
    }

    default void onTaskUpdate(List<TaskResultPack> packs) {
    }

    default void onUserConsoleLog(UserConsoleLog log) {
    }

    /**
     * A worker finished executing the given files. Called once per file batch, before the
     * run as a whole finishes.
     */
    default void onFilesFinished(List<TestFile> files) {
    }

    /**
     * The run finished. Called exactly once per run with the files of its specs.
     */
    default void onFinished(List<TestFile> files, List<UnhandledError> errors, Map<String, Object> coverage) {
    }

    default void onWatcherStart(List<TestFile> files, List<UnhandledError> errors) {
    }

    default void onWatcherRerun(List<Path> files, String trigger) {
    }

    default void onTestRemoved(String trigger) {
    }

    default void onServerRestart(CancelReason reason) {
    }

    default void onProcessTimeout() {
    }
}
