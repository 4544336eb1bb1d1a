package com.example.orchestrator;

import com.example.orchestrator.model.TaskState;
import com.example.orchestrator.model.Tasks;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.model.UnhandledError;
import com.example.orchestrator.model.UserConsoleLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes run progress and summaries to the log.
 */
public final class LoggingReporter implements Reporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingReporter.class);

    @Override
    public void onSpecsCollected(List<WorkspaceSpec> specs) {
        LOGGER.debug("Collected {} spec(s)", specs.size());
    }

    @Override
    public void onUserConsoleLog(UserConsoleLog log) {
        LOGGER.debug("[{}] {}", log.type(), log.content());
    }

    @Override
    public void onFilesFinished(List<TestFile> files) {
        for (TestFile file : files) {
            TaskState state = file.getResult() == null ? TaskState.RUN : file.getResult().state();
            LOGGER.debug("{} [{}] {}", state, file.getProjectName(), file.getName());
        }
    }

    @Override
    public void onFinished(List<TestFile> files, List<UnhandledError> errors, Map<String, Object> coverage) {
        long passedFiles = files.stream().filter(file -> file.hasState(TaskState.PASS)).count();
        long failedFiles = files.stream().filter(file -> file.hasState(TaskState.FAIL)).count();
        long skippedFiles = files.stream().filter(file -> file.hasState(TaskState.SKIP)).count();
        LOGGER.info("Test Files  {} passed | {} failed | {} skipped ({})",
                passedFiles, failedFiles, skippedFiles, files.size());
        LOGGER.info("Tests       {} passed | {} failed | {} skipped",
                Tasks.countTests(files, TaskState.PASS),
                Tasks.countTests(files, TaskState.FAIL),
                Tasks.countTests(files, TaskState.SKIP));
        for (TestFile file : files) {
            if (file.hasState(TaskState.FAIL)) {
                LOGGER.warn("FAIL [{}] {}: {}", file.getProjectName(), file.getName(), file.getResult().errors());
            }
        }
        for (UnhandledError error : errors) {
            LOGGER.error("{}: {} {}", error.type(), error.name(), error.message());
        }
    }

    @Override
    public void onWatcherStart(List<TestFile> files, List<UnhandledError> errors) {
        if (Tasks.hasFailed(files) || !errors.isEmpty()) {
            LOGGER.info("Tests failed. Watching for file changes...");
        } else {
            LOGGER.info("Waiting for file changes...");
        }
    }

    @Override
    public void onWatcherRerun(List<Path> files, String trigger) {
        LOGGER.info("Rerun {} file(s){}", files.size(), trigger == null || trigger.isEmpty() ? "" : " (" + trigger + ")");
    }

    @Override
    public void onTestRemoved(String trigger) {
        LOGGER.info("Test removed: {}", trigger);
    }

    @Override
    public void onServerRestart(CancelReason reason) {
        LOGGER.info("Restarting ({})", reason);
    }

    @Override
    public void onProcessTimeout() {
        LOGGER.warn("Close timed out");
    }
}
