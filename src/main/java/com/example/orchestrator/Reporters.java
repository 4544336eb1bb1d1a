package com.example.orchestrator;

import com.example.orchestrator.model.TaskResultPack;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.model.UnhandledError;
import com.example.orchestrator.model.UserConsoleLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans every event out to the registered reporters. A reporter that throws is logged and
 * does not prevent delivery to the others.
 */
public final class Reporters implements Reporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(Reporters.class);

    private final List<Reporter> reporters = new CopyOnWriteArrayList<>();

    public Reporters(List<? extends Reporter> reporters) {
        this.reporters.addAll(reporters);
    }

    public void add(Reporter reporter) {
        reporters.add(reporter);
    }

    public List<Reporter> all() {
        return List.copyOf(reporters);
    }

    @Override
    public void onInit(Orchestrator orchestrator) {
        publish("onInit", reporter -> reporter.onInit(orchestrator));
    }

    @Override
    public void onPathsCollected(List<Path> paths) {
        publish("onPathsCollected", reporter -> reporter.onPathsCollected(paths));
    }

    @Override
    public void onSpecsCollected(List<WorkspaceSpec> specs) {
        publish("onSpecsCollected", reporter -> reporter.onSpecsCollected(specs));
    }

    @Override
    public void onCollected(List<TestFile> files) {
        publish("onCollected", reporter -> reporter.onCollected(files));
    }

    @Override
    public void onTaskUpdate(List<TaskResultPack> packs) {
        publish("onTaskUpdate", reporter -> reporter.onTaskUpdate(packs));
    }

    @Override
    public void onUserConsoleLog(UserConsoleLog log) {
        publish("onUserConsoleLog", reporter -> reporter.onUserConsoleLog(log));
    }

    @Override
    public void onFilesFinished(List<TestFile> files) {
        publish("onFilesFinished", reporter -> reporter.onFilesFinished(files));
    }

    @Override
    public void onFinished(List<TestFile> files, List<UnhandledError> errors, Map<String, Object> coverage) {
        publish("onFinished", reporter -> reporter.onFinished(files, errors, coverage));
    }

    @Override
    public void onWatcherStart(List<TestFile> files, List<UnhandledError> errors) {
        publish("onWatcherStart", reporter -> reporter.onWatcherStart(files, errors));
    }

    @Override
    public void onWatcherRerun(List<Path> files, String trigger) {
        publish("onWatcherRerun", reporter -> reporter.onWatcherRerun(files, trigger));
    }

    @Override
    public void onTestRemoved(String trigger) {
        publish("onTestRemoved", reporter -> reporter.onTestRemoved(trigger));
    }

    @Override
    public void onServerRestart(CancelReason reason) {
        publish("onServerRestart", reporter -> reporter.onServerRestart(reason));
    }

    @Override
    public void onProcessTimeout() {
        publish("onProcessTimeout", Reporter::onProcessTimeout);
    }

    private void publish(String event, Consumer<Reporter> delivery) {
        for (Reporter reporter : reporters) {
            deliverSafely(reporter, event, delivery);
        }
    }

    private void deliverSafely(Reporter reporter, String event, Consumer<Reporter> delivery) {
        try {
            delivery.accept(reporter);
        } catch (Exception ex) {
            LOGGER.warn("Reporter {} failed handling {}: {}",
                    reporter.getClass().getSimpleName(), event, ex.getMessage(), ex);
        }
    }
}
