package com.example.orchestrator;

import com.example.orchestrator.graph.ChangeSet;
import com.example.orchestrator.rpc.ControlLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Coalesces bursts of changes into one rerun. Every call re-arms the debounce timer, so only
 * the last call of a burst fires. A restart of the execution context between arming and
 * firing silently drops the rerun.
 */
public final class RerunScheduler implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(RerunScheduler.class);

    private final ControlLoop loop;
    private final ChangeSet changeSet;
    private final WorkspaceRegistry registry;
    private final Path root;
    private final Duration debounce;
    private final IntSupplier restarts;
    private final Supplier<CompletableFuture<Void>> runningPromise;
    private final RerunHandler handler;
    private final ScheduledExecutorService timer;
    private ScheduledFuture<?> pending;
    private volatile String filenamePattern;
    private boolean closed;

    public RerunScheduler(ControlLoop loop,
                          ChangeSet changeSet,
                          WorkspaceRegistry registry,
                          Path root,
                          Duration debounce,
                          IntSupplier restarts,
                          Supplier<CompletableFuture<Void>> runningPromise,
                          RerunHandler handler) {
        this.loop = loop;
        this.changeSet = changeSet;
        this.registry = registry;
        this.root = root;
        this.debounce = debounce;
        this.restarts = restarts;
        this.runningPromise = runningPromise;
        this.handler = handler;
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "orchestrator-rerun-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Arms the debounce timer once the current run settled.
     */
    public void scheduleRerun(List<Path> triggers) {
        int currentCount = restarts.getAsInt();
        cancelTimer();
        runningPromise.get()
                .handle((ignored, error) -> null)
                .thenRun(() -> arm(List.copyOf(triggers), currentCount));
    }

    public Optional<String> filenamePattern() {
        return Optional.ofNullable(filenamePattern);
    }

    public void setFilenamePattern(String pattern) {
        filenamePattern = pattern == null || pattern.isEmpty() ? null : pattern;
    }

    private synchronized void arm(List<Path> triggers, int currentCount) {
        cancelTimer();
        if (closed || restarts.getAsInt() != currentCount) {
            return;
        }
        pending = timer.schedule(() -> post(triggers, currentCount), debounce.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void post(List<Path> triggers, int currentCount) {
        try {
            loop.post("rerun", () -> fire(triggers, currentCount));
        } catch (RejectedExecutionException ex) {
            LOGGER.debug("Control loop closed, dropping scheduled rerun");
        }
    }

    /**
     * Decides on the rerun set. Runs on the control loop.
     */
    CompletableFuture<Void> fire(List<Path> triggers, int currentCount) {
        changeSet.retainWatched();
        if (!changeSet.hasChanges()) {
            changeSet.clearInvalidates();
            return CompletableFuture.completedFuture(null);
        }
        if (restarts.getAsInt() != currentCount) {
            LOGGER.debug("Execution context restarted, dropping scheduled rerun");
            return CompletableFuture.completedFuture(null);
        }

        List<Path> files = changeSet.changedTests();
        String pattern = filenamePattern;
        if (pattern != null) {
            Set<Path> matching;
            try {
                matching = registry.globTestFiles(List.of(pattern)).stream()
                        .map(WorkspaceSpec::file)
                        .collect(Collectors.toSet());
            } catch (IOException ex) {
                LOGGER.warn("Failed to glob test files for pattern {}", pattern, ex);
                return CompletableFuture.completedFuture(null);
            }
            files = files.stream().filter(matching::contains).toList();
            if (files.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
        }

        changeSet.clearChanged();
        String trigger = triggers.stream()
                .map(path -> FilePaths.relativeLabel(root, path))
                .distinct()
                .collect(Collectors.joining(", "));
        LOGGER.info("Rerunning {} file(s) after change in {}", files.size(), trigger);
        return handler.rerun(files, trigger);
    }

    private synchronized void cancelTimer() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        cancelTimer();
        timer.shutdownNow();
    }
}
