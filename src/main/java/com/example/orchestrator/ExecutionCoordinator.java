package com.example.orchestrator;

import com.example.orchestrator.cache.ResultsCache;
import com.example.orchestrator.graph.ChangeSet;
import com.example.orchestrator.model.Tasks;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.pool.WorkerPool;
import com.example.orchestrator.rpc.ControlLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Owns the single current run.
 * <p>
 * Runs are chained: a new run starts only after the previous one settled, and every step that
 * touches shared state runs on the {@link ControlLoop}. Because worker messages are queued on
 * the same loop, a run is finalized only after every message its workers sent was applied.
 * Cancellation does not wait for that chain.
 */
public final class ExecutionCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionCoordinator.class);
    static final String UNHANDLED_ERROR = "Unhandled Error";

    private final ControlLoop loop;
    private final StateManager state;
    private final WorkspaceRegistry registry;
    private final ChangeSet changeSet;
    private final ResultsCache cache;
    private final Reporter reporter;
    private final Supplier<WorkerPool> poolFactory;
    private final Optional<CoverageProvider> coverageProvider;
    private final AtomicLong generation = new AtomicLong();
    private final List<Consumer<CancelReason>> cancelListeners = new CopyOnWriteArrayList<>();

    private CompletableFuture<Void> runningPromise = CompletableFuture.completedFuture(null);
    private volatile Run activeRun;
    private volatile boolean cancelling;
    private volatile boolean closed;
    private volatile int exitCode;
    private volatile ProjectOverrides overrides = ProjectOverrides.none();
    private WorkerPool pool;
    private boolean firstRun = true;
    private CompletableFuture<Void> closePromise;

    public ExecutionCoordinator(ControlLoop loop,
                                StateManager state,
                                WorkspaceRegistry registry,
                                ChangeSet changeSet,
                                ResultsCache cache,
                                Reporter reporter,
                                Supplier<WorkerPool> poolFactory,
                                Optional<CoverageProvider> coverageProvider) {
        this.loop = loop;
        this.state = state;
        this.registry = registry;
        this.changeSet = changeSet;
        this.cache = cache;
        this.reporter = reporter;
        this.poolFactory = poolFactory;
        this.coverageProvider = coverageProvider;
    }

    /**
     * Schedules a run over the specs after the previous run settles. The returned future
     * completes after the run was finalized and reported.
     */
    public CompletableFuture<Void> runFiles(List<WorkspaceSpec> specs, boolean allTestsRun) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Coordinator is closed"));
        }
        List<Path> filepaths = specs.stream().map(WorkspaceSpec::file).toList();
        loop.post("onPathsCollected", () -> {
            state.collectPaths(filepaths);
            reporter.onPathsCollected(filepaths);
            reporter.onSpecsCollected(specs);
        });

        Run run = new Run(generation.incrementAndGet(), specs, allTestsRun, overrides);
        CompletableFuture<Void> current;
        synchronized (this) {
            current = runningPromise
                    .handle((ignored, error) -> null)
                    .thenComposeAsync(ignored -> execute(run), loop)
                    .handleAsync((ignored, error) -> {
                        finish(run, error);
                        if (error != null) {
                            throw error instanceof CompletionException completion
                                    ? completion
                                    : new CompletionException(error);
                        }
                        return null;
                    }, loop);
            runningPromise = current;
        }
        return current;
    }

    /**
     * Flags the current run as cancelling and notifies its listeners right away, without
     * waiting for the run chain.
     */
    public void cancelCurrentRun(CancelReason reason) {
        cancelling = true;
        Run run = activeRun;
        if (run != null) {
            run.cancel(reason);
        }
        List<Consumer<CancelReason>> listeners = new ArrayList<>(cancelListeners);
        cancelListeners.removeAll(listeners);
        for (Consumer<CancelReason> listener : listeners) {
            try {
                listener.accept(reason);
            } catch (RuntimeException ex) {
                LOGGER.warn("Cancel listener failed", ex);
            }
        }
    }

    /**
     * Registers a listener for the cancellation of the current run. Listeners are dropped
     * when the next run starts.
     */
    public void onCancel(Consumer<CancelReason> listener) {
        cancelListeners.add(listener);
    }

    public boolean isCancelling() {
        return cancelling;
    }

    public int exitCode() {
        return exitCode;
    }

    public void setExitCode(int code) {
        exitCode = code;
    }

    public ProjectOverrides configOverrides() {
        return overrides;
    }

    public void setConfigOverrides(ProjectOverrides overrides) {
        this.overrides = overrides;
    }

    public long generation() {
        return generation.get();
    }

    public synchronized CompletableFuture<Void> runningPromise() {
        return runningPromise;
    }

    /**
     * Closes the worker pool once the current run settled. The next run creates a new pool.
     */
    public CompletableFuture<Void> resetPool() {
        return runningPromise()
                .handle((ignored, error) -> null)
                .thenRunAsync(this::closePool);
    }

    /**
     * Cancels an in-flight run, waits for it to settle, closes the pool and tears down global
     * setups. Idempotent.
     */
    public synchronized CompletableFuture<Void> close() {
        if (closePromise != null) {
            return closePromise;
        }
        closed = true;
        if (activeRun != null) {
            cancelCurrentRun(CancelReason.SHUTDOWN);
        }
        // Teardown blocks on workers, which in turn may wait on the control loop.
        closePromise = runningPromise
                .handle((ignored, error) -> null)
                .thenRunAsync(() -> {
                    closePool();
                    teardownGlobalSetups();
                });
        return closePromise;
    }

    private CompletableFuture<Void> execute(Run run) {
        activeRun = run;
        cancelListeners.clear();
        cancelling = false;
        LOGGER.debug("Starting run #{} with {} spec(s)", run.generation(), run.specs().size());

        run.setInvalidates(changeSet.drainInvalidates());
        state.clearErrors();
        createPlaceholders(run.specs());

        if (!firstRun) {
            coverageProvider.ifPresent(provider -> {
                try {
                    provider.clean();
                } catch (Exception ex) {
                    LOGGER.warn("Failed to clean coverage", ex);
                }
            });
        }

        try {
            initializeGlobalSetup(run.specs());
        } catch (Exception ex) {
            LOGGER.error("Global setup failed", ex);
            state.catchError(ex, UNHANDLED_ERROR);
            recordOutcome();
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> dispatched;
        try {
            dispatched = obtainPool().runTests(run);
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to dispatch run #{}", run.generation(), ex);
            dispatched = CompletableFuture.failedFuture(ex);
        }
        return dispatched.handleAsync((ignored, error) -> {
            if (error != null) {
                state.catchError(error, UNHANDLED_ERROR);
            }
            recordOutcome();
            return null;
        }, loop);
    }

    private void recordOutcome() {
        List<TestFile> files = state.getFiles();
        if (Tasks.hasFailed(files) || !state.getUnhandledErrors().isEmpty()) {
            exitCode = 1;
        }
        cache.updateResults(files);
        cache.writeToCache();
    }

    private void finish(Run run, Throwable error) {
        if (error != null) {
            LOGGER.error("Run #{} did not complete normally", run.generation(), error);
        }
        List<Path> files = new ArrayList<>(new LinkedHashSet<>(run.specs().stream().map(WorkspaceSpec::file).toList()));
        Map<String, Object> coverage = generateCoverage(run.allTestsRun());

        reporter.onFinished(state.getFiles(files), state.getUnhandledErrors(), coverage);
        coverageProvider.ifPresent(provider -> {
            try {
                provider.reportCoverage(coverage, run.allTestsRun());
            } catch (Exception ex) {
                LOGGER.warn("Failed to report coverage", ex);
            }
        });

        if (activeRun == run) {
            activeRun = null;
        }
        firstRun = false;
        LOGGER.debug("Finished run #{}", run.generation());
    }

    private Map<String, Object> generateCoverage(boolean allTestsRun) {
        if (coverageProvider.isEmpty()) {
            return null;
        }
        try {
            return coverageProvider.get().generateCoverage(allTestsRun);
        } catch (Exception ex) {
            LOGGER.warn("Failed to generate coverage", ex);
            state.catchError(ex, UNHANDLED_ERROR);
            return null;
        }
    }

    private void createPlaceholders(List<WorkspaceSpec> specs) {
        Map<Project, List<Path>> byProject = new LinkedHashMap<>();
        for (WorkspaceSpec spec : specs) {
            byProject.computeIfAbsent(spec.project(), ignored -> new ArrayList<>()).add(spec.file());
        }
        byProject.forEach(state::clearFiles);
    }

    private void initializeGlobalSetup(List<WorkspaceSpec> specs) throws Exception {
        Set<Project> projects = new LinkedHashSet<>();
        specs.forEach(spec -> projects.add(spec.project()));
        projects.add(registry.coreProject());
        for (Project project : projects) {
            project.initializeGlobalSetup();
        }
    }

    private synchronized WorkerPool obtainPool() {
        if (pool == null) {
            pool = poolFactory.get();
        }
        return pool;
    }

    private void closePool() {
        WorkerPool current;
        synchronized (this) {
            current = pool;
            pool = null;
        }
        if (current != null) {
            current.close();
            for (WorkspaceSpec spec : current.unfinishedSpecs()) {
                state.addProcessTimeoutCause("Failed to terminate worker while running " + spec);
            }
        }
    }

    private void teardownGlobalSetups() {
        Set<Project> projects = new LinkedHashSet<>(registry.resolvedProjects());
        projects.add(registry.coreProject());
        List<Project> ordered = new ArrayList<>(projects);
        Collections.reverse(ordered);
        ordered.forEach(Project::teardownGlobalSetup);
    }
}
