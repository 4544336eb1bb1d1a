package com.example.orchestrator;

import com.example.orchestrator.cache.ResultsCache;
import com.example.orchestrator.cache.SpecSequencer;
import com.example.orchestrator.graph.ChangePropagator;
import com.example.orchestrator.graph.ChangeSet;
import com.example.orchestrator.graph.ModuleTransformer;
import com.example.orchestrator.graph.RelatedFilesFilter;
import com.example.orchestrator.graph.SourceImportTransformer;
import com.example.orchestrator.model.Task;
import com.example.orchestrator.model.Tasks;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.pool.ProcessTestFileRunner;
import com.example.orchestrator.pool.TestFileRunner;
import com.example.orchestrator.pool.ThreadWorkerPool;
import com.example.orchestrator.pool.WorkerPool;
import com.example.orchestrator.rpc.ControlLoop;
import com.example.orchestrator.rpc.ControlRpcHandler;
import com.example.orchestrator.rpc.RuntimeRpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Entry point of the orchestrator. Owns the control loop, the shared state, the workspace and
 * the execution coordinator, and turns file system events into debounced reruns.
 *
 * <p>Operations may be called from any thread. Everything that touches shared state is applied
 * on the control loop.
 */
public final class Orchestrator implements WatchListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(Orchestrator.class);

    private final ProjectOverrides cliOverrides;
    private final ConfigLoader configLoader;
    private final ConfigFilePolicy configFilePolicy;
    private final ModuleTransformer transformer;
    private final Supplier<TestFileRunner> runnerFactory;
    private final Reporters reporters;
    private final Optional<CoverageProvider> coverageProvider;
    private final ControlLoop loop = new ControlLoop();
    private final StateManager state = new StateManager();
    private final ChangeSet changeSet = new ChangeSet();
    private final AtomicInteger restartsCount = new AtomicInteger();
    private final Map<Project, RuntimeRpc> rpcHandlers = new ConcurrentHashMap<>();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();

    private volatile OrchestratorConfig config;
    private volatile WorkspaceRegistry registry;
    private volatile ChangePropagator propagator;
    private volatile RelatedFilesFilter relatedFilter;
    private volatile ResultsCache cache;
    private volatile SpecSequencer sequencer;
    private volatile ExecutionCoordinator coordinator;
    private volatile RerunScheduler scheduler;
    private volatile boolean resolved;
    private volatile List<String> filters = List.of();
    private volatile IntConsumer exitHandler = System::exit;
    private FileWatcher watcher;
    private CompletableFuture<Void> closePromise;

    public Orchestrator(OrchestratorConfig config, List<? extends Reporter> reporters) {
        this(config, ProjectOverrides.none(), new SourceImportTransformer(), ProcessTestFileRunner::new,
                reporters, Optional.empty(), ConfigFilePolicy.DEFAULT);
    }

    public Orchestrator(OrchestratorConfig config,
                        ProjectOverrides cliOverrides,
                        ModuleTransformer transformer,
                        Supplier<TestFileRunner> runnerFactory,
                        List<? extends Reporter> reporters,
                        Optional<CoverageProvider> coverageProvider,
                        ConfigFilePolicy configFilePolicy) {
        this.cliOverrides = cliOverrides;
        this.configLoader = new ConfigLoader();
        this.configFilePolicy = configFilePolicy;
        this.transformer = transformer;
        this.runnerFactory = runnerFactory;
        this.reporters = new Reporters(reporters);
        this.coverageProvider = coverageProvider;
        configure(config.withOverrides(cliOverrides));
    }

    private void configure(OrchestratorConfig next) {
        this.config = next;
        this.registry = new WorkspaceRegistry(next, configLoader, transformer, configFilePolicy);
        GlobMatcher forceRerunTriggers = GlobMatcher.of(next.root(), next.forceRerunTriggers());
        this.propagator = new ChangePropagator(registry, state, changeSet, forceRerunTriggers);
        this.relatedFilter = new RelatedFilesFilter(next.root(), next.related(), forceRerunTriggers, next.watch());
        this.cache = new ResultsCache(next.cacheFile(), next.root(), next.cacheEnabled());
        this.sequencer = new SpecSequencer(cache, next.root());
        rpcHandlers.clear();
        this.coordinator = new ExecutionCoordinator(loop, state, registry, changeSet, cache, reporters,
                this::createPool, coverageProvider);
        this.scheduler = new RerunScheduler(loop, changeSet, registry, next.root(), next.debounce(),
                restartsCount::get, () -> coordinator.runningPromise(), this::rerunChanged);
        this.resolved = false;
    }

    /**
     * Resolves the workspace projects and reads the results cache. Called by {@link #start} and
     * {@link #init} when it has not happened yet.
     */
    public synchronized List<Project> resolveWorkspace() throws IOException {
        List<Project> projects = registry.resolve();
        cache.readFromCache();
        resolved = true;
        return projects;
    }

    private void ensureResolved() throws IOException {
        if (!resolved) {
            resolveWorkspace();
        }
    }

    /**
     * Globs the test files matching the filters and runs them. In watch mode the watcher is
     * started first and stays active after the run.
     */
    public CompletableFuture<Void> start(List<String> filters) throws IOException {
        ensureResolved();
        this.filters = List.copyOf(filters);
        onLoop("onInit", () -> reporters.onInit(this));
        if (config.watch()) {
            startWatcher();
        }

        List<WorkspaceSpec> specs = relatedFilter.filter(registry.globTestFiles(filters));
        if (specs.isEmpty()) {
            return handleNoTestFiles(filters);
        }

        cache.populateStats(specs.stream().map(WorkspaceSpec::file).distinct().toList());
        CompletableFuture<Void> run = coordinator.runFiles(sequencer.sort(specs), true);
        if (config.watch()) {
            run = run.thenCompose(ignored -> reportWatcherStart(state.getFiles()));
        }
        return run;
    }

    private CompletableFuture<Void> handleNoTestFiles(List<String> filters) {
        if (coverageProvider.isPresent()) {
            try {
                CoverageProvider provider = coverageProvider.get();
                provider.reportCoverage(provider.generateCoverage(true), true);
            } catch (Exception ex) {
                LOGGER.warn("Failed to report coverage", ex);
            }
        }
        LOGGER.warn("No test files found{}", filters.isEmpty() ? "" : " for filter " + String.join(", ", filters));
        boolean related = config.related().map(files -> !files.isEmpty()).orElse(false);
        if (!config.watch() || !related) {
            coordinator.setExitCode(config.passWithNoTests() ? 0 : 1);
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Prepares watch mode without running anything: globs test files and starts the watcher.
     */
    public CompletableFuture<Void> init() throws IOException {
        ensureResolved();
        onLoop("onInit", () -> reporters.onInit(this));
        registry.globTestFiles(List.of());
        if (!config.watch()) {
            return CompletableFuture.completedFuture(null);
        }
        startWatcher();
        return reportWatcherStart(state.getFiles());
    }

    private synchronized void startWatcher() throws IOException {
        if (watcher == null) {
            watcher = new FileWatcher(config.root(), this);
            watcher.start();
        }
    }

    /**
     * Runs the files again. A trigger of {@code null} marks the run as covering all tests. An
     * active filename pattern narrows the files first.
     */
    public CompletableFuture<Void> rerunFiles(List<Path> files, String trigger) {
        List<Path> selected = files;
        Optional<String> pattern = scheduler.filenamePattern();
        if (pattern.isPresent()) {
            try {
                Set<Path> matching = registry.globTestFiles(List.of(pattern.get())).stream()
                        .map(WorkspaceSpec::file)
                        .collect(Collectors.toSet());
                selected = files.stream().filter(matching::contains).toList();
            } catch (IOException ex) {
                return CompletableFuture.failedFuture(ex);
            }
        }
        return executeRerun(selected, trigger, trigger == null);
    }

    public CompletableFuture<Void> rerunFiles() {
        return rerunFiles(state.getFilepaths(), null);
    }

    private CompletableFuture<Void> rerunChanged(List<Path> files, String trigger) {
        return executeRerun(files, trigger, false);
    }

    private CompletableFuture<Void> executeRerun(List<Path> files, String trigger, boolean allTestsRun) {
        List<Path> selected = List.copyOf(files);
        return onLoop("onWatcherRerun", () -> reporters.onWatcherRerun(selected, trigger))
                .thenCompose(ignored -> {
                    List<WorkspaceSpec> specs = selected.stream()
                            .flatMap(file -> registry.getProjectsByTestFile(file).stream())
                            .toList();
                    return coordinator.runFiles(sequencer.sort(specs), allTestsRun);
                })
                .thenCompose(ignored -> reportWatcherStart(state.getFiles(selected)));
    }

    public CompletableFuture<Void> rerunFailed() {
        return rerunFiles(state.getFailedFilepaths(), "rerun failed");
    }

    /**
     * Restricts runs to the projects named by the pattern, then reruns all of their test
     * files. An empty pattern restores every project.
     */
    public CompletableFuture<Void> changeProjectName(String pattern) {
        registry.filterProjects(pattern == null || pattern.isEmpty() ? List.of() : List.of(pattern));
        List<Path> files;
        try {
            files = registry.globTestFiles(List.of()).stream().map(WorkspaceSpec::file).distinct().toList();
        } catch (IOException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        return rerunFiles(files, "change project filter");
    }

    /**
     * Sets the test name pattern for upcoming runs and reruns the files that have a task
     * matching it, or that were not collected yet.
     */
    public CompletableFuture<Void> changeNamePattern(String pattern, List<Path> files, String trigger) {
        boolean reset = pattern == null || pattern.isEmpty();
        if (reset) {
            scheduler.setFilenamePattern(null);
        }
        coordinator.setConfigOverrides(coordinator.configOverrides().withTestNamePattern(pattern));

        List<Path> selected = files;
        if (!reset) {
            Pattern regex;
            try {
                regex = Pattern.compile(pattern);
            } catch (PatternSyntaxException ex) {
                throw new ConfigurationException("Invalid test name pattern " + pattern + ": " + ex.getDescription(), ex);
            }
            selected = files.stream().filter(file -> {
                List<TestFile> known = state.getFiles(List.of(file));
                if (known.isEmpty()) {
                    return true;
                }
                List<Task> tasks = Tasks.getTasks(known.get(0));
                return tasks.isEmpty() || tasks.stream().anyMatch(task -> regex.matcher(task.getName()).find());
            }).toList();
        }
        return rerunFiles(selected, trigger);
    }

    public CompletableFuture<Void> changeNamePattern(String pattern) {
        return changeNamePattern(pattern, state.getFilepaths(), "change pattern");
    }

    public CompletableFuture<Void> changeFilenamePattern(String pattern, List<Path> files) {
        scheduler.setFilenamePattern(pattern);
        String trigger = pattern == null || pattern.isEmpty() ? "reset filename pattern" : "change filename pattern";
        return rerunFiles(files, trigger);
    }

    public CompletableFuture<Void> changeFilenamePattern(String pattern) {
        return changeFilenamePattern(pattern, state.getFilepaths());
    }

    /**
     * Restricts watch reruns to the given test files. An empty list watches everything.
     */
    public void watchTests(List<Path> tests) {
        changeSet.watchTests(tests.stream().map(FilePaths::normalize).toList());
    }

    public void cancelCurrentRun(CancelReason reason) {
        coordinator.cancelCurrentRun(reason);
    }

    /**
     * Rebuilds the execution context from a freshly loaded configuration: the running run is
     * cancelled, pending reruns are dropped, the pool is closed and state starts over. The last
     * filters are run again afterwards.
     */
    public CompletableFuture<Void> restart() {
        OrchestratorConfig next;
        try {
            next = reloadConfig();
        } catch (IOException ex) {
            LOGGER.error("Failed to reload configuration, keeping the current one", ex);
            return CompletableFuture.failedFuture(ex);
        }
        restartsCount.incrementAndGet();
        ExecutionCoordinator previous = coordinator;
        String filenamePattern = scheduler.filenamePattern().orElse(null);
        scheduler.close();
        previous.cancelCurrentRun(CancelReason.CONFIG_CHANGE);
        LOGGER.info("Restarting after configuration change (restart #{})", restartsCount.get());

        return onLoop("onServerRestart", () -> reporters.onServerRestart(CancelReason.CONFIG_CHANGE))
                .thenCompose(ignored -> previous.close())
                .thenCompose(ignored -> onLoop("restart", () -> {
                    state.clear();
                    changeSet.clear();
                }))
                .thenCompose(ignored -> {
                    configure(next);
                    scheduler.setFilenamePattern(filenamePattern);
                    try {
                        return start(filters);
                    } catch (IOException ex) {
                        return CompletableFuture.failedFuture(ex);
                    }
                });
    }

    private OrchestratorConfig reloadConfig() throws IOException {
        OrchestratorConfig current = config;
        if (current.configFile().isEmpty()) {
            return current;
        }
        return configLoader.load(current.configFile().get())
                .withWatch(current.watch())
                .withOverrides(cliOverrides);
    }

    @Override
    public void onChange(Path file) {
        Path filepath = FilePaths.normalize(file);
        if (config.configFile().map(filepath::equals).orElse(false)) {
            restart().whenComplete((ignored, error) -> {
                if (error != null) {
                    LOGGER.error("Restart after configuration change failed", error);
                }
            });
            return;
        }
        post("onChange", () -> {
            for (Project project : registry.getModuleProjects(filepath)) {
                project.moduleServer().invalidate(filepath);
            }
            List<Path> needsRerun = propagator.handleFileChanged(filepath);
            if (!needsRerun.isEmpty()) {
                scheduler.scheduleRerun(needsRerun);
            }
        });
    }

    @Override
    public void onUnlink(Path file) {
        Path filepath = FilePaths.normalize(file);
        post("onUnlink", () -> {
            changeSet.invalidate(filepath);
            if (state.hasFile(filepath)) {
                state.removeFile(filepath);
                cache.removeFromCache(filepath);
                cache.removeStats(filepath);
                changeSet.removeChanged(filepath);
                reporters.onTestRemoved(filepath.toString());
            }
        });
    }

    @Override
    public void onAdd(Path file) {
        Path filepath = FilePaths.normalize(file);
        post("onAdd", () -> {
            for (Project project : registry.getModuleProjects(filepath)) {
                project.moduleServer().invalidate(filepath);
            }
            List<Project> owners = registry.projects().stream()
                    .filter(project -> project.isTargetFile(filepath))
                    .toList();
            if (!owners.isEmpty()) {
                for (Project project : owners) {
                    project.addTestFile(filepath);
                    registry.registerTestFile(project, filepath);
                }
                cache.updateStats(filepath);
                changeSet.markChanged(filepath);
                scheduler.scheduleRerun(List.of(filepath));
                return;
            }
            List<Path> needsRerun = propagator.handleFileChanged(filepath);
            if (!needsRerun.isEmpty()) {
                scheduler.scheduleRerun(needsRerun);
            }
        });
    }

    private void post(String method, Runnable action) {
        try {
            loop.post(method, action);
        } catch (RejectedExecutionException ex) {
            LOGGER.debug("Ignoring {} after close", method);
        }
    }

    private CompletableFuture<Void> onLoop(String method, Runnable action) {
        return loop.call(method, () -> {
            action.run();
            return null;
        });
    }

    private CompletableFuture<Void> reportWatcherStart(List<TestFile> files) {
        return onLoop("onWatcherStart", () -> reporters.onWatcherStart(files, state.getUnhandledErrors()));
    }

    private WorkerPool createPool() {
        OrchestratorConfig current = config;
        return new ThreadWorkerPool(current.threadCount(), runnerFactory.get(), this::rpcFor, current.bail(),
                current.teardownTimeout());
    }

    private RuntimeRpc rpcFor(Project project) {
        ExecutionCoordinator current = coordinator;
        return rpcHandlers.computeIfAbsent(project,
                key -> new ControlRpcHandler(key, loop, state, reporters, current::cancelCurrentRun));
    }

    /**
     * Stops the watcher and pending reruns, cancels the running run and tears everything down.
     * Idempotent.
     */
    public synchronized CompletableFuture<Void> close() {
        if (closePromise != null) {
            return closePromise;
        }
        scheduler.close();
        if (watcher != null) {
            try {
                watcher.close();
            } catch (IOException ex) {
                LOGGER.warn("Failed to close file watcher", ex);
            }
        }
        closePromise = coordinator.close().whenComplete((ignored, error) -> {
            if (error != null) {
                LOGGER.warn("Close finished with an error", error);
            }
            loop.close();
            closed.complete(null);
        });
        return closePromise;
    }

    /**
     * Closes, and when {@code force} is set hands the exit code to the exit handler afterwards.
     * When closing takes longer than the teardown timeout the process timeout causes are logged
     * and the exit handler is called anyway.
     */
    public CompletableFuture<Void> exit(boolean force) {
        long timeoutMillis = config.teardownTimeout().toMillis();
        CompletableFuture<Void> timeout = CompletableFuture.runAsync(
                () -> handleCloseTimeout(timeoutMillis),
                CompletableFuture.delayedExecutor(timeoutMillis, TimeUnit.MILLISECONDS));
        return close().whenComplete((ignored, error) -> {
            timeout.cancel(false);
            if (force) {
                exitHandler.accept(exitCode());
            }
        });
    }

    private void handleCloseTimeout(long timeoutMillis) {
        reporters.onProcessTimeout();
        LOGGER.warn("close timed out after {}ms", timeoutMillis);
        for (String cause : state.getProcessTimeoutCauses()) {
            LOGGER.warn("{}", cause);
        }
        exitHandler.accept(exitCode());
    }

    public void setExitHandler(IntConsumer exitHandler) {
        this.exitHandler = exitHandler;
    }

    /**
     * Completes once {@link #close()} finished.
     */
    public CompletableFuture<Void> closed() {
        return closed;
    }

    public int exitCode() {
        return coordinator.exitCode();
    }

    public OrchestratorConfig config() {
        return config;
    }

    public StateManager state() {
        return state;
    }

    public ChangeSet changeSet() {
        return changeSet;
    }

    public WorkspaceRegistry registry() {
        return registry;
    }

    public ExecutionCoordinator coordinator() {
        return coordinator;
    }

    public ResultsCache cache() {
        return cache;
    }

    public ControlLoop controlLoop() {
        return loop;
    }

    public Reporters reporters() {
        return reporters;
    }

    public int restartsCount() {
        return restartsCount.get();
    }
}
