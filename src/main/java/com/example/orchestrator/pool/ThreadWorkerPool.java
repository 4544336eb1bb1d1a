package com.example.orchestrator.pool;

import com.example.orchestrator.CancelReason;
import com.example.orchestrator.Project;
import com.example.orchestrator.Run;
import com.example.orchestrator.WorkspaceSpec;
import com.example.orchestrator.model.TaskMode;
import com.example.orchestrator.model.TaskResult;
import com.example.orchestrator.model.TaskState;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.rpc.RuntimeRpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs each spec on a fixed pool of worker threads. Workers reach the control side only
 * through the {@link RuntimeRpc} of the file's project.
 */
public final class ThreadWorkerPool implements WorkerPool {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThreadWorkerPool.class);
    static final String UNHANDLED_ERROR = "Unhandled Error";

    private final ExecutorService executor;
    private final TestFileRunner runner;
    private final Function<Project, RuntimeRpc> rpcFactory;
    private final int bail;
    private final Duration shutdownTimeout;
    private final Set<WorkspaceSpec> running = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public ThreadWorkerPool(int threadCount, TestFileRunner runner, Function<Project, RuntimeRpc> rpcFactory, int bail) {
        this(threadCount, runner, rpcFactory, bail, Duration.ofMinutes(1));
    }

    public ThreadWorkerPool(int threadCount, TestFileRunner runner, Function<Project, RuntimeRpc> rpcFactory, int bail,
                            Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
        this.executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        this.runner = runner;
        this.rpcFactory = rpcFactory;
        this.bail = bail;
    }

    @Override
    public CompletableFuture<Void> runTests(Run run) {
        if (closed) {
            throw new IllegalStateException("Worker pool is closed");
        }
        run.onCancel(reason -> LOGGER.debug("Run #{} cancelled ({}), remaining specs will be skipped",
                run.generation(), reason));

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (WorkspaceSpec spec : run.specs()) {
            RuntimeRpc rpc = rpcFactory.apply(spec.project());
            futures.add(CompletableFuture.runAsync(() -> runSpec(run, spec, rpc), executor));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    }

    private void runSpec(Run run, WorkspaceSpec spec, RuntimeRpc rpc) {
        // Cancellation is observed only between specs; a started spec always finishes.
        if (run.isCancelled() || closed) {
            reportSkipped(spec, rpc);
            return;
        }

        WorkerContext context = new WorkerContext(spec, rpc, run.invalidates(), run::isCancelled, run.configFor(spec));
        running.add(spec);
        try {
            runner.run(context);
        } catch (Exception ex) {
            LOGGER.warn("Worker failed while running {}", spec, ex);
            rpc.onUnhandledError(ex, UNHANDLED_ERROR);
        } finally {
            running.remove(spec);
        }

        if (bail > 0 && !run.isCancelled()) {
            checkBail(rpc);
        }
    }

    private void checkBail(RuntimeRpc rpc) {
        try {
            long failed = rpc.getCountOfFailedTests().join();
            if (failed >= bail) {
                LOGGER.info("{} failed test(s) reached the bail limit of {}", failed, bail);
                rpc.onCancel(CancelReason.TEST_FAILURE);
            }
        } catch (CompletionException ex) {
            LOGGER.warn("Could not query failed test count", ex);
        }
    }

    private void reportSkipped(WorkspaceSpec spec, RuntimeRpc rpc) {
        TestFile file = TestFile.create(spec.file(), spec.project().root(), spec.projectName());
        file.setMode(TaskMode.SKIP);
        file.setResult(TaskResult.of(TaskState.SKIP));
        rpc.onCollected(List.of(file));
        rpc.onFinished(List.of(file));
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Workers did not stop within {}ms, interrupting", shutdownTimeout.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public List<WorkspaceSpec> unfinishedSpecs() {
        return List.copyOf(running);
    }
}
