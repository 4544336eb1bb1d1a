package com.example.orchestrator.pool;

import com.example.orchestrator.Run;
import com.example.orchestrator.WorkspaceSpec;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Executes the specs of a run in isolated workers.
 */
public interface WorkerPool extends AutoCloseable {
    /**
     * Starts executing the run's specs. The future completes once every spec has either
     * finished or been skipped.
     *
     * @throws IllegalStateException if the pool is closed
     */
    CompletableFuture<Void> runTests(Run run);

    /**
     * Releases the workers. Idempotent; specs not yet started are skipped.
     */
    @Override
    void close();

    /**
     * Specs whose workers were still running when {@link #close()} gave up waiting.
     */
    default List<WorkspaceSpec> unfinishedSpecs() {
        return List.of();
    }
}
