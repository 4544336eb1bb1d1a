package com.example.orchestrator.pool;

/**
 * The test runtime inside a worker: executes one test file and streams its results back
 * through {@link WorkerContext#rpc()}.
 */
@FunctionalInterface
public interface TestFileRunner {
    void run(WorkerContext context) throws Exception;
}
