package com.example.orchestrator.pool;

import com.example.orchestrator.ProjectConfig;
import com.example.orchestrator.WorkspaceSpec;
import com.example.orchestrator.rpc.RuntimeRpc;

import java.nio.file.Path;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * What a worker gets for one spec.
 */
public record WorkerContext(
        WorkspaceSpec spec,
        RuntimeRpc rpc,
        Set<Path> invalidates,
        BooleanSupplier cancellation,
        ProjectConfig config
) {
    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }
}
