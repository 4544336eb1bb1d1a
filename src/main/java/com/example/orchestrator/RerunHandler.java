package com.example.orchestrator;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Receives the files a debounced rerun settled on.
 */
@FunctionalInterface
public interface RerunHandler {
    CompletableFuture<Void> rerun(List<Path> files, String trigger);
}
