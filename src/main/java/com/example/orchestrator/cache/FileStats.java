package com.example.orchestrator.cache;

public record FileStats(
        long size,
        long mtime
) {
}
