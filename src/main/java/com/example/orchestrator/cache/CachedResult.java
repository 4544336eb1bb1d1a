package com.example.orchestrator.cache;

/**
 * Last known outcome of one test file in one project.
 */
public record CachedResult(
        boolean failed,
        long duration
) {
}
