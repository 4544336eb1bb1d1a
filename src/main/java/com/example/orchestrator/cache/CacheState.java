package com.example.orchestrator.cache;

import java.util.Map;

/**
 * Serializable payload of the results cache file.
 */
public record CacheState(
        String version,
        Map<String, CachedResult> results,
        Map<String, FileStats> stats
) {
    public CacheState {
        results = results == null ? Map.of() : results;
        stats = stats == null ? Map.of() : stats;
    }
}
