package com.example.orchestrator.cache;

import com.example.orchestrator.WorkspaceSpec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Orders specs so the most informative ones start first. Files never seen before come first,
 * then files with known size but no cached result (larger first), then files with a cached
 * result: previously failed ones, then the slowest.
 */
public final class SpecSequencer {
    private static final int UNSEEN = 0;
    private static final int STATS_ONLY = 1;
    private static final int HAS_RESULT = 2;

    private final ResultsCache cache;
    private final Path root;

    public SpecSequencer(ResultsCache cache, Path root) {
        this.cache = cache;
        this.root = root;
    }

    public List<WorkspaceSpec> sort(List<WorkspaceSpec> specs) {
        Map<WorkspaceSpec, SortKey> keys = new HashMap<>();
        for (WorkspaceSpec spec : specs) {
            keys.computeIfAbsent(spec, this::sortKey);
        }
        List<WorkspaceSpec> sorted = new ArrayList<>(specs);
        sorted.sort(Comparator.comparing(keys::get, SortKey.ORDER));
        return sorted;
    }

    private SortKey sortKey(WorkspaceSpec spec) {
        Optional<CachedResult> result = cache.getResults(ResultsCache.key(spec.projectName(), root, spec.file()));
        if (result.isPresent()) {
            return new SortKey(HAS_RESULT, result.get().failed() ? 0 : 1, result.get().duration());
        }
        Optional<FileStats> stats = cache.getFileStats(spec.file());
        return stats.map(value -> new SortKey(STATS_ONLY, 0, value.size()))
                .orElseGet(() -> new SortKey(UNSEEN, 0, 0));
    }

    /**
     * Ascending rank and outcome, then descending weight (size or duration).
     */
    private record SortKey(int rank, int outcome, long weight) {
        static final Comparator<SortKey> ORDER = Comparator.comparingInt(SortKey::rank)
                .thenComparingInt(SortKey::outcome)
                .thenComparing(Comparator.comparingLong(SortKey::weight).reversed());
    }
}
