package com.example.orchestrator.cache;

import com.example.orchestrator.FilePaths;
import com.example.orchestrator.model.TaskState;
import com.example.orchestrator.model.TestFile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known pass/fail and duration per test file plus file stats, persisted to a single JSON
 * file between processes. Reading and writing are best effort: a missing or corrupt cache
 * never blocks a run.
 */
public final class ResultsCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultsCache.class);
    static final String VERSION = "1";

    private final ObjectMapper mapper;
    private final Path cachePath;
    private final Path root;
    private final boolean enabled;
    private final Map<String, CachedResult> results = new ConcurrentHashMap<>();
    private final Map<String, FileStats> stats = new ConcurrentHashMap<>();

    public ResultsCache(Path cachePath, Path root, boolean enabled) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cachePath = cachePath;
        this.root = FilePaths.normalize(root);
        this.enabled = enabled;
    }

    public static String key(String projectName, Path root, Path file) {
        return (projectName == null ? "" : projectName) + ":" + FilePaths.relativeLabel(root, file);
    }

    public Optional<CachedResult> getResults(String key) {
        return Optional.ofNullable(results.get(key));
    }

    public Optional<FileStats> getFileStats(Path file) {
        return Optional.ofNullable(stats.get(FilePaths.normalize(file).toString()));
    }

    /**
     * Loads the cache file if it exists. Unreadable content is logged and ignored.
     */
    public void readFromCache() {
        if (!enabled || !Files.exists(cachePath)) {
            return;
        }
        try {
            CacheState state = mapper.readValue(cachePath.toFile(), CacheState.class);
            if (state == null) {
                LOGGER.warn("Results cache {} is empty, starting empty", cachePath);
                return;
            }
            if (!VERSION.equals(state.version())) {
                LOGGER.info("Ignoring results cache {} written by version {}", cachePath, state.version());
                return;
            }
            state.results().forEach((key, result) -> {
                if (key != null && result != null) {
                    results.put(key, result);
                }
            });
            state.stats().forEach((key, fileStats) -> {
                if (key != null && fileStats != null) {
                    stats.put(key, fileStats);
                }
            });
            LOGGER.debug("Loaded {} cached result(s) from {}", results.size(), cachePath);
        } catch (IOException ex) {
            LOGGER.warn("Could not read results cache {}, starting empty", cachePath, ex);
        }
    }

    public void updateResults(Collection<TestFile> files) {
        for (TestFile file : files) {
            if (file.getResult() == null) {
                continue;
            }
            long duration = Math.max(0L, file.getResult().duration());
            results.put(key(file.getProjectName(), root, file.path()),
                    new CachedResult(file.getResult().state() == TaskState.FAIL, duration));
        }
    }

    public void removeFromCache(Path file) {
        String suffix = ":" + FilePaths.relativeLabel(root, file);
        results.keySet().removeIf(key -> key.endsWith(suffix));
    }

    /**
     * Writes the cache file, creating parent directories if needed. Failures are logged.
     */
    public void writeToCache() {
        if (!enabled) {
            return;
        }
        try {
            Files.createDirectories(cachePath.getParent());
            CacheState state = new CacheState(VERSION, new TreeMap<>(results), new TreeMap<>(stats));
            mapper.writerWithDefaultPrettyPrinter().writeValue(cachePath.toFile(), state);
        } catch (IOException ex) {
            LOGGER.warn("Could not write results cache {}", cachePath, ex);
        }
    }

    public void populateStats(Collection<Path> files) {
        files.forEach(this::updateStats);
    }

    public void updateStats(Path file) {
        Path normalized = FilePaths.normalize(file);
        try {
            stats.put(normalized.toString(),
                    new FileStats(Files.size(normalized), Files.getLastModifiedTime(normalized).toMillis()));
        } catch (IOException ex) {
            LOGGER.debug("Could not read stats of {}", normalized, ex);
            stats.remove(normalized.toString());
        }
    }

    public void removeStats(Path file) {
        stats.remove(FilePaths.normalize(file).toString());
    }

    public void clear() {
        results.clear();
        stats.clear();
    }

    public Path path() {
        return cachePath;
    }
}
