package com.example.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ConfigLoader {
    private static final List<String> DEFAULT_INCLUDE = List.of(
            "**/*.{test,spec}.{js,mjs,cjs,ts,mts,cts,jsx,tsx}"
    );
    private static final List<String> DEFAULT_EXCLUDE = List.of(
            "**/node_modules/**",
            "**/dist/**",
            "**/.git/**"
    );
    private static final List<String> DEFAULT_FORCE_RERUN_TRIGGERS = List.of(
            "**/package.json",
            "**/orchestrator.config.*"
    );
    private static final List<String> DEFAULT_TEST_COMMAND = List.of("node", "{file}");
    private static final long DEFAULT_TEST_TIMEOUT_MILLIS = 5_000;
    private static final long DEFAULT_DEBOUNCE_MILLIS = 100;
    private static final long DEFAULT_TEARDOWN_TIMEOUT_MILLIS = 10_000;
    private static final String DEFAULT_CACHE_FILE = ".orchestrator/results.json";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads the root configuration file. Relative paths inside it are resolved against the
     * directory containing the file.
     */
    public OrchestratorConfig load(Path path) throws IOException {
        Path configFile = FilePaths.normalize(path);
        RawConfig raw = read(configFile, RawConfig.class);
        Path baseDirectory = configFile.getParent();
        return fromRaw(raw, baseDirectory, Optional.of(configFile));
    }

    /**
     * Default settings for a root directory without a config file.
     */
    public OrchestratorConfig defaults(Path root) {
        return fromRaw(new RawConfig(), FilePaths.normalize(root), Optional.empty());
    }

    /**
     * Loads a project config file found by a workspace glob. The project root defaults to the
     * directory of the file and the name to the directory name.
     */
    public ProjectConfig loadProject(Path path) throws IOException {
        Path configFile = FilePaths.normalize(path);
        RawProjectConfig raw = read(configFile, RawProjectConfig.class);
        return projectFromRaw(raw, configFile.getParent());
    }

    /**
     * Project settings for a directory matched by a workspace glob that has no config file.
     */
    public ProjectConfig defaultProject(Path directory) {
        return projectFromRaw(new RawProjectConfig(), FilePaths.normalize(directory));
    }

    /**
     * Reads a workspace file: either a JSON array of entries or an object with a
     * {@code projects} array. String entries are globs, object entries inline project configs.
     */
    public WorkspaceDefinition loadWorkspace(Path path) throws IOException {
        Path workspaceFile = FilePaths.normalize(path);
        JsonNode root;
        try {
            root = mapper.readTree(workspaceFile.toFile());
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Workspace config file " + workspaceFile + " is not valid JSON.", ex);
        }
        JsonNode entries = root != null && root.isObject() ? root.get("projects") : root;
        if (entries == null || !entries.isArray()) {
            throw new ConfigurationException("Workspace config file " + workspaceFile
                    + " must define an array of project entries.");
        }

        Path baseDirectory = workspaceFile.getParent();
        WorkspaceDefinition definition = new WorkspaceDefinition();
        for (JsonNode entry : entries) {
            if (entry.isTextual()) {
                definition.glob(entry.asText());
            } else if (entry.isObject()) {
                RawProjectConfig raw = mapper.treeToValue(entry, RawProjectConfig.class);
                definition.project(projectFromRaw(raw, baseDirectory));
            } else {
                throw new ConfigurationException("Unsupported workspace entry " + entry + " in " + workspaceFile);
            }
        }
        return definition;
    }

    private <T> T read(Path file, Class<T> type) throws IOException {
        try {
            return mapper.readValue(file.toFile(), type);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Config file " + file + " could not be parsed: " + ex.getOriginalMessage(), ex);
        }
    }

    private OrchestratorConfig fromRaw(RawConfig raw, Path baseDirectory, Optional<Path> configFile) {
        Path root = raw.root == null || raw.root.isBlank()
                ? baseDirectory
                : FilePaths.normalize(baseDirectory.resolve(raw.root));
        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        if (raw.bail != null && raw.bail < 0) {
            throw new ConfigurationException("bail must not be negative.");
        }
        int bail = raw.bail == null ? 0 : raw.bail;
        boolean watch = raw.watch != null && raw.watch;
        boolean passWithNoTests = raw.passWithNoTests != null && raw.passWithNoTests;
        boolean cacheEnabled = raw.cache == null || raw.cache;
        Path cacheFile = root.resolve(optionalString(raw.cacheFile, DEFAULT_CACHE_FILE));
        Optional<Path> workspace = Optional.ofNullable(raw.workspace)
                .filter(value -> !value.isBlank())
                .map(root::resolve);
        Optional<Path> reportDirectory = Optional.ofNullable(raw.reportDirectory)
                .filter(value -> !value.isBlank())
                .map(root::resolve);
        Optional<List<String>> related = Optional.ofNullable(raw.related).map(List::copyOf);

        return new OrchestratorConfig(
                root,
                configFile,
                optionalString(raw.name, ""),
                orDefault(raw.include, DEFAULT_INCLUDE),
                mergePatterns(DEFAULT_EXCLUDE, raw.exclude),
                orDefault(raw.testCommand, DEFAULT_TEST_COMMAND),
                millis(raw.testTimeoutMillis, DEFAULT_TEST_TIMEOUT_MILLIS),
                workspace,
                orDefault(raw.project, List.of()),
                orDefault(raw.forceRerunTriggers, DEFAULT_FORCE_RERUN_TRIGGERS),
                related,
                threadCount,
                bail,
                watch,
                passWithNoTests,
                millis(raw.debounceMillis, DEFAULT_DEBOUNCE_MILLIS),
                millis(raw.teardownTimeoutMillis, DEFAULT_TEARDOWN_TIMEOUT_MILLIS),
                cacheEnabled,
                cacheFile,
                reportDirectory,
                new ProjectOverrides(Optional.empty(), Optional.ofNullable(raw.testNamePattern).filter(value -> !value.isBlank()))
        );
    }

    private ProjectConfig projectFromRaw(RawProjectConfig raw, Path baseDirectory) {
        Path root = raw.root == null || raw.root.isBlank()
                ? baseDirectory
                : FilePaths.normalize(baseDirectory.resolve(raw.root));
        String defaultName = root.getFileName() == null ? "" : root.getFileName().toString();
        return new ProjectConfig(
                optionalString(raw.name, defaultName),
                root,
                orDefault(raw.include, DEFAULT_INCLUDE),
                mergePatterns(DEFAULT_EXCLUDE, raw.exclude),
                orDefault(raw.testCommand, DEFAULT_TEST_COMMAND),
                millis(raw.testTimeoutMillis, DEFAULT_TEST_TIMEOUT_MILLIS),
                Optional.ofNullable(raw.testNamePattern).filter(value -> !value.isBlank())
        );
    }

    private Duration millis(Long value, long fallback) {
        if (value != null && value < 0) {
            throw new ConfigurationException("Durations must not be negative, got " + value + "ms.");
        }
        return Duration.ofMillis(value == null ? fallback : value);
    }

    private List<String> orDefault(List<String> values, List<String> fallback) {
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        return List.copyOf(values);
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String root;
        public String name;
        public List<String> include;
        public List<String> exclude;
        public List<String> testCommand;
        public Long testTimeoutMillis;
        public String testNamePattern;
        public String workspace;
        public List<String> project;
        public List<String> forceRerunTriggers;
        public List<String> related;
        public Integer threadCount;
        public Integer bail;
        public Boolean watch;
        public Boolean passWithNoTests;
        public Long debounceMillis;
        public Long teardownTimeoutMillis;
        public Boolean cache;
        public String cacheFile;
        public String reportDirectory;
    }

    private static class RawProjectConfig {
        public String name;
        public String root;
        public List<String> include;
        public List<String> exclude;
        public List<String> testCommand;
        public Long testTimeoutMillis;
        public String testNamePattern;
    }
}
