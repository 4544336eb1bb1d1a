package com.example.orchestrator;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for the orchestrator.
 */
public record OrchestratorConfig(
        Path root,
        Optional<Path> configFile,
        String name,
        List<String> include,
        List<String> exclude,
        List<String> testCommand,
        Duration testTimeout,
        Optional<Path> workspace,
        List<String> projectFilters,
        List<String> forceRerunTriggers,
        Optional<List<String>> related,
        int threadCount,
        int bail,
        boolean watch,
        boolean passWithNoTests,
        Duration debounce,
        Duration teardownTimeout,
        boolean cacheEnabled,
        Path cacheFile,
        Optional<Path> reportDirectory,
        ProjectOverrides overrides
) {
    /**
     * Settings of the core project, the fallback owner of every file.
     */
    public ProjectConfig coreProjectConfig() {
        return new ProjectConfig(name, root, include, exclude, testCommand, testTimeout, Optional.empty())
                .withOverrides(overrides);
    }

    public OrchestratorConfig withWatch(boolean enabled) {
        return new OrchestratorConfig(root, configFile, name, include, exclude, testCommand, testTimeout, workspace,
                projectFilters, forceRerunTriggers, related, threadCount, bail, enabled, passWithNoTests, debounce,
                teardownTimeout, cacheEnabled, cacheFile, reportDirectory, overrides);
    }

    public OrchestratorConfig withOverrides(ProjectOverrides cliOverrides) {
        return new OrchestratorConfig(root, configFile, name, include, exclude, testCommand, testTimeout, workspace,
                projectFilters, forceRerunTriggers, related, threadCount, bail, watch, passWithNoTests, debounce,
                teardownTimeout, cacheEnabled, cacheFile, reportDirectory, overrides.merge(cliOverrides));
    }
}
