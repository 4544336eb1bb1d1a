package com.example.orchestrator;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Immutable settings of a single project within a workspace.
 */
public record ProjectConfig(
        String name,
        Path root,
        List<String> include,
        List<String> exclude,
        List<String> testCommand,
        Duration testTimeout,
        Optional<String> testNamePattern
) {
    public ProjectConfig {
        root = FilePaths.normalize(root);
        include = List.copyOf(include);
        exclude = List.copyOf(exclude);
        testCommand = List.copyOf(testCommand);
    }

    public ProjectConfig withOverrides(ProjectOverrides overrides) {
        return new ProjectConfig(
                name,
                root,
                include,
                exclude,
                testCommand,
                overrides.testTimeout().orElse(testTimeout),
                overrides.testNamePattern().or(() -> testNamePattern)
        );
    }

    public ProjectConfig withName(String newName) {
        return new ProjectConfig(newName, root, include, exclude, testCommand, testTimeout, testNamePattern);
    }
}
