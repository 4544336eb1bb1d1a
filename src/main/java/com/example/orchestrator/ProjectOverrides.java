package com.example.orchestrator;

import java.time.Duration;
import java.util.Optional;

/**
 * Command-line level options applied on top of every project's own configuration.
 */
public record ProjectOverrides(
        Optional<Duration> testTimeout,
        Optional<String> testNamePattern
) {
    public static ProjectOverrides none() {
        return new ProjectOverrides(Optional.empty(), Optional.empty());
    }

    public ProjectOverrides withTestNamePattern(String pattern) {
        return new ProjectOverrides(testTimeout, Optional.ofNullable(pattern).filter(value -> !value.isEmpty()));
    }

    public ProjectOverrides merge(ProjectOverrides other) {
        return new ProjectOverrides(
                other.testTimeout().or(() -> testTimeout),
                other.testNamePattern().or(() -> testNamePattern)
        );
    }
}
