package com.example.orchestrator;

/**
 * Passed to inline project factories of a workspace definition.
 */
public record EnvironmentContext(
        String command,
        String mode
) {
    public static EnvironmentContext of(boolean watch) {
        return new EnvironmentContext(watch ? "watch" : "run", "test");
    }
}
