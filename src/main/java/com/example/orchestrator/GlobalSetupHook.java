package com.example.orchestrator;

/**
 * Shared precondition of a project, run once before its first test run and torn down on close.
 */
public interface GlobalSetupHook {
    void setup(Project project) throws Exception;

    default void teardown(Project project) throws Exception {
    }
}
