package com.example.orchestrator.model;

import java.util.List;

/**
 * Outcome of a single task as reported by a worker.
 */
public record TaskResult(
        TaskState state,
        long duration,
        List<String> errors
) {
    public TaskResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static TaskResult of(TaskState state) {
        return new TaskResult(state, 0L, List.of());
    }

    public TaskResult withState(TaskState newState) {
        return new TaskResult(newState, duration, errors);
    }
}
