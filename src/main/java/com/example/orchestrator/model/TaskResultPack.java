package com.example.orchestrator.model;

import java.util.Map;

/**
 * Incremental task update streamed from a worker: the task id, its latest result and meta.
 */
public record TaskResultPack(
        String taskId,
        TaskResult result,
        Map<String, Object> meta
) {
    public TaskResultPack {
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public static TaskResultPack of(Task task, TaskResult result) {
        return new TaskResultPack(task.getId(), result, task.getMeta());
    }
}
