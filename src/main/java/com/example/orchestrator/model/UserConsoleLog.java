package com.example.orchestrator.model;

/**
 * A line of console output captured in a worker, timestamped so reporters can order it.
 */
public record UserConsoleLog(
        String content,
        String type,
        String taskId,
        long time
) {
    public static UserConsoleLog stdout(String taskId, String content) {
        return new UserConsoleLog(content, "stdout", taskId, System.currentTimeMillis());
    }

    public static UserConsoleLog stderr(String taskId, String content) {
        return new UserConsoleLog(content, "stderr", taskId, System.currentTimeMillis());
    }
}
