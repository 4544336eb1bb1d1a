package com.example.orchestrator.model;

/**
 * Thrown by a test that declares itself not applicable. The referenced task ends up skipped
 * instead of failed.
 */
public class PendingTestException extends RuntimeException {
    public static final String CODE = "PENDING";

    private final String taskId;

    public PendingTestException(String taskId, String note) {
        super(note);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getCode() {
        return CODE;
    }
}
