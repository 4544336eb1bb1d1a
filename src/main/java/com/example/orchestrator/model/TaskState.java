package com.example.orchestrator.model;

public enum TaskState {
    RUN,
    PASS,
    FAIL,
    SKIP,
    PENDING
}
