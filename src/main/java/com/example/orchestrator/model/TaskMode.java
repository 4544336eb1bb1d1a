package com.example.orchestrator.model;

public enum TaskMode {
    RUN,
    ONLY,
    SKIP,
    TODO
}
