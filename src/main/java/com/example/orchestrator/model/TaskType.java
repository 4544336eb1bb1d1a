package com.example.orchestrator.model;

public enum TaskType {
    TEST,
    SUITE,
    FILE
}
