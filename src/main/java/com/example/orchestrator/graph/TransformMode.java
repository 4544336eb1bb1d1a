package com.example.orchestrator.graph;

public enum TransformMode {
    SSR,
    WEB
}
