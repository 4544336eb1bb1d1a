package com.example.orchestrator;

@FunctionalInterface
public interface ProjectConfigFactory {
    ProjectConfig create(EnvironmentContext context) throws Exception;
}
