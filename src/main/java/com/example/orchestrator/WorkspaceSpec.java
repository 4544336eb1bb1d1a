package com.example.orchestrator;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One schedulable unit of work: a test file within a project. Two specs are equal when they
 * name the same project and file.
 */
public record WorkspaceSpec(
        Project project,
        Path file
) {
    public WorkspaceSpec {
        Objects.requireNonNull(project, "project");
        file = FilePaths.normalize(file);
    }

    public String projectName() {
        return project.name();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof WorkspaceSpec spec)) {
            return false;
        }
        return project.name().equals(spec.project.name()) && file.equals(spec.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(project.name(), file);
    }

    @Override
    public String toString() {
        return "[" + project.name() + "] " + file;
    }
}
