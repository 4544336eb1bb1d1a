package com.example.orchestrator;

import java.util.ArrayList;
import java.util.List;

/**
 * Entries of a workspace: glob patterns pointing at project directories or config files, and
 * inline project configurations (plain or produced by a factory).
 */
public final class WorkspaceDefinition {
    private final List<String> globs = new ArrayList<>();
    private final List<ProjectConfigFactory> inline = new ArrayList<>();

    public WorkspaceDefinition glob(String pattern) {
        globs.add(pattern);
        return this;
    }

    public WorkspaceDefinition project(ProjectConfig config) {
        inline.add(context -> config);
        return this;
    }

    public WorkspaceDefinition project(ProjectConfigFactory factory) {
        inline.add(factory);
        return this;
    }

    public List<String> globs() {
        return List.copyOf(globs);
    }

    public List<ProjectConfigFactory> inline() {
        return List.copyOf(inline);
    }

    public boolean isEmpty() {
        return globs.isEmpty() && inline.isEmpty();
    }
}
