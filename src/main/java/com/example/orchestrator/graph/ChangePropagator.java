package com.example.orchestrator.graph;

import com.example.orchestrator.FilePaths;
import com.example.orchestrator.GlobMatcher;
import com.example.orchestrator.Project;
import com.example.orchestrator.StateManager;
import com.example.orchestrator.WorkspaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps an edited file to the test files that transitively depend on it.
 * <p>
 * Affected test files are added to the {@link ChangeSet}'s changed tests. The returned list is
 * the trigger chain: the edited file itself when it, or something importing it, leads to a
 * test file. Must be called from the control loop.
 */
public final class ChangePropagator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChangePropagator.class);

    private final WorkspaceRegistry registry;
    private final StateManager state;
    private final ChangeSet changeSet;
    private final GlobMatcher forceRerunTriggers;

    public ChangePropagator(WorkspaceRegistry registry,
                            StateManager state,
                            ChangeSet changeSet,
                            GlobMatcher forceRerunTriggers) {
        this.registry = registry;
        this.state = state;
        this.changeSet = changeSet;
        this.forceRerunTriggers = forceRerunTriggers;
    }

    public List<Path> handleFileChanged(Path file) {
        Path filepath = FilePaths.normalize(file);
        if (changeSet.isChanged(filepath) || changeSet.isInvalidated(filepath)) {
            return List.of();
        }

        if (forceRerunTriggers.matches(filepath)) {
            LOGGER.debug("{} matches a force rerun trigger, marking all test files as changed", filepath);
            changeSet.markChanged(state.getFilepaths());
            return List.of(filepath);
        }

        List<Project> projects = registry.getModuleProjects(filepath);
        if (projects.isEmpty()) {
            if (isKnownTestFile(filepath)) {
                changeSet.markChanged(filepath);
                return List.of(filepath);
            }
            return List.of();
        }

        Set<Path> files = new LinkedHashSet<>();
        for (Project project : projects) {
            DependencyGraph graph = project.dependencyGraph();
            if (!graph.hasModule(filepath)) {
                continue;
            }
            changeSet.invalidate(filepath);

            if (state.hasFile(filepath) || project.isTestFile(filepath)) {
                changeSet.markChanged(filepath);
                files.add(filepath);
                continue;
            }

            boolean rerun = false;
            for (Path importer : graph.importersOf(filepath)) {
                if (!handleFileChanged(importer).isEmpty()) {
                    rerun = true;
                }
            }
            if (rerun) {
                files.add(filepath);
            }
        }
        return List.copyOf(files);
    }

    private boolean isKnownTestFile(Path filepath) {
        if (state.hasFile(filepath)) {
            return true;
        }
        return registry.projects().stream().anyMatch(project -> project.isTestFile(filepath));
    }
}
