package com.example.orchestrator.graph;

import com.example.orchestrator.FilePaths;
import com.example.orchestrator.GlobMatcher;
import com.example.orchestrator.WorkspaceSpec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps only the specs that are, or transitively import, one of the related source files.
 */
public final class RelatedFilesFilter {
    private final Optional<List<Path>> related;
    private final GlobMatcher forceRerunTriggers;
    private final boolean watch;

    public RelatedFilesFilter(Path root, Optional<List<String>> related, GlobMatcher forceRerunTriggers, boolean watch) {
        this.related = related.map(paths -> paths.stream()
                .map(path -> FilePaths.normalize(root.resolve(path)))
                .toList());
        this.forceRerunTriggers = forceRerunTriggers;
        this.watch = watch;
    }

    public List<WorkspaceSpec> filter(List<WorkspaceSpec> specs) {
        if (related.isEmpty()) {
            return specs;
        }
        List<Path> relatedFiles = related.get();
        if (relatedFiles.stream().anyMatch(forceRerunTriggers::matches)) {
            return specs;
        }
        if (!watch && relatedFiles.isEmpty()) {
            return List.of();
        }

        List<WorkspaceSpec> running = new ArrayList<>();
        for (WorkspaceSpec spec : specs) {
            Set<Path> dependencies = spec.project().moduleServer().dependenciesOf(spec.file());
            if (relatedFiles.stream().anyMatch(path -> path.equals(spec.file()) || dependencies.contains(path))) {
                running.add(spec);
            }
        }
        return running;
    }
}
