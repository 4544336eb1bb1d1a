package com.example.orchestrator.graph;

import com.example.orchestrator.FilePaths;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Import edges of one project, kept as adjacency sets in both directions.
 */
public final class DependencyGraph {
    private final Map<Path, Set<Path>> imports = new ConcurrentHashMap<>();
    private final Map<Path, Set<Path>> importers = new ConcurrentHashMap<>();

    public void recordModule(Path file) {
        imports.computeIfAbsent(FilePaths.normalize(file), ignored -> ConcurrentHashMap.newKeySet());
    }

    public void recordEdge(Path importer, Path imported) {
        Path from = FilePaths.normalize(importer);
        Path to = FilePaths.normalize(imported);
        recordModule(from);
        recordModule(to);
        imports.get(from).add(to);
        importers.computeIfAbsent(to, ignored -> ConcurrentHashMap.newKeySet()).add(from);
    }

    /**
     * Drops the outgoing edges of a file so they are rebuilt on its next transform. Edges
     * pointing at the file stay, its importers are still known.
     */
    public void invalidate(Path file) {
        Path from = FilePaths.normalize(file);
        Set<Path> outgoing = imports.get(from);
        if (outgoing == null) {
            return;
        }
        for (Path dependency : outgoing) {
            Set<Path> back = importers.get(dependency);
            if (back != null) {
                back.remove(from);
            }
        }
        outgoing.clear();
    }

    public boolean hasModule(Path file) {
        return imports.containsKey(FilePaths.normalize(file));
    }

    public Set<Path> importersOf(Path file) {
        return Set.copyOf(importers.getOrDefault(FilePaths.normalize(file), Set.of()));
    }

    public Set<Path> importsOf(Path file) {
        return Set.copyOf(imports.getOrDefault(FilePaths.normalize(file), Set.of()));
    }

    public int size() {
        return imports.size();
    }

    public void clear() {
        imports.clear();
        importers.clear();
    }
}
