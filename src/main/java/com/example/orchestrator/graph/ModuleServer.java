package com.example.orchestrator.graph;

import com.example.orchestrator.FilePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves transformed modules for one project, caching transforms and recording the import
 * edges of every module it serves.
 */
public final class ModuleServer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModuleServer.class);

    private final ModuleTransformer transformer;
    private final DependencyGraph graph;
    private final Map<Path, TransformResult> cache = new ConcurrentHashMap<>();

    public ModuleServer(ModuleTransformer transformer, DependencyGraph graph) {
        this.transformer = transformer;
        this.graph = graph;
    }

    public TransformResult fetchModule(Path file, TransformMode mode) throws IOException {
        Path normalized = FilePaths.normalize(file);
        TransformResult cached = cache.get(normalized);
        if (cached != null) {
            return cached;
        }
        TransformResult result = transformer.transform(normalized, mode);
        graph.recordModule(normalized);
        for (String dependency : allDependencies(result)) {
            transformer.resolveId(dependency, normalized, mode)
                    .ifPresent(resolved -> graph.recordEdge(normalized, resolved));
        }
        cache.put(normalized, result);
        return result;
    }

    public Optional<Path> resolveId(String id, Path importer, TransformMode mode) {
        return transformer.resolveId(id, importer == null ? null : FilePaths.normalize(importer), mode);
    }

    /**
     * Drops the cached transform of a file together with its outgoing edges.
     */
    public void invalidate(Path file) {
        Path normalized = FilePaths.normalize(file);
        cache.remove(normalized);
        graph.invalidate(normalized);
    }

    /**
     * Transitive dependencies of a file, transforming modules as needed. The file itself is
     * not part of the result.
     */
    public Set<Path> dependenciesOf(Path file) {
        Path start = FilePaths.normalize(file);
        Set<Path> visited = new LinkedHashSet<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.add(start);
        while (!pending.isEmpty()) {
            Path current = pending.removeFirst();
            if (!visited.add(current)) {
                continue;
            }
            try {
                fetchModule(current, TransformMode.SSR);
            } catch (IOException ex) {
                LOGGER.warn("Failed to transform {}", current, ex);
                continue;
            }
            for (Path dependency : graph.importsOf(current)) {
                if (!visited.contains(dependency)) {
                    pending.addLast(dependency);
                }
            }
        }
        visited.remove(start);
        return visited;
    }

    public DependencyGraph graph() {
        return graph;
    }

    private Set<String> allDependencies(TransformResult result) {
        Set<String> dependencies = new LinkedHashSet<>(result.dependencies());
        dependencies.addAll(result.dynamicDependencies());
        return dependencies;
    }
}
