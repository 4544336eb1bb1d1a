package com.example.orchestrator.graph;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Turns a file into executable code and resolves import specifiers to files.
 */
public interface ModuleTransformer {
    TransformResult transform(Path file, TransformMode mode) throws IOException;

    /**
     * Resolves an import specifier relative to its importer. Empty for external modules.
     */
    Optional<Path> resolveId(String id, Path importer, TransformMode mode);
}
