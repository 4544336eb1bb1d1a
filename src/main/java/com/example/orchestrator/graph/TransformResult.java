package com.example.orchestrator.graph;

import java.util.List;

/**
 * Output of the module transform: executable code plus the raw import specifiers it contains.
 */
public record TransformResult(
        String code,
        List<String> dependencies,
        List<String> dynamicDependencies
) {
    public TransformResult {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        dynamicDependencies = dynamicDependencies == null ? List.of() : List.copyOf(dynamicDependencies);
    }
}
