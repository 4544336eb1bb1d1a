package com.example.orchestrator;

import java.nio.file.Path;
import java.util.List;

/**
 * Decides which config file wins when a workspace glob yields several for the same directory.
 */
@FunctionalInterface
public interface ConfigFilePolicy {
    Path choose(List<Path> candidates);

    ConfigFilePolicy DEFAULT = preferPrefix("orchestrator.config");

    static ConfigFilePolicy preferPrefix(String prefix) {
        return candidates -> candidates.stream()
                .filter(candidate -> candidate.getFileName() != null
                        && candidate.getFileName().toString().startsWith(prefix))
                .findFirst()
                .orElse(candidates.get(0));
    }
}
