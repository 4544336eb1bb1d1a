package com.example.orchestrator;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Matches absolute paths against glob patterns written relative to a root directory.
 * A leading {@code **}{@code /} also matches files directly under the root.
 */
public final class GlobMatcher {
    private final Path root;
    private final List<String> patterns;
    private final List<PathMatcher> matchers;

    private GlobMatcher(Path root, List<String> patterns) {
        this.root = FilePaths.normalize(root);
        this.patterns = List.copyOf(patterns);
        this.matchers = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            String normalized = pattern.replace('\\', '/');
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + normalized));
            if (normalized.startsWith("**/")) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + normalized.substring(3)));
            }
        }
    }

    public static GlobMatcher of(Path root, List<String> patterns) {
        return new GlobMatcher(root, patterns == null ? List.of() : patterns);
    }

    public boolean matches(Path path) {
        if (matchers.isEmpty()) {
            return false;
        }
        Path absolute = FilePaths.normalize(path);
        Path candidate = absolute.startsWith(root) ? root.relativize(absolute) : absolute;
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(candidate) || matcher.matches(absolute)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return matchers.isEmpty();
    }

    public List<String> patterns() {
        return patterns;
    }
}
