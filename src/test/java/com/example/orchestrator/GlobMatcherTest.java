package com.example.orchestrator;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlobMatcherTest {
    private final Path root = Path.of("/work/project");

    @Test
    void leadingDoubleStarAlsoMatchesTopLevelFiles() {
        GlobMatcher matcher = GlobMatcher.of(root, List.of("**/*.test.ts"));

        assertTrue(matcher.matches(root.resolve("a.test.ts")));
        assertTrue(matcher.matches(root.resolve("src/deep/b.test.ts")));
        assertFalse(matcher.matches(root.resolve("src/b.ts")));
    }

    @Test
    void bracesSelectAlternatives() {
        GlobMatcher matcher = GlobMatcher.of(root, List.of("**/*.{test,spec}.{js,ts}"));

        assertTrue(matcher.matches(root.resolve("a.spec.js")));
        assertTrue(matcher.matches(root.resolve("lib/a.test.ts")));
        assertFalse(matcher.matches(root.resolve("lib/a.test.tsx")));
    }

    @Test
    void emptyMatcherMatchesNothing() {
        GlobMatcher matcher = GlobMatcher.of(root, List.of());

        assertTrue(matcher.isEmpty());
        assertFalse(matcher.matches(root.resolve("package.json")));
    }
}
