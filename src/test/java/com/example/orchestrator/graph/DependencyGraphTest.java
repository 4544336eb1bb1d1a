package com.example.orchestrator.graph;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyGraphTest {
    private final Path testFile = Path.of("/work/a.test.ts");
    private final Path util = Path.of("/work/util.ts");
    private final Path helper = Path.of("/work/helper.ts");

    @Test
    void tracksEdgesInBothDirections() {
        DependencyGraph graph = new DependencyGraph();
        graph.recordEdge(testFile, util);
        graph.recordEdge(util, helper);

        assertEquals(Set.of(util), graph.importsOf(testFile));
        assertEquals(Set.of(testFile), graph.importersOf(util));
        assertEquals(Set.of(util), graph.importersOf(helper));
        assertTrue(graph.hasModule(helper));
        assertEquals(3, graph.size());
    }

    @Test
    void invalidateDropsOnlyOutgoingEdges() {
        DependencyGraph graph = new DependencyGraph();
        graph.recordEdge(testFile, util);
        graph.recordEdge(util, helper);

        graph.invalidate(util);

        assertTrue(graph.importsOf(util).isEmpty());
        assertTrue(graph.importersOf(helper).isEmpty());
        assertEquals(Set.of(testFile), graph.importersOf(util));
        assertTrue(graph.hasModule(util));
    }

    @Test
    void unknownFilesHaveNoEdges() {
        DependencyGraph graph = new DependencyGraph();

        graph.invalidate(util);

        assertFalse(graph.hasModule(util));
        assertTrue(graph.importersOf(util).isEmpty());
    }
}
