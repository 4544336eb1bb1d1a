package com.example.orchestrator.graph;

import com.example.orchestrator.ConfigLoader;
import com.example.orchestrator.GlobMatcher;
import com.example.orchestrator.OrchestratorConfig;
import com.example.orchestrator.Project;
import com.example.orchestrator.StateManager;
import com.example.orchestrator.TestProjects;
import com.example.orchestrator.WorkspaceRegistry;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangePropagatorTest {
    @Test
    void changedDependencyMarksImportingTestFile() throws Exception {
        Fixture fixture = new Fixture();

        List<Path> triggers = fixture.propagator.handleFileChanged(fixture.util);

        assertEquals(List.of(fixture.util), triggers);
        assertEquals(List.of(fixture.testFile), fixture.changeSet.changedTests());
        assertTrue(fixture.changeSet.isInvalidated(fixture.util));
        assertTrue(fixture.changeSet.isInvalidated(fixture.testFile));
    }

    @Test
    void unrelatedFileTriggersNothing() throws Exception {
        Fixture fixture = new Fixture();

        assertTrue(fixture.propagator.handleFileChanged(fixture.unrelated).isEmpty());
        assertTrue(fixture.changeSet.changedTests().isEmpty());
    }

    @Test
    void repeatedChangeIsIgnoredUntilTheNextRun() throws Exception {
        Fixture fixture = new Fixture();
        fixture.propagator.handleFileChanged(fixture.util);

        assertTrue(fixture.propagator.handleFileChanged(fixture.util).isEmpty());
        assertEquals(List.of(fixture.testFile), fixture.changeSet.changedTests());
    }

    @Test
    void changedTestFileMarksItself() throws Exception {
        Fixture fixture = new Fixture();

        assertEquals(List.of(fixture.testFile), fixture.propagator.handleFileChanged(fixture.testFile));
        assertEquals(List.of(fixture.testFile), fixture.changeSet.changedTests());
    }

    @Test
    void forceRerunTriggerMarksEveryKnownFile() throws Exception {
        Fixture fixture = new Fixture();
        Path packageJson = TestProjects.write(fixture.root, "package.json", "{}");
        fixture.state.clearFiles(fixture.project, List.of(fixture.testFile));

        List<Path> triggers = fixture.propagator.handleFileChanged(packageJson);

        assertEquals(List.of(packageJson), triggers);
        assertEquals(List.of(fixture.testFile), fixture.changeSet.changedTests());
    }

    @Test
    void knownTestFileOutsideTheGraphIsMarked() throws Exception {
        Fixture fixture = new Fixture();
        Path other = TestProjects.write(fixture.root, "b.test.ts", "");
        fixture.registry.globTestFiles(List.of());

        assertEquals(List.of(other), fixture.propagator.handleFileChanged(other));
        assertEquals(List.of(other), fixture.changeSet.changedTests());
    }

    private static final class Fixture {
        private final Path root;
        private final Path testFile;
        private final Path util;
        private final Path unrelated;
        private final StateManager state = new StateManager();
        private final ChangeSet changeSet = new ChangeSet();
        private final WorkspaceRegistry registry;
        private final Project project;
        private final ChangePropagator propagator;

        private Fixture() throws Exception {
            root = Files.createTempDirectory("propagate-root");
            testFile = TestProjects.write(root, "a.test.ts", "import { add } from './util'\n");
            util = TestProjects.write(root, "util.ts", "export const add = (a, b) => a + b\n");
            unrelated = TestProjects.write(root, "b.ts", "export const b = 1\n");

            OrchestratorConfig config = new ConfigLoader().defaults(root);
            registry = new WorkspaceRegistry(config, new ConfigLoader(), new SourceImportTransformer());
            registry.resolve(Optional.empty());
            registry.globTestFiles(List.of());
            project = registry.coreProject();
            project.moduleServer().fetchModule(testFile, TransformMode.SSR);

            propagator = new ChangePropagator(registry, state, changeSet,
                    GlobMatcher.of(root, List.of("**/package.json")));
        }
    }
}
