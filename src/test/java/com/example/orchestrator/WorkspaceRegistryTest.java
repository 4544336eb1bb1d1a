package com.example.orchestrator;

import com.example.orchestrator.graph.SourceImportTransformer;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkspaceRegistryTest {
    @Test
    void withoutWorkspaceTheCoreProjectOwnsEverything() throws Exception {
        Path root = Files.createTempDirectory("workspace-root");
        Path testFile = TestProjects.write(root, "src/a.test.ts", "");
        WorkspaceRegistry registry = registry(root);

        List<Project> projects = registry.resolve();

        assertEquals(1, projects.size());
        assertTrue(projects.get(0).isCore());
        List<WorkspaceSpec> specs = registry.globTestFiles(List.of());
        assertEquals(List.of(new WorkspaceSpec(registry.coreProject(), testFile)), specs);
        assertEquals(specs, registry.getProjectsByTestFile(testFile));
    }

    @Test
    void rejectsDuplicateProjectNames() throws Exception {
        Path root = Files.createTempDirectory("workspace-root");
        TestProjects.write(root, "orchestrator.workspace.json", "[\"packages/*\"]");
        TestProjects.write(root, "packages/a/project.config.json", "{\"name\": \"unit\"}");
        TestProjects.write(root, "packages/b/project.config.json", "{\"name\": \"unit\"}");
        WorkspaceRegistry registry = registry(root);

        ConfigurationException error = assertThrows(ConfigurationException.class, registry::resolve);

        assertEquals("Project name \"unit\" is not unique. All projects in a workspace should have unique names.",
                error.getMessage());
    }

    @Test
    void globbedDirectoriesBecomeProjects() throws Exception {
        Path root = Files.createTempDirectory("workspace-root");
        TestProjects.write(root, "orchestrator.workspace.json", "{\"projects\": [\"packages/*\"]}");
        TestProjects.write(root, "packages/a/project.config.json", "{\"name\": \"alpha\"}");
        Files.createDirectories(root.resolve("packages/b"));
        Path testFile = TestProjects.write(root, "packages/a/math.test.ts", "");
        WorkspaceRegistry registry = registry(root);

        List<Project> projects = registry.resolve();

        assertEquals(List.of("alpha", "b"), projects.stream().map(Project::name).toList());
        assertEquals(root.resolve("packages/a"), projects.get(0).root());
        List<WorkspaceSpec> specs = registry.globTestFiles(List.of());
        assertEquals(1, specs.size());
        assertEquals("alpha", registry.getProjectsByTestFile(testFile).get(0).projectName());
    }

    @Test
    void configFilePolicyDecidesBetweenConfigsInOneDirectory() throws Exception {
        Path root = Files.createTempDirectory("workspace-root");
        TestProjects.write(root, "packages/a/orchestrator.config.json", "{\"name\": \"from-orchestrator\"}");
        TestProjects.write(root, "packages/a/project.config.json", "{\"name\": \"from-project\"}");
        WorkspaceDefinition definition = new WorkspaceDefinition().glob("packages/*/*.config.json");
        OrchestratorConfig config = new ConfigLoader().defaults(root);

        WorkspaceRegistry preferDefault = new WorkspaceRegistry(config, new ConfigLoader(), new SourceImportTransformer());
        WorkspaceRegistry preferProject = new WorkspaceRegistry(config, new ConfigLoader(), new SourceImportTransformer(),
                ConfigFilePolicy.preferPrefix("project.config"));

        assertEquals("from-orchestrator", preferDefault.resolve(definition).get(0).name());
        assertEquals("from-project", preferProject.resolve(definition).get(0).name());
    }

    @Test
    void inlineFactoriesReceiveTheEnvironment() throws Exception {
        Path root = Files.createTempDirectory("workspace-root");
        AtomicReference<EnvironmentContext> seen = new AtomicReference<>();
        WorkspaceDefinition definition = new WorkspaceDefinition()
                .project(TestProjects.config("unit", root))
                .project(context -> {
                    seen.set(context);
                    return TestProjects.config("e2e", root);
                });
        WorkspaceRegistry registry = registry(root);

        List<Project> projects = registry.resolve(definition);

        assertEquals(List.of("unit", "e2e"), projects.stream().map(Project::name).toList());
        assertEquals("run", seen.get().command());
        assertEquals("test", seen.get().mode());
    }

    @Test
    void failingInlineFactoryIsAConfigurationError() throws Exception {
        Path root = Files.createTempDirectory("workspace-root");
        WorkspaceDefinition definition = new WorkspaceDefinition().project(context -> {
            throw new IllegalStateException("no database");
        });

        assertThrows(ConfigurationException.class, () -> registry(root).resolve(definition));
    }

    @Test
    void filtersProjectsByWildcard() throws Exception {
        Path root = Files.createTempDirectory("workspace-root");
        WorkspaceDefinition definition = new WorkspaceDefinition()
                .project(TestProjects.config("unit-node", root))
                .project(TestProjects.config("unit-browser", root))
                .project(TestProjects.config("e2e", root));
        WorkspaceRegistry registry = registry(root);
        registry.resolve(definition);

        List<Project> filtered = registry.filterProjects(List.of("unit-*"));

        assertEquals(List.of("unit-node", "unit-browser"), filtered.stream().map(Project::name).toList());
        assertEquals(3, registry.resolvedProjects().size());
        assertSame(filtered.get(1), registry.getProjectByName("unit-browser"));
        assertEquals(3, registry.filterProjects(List.of()).size());
    }

    @Test
    void unknownNamesFallBackToTheCoreProjectEvenWhenUnlisted() throws Exception {
        Path root = Files.createTempDirectory("workspace-root");
        WorkspaceDefinition definition = new WorkspaceDefinition()
                .project(TestProjects.config("unit", root))
                .project(TestProjects.config("e2e", root));
        WorkspaceRegistry registry = registry(root);
        registry.resolve(definition);

        Project fallback = registry.getProjectByName("missing");

        assertTrue(fallback.isCore());
        assertSame(registry.coreProject(), fallback);
        assertSame(fallback, registry.getProjectByName("missing"));
        assertEquals(List.of("unit", "e2e"), registry.projects().stream().map(Project::name).toList());
    }

    private static WorkspaceRegistry registry(Path root) {
        return new WorkspaceRegistry(new ConfigLoader().defaults(root), new ConfigLoader(), new SourceImportTransformer());
    }
}
