package com.example.orchestrator;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsConfigRelativeToItsDirectory() throws Exception {
        Path directory = Files.createTempDirectory("config-root");
        Path configFile = TestProjects.write(directory, "orchestrator.config.json", String.join("\n",
                "{",
                "  \"root\": \"app\",",
                "  \"name\": \"core\",",
                "  \"include\": [\"**/*.spec.js\"],",
                "  \"exclude\": [\"**/fixtures/**\"],",
                "  \"testTimeoutMillis\": 2000,",
                "  \"testNamePattern\": \"math\",",
                "  \"bail\": 3,",
                "  \"threadCount\": 2,",
                "  \"watch\": true,",
                "  \"related\": [\"src/util.js\"],",
                "  \"reportDirectory\": \"reports\",",
                "  \"unknownOption\": 42",
                "}"));

        OrchestratorConfig config = new ConfigLoader().load(configFile);

        Path root = directory.resolve("app");
        assertEquals(root, config.root());
        assertEquals(Optional.of(configFile), config.configFile());
        assertEquals("core", config.name());
        assertEquals(List.of("**/*.spec.js"), config.include());
        assertTrue(config.exclude().contains("**/node_modules/**"));
        assertTrue(config.exclude().contains("**/fixtures/**"));
        assertEquals(Duration.ofMillis(2000), config.testTimeout());
        assertEquals(Optional.of("math"), config.overrides().testNamePattern());
        assertEquals(3, config.bail());
        assertEquals(2, config.threadCount());
        assertTrue(config.watch());
        assertEquals(Optional.of(List.of("src/util.js")), config.related());
        assertEquals(Optional.of(root.resolve("reports")), config.reportDirectory());
        assertEquals(root.resolve(".orchestrator/results.json"), config.cacheFile());
    }

    @Test
    void defaultsWithoutConfigFile() throws Exception {
        Path root = Files.createTempDirectory("config-root");

        OrchestratorConfig config = new ConfigLoader().defaults(root);

        assertEquals(FilePaths.normalize(root), config.root());
        assertTrue(config.configFile().isEmpty());
        assertEquals(0, config.bail());
        assertFalse(config.watch());
        assertTrue(config.cacheEnabled());
        assertTrue(config.related().isEmpty());
        assertEquals(Duration.ofMillis(100), config.debounce());
        assertTrue(config.forceRerunTriggers().contains("**/package.json"));
    }

    @Test
    void rejectsMalformedAndInvalidConfigs() throws Exception {
        Path directory = Files.createTempDirectory("config-root");
        Path malformed = TestProjects.write(directory, "broken.json", "{ \"bail\": ");
        Path negative = TestProjects.write(directory, "negative.json", "{ \"bail\": -1 }");
        ConfigLoader loader = new ConfigLoader();

        assertThrows(ConfigurationException.class, () -> loader.load(malformed));
        assertThrows(ConfigurationException.class, () -> loader.load(negative));
    }

    @Test
    void cliOverridesWinOverConfigValues() throws Exception {
        Path directory = Files.createTempDirectory("config-root");
        Path configFile = TestProjects.write(directory, "orchestrator.config.json",
                "{ \"testNamePattern\": \"math\", \"testTimeoutMillis\": 1000 }");

        OrchestratorConfig config = new ConfigLoader().load(configFile)
                .withOverrides(new ProjectOverrides(Optional.of(Duration.ofSeconds(30)), Optional.empty()));
        ProjectConfig core = config.coreProjectConfig();

        assertEquals(Duration.ofSeconds(30), core.testTimeout());
        assertEquals(Optional.of("math"), core.testNamePattern());
    }

    @Test
    void loadsWorkspaceEntries() throws Exception {
        Path directory = Files.createTempDirectory("config-root");
        Path workspaceFile = TestProjects.write(directory, "orchestrator.workspace.json", String.join("\n",
                "[",
                "  \"packages/*\",",
                "  { \"name\": \"inline\", \"root\": \"inline-root\", \"testCommand\": [\"deno\", \"test\", \"{file}\"] }",
                "]"));

        WorkspaceDefinition definition = new ConfigLoader().loadWorkspace(workspaceFile);

        assertEquals(List.of("packages/*"), definition.globs());
        assertEquals(1, definition.inline().size());
        ProjectConfig inline = definition.inline().get(0).create(EnvironmentContext.of(false));
        assertEquals("inline", inline.name());
        assertEquals(directory.resolve("inline-root"), inline.root());
        assertEquals(List.of("deno", "test", "{file}"), inline.testCommand());
    }

    @Test
    void rejectsWorkspaceWithoutEntries() throws Exception {
        Path directory = Files.createTempDirectory("config-root");
        Path workspaceFile = TestProjects.write(directory, "orchestrator.workspace.json", "{ \"name\": \"nothing\" }");

        assertThrows(ConfigurationException.class, () -> new ConfigLoader().loadWorkspace(workspaceFile));
    }
}
