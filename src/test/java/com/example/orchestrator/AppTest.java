package com.example.orchestrator;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {

    @Test
    void parsesOptionsAndFilters() {
        App.CommandLine commandLine = App.CommandLine.parse(new String[]{
                "orchestrator.config.json", "--watch", "-t=adds", "--testTimeout=250", "math", "util"
        });

        assertEquals(Path.of("orchestrator.config.json"), commandLine.configPath());
        assertTrue(commandLine.watch());
        assertEquals(Optional.of("adds"), commandLine.overrides().testNamePattern());
        assertEquals(Optional.of(Duration.ofMillis(250)), commandLine.overrides().testTimeout());
        assertEquals(List.of("math", "util"), commandLine.filters());
    }

    @Test
    void emptyNamePatternIsIgnored() {
        App.CommandLine commandLine = App.CommandLine.parse(new String[]{"config.json", "--testNamePattern="});

        assertFalse(commandLine.watch());
        assertEquals(Optional.empty(), commandLine.overrides().testNamePattern());
    }

    @Test
    void rejectsUnknownOptionsAndBadTimeouts() {
        assertThrows(ConfigurationException.class,
                () -> App.CommandLine.parse(new String[]{"config.json", "--coverage"}));
        assertThrows(ConfigurationException.class,
                () -> App.CommandLine.parse(new String[]{"config.json", "--testTimeout=soon"}));
        assertThrows(ConfigurationException.class,
                () -> App.CommandLine.parse(new String[]{"config.json", "--testTimeout=-5"}));
    }
}
