package com.example.orchestrator;

import com.example.orchestrator.graph.SourceImportTransformer;
import com.example.orchestrator.pool.ProcessTestFileRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar test-orchestrator.jar <config.json> [--watch] "
                    + "[--testNamePattern=<regex>] [--testTimeout=<ms>] [filters...]");
            System.exit(1);
        }

        CommandLine commandLine;
        OrchestratorConfig loaded;
        try {
            commandLine = CommandLine.parse(args);
            loaded = new ConfigLoader().load(commandLine.configPath());
        } catch (ConfigurationException ex) {
            LOGGER.error("{}", ex.getMessage());
            System.exit(1);
            return;
        }
        OrchestratorConfig config = commandLine.watch() ? loaded.withWatch(true) : loaded;

        List<Reporter> reporters = new ArrayList<>();
        reporters.add(new LoggingReporter());
        config.reportDirectory().ifPresent(directory -> reporters.add(new JsonRunReporter(directory, config.root())));

        Orchestrator orchestrator = new Orchestrator(config, commandLine.overrides(),
                new SourceImportTransformer(), ProcessTestFileRunner::new,
                reporters, Optional.empty(), ConfigFilePolicy.DEFAULT);
        long teardownMillis = config.teardownTimeout().toMillis();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                orchestrator.close().get(teardownMillis, TimeUnit.MILLISECONDS);
            } catch (Exception ex) {
                LOGGER.warn("Shutdown did not complete cleanly", ex);
            }
        }, "orchestrator-shutdown"));

        try {
            orchestrator.start(commandLine.filters()).join();
        } catch (ConfigurationException ex) {
            LOGGER.error("{}", ex.getMessage());
            System.exit(1);
        }

        if (config.watch()) {
            orchestrator.closed().join();
            return;
        }
        orchestrator.exit(true).join();
    }

    /**
     * Parsed command line: the config path, CLI overrides and positional file filters.
     */
    record CommandLine(Path configPath, boolean watch, ProjectOverrides overrides, List<String> filters) {
        static CommandLine parse(String[] args) {
            Path configPath = Path.of(args[0]);
            boolean watch = false;
            Optional<String> testNamePattern = Optional.empty();
            Optional<Duration> testTimeout = Optional.empty();
            List<String> filters = new ArrayList<>();
            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                if (arg.equals("--watch") || arg.equals("-w")) {
                    watch = true;
                } else if (arg.startsWith("--testNamePattern=")) {
                    testNamePattern = Optional.of(arg.substring("--testNamePattern=".length()));
                } else if (arg.startsWith("-t=")) {
                    testNamePattern = Optional.of(arg.substring("-t=".length()));
                } else if (arg.startsWith("--testTimeout=")) {
                    testTimeout = Optional.of(parseMillis(arg.substring("--testTimeout=".length())));
                } else if (arg.startsWith("-")) {
                    throw new ConfigurationException("Unknown option " + arg);
                } else {
                    filters.add(arg);
                }
            }
            ProjectOverrides overrides = new ProjectOverrides(testTimeout, testNamePattern.filter(value -> !value.isEmpty()));
            return new CommandLine(configPath, watch, overrides, List.copyOf(filters));
        }

        private static Duration parseMillis(String value) {
            try {
                long millis = Long.parseLong(value);
                if (millis < 0) {
                    throw new ConfigurationException("--testTimeout must not be negative, got " + value);
                }
                return Duration.ofMillis(millis);
            } catch (NumberFormatException ex) {
                throw new ConfigurationException("--testTimeout expects milliseconds, got " + value, ex);
            }
        }
    }
}
