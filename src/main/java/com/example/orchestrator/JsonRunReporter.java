package com.example.orchestrator;

import com.example.orchestrator.model.TaskResult;
import com.example.orchestrator.model.TaskState;
import com.example.orchestrator.model.Tasks;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.model.UnhandledError;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Writes one JSON report per finished run to sequential {@code run_000001.json} files.
 * Numbering continues after the highest report already in the directory.
 */
public class JsonRunReporter implements Reporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonRunReporter.class);
    private static final String PREFIX = "run_";
    private static final Pattern REPORT_NAME = Pattern.compile("run_(\\d+)\\.json");

    private final ObjectMapper mapper;
    private final Path outputDirectory;
    private final Path root;
    private final AtomicInteger sequence;

    public JsonRunReporter(Path outputDirectory, Path root) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.outputDirectory = outputDirectory;
        this.root = root;
        this.sequence = new AtomicInteger(nextSequence(outputDirectory));
    }

    @Override
    public void onFinished(List<TestFile> files, List<UnhandledError> errors, Map<String, Object> coverage) {
        List<FileSummary> summaries = files.stream().map(this::summarize).toList();
        RunReport report = new RunReport(Instant.now(), summaries, errors, coverage);
        try {
            write(report);
        } catch (IOException ex) {
            LOGGER.warn("Could not write run report to {}", outputDirectory, ex);
        }
    }

    public synchronized Path write(RunReport report) throws IOException {
        Files.createDirectories(outputDirectory);
        Path file = outputDirectory.resolve(String.format("%s%06d.json", PREFIX, sequence.getAndIncrement()));
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        LOGGER.debug("Wrote run report {}", file);
        return file;
    }

    public int nextSequence() {
        return sequence.get();
    }

    private FileSummary summarize(TestFile file) {
        TaskResult result = file.getResult();
        return new FileSummary(
                file.getProjectName(),
                FilePaths.relativeLabel(root, file.path()),
                result == null ? null : result.state(),
                result == null ? 0L : result.duration(),
                Tasks.countTests(List.of(file), TaskState.PASS),
                Tasks.countTests(List.of(file), TaskState.FAIL),
                Tasks.countTests(List.of(file), TaskState.SKIP),
                result == null ? List.of() : result.errors()
        );
    }

    private static int nextSequence(Path directory) {
        if (!Files.isDirectory(directory)) {
            return 1;
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .map(path -> REPORT_NAME.matcher(path.getFileName().toString()))
                    .filter(Matcher::matches)
                    .mapToInt(matcher -> Integer.parseInt(matcher.group(1)))
                    .max()
                    .orElse(0) + 1;
        } catch (IOException ex) {
            LOGGER.warn("Could not list existing reports in {}", directory, ex);
            return 1;
        }
    }

    /**
     * Serialized content of one report file.
     */
    public record RunReport(
            Instant finishedAt,
            List<FileSummary> files,
            List<UnhandledError> errors,
            Map<String, Object> coverage
    ) {
    }

    public record FileSummary(
            String projectName,
            String file,
            TaskState state,
            long duration,
            long passed,
            long failed,
            long skipped,
            List<String> errors
    ) {
    }
}
