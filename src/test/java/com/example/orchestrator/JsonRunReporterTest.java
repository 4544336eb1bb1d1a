package com.example.orchestrator;

import com.example.orchestrator.model.Task;
import com.example.orchestrator.model.TaskResult;
import com.example.orchestrator.model.TaskState;
import com.example.orchestrator.model.TestFile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonRunReporterTest {

    @Test
    void numberingContinuesAfterExistingReports() throws Exception {
        Path root = Files.createTempDirectory("reports-root");
        Path reports = Files.createDirectories(root.resolve("reports"));
        Files.writeString(reports.resolve("run_000007.json"), "{}");
        Files.writeString(reports.resolve("notes.json"), "{}");

        JsonRunReporter reporter = new JsonRunReporter(reports, root);

        assertEquals(8, reporter.nextSequence());
    }

    @Test
    void writesOneSummaryPerFinishedFile() throws Exception {
        Path root = Files.createTempDirectory("reports-root");
        Path reports = root.resolve("reports");
        TestFile file = TestFile.create(root.resolve("math.test.ts"), root, "unit");
        Task passing = file.addTest("adds");
        passing.setResult(TaskResult.of(TaskState.PASS));
        Task failing = file.addTest("divides");
        failing.setResult(TaskResult.of(TaskState.FAIL));
        file.setResult(TaskResult.of(TaskState.FAIL));

        JsonRunReporter reporter = new JsonRunReporter(reports, root);
        reporter.onFinished(List.of(file), List.of(), Map.of());

        Path written = reports.resolve("run_000001.json");
        assertTrue(Files.exists(written));
        assertEquals(2, reporter.nextSequence());

        JsonNode report = new ObjectMapper().readTree(written.toFile());
        JsonNode summary = report.get("files").get(0);
        assertEquals("unit", summary.get("projectName").asText());
        assertEquals("math.test.ts", summary.get("file").asText());
        assertEquals("FAIL", summary.get("state").asText());
        assertEquals(1, summary.get("passed").asInt());
        assertEquals(1, summary.get("failed").asInt());
    }
}
