package com.example.orchestrator.cache;

import com.example.orchestrator.Project;
import com.example.orchestrator.TestProjects;
import com.example.orchestrator.WorkspaceSpec;
import com.example.orchestrator.model.TaskResult;
import com.example.orchestrator.model.TaskState;
import com.example.orchestrator.model.TestFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpecSequencerTest {
    @Test
    void failedFilesRunFirstThenSlowestFiles() throws Exception {
        Path root = Files.createTempDirectory("sequencer-root");
        Project project = TestProjects.project("unit", root);
        Path fast = TestProjects.write(root, "fast.test.ts", "");
        Path slow = TestProjects.write(root, "slow.test.ts", "");
        Path failing = TestProjects.write(root, "failing.test.ts", "");
        ResultsCache cache = new ResultsCache(root.resolve("results.json"), root, false);
        cache.updateResults(List.of(
                result(fast, root, TaskState.PASS, 10L),
                result(slow, root, TaskState.PASS, 500L),
                result(failing, root, TaskState.FAIL, 1L)));

        List<WorkspaceSpec> sorted = new SpecSequencer(cache, root).sort(List.of(
                new WorkspaceSpec(project, fast),
                new WorkspaceSpec(project, slow),
                new WorkspaceSpec(project, failing)));

        assertEquals(List.of(failing, slow, fast), sorted.stream().map(WorkspaceSpec::file).toList());
    }

    @Test
    void unknownFilesRunLargestFirst() throws Exception {
        Path root = Files.createTempDirectory("sequencer-root");
        Project project = TestProjects.project("unit", root);
        Path small = TestProjects.write(root, "small.test.ts", "x");
        Path large = TestProjects.write(root, "large.test.ts", "x".repeat(1000));
        Path unseen = TestProjects.write(root, "unseen.test.ts", "x".repeat(10));
        ResultsCache cache = new ResultsCache(root.resolve("results.json"), root, false);
        cache.populateStats(List.of(small, large));

        List<WorkspaceSpec> sorted = new SpecSequencer(cache, root).sort(List.of(
                new WorkspaceSpec(project, small),
                new WorkspaceSpec(project, large),
                new WorkspaceSpec(project, unseen)));

        assertEquals(List.of(unseen, large, small), sorted.stream().map(WorkspaceSpec::file).toList());
    }

    @Test
    void mixedCacheEntriesSortIntoGroups() throws Exception {
        Path root = Files.createTempDirectory("sequencer-root");
        Project project = TestProjects.project("unit", root);
        ResultsCache cache = new ResultsCache(root.resolve("results.json"), root, false);
        Random random = new Random(42);
        List<WorkspaceSpec> specs = new ArrayList<>();
        List<Path> unseen = new ArrayList<>();
        List<Path> statsOnly = new ArrayList<>();
        List<TestFile> results = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            Path file = TestProjects.write(root, "file" + i + ".test.ts", "x".repeat(random.nextInt(500)));
            specs.add(new WorkspaceSpec(project, file));
            switch (i % 3) {
                case 0 -> unseen.add(file);
                case 1 -> statsOnly.add(file);
                default -> results.add(result(file, root, random.nextBoolean() ? TaskState.FAIL : TaskState.PASS,
                        random.nextInt(1000)));
            }
        }
        cache.populateStats(statsOnly);
        cache.updateResults(results);
        SpecSequencer sequencer = new SpecSequencer(cache, root);

        for (int attempt = 0; attempt < 20; attempt++) {
            Collections.shuffle(specs, random);
            List<Path> sorted = sequencer.sort(specs).stream().map(WorkspaceSpec::file).toList();

            assertEquals(300, sorted.size());
            assertTrue(unseen.containsAll(sorted.subList(0, 100)));
            List<Path> sized = sorted.subList(100, 200);
            assertTrue(statsOnly.containsAll(sized));
            for (int i = 1; i < sized.size(); i++) {
                assertTrue(Files.size(sized.get(i - 1)) >= Files.size(sized.get(i)));
            }
            List<Path> cached = sorted.subList(200, 300);
            for (int i = 1; i < cached.size(); i++) {
                CachedResult previous = cache.getResults(ResultsCache.key("unit", root, cached.get(i - 1))).orElseThrow();
                CachedResult current = cache.getResults(ResultsCache.key("unit", root, cached.get(i))).orElseThrow();
                assertTrue(previous.failed() || !current.failed());
                if (previous.failed() == current.failed()) {
                    assertTrue(previous.duration() >= current.duration());
                }
            }
        }
    }

    private static TestFile result(Path file, Path root, TaskState state, long duration) {
        TestFile testFile = TestFile.create(file, root, "unit");
        testFile.setResult(new TaskResult(state, duration, List.of()));
        return testFile;
    }
}
