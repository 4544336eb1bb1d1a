package com.example.orchestrator.pool;

import com.example.orchestrator.WorkspaceSpec;
import com.example.orchestrator.graph.TransformMode;
import com.example.orchestrator.graph.TransformResult;
import com.example.orchestrator.model.Task;
import com.example.orchestrator.model.TaskResult;
import com.example.orchestrator.model.TaskResultPack;
import com.example.orchestrator.model.TaskState;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.model.UserConsoleLog;
import com.example.orchestrator.rpc.RuntimeRpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Built-in worker runtime. Loads the file's module graph through the control side, then runs
 * the project's test command with {@code {file}} replaced by the test file path. The file is
 * reported as one test that passes when the command exits with 0; every output line becomes
 * a console log of the file.
 */
public final class ProcessTestFileRunner implements TestFileRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessTestFileRunner.class);
    static final String FILE_PLACEHOLDER = "{file}";

    private final Map<Path, TransformResult> moduleCache = new ConcurrentHashMap<>();

    @Override
    public void run(WorkerContext context) throws Exception {
        WorkspaceSpec spec = context.spec();
        RuntimeRpc rpc = context.rpc();
        context.invalidates().forEach(moduleCache::remove);

        TestFile file = TestFile.create(spec.file(), spec.project().root(), spec.projectName());
        Task test = file.addTest(file.getName());
        rpc.onCollected(List.of(file));

        if (context.isCancelled() || !matchesNamePattern(context, test)) {
            TaskResult skipped = TaskResult.of(TaskState.SKIP);
            rpc.onTaskUpdate(List.of(TaskResultPack.of(test, skipped), TaskResultPack.of(file, skipped)));
            rpc.onFinished(List.of(file));
            return;
        }

        long start = System.currentTimeMillis();
        rpc.onTaskUpdate(List.of(TaskResultPack.of(file, TaskResult.of(TaskState.RUN))));
        loadModuleGraph(spec.file(), rpc);

        List<String> errors = new ArrayList<>();
        execute(context, file, errors);

        long duration = System.currentTimeMillis() - start;
        TaskResult result = new TaskResult(errors.isEmpty() ? TaskState.PASS : TaskState.FAIL, duration, errors);
        rpc.onTaskUpdate(List.of(TaskResultPack.of(test, result), TaskResultPack.of(file, result)));
        rpc.onFinished(List.of(file));
    }

    private void execute(WorkerContext context, TestFile file, List<String> errors) throws InterruptedException {
        WorkspaceSpec spec = context.spec();
        RuntimeRpc rpc = context.rpc();
        List<String> command = context.config().testCommand().stream()
                .map(part -> part.replace(FILE_PLACEHOLDER, spec.file().toString()))
                .toList();

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(spec.project().root().toFile())
                    .start();
        } catch (IOException ex) {
            LOGGER.warn("Could not start {} for {}", command, spec.file(), ex);
            errors.add("Could not start test command " + command + ": " + ex.getMessage());
            return;
        }

        Thread stdout = pump(process.getInputStream(), line -> rpc.onUserConsoleLog(UserConsoleLog.stdout(file.getId(), line)));
        Thread stderr = pump(process.getErrorStream(), line -> rpc.onUserConsoleLog(UserConsoleLog.stderr(file.getId(), line)));

        long timeoutMillis = context.config().testTimeout().toMillis();
        boolean finished = true;
        if (timeoutMillis > 0) {
            finished = process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS);
        } else {
            process.waitFor();
        }
        if (!finished) {
            process.destroyForcibly();
            process.waitFor();
            errors.add("Test timed out in " + timeoutMillis + "ms.");
        }
        stdout.join();
        stderr.join();

        if (finished && process.exitValue() != 0) {
            errors.add("Test command exited with code " + process.exitValue());
        }
    }

    private boolean matchesNamePattern(WorkerContext context, Task test) {
        Optional<String> pattern = context.config().testNamePattern();
        return pattern.isEmpty() || Pattern.compile(pattern.get()).matcher(test.getName()).find();
    }

    /**
     * Fetches the test file and everything it imports so the control side learns the edges.
     */
    private void loadModuleGraph(Path entry, RuntimeRpc rpc) {
        Set<Path> visited = new HashSet<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.add(entry);
        while (!pending.isEmpty()) {
            Path current = pending.removeFirst();
            if (!visited.add(current)) {
                continue;
            }
            try {
                TransformResult module = fetch(current, rpc);
                List<String> specifiers = new ArrayList<>(module.dependencies());
                specifiers.addAll(module.dynamicDependencies());
                for (String specifier : specifiers) {
                    rpc.resolveId(specifier, current, TransformMode.SSR).join().ifPresent(pending::addLast);
                }
            } catch (CompletionException ex) {
                LOGGER.warn("Could not load module {}", current, ex.getCause());
            }
        }
    }

    private TransformResult fetch(Path module, RuntimeRpc rpc) {
        TransformResult cached = moduleCache.get(module);
        if (cached != null) {
            return cached;
        }
        TransformResult result = rpc.fetchModule(module, TransformMode.SSR).join();
        moduleCache.put(module, result);
        return result;
    }

    private Thread pump(InputStream stream, Consumer<String> sink) {
        Thread reader = new Thread(() -> {
            try (BufferedReader lines = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = lines.readLine()) != null) {
                    sink.accept(line);
                }
            } catch (IOException ex) {
                LOGGER.debug("Output stream closed", ex);
            }
        });
        reader.setDaemon(true);
        reader.start();
        return reader;
    }
}
