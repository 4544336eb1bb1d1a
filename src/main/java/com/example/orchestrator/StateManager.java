package com.example.orchestrator;

import com.example.orchestrator.model.AggregateTestException;
import com.example.orchestrator.model.PendingTestException;
import com.example.orchestrator.model.Suite;
import com.example.orchestrator.model.Task;
import com.example.orchestrator.model.TaskMode;
import com.example.orchestrator.model.TaskResult;
import com.example.orchestrator.model.TaskResultPack;
import com.example.orchestrator.model.TaskState;
import com.example.orchestrator.model.TestFile;
import com.example.orchestrator.model.UnhandledError;
import com.example.orchestrator.model.UserConsoleLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

/**
 * Authoritative store of per-file results, task identities and unhandled errors.
 * <p>
 * Mutations are expected to arrive through the control loop one at a time, so every update is
 * applied in delivery order. The concurrent collections only make reads from other threads
 * safe; they are not a substitute for that ordering.
 */
public final class StateManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(StateManager.class);

    private final Map<Path, List<TestFile>> filesMap = new ConcurrentHashMap<>();
    private final Set<Path> pathsSet = ConcurrentHashMap.newKeySet();
    private final Map<String, Task> idMap = new ConcurrentHashMap<>();
    private final List<UnhandledError> errors = new CopyOnWriteArrayList<>();
    private final Set<String> processTimeoutCauses = ConcurrentHashMap.newKeySet();

    /**
     * Records an unhandled error. Aggregates are split into their constituents and pending
     * signals turn the referenced task into a skipped one instead of being recorded.
     */
    public void catchError(Object error, String type) {
        Object unwrapped = unwrap(error);
        if (unwrapped instanceof AggregateTestException aggregate) {
            aggregate.getErrors().forEach(inner -> catchError(inner, type));
            return;
        }
        if (unwrapped instanceof PendingTestException pending) {
            Task task = idMap.get(pending.getTaskId());
            if (task != null) {
                task.setMode(TaskMode.SKIP);
                task.setResult(task.getResult() == null
                        ? TaskResult.of(TaskState.SKIP)
                        : task.getResult().withState(TaskState.SKIP));
            }
            return;
        }
        errors.add(UnhandledError.from(unwrapped, type));
    }

    public void clearErrors() {
        errors.clear();
    }

    public List<UnhandledError> getUnhandledErrors() {
        return List.copyOf(errors);
    }

    public void addProcessTimeoutCause(String cause) {
        processTimeoutCauses.add(cause);
    }

    public List<String> getProcessTimeoutCauses() {
        return List.copyOf(processTimeoutCauses);
    }

    public List<Path> getPaths() {
        return List.copyOf(pathsSet);
    }

    public void collectPaths(Collection<Path> paths) {
        paths.forEach(path -> pathsSet.add(FilePaths.normalize(path)));
    }

    public List<TestFile> getFiles() {
        List<TestFile> files = new ArrayList<>();
        filesMap.values().forEach(files::addAll);
        return files;
    }

    public List<TestFile> getFiles(Collection<Path> keys) {
        List<TestFile> files = new ArrayList<>();
        for (Path key : keys) {
            List<TestFile> entries = filesMap.get(FilePaths.normalize(key));
            if (entries != null) {
                files.addAll(entries);
            }
        }
        return files;
    }

    public List<Path> getFilepaths() {
        return List.copyOf(filesMap.keySet());
    }

    public boolean hasFile(Path filepath) {
        return filesMap.containsKey(FilePaths.normalize(filepath));
    }

    public List<Path> getFailedFilepaths() {
        return getFiles().stream()
                .filter(file -> file.hasState(TaskState.FAIL))
                .map(TestFile::path)
                .distinct()
                .toList();
    }

    public Optional<Task> getTask(String id) {
        return Optional.ofNullable(idMap.get(id));
    }

    /**
     * Merges freshly collected files. A file replaces the previous file of the same project and
     * path but keeps its logs, which may have been recorded before collection finished.
     */
    public void collectFiles(Collection<TestFile> files) {
        for (TestFile file : files) {
            Path key = FilePaths.normalize(file.path());
            List<TestFile> existing = filesMap.getOrDefault(key, List.of());
            List<TestFile> merged = new ArrayList<>();
            for (TestFile candidate : existing) {
                if (candidate.getProjectName().equals(file.getProjectName())) {
                    file.setLogs(candidate.getLogs());
                } else {
                    merged.add(candidate);
                }
            }
            merged.add(file);
            filesMap.put(key, merged);
            updateId(file);
        }
    }

    /**
     * Replaces the project's results for the given paths with empty file tasks, so logs
     * streamed before collection have an owner.
     */
    public void clearFiles(Project project, Collection<Path> paths) {
        for (Path path : paths) {
            Path key = FilePaths.normalize(path);
            TestFile fileTask = TestFile.create(key, project.root(), project.name());
            idMap.put(fileTask.getId(), fileTask);
            List<TestFile> merged = new ArrayList<>();
            for (TestFile candidate : filesMap.getOrDefault(key, List.of())) {
                if (!candidate.getProjectName().equals(project.name())) {
                    merged.add(candidate);
                }
            }
            merged.add(fileTask);
            filesMap.put(key, merged);
        }
    }

    /**
     * Registers skipped file tasks for files that were never started.
     */
    public void cancelFiles(Collection<Path> files, Path root, String projectName) {
        List<TestFile> skipped = new ArrayList<>();
        for (Path file : files) {
            TestFile fileTask = TestFile.create(file, root, projectName);
            fileTask.setMode(TaskMode.SKIP);
            fileTask.setResult(TaskResult.of(TaskState.SKIP));
            skipped.add(fileTask);
        }
        collectFiles(skipped);
    }

    public void removeFile(Path filepath) {
        List<TestFile> removed = filesMap.remove(FilePaths.normalize(filepath));
        if (removed != null) {
            removed.forEach(this::forgetIds);
        }
    }

    public void updateTasks(Collection<TaskResultPack> packs) {
        for (TaskResultPack pack : packs) {
            Task task = idMap.get(pack.taskId());
            if (task == null) {
                LOGGER.debug("Ignoring update for unknown task {}", pack.taskId());
                continue;
            }
            task.setResult(pack.result());
            task.setMeta(pack.meta());
            if (pack.result() != null && pack.result().state() == TaskState.SKIP) {
                task.setMode(TaskMode.SKIP);
            }
        }
    }

    public void updateUserLog(UserConsoleLog log) {
        Task task = log.taskId() == null ? null : idMap.get(log.taskId());
        if (task != null) {
            task.getLogs().add(log);
        }
    }

    /**
     * Forgets everything. Used when the execution context restarts.
     */
    public void clear() {
        filesMap.clear();
        pathsSet.clear();
        idMap.clear();
        errors.clear();
        processTimeoutCauses.clear();
    }

    public long getCountOfFailedTests() {
        return idMap.values().stream()
                .filter(task -> task.hasState(TaskState.FAIL))
                .count();
    }

    private void updateId(Task task) {
        if (idMap.get(task.getId()) == task) {
            return;
        }
        idMap.put(task.getId(), task);
        if (task instanceof Suite suite) {
            suite.getTasks().forEach(this::updateId);
        }
    }

    private void forgetIds(Task task) {
        idMap.remove(task.getId(), task);
        if (task instanceof Suite suite) {
            suite.getTasks().forEach(this::forgetIds);
        }
    }

    private Object unwrap(Object error) {
        Object current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && ((Throwable) current).getCause() != null) {
            current = ((Throwable) current).getCause();
        }
        return current;
    }
}
