package com.example.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of a file's task tree. Identity is the {@code id}, which stays the same across reruns
 * of the same logical test.
 */
public class Task {
    private final String id;
    private final String name;
    private final TaskType type;
    private TaskMode mode = TaskMode.RUN;
    private TaskResult result;
    private Map<String, Object> meta = new HashMap<>();
    private List<UserConsoleLog> logs = new ArrayList<>();
    private TestFile file;

    public Task(String id, String name, TaskType type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TaskType getType() {
        return type;
    }

    public TaskMode getMode() {
        return mode;
    }

    public void setMode(TaskMode mode) {
        this.mode = mode;
    }

    public TaskResult getResult() {
        return result;
    }

    public void setResult(TaskResult result) {
        this.result = result;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }

    public void setMeta(Map<String, Object> meta) {
        this.meta = meta == null ? new HashMap<>() : new HashMap<>(meta);
    }

    public List<UserConsoleLog> getLogs() {
        return logs;
    }

    public void setLogs(List<UserConsoleLog> logs) {
        this.logs = logs == null ? new ArrayList<>() : logs;
    }

    @JsonIgnore
    public TestFile getFile() {
        return file;
    }

    void setFile(TestFile file) {
        this.file = file;
    }

    @JsonIgnore
    public boolean hasState(TaskState state) {
        return result != null && result.state() == state;
    }
}
