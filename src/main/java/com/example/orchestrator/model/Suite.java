package com.example.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Suite extends Task {
    private final List<Task> tasks = new ArrayList<>();

    public Suite(String id, String name, TaskType type) {
        super(id, name, type);
    }

    public List<Task> getTasks() {
        return Collections.unmodifiableList(tasks);
    }

    public Task addTest(String name) {
        Task test = new Task(childId(), name, TaskType.TEST);
        return attach(test);
    }

    public Suite addSuite(String name) {
        Suite suite = new Suite(childId(), name, TaskType.SUITE);
        return attach(suite);
    }

    private <T extends Task> T attach(T task) {
        task.setFile(getFile());
        tasks.add(task);
        return task;
    }

    private String childId() {
        return getId() + "_" + tasks.size();
    }
}
