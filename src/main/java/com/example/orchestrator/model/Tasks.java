package com.example.orchestrator.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Helpers for walking task trees.
 */
public final class Tasks {
    private Tasks() {
    }

    /**
     * Returns every test (leaf) task below the given task, depth first.
     */
    public static List<Task> getTests(Task task) {
        List<Task> tests = new ArrayList<>();
        collect(task, tests, true);
        return tests;
    }

    /**
     * Returns the given task and every task below it, depth first.
     */
    public static List<Task> getTasks(Task task) {
        List<Task> tasks = new ArrayList<>();
        collect(task, tasks, false);
        return tasks;
    }

    public static boolean hasFailed(Collection<? extends Task> tasks) {
        for (Task task : tasks) {
            if (task.hasState(TaskState.FAIL)) {
                return true;
            }
            if (task instanceof Suite suite && hasFailed(suite.getTasks())) {
                return true;
            }
        }
        return false;
    }

    public static long countTests(Collection<? extends Task> roots, TaskState state) {
        return roots.stream()
                .flatMap(root -> getTests(root).stream())
                .filter(test -> test.hasState(state))
                .count();
    }

    private static void collect(Task task, List<Task> target, boolean leavesOnly) {
        if (task instanceof Suite suite) {
            if (!leavesOnly) {
                target.add(suite);
            }
            suite.getTasks().forEach(child -> collect(child, target, leavesOnly));
        } else {
            target.add(task);
        }
    }
}
