package com.example.orchestrator.model;

import java.nio.file.Path;

/**
 * Root of a task tree: the results of one test file within one project.
 */
public class TestFile extends Suite {
    private final String filepath;
    private final String projectName;

    public TestFile(String id, String name, String filepath, String projectName) {
        super(id, name, TaskType.FILE);
        this.filepath = filepath;
        this.projectName = projectName;
        setFile(this);
    }

    /**
     * Creates an empty file task whose id is derived from the path relative to the project
     * root and the project name, so it is stable across reruns.
     */
    public static TestFile create(Path filepath, Path root, String projectName) {
        Path absolute = filepath.toAbsolutePath().normalize();
        String relative = root.toAbsolutePath().normalize().relativize(absolute).toString().replace('\\', '/');
        String name = projectName == null ? "" : projectName;
        return new TestFile(TaskIds.generateHash(relative + name), relative, absolute.toString(), name);
    }

    public String getFilepath() {
        return filepath;
    }

    public String getProjectName() {
        return projectName;
    }

    public Path path() {
        return Path.of(filepath);
    }
}
