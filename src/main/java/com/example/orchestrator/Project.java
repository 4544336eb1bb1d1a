package com.example.orchestrator;

import com.example.orchestrator.graph.DependencyGraph;
import com.example.orchestrator.graph.ModuleServer;
import com.example.orchestrator.graph.ModuleTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A named, independently configured test domain: its root, the globs that select test files,
 * the files found so far and the module graph built while serving its modules.
 */
public final class Project {
    private static final Logger LOGGER = LoggerFactory.getLogger(Project.class);
    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("node_modules", ".git", ".orchestrator", "target");

    private final ProjectConfig config;
    private final boolean core;
    private final GlobMatcher includeMatcher;
    private final GlobMatcher excludeMatcher;
    private final DependencyGraph dependencyGraph = new DependencyGraph();
    private final ModuleServer moduleServer;
    private final List<Path> testFiles = new CopyOnWriteArrayList<>();
    private final List<GlobalSetupHook> globalSetups = new CopyOnWriteArrayList<>();
    private final List<GlobalSetupHook> initializedSetups = new ArrayList<>();
    private boolean globalSetupInitialized;

    public Project(ProjectConfig config, ModuleTransformer transformer) {
        this(config, transformer, false);
    }

    Project(ProjectConfig config, ModuleTransformer transformer, boolean core) {
        this.config = config;
        this.core = core;
        this.includeMatcher = GlobMatcher.of(config.root(), config.include());
        this.excludeMatcher = GlobMatcher.of(config.root(), config.exclude());
        this.moduleServer = new ModuleServer(transformer, dependencyGraph);
    }

    public String name() {
        return config.name();
    }

    public Path root() {
        return config.root();
    }

    public ProjectConfig config() {
        return config;
    }

    public boolean isCore() {
        return core;
    }

    public DependencyGraph dependencyGraph() {
        return dependencyGraph;
    }

    public ModuleServer moduleServer() {
        return moduleServer;
    }

    /**
     * Walks the project root for files matching the include globs and not the exclude globs.
     * Every match is remembered as a known test file; only those matching one of the filters
     * (case-insensitive substring of the relative path, or absolute prefix) are returned.
     */
    public List<Path> globTestFiles(List<String> filters) throws IOException {
        List<Path> matches = new ArrayList<>();
        if (Files.isDirectory(root())) {
            Files.walkFileTree(root(), new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    Path name = dir.getFileName();
                    if (!dir.equals(root()) && name != null && SKIPPED_DIRECTORIES.contains(name.toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isTargetFile(file)) {
                        matches.add(FilePaths.normalize(file));
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        Collections.sort(matches);
        testFiles.clear();
        testFiles.addAll(matches);
        LOGGER.debug("Project '{}' matched {} test file(s)", name(), matches.size());
        if (filters == null || filters.isEmpty()) {
            return List.copyOf(matches);
        }
        return matches.stream().filter(file -> matchesFilter(file, filters)).toList();
    }

    /**
     * Whether the file is one of the test files already found for this project.
     */
    public boolean isTestFile(Path file) {
        return testFiles.contains(FilePaths.normalize(file));
    }

    /**
     * Whether the file would be selected by this project's include and exclude globs.
     */
    public boolean isTargetFile(Path file) {
        Path normalized = FilePaths.normalize(file);
        return normalized.startsWith(root())
                && includeMatcher.matches(normalized)
                && !excludeMatcher.matches(normalized);
    }

    public void addTestFile(Path file) {
        Path normalized = FilePaths.normalize(file);
        if (!testFiles.contains(normalized)) {
            testFiles.add(normalized);
        }
    }

    public List<Path> testFiles() {
        return List.copyOf(testFiles);
    }

    public void addGlobalSetup(GlobalSetupHook hook) {
        globalSetups.add(hook);
    }

    /**
     * Runs the global setup hooks once per project lifetime. Later calls are no-ops.
     */
    public synchronized void initializeGlobalSetup() throws Exception {
        if (globalSetupInitialized) {
            return;
        }
        globalSetupInitialized = true;
        for (GlobalSetupHook hook : globalSetups) {
            hook.setup(this);
            initializedSetups.add(hook);
        }
    }

    /**
     * Tears down initialized hooks in reverse order. Failures are logged and do not stop the
     * remaining teardowns.
     */
    public synchronized void teardownGlobalSetup() {
        List<GlobalSetupHook> reversed = new ArrayList<>(initializedSetups);
        Collections.reverse(reversed);
        for (GlobalSetupHook hook : reversed) {
            try {
                hook.teardown(this);
            } catch (Exception ex) {
                LOGGER.warn("Global teardown failed for project '{}'", name(), ex);
            }
        }
        initializedSetups.clear();
        globalSetupInitialized = false;
    }

    private boolean matchesFilter(Path file, List<String> filters) {
        String relative = FilePaths.relativeLabel(root(), file).toLowerCase(Locale.ROOT);
        for (String filter : filters) {
            if (Path.of(filter).isAbsolute() && file.startsWith(FilePaths.normalize(Path.of(filter)))) {
                return true;
            }
            if (relative.contains(filter.replace('\\', '/').toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Project[" + name() + "]";
    }
}
