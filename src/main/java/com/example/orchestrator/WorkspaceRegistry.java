package com.example.orchestrator;

import com.example.orchestrator.graph.ModuleTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Owns the projects of a workspace: resolves the workspace definition into projects, enforces
 * unique names and maps files to the projects that own them.
 */
public final class WorkspaceRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkspaceRegistry.class);

    static final List<String> CONFIG_NAMES = List.of("orchestrator.config", "project.config");
    static final List<String> CONFIG_FILES = List.of("orchestrator.config.json", "project.config.json");
    static final List<String> WORKSPACE_FILES = List.of("orchestrator.workspace.json", "orchestrator.projects.json");
    private static final Set<String> IGNORED_DIRECTORIES = Set.of("node_modules", ".git", "target");

    private final OrchestratorConfig config;
    private final ConfigLoader configLoader;
    private final ModuleTransformer transformer;
    private final ConfigFilePolicy configFilePolicy;
    private final Map<Path, Set<Project>> projectsTestFiles = new ConcurrentHashMap<>();
    private volatile Project coreProject;
    private volatile List<Project> resolvedProjects = List.of();
    private volatile List<Project> projects = List.of();

    public WorkspaceRegistry(OrchestratorConfig config, ConfigLoader configLoader, ModuleTransformer transformer) {
        this(config, configLoader, transformer, ConfigFilePolicy.DEFAULT);
    }

    public WorkspaceRegistry(OrchestratorConfig config,
                             ConfigLoader configLoader,
                             ModuleTransformer transformer,
                             ConfigFilePolicy configFilePolicy) {
        this.config = config;
        this.configLoader = configLoader;
        this.transformer = transformer;
        this.configFilePolicy = configFilePolicy;
    }

    /**
     * Resolves the workspace found through the configuration (explicit {@code workspace} option
     * or a workspace file next to the root config), or just the core project when there is none.
     */
    public List<Project> resolve() throws IOException {
        return resolve(findWorkspaceConfigPath());
    }

    public List<Project> resolve(Optional<Path> workspaceConfigPath) throws IOException {
        if (workspaceConfigPath.isEmpty()) {
            return activate(List.of(createCoreProject()));
        }
        WorkspaceDefinition definition = configLoader.loadWorkspace(workspaceConfigPath.get());
        return resolve(definition);
    }

    /**
     * Turns each entry of the definition into a project and checks that names are unique.
     */
    public List<Project> resolve(WorkspaceDefinition definition) throws IOException {
        Project core = createCoreProject();
        List<Project> resolved = new ArrayList<>();
        for (Path configFile : expandGlobs(definition.globs())) {
            if (config.configFile().map(configFile::equals).orElse(false)) {
                resolved.add(core);
                continue;
            }
            ProjectConfig projectConfig = Files.isDirectory(configFile)
                    ? configLoader.defaultProject(configFile)
                    : configLoader.loadProject(configFile);
            resolved.add(new Project(projectConfig.withOverrides(config.overrides()), transformer));
        }

        EnvironmentContext context = EnvironmentContext.of(config.watch());
        for (ProjectConfigFactory factory : definition.inline()) {
            ProjectConfig projectConfig;
            try {
                projectConfig = factory.create(context);
            } catch (ConfigurationException ex) {
                throw ex;
            } catch (Exception ex) {
                throw new ConfigurationException("Inline project configuration failed: " + ex.getMessage(), ex);
            }
            if (projectConfig == null) {
                throw new ConfigurationException("Inline project configuration returned no config.");
            }
            resolved.add(new Project(projectConfig.withOverrides(config.overrides()), transformer));
        }

        if (resolved.isEmpty()) {
            return activate(List.of(core));
        }
        ensureUniqueNames(resolved);
        return activate(resolved);
    }

    /**
     * The core project. Created by every resolution, whether or not the workspace lists it, and
     * the fallback owner for unknown project names.
     */
    public synchronized Project coreProject() {
        if (coreProject == null) {
            coreProject = new Project(config.coreProjectConfig(), transformer, true);
        }
        return coreProject;
    }

    /**
     * Projects currently taking part in runs, after project filters.
     */
    public List<Project> projects() {
        return projects;
    }

    /**
     * Every project produced by the last resolution, including filtered-out ones.
     */
    public List<Project> resolvedProjects() {
        return resolvedProjects;
    }

    /**
     * Restricts the active projects to those whose name matches one of the wildcard patterns.
     * No pattern restores all resolved projects.
     */
    public List<Project> filterProjects(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            projects = resolvedProjects;
            return projects;
        }
        List<Pattern> regexes = patterns.stream().map(WorkspaceRegistry::wildcardPatternToRegex).toList();
        projects = resolvedProjects.stream()
                .filter(project -> regexes.stream().anyMatch(regex -> regex.matcher(project.name()).matches()))
                .toList();
        return projects;
    }

    public Project getProjectByName(String name) {
        String wanted = name == null ? "" : name;
        return projects.stream()
                .filter(project -> project.name().equals(wanted))
                .findFirst()
                .orElseGet(this::coreProject);
    }

    public Project getProjectByTaskId(String taskId, StateManager state) {
        String projectName = state.getTask(taskId)
                .map(task -> task.getFile() == null ? "" : task.getFile().getProjectName())
                .orElse("");
        return getProjectByName(projectName);
    }

    /**
     * Globs test files of all active projects and remembers which projects own each file.
     */
    public List<WorkspaceSpec> globTestFiles(List<String> filters) throws IOException {
        List<WorkspaceSpec> specs = new ArrayList<>();
        for (Project project : projects) {
            for (Path file : project.globTestFiles(filters)) {
                specs.add(new WorkspaceSpec(project, file));
                registerTestFile(project, file);
            }
        }
        return specs;
    }

    public void registerTestFile(Project project, Path file) {
        projectsTestFiles.computeIfAbsent(FilePaths.normalize(file), ignored -> ConcurrentHashMap.newKeySet())
                .add(project);
    }

    public List<WorkspaceSpec> getProjectsByTestFile(Path file) {
        Path normalized = FilePaths.normalize(file);
        Set<Project> owners = projectsTestFiles.get(normalized);
        if (owners == null) {
            return List.of();
        }
        return owners.stream()
                .sorted((left, right) -> left.name().compareTo(right.name()))
                .map(project -> new WorkspaceSpec(project, normalized))
                .toList();
    }

    /**
     * Active projects whose module graph contains the file.
     */
    public List<Project> getModuleProjects(Path file) {
        return projects.stream()
                .filter(project -> project.dependencyGraph().hasModule(file))
                .toList();
    }

    public Optional<Path> findWorkspaceConfigPath() {
        if (config.workspace().isPresent()) {
            return config.workspace();
        }
        Path configDirectory = config.configFile().map(Path::getParent).orElse(config.root());
        for (String name : WORKSPACE_FILES) {
            Path candidate = configDirectory.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private synchronized Project createCoreProject() {
        coreProject = new Project(config.coreProjectConfig(), transformer, true);
        return coreProject;
    }

    private List<Project> activate(List<Project> resolved) {
        resolvedProjects = List.copyOf(resolved);
        projectsTestFiles.clear();
        filterProjects(config.projectFilters());
        LOGGER.info("Resolved {} project(s): {}", resolvedProjects.size(),
                resolvedProjects.stream().map(Project::name).toList());
        return resolvedProjects;
    }

    private void ensureUniqueNames(List<Project> resolved) {
        Set<String> names = new HashSet<>();
        for (Project project : resolved) {
            if (!names.add(project.name())) {
                throw new ConfigurationException("Project name \"" + project.name()
                        + "\" is not unique. All projects in a workspace should have unique names.");
            }
        }
    }

    /**
     * Expands workspace globs into one config file (or bare directory) per directory.
     */
    private List<Path> expandGlobs(List<String> globs) throws IOException {
        if (globs.isEmpty()) {
            return List.of();
        }
        Path root = config.root();
        List<PathMatcher> matchers = new ArrayList<>();
        for (String glob : globs) {
            String pattern = glob.replace("<rootDir>", root.toString()).replace('\\', '/');
            if (Path.of(pattern).isAbsolute()) {
                pattern = FilePaths.relativeLabel(root, Path.of(pattern));
            }
            if (pattern.endsWith("/")) {
                pattern = pattern.substring(0, pattern.length() - 1);
            }
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }

        List<Path> matched = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                Path name = dir.getFileName();
                if (!dir.equals(root) && name != null && IGNORED_DIRECTORIES.contains(name.toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                if (!dir.equals(root) && matchesAny(matchers, root.relativize(dir))) {
                    matched.add(FilePaths.normalize(dir));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (matchesAny(matchers, root.relativize(file))) {
                    matched.add(FilePaths.normalize(file));
                }
                return FileVisitResult.CONTINUE;
            }
        });
        matched.sort(null);

        List<Path> candidates = new ArrayList<>();
        for (Path path : matched) {
            if (Files.isDirectory(path)) {
                boolean hasMatchedConfig = matched.stream()
                        .anyMatch(other -> !other.equals(path) && path.equals(other.getParent()) && isConfigFile(other));
                if (hasMatchedConfig) {
                    continue;
                }
                candidates.add(configInside(path).orElse(path));
            } else if (isConfigFile(path)) {
                candidates.add(path);
            }
        }

        Map<Path, List<Path>> byDirectory = new LinkedHashMap<>();
        for (Path candidate : candidates) {
            Path directory = Files.isDirectory(candidate) ? candidate : candidate.getParent();
            byDirectory.computeIfAbsent(directory, ignored -> new ArrayList<>()).add(candidate);
        }
        Set<Path> chosen = new LinkedHashSet<>();
        for (List<Path> configFiles : byDirectory.values()) {
            chosen.add(configFiles.size() == 1 ? configFiles.get(0) : configFilePolicy.choose(configFiles));
        }
        return List.copyOf(chosen);
    }

    private Optional<Path> configInside(Path directory) {
        for (String name : CONFIG_FILES) {
            Path candidate = directory.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean isConfigFile(Path path) {
        Path name = path.getFileName();
        return name != null && CONFIG_NAMES.stream().anyMatch(prefix -> name.toString().startsWith(prefix));
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path relative) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    static Pattern wildcardPatternToRegex(String pattern) {
        StringBuilder regex = new StringBuilder();
        for (String part : pattern.split("\\*", -1)) {
            if (regex.length() > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.compile(regex.toString());
    }
}
