package com.novelforge;

import com.novelforge.models.ProjectFile;
import com.novelforge.models.ProjectSummary;
import com.novelforge.models.WorkflowState;
import com.novelforge.settings.NovelConfig;
import com.novelforge.storage.ConfigStore;
import com.novelforge.storage.StateStore;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Project folders under the output directory: one folder per project, holding its config,
 * workflow state, checkpoints and generated files.
 */
public class ProjectService {

    private static final DateTimeFormatter ID_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_NAME_LENGTH = 80;

    private final Path outputRoot;
    private final ConfigStore configStore;
    private final StateStore stateStore;
    private final AppLogger logger = AppLogger.get();

    public ProjectService(Path outputRoot, ConfigStore configStore, StateStore stateStore) {
        this.outputRoot = outputRoot.toAbsolutePath().normalize();
        this.configStore = configStore;
        this.stateStore = stateStore;
    }

    public Path getOutputRoot() {
        return outputRoot;
    }

    public StateStore getStateStore() {
        return stateStore;
    }

    /**
     * Validate the config, create the project folder and write the initial config and state.
     */
    public ProjectContext create(NovelConfig config) throws IOException {
        config.validate();
        String projectId = generateProjectId(config.getProjectName());
        Path root = projectRoot(projectId);
        if (Files.exists(root)) {
            throw new IllegalStateException("Project already exists: " + projectId);
        }
        String now = Instant.now().toString();
        config.setProjectId(projectId);
        config.setCreatedAt(now);
        config.setUpdatedAt(now);

        ProjectContext project = new ProjectContext(root, config);
        project.ensureLayout();
        configStore.save(root, config);
        stateStore.save(root, WorkflowState.create(projectId));
        logger.info("[Projects] Created " + projectId);
        return project;
    }

    /**
     * @throws FileNotFoundException when the project has no config
     */
    public ProjectContext open(String projectId) throws IOException {
        Path root = projectRoot(projectId);
        if (!configStore.exists(root)) {
            throw new FileNotFoundException("Project not found: " + projectId);
        }
        return new ProjectContext(root, configStore.load(root));
    }

    public WorkflowState loadState(String projectId) throws IOException {
        return stateStore.load(projectRoot(projectId));
    }

    public void saveState(String projectId, WorkflowState state) throws IOException {
        stateStore.save(projectRoot(projectId), state);
    }

    public boolean exists(String projectId) {
        return configStore.exists(projectRoot(projectId));
    }

    /**
     * All readable projects, most recently updated first. Folders with a missing or
     * corrupt config are skipped.
     */
    public List<ProjectSummary> list() throws IOException {
        List<ProjectSummary> projects = new ArrayList<>();
        if (!Files.isDirectory(outputRoot)) {
            return projects;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputRoot, Files::isDirectory)) {
            for (Path dir : stream) {
                String projectId = dir.getFileName().toString();
                try {
                    projects.add(summary(projectId));
                } catch (IOException | RuntimeException e) {
                    logger.warn("[Projects] Skipping " + projectId + ": " + e.getMessage());
                }
            }
        }
        projects.sort(Comparator.comparing(ProjectSummary::getLastUpdated,
            Comparator.nullsLast(Comparator.reverseOrder())));
        return projects;
    }

    public ProjectSummary summary(String projectId) throws IOException {
        ProjectContext project = open(projectId);
        WorkflowState state = stateStore.load(project.getRoot());
        NovelConfig config = project.getConfig();
        ProjectSummary summary = new ProjectSummary();
        summary.setProjectId(projectId);
        summary.setProjectName(config.getProjectName());
        summary.setTheme(config.getTheme());
        summary.setGenre(config.getGenre());
        summary.setNovelLength(config.lengthDescription());
        summary.setPhase(state.getPhase());
        summary.setPaused(state.isPaused());
        summary.setCreatedAt(state.getCreatedAt());
        summary.setLastUpdated(state.getLastUpdated());
        summary.setProgressPercentage(state.progressPercentage());
        return summary;
    }

    public void delete(String projectId) throws IOException {
        Path root = projectRoot(projectId);
        if (!Files.isDirectory(root)) {
            throw new FileNotFoundException("Project not found: " + projectId);
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(p);
            }
        }
        logger.info("[Projects] Deleted " + projectId);
    }

    /**
     * Generated files of a project. Bookkeeping files (dot files) are left out.
     */
    public List<ProjectFile> listFiles(String projectId) throws IOException {
        ProjectContext project = open(projectId);
        Path root = project.getRoot();
        List<ProjectFile> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList())) {
                String relative = project.relativize(p);
                if (relative.startsWith(".") || relative.contains("/.")) {
                    continue;
                }
                files.add(new ProjectFile(relative, Files.size(p), Files.getLastModifiedTime(p).toInstant().toString()));
            }
        }
        return files;
    }

    public String readFile(String projectId, String relativePath) throws IOException {
        Path path = open(projectId).resolve(relativePath);
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("File not found: " + relativePath);
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * @throws SecurityException if the id would leave the output directory
     */
    public Path projectRoot(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("Project id is required");
        }
        Path resolved = outputRoot.resolve(projectId).normalize();
        if (!resolved.startsWith(outputRoot) || resolved.equals(outputRoot)) {
            throw new SecurityException("Project id escapes output directory");
        }
        return resolved;
    }

    static String generateProjectId(String projectName) {
        return sanitizeName(projectName) + " - " + LocalDateTime.now().format(ID_STAMP);
    }

    /**
     * Keep letters, digits, spaces, hyphens, apostrophes and commas; collapse whitespace.
     */
    static String sanitizeName(String name) {
        StringBuilder sb = new StringBuilder();
        for (char c : name.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '\'' || c == ',') {
                sb.append(c);
            }
        }
        String collapsed = sb.toString().trim().replaceAll("\\s+", " ");
        if (collapsed.length() > MAX_NAME_LENGTH) {
            collapsed = collapsed.substring(0, MAX_NAME_LENGTH).trim();
        }
        return collapsed.isEmpty() ? "project" : collapsed;
    }
}
