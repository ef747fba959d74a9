package com.novelforge;

import com.novelforge.settings.NovelConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Handle for one project folder. Passed explicitly to every component that reads or
 * writes project files, so several projects can run side by side.
 *
 * Layout:
 *   {outputRoot}/{projectId}/
 *   ├── .novel_config.json
 *   ├── .novel_state.json
 *   ├── .conversation_history_{PHASE}.json
 *   ├── planning/     summary, characters, structure, outline
 *   ├── manuscript/   chunk_NN.md
 *   └── critiques/    plan and chunk critiques, revision requests
 */
public class ProjectContext {

    public static final String PLANNING_DIR = "planning";
    public static final String MANUSCRIPT_DIR = "manuscript";
    public static final String CRITIQUES_DIR = "critiques";

    private final String projectId;
    private final Path root;
    private final NovelConfig config;

    public ProjectContext(Path root, NovelConfig config) {
        this.projectId = config.getProjectId();
        this.root = root.toAbsolutePath().normalize();
        this.config = config;
    }

    public String getProjectId() {
        return projectId;
    }

    public Path getRoot() {
        return root;
    }

    public NovelConfig getConfig() {
        return config;
    }

    public Path planningDir() {
        return root.resolve(PLANNING_DIR);
    }

    public Path manuscriptDir() {
        return root.resolve(MANUSCRIPT_DIR);
    }

    public Path critiquesDir() {
        return root.resolve(CRITIQUES_DIR);
    }

    public Path chunkFile(int item) {
        return manuscriptDir().resolve(String.format("chunk_%02d.md", item));
    }

    public void ensureLayout() throws IOException {
        Files.createDirectories(planningDir());
        Files.createDirectories(manuscriptDir());
        Files.createDirectories(critiquesDir());
    }

    /**
     * Resolve a project-relative path, refusing anything that escapes the project folder.
     */
    public Path resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("Path is required");
        }
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new SecurityException("Path escapes project folder: " + relativePath);
        }
        return resolved;
    }

    public String relativize(Path path) {
        return root.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }
}
