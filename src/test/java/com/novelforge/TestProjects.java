package com.novelforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.models.WorkflowState;
import com.novelforge.settings.NovelConfig;
import com.novelforge.storage.ConfigStore;
import com.novelforge.storage.JsonStorage;
import com.novelforge.storage.StateStore;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Fixtures shared by tests: a project folder with config and initial state on disk.
 */
public final class TestProjects {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private TestProjects() {
    }

    public static NovelConfig config(String projectId) {
        NovelConfig config = new NovelConfig();
        config.setProjectId(projectId);
        config.setProjectName("The Lighthouse Keeper");
        config.setTheme("A keeper discovers the light guides ships that should not exist");
        config.setGenre("Literary fantasy");
        config.getCheckpoints().setRequirePlanApproval(false);
        return config;
    }

    public static ProjectContext create(Path dir, NovelConfig config) throws IOException {
        ProjectContext project = new ProjectContext(dir.resolve(config.getProjectId()), config);
        project.ensureLayout();
        JsonStorage storage = new JsonStorage(MAPPER);
        new ConfigStore(storage).save(project.getRoot(), config);
        new StateStore(storage).save(project.getRoot(), WorkflowState.create(config.getProjectId()));
        return project;
    }

    public static ProjectContext create(Path dir) throws IOException {
        return create(dir, config("novel-1"));
    }

    public static String words(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(i == 0 ? "" : " ").append("word").append(i);
        }
        return sb.toString();
    }
}
