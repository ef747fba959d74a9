package com.novelforge.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.AppLogger;
import com.novelforge.ProjectContext;
import com.novelforge.ProjectService;
import com.novelforge.models.ProjectFile;
import com.novelforge.pipeline.GenerationManager;
import com.novelforge.settings.ModelCatalog;
import com.novelforge.settings.NovelConfig;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.FileNotFoundException;
import java.util.List;
import java.util.Map;

/**
 * REST controller for projects and their files.
 *
 * Endpoints:
 *   POST   /api/projects               Create a project from a NovelConfig body
 *   GET    /api/projects               List projects
 *   GET    /api/projects/{id}          Project summary
 *   DELETE /api/projects/{id}          Delete a project folder
 *   GET    /api/models                 Supported models
 *   GET    /api/projects/{id}/files    Generated files
 *   GET    /api/projects/{id}/file?path=  Read one file
 */
public class ProjectController implements Controller {

    private final ProjectService projects;
    private final GenerationManager generation;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public ProjectController(ProjectService projects, GenerationManager generation, ObjectMapper objectMapper) {
        this.projects = projects;
        this.generation = generation;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/projects", this::createProject);
        app.get("/api/projects", this::listProjects);
        app.get("/api/projects/{id}", this::getProject);
        app.delete("/api/projects/{id}", this::deleteProject);
        app.get("/api/models", this::listModels);
        app.get("/api/projects/{id}/files", this::listFiles);
        app.get("/api/projects/{id}/file", this::getFile);
    }

    private void createProject(Context ctx) {
        try {
            NovelConfig config = objectMapper.readValue(ctx.body(), NovelConfig.class);
            ProjectContext project = projects.create(config);
            ctx.status(201).json(projects.summary(project.getProjectId()));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Invalid project config: " + e.getOriginalMessage()));
        } catch (Exception e) {
            logger.warn("Failed to create project: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void listProjects(Context ctx) {
        try {
            List<?> list = projects.list();
            ctx.json(Map.of("projects", list, "total_count", list.size()));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getProject(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            ctx.json(projects.summary(id));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void deleteProject(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            if (generation.isRunning(id)) {
                ctx.status(409).json(Map.of("error", "Stop generation before deleting " + id));
                return;
            }
            projects.delete(id);
            ctx.json(Map.of("success", true, "message", "Project " + id + " deleted"));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void listModels(Context ctx) {
        ctx.json(Map.of("models", ModelCatalog.all(), "default", ModelCatalog.DEFAULT_MODEL_ID));
    }

    private void listFiles(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            List<ProjectFile> files = projects.listFiles(id);
            ctx.json(Map.of("files", files, "total_count", files.size()));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getFile(Context ctx) {
        String id = Controller.projectId(ctx);
        String path = ctx.queryParam("path");
        if (path == null || path.isBlank()) {
            ctx.status(400).json(Map.of("error", "Path parameter required"));
            return;
        }
        try {
            String content = projects.readFile(id, path);
            ctx.json(Map.of("file_path", path, "content", content,
                "size", content.getBytes(java.nio.charset.StandardCharsets.UTF_8).length));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (SecurityException e) {
            ctx.status(403).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
