package com.novelforge.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.AppLogger;
import com.novelforge.ConfigurationException;
import com.novelforge.ProjectService;
import com.novelforge.models.PendingApproval;
import com.novelforge.models.WorkflowState;
import com.novelforge.pipeline.ApprovalService;
import com.novelforge.pipeline.GenerationManager;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.FileNotFoundException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for generation runs and approvals.
 *
 * Endpoints:
 *   POST /api/projects/{id}/start|pause|resume|stop
 *   GET  /api/projects/{id}/pending-approval
 *   POST /api/projects/{id}/approve        { "approved": true|false, "notes": "..." }
 *   GET  /api/projects/{id}/status         Full workflow state
 *   GET  /api/projects/{id}/progress
 *   GET  /api/projects/{id}/generation-status
 */
public class GenerationController implements Controller {

    private final ProjectService projects;
    private final GenerationManager generation;
    private final ApprovalService approvals;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public GenerationController(ProjectService projects, GenerationManager generation, ApprovalService approvals,
                                ObjectMapper objectMapper) {
        this.projects = projects;
        this.generation = generation;
        this.approvals = approvals;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/projects/{id}/start", this::start);
        app.post("/api/projects/{id}/pause", this::pause);
        app.post("/api/projects/{id}/resume", this::resume);
        app.post("/api/projects/{id}/stop", this::stop);
        app.get("/api/projects/{id}/pending-approval", this::pendingApproval);
        app.post("/api/projects/{id}/approve", this::approve);
        app.get("/api/projects/{id}/status", this::status);
        app.get("/api/projects/{id}/progress", this::progress);
        app.get("/api/projects/{id}/generation-status", this::generationStatus);
    }

    private void start(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            boolean started = generation.start(id);
            if (!started) {
                ctx.status(409).json(Map.of("success", false, "message", "Generation already running",
                    "project_id", id));
                return;
            }
            ctx.json(Map.of("success", true, "message", "Generation started", "project_id", id));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (ConfigurationException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.warn("Failed to start generation for " + id + ": " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void pause(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            generation.pause(id);
            ctx.json(Map.of("success", true, "message", "Generation paused"));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void resume(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            boolean started = generation.resume(id);
            ctx.json(Map.of("success", true, "message", "Generation resumed", "started", started));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (ConfigurationException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void stop(Context ctx) {
        String id = Controller.projectId(ctx);
        boolean stopped = generation.stop(id);
        ctx.json(Map.of("success", stopped, "message", stopped ? "Stop requested" : "Generation not running"));
    }

    private void pendingApproval(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            PendingApproval pending = approvals.pending(id);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("has_pending", pending != null);
            body.put("approval", pending);
            ctx.json(body);
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void approve(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            JsonNode approvedNode = body.path("approved");
            if (!approvedNode.isBoolean()) {
                ctx.status(400).json(Map.of("error", "approved (boolean) is required"));
                return;
            }
            String notes = body.path("notes").isTextual() ? body.path("notes").asText() : null;
            WorkflowState state = approvals.decide(id, approvedNode.asBoolean(), notes);
            ctx.json(Map.of("success", true, "approved", approvedNode.asBoolean(), "phase", state.getPhase()));
        } catch (IllegalStateException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body"));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void status(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            ctx.json(projects.loadState(id));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void progress(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            WorkflowState state = projects.loadState(id);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("project_id", id);
            body.put("phase", state.getPhase());
            body.put("progress_percentage", state.progressPercentage());
            body.put("current_chunk", state.getCurrentItem());
            body.put("total_chunks", state.getTotalItems());
            body.put("chunks_completed", state.getCompletedItems().size());
            body.put("total_iterations", state.getTotalIterations());
            body.put("paused", state.isPaused());
            ctx.json(body);
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void generationStatus(Context ctx) {
        String id = Controller.projectId(ctx);
        try {
            ctx.json(generation.status(id));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
