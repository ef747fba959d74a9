package com.novelforge.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelforge.AppLogger;
import com.novelforge.models.PendingApproval;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;
import com.novelforge.output.ApprovalChannel;
import com.novelforge.output.GenerationObserver;
import com.novelforge.tools.ToolResult;
import io.javalin.Javalin;
import io.javalin.websocket.WsContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes generation events to browser clients subscribed on {@code /ws/projects/{id}}.
 * Every message is a JSON object with a {@code type} field.
 */
public class WebSocketObserver implements Controller, GenerationObserver, ApprovalChannel {

    private final Map<String, Set<WsContext>> subscribers = new ConcurrentHashMap<>();
    private final AppLogger logger = AppLogger.get();

    @Override
    public void registerRoutes(Javalin app) {
        app.ws("/ws/projects/{id}", ws -> {
            ws.onConnect(ctx -> {
                String id = ctx.pathParam("id");
                subscribers.computeIfAbsent(id, k -> ConcurrentHashMap.newKeySet()).add(ctx);
                logger.info("[WebSocket] Client connected to " + id);
            });
            ws.onClose(ctx -> {
                Set<WsContext> set = subscribers.get(ctx.pathParam("id"));
                if (set != null) {
                    set.remove(ctx);
                }
            });
            ws.onError(ctx -> {
                Set<WsContext> set = subscribers.get(ctx.pathParam("id"));
                if (set != null) {
                    set.remove(ctx);
                }
            });
        });
    }

    public int subscriberCount(String projectId) {
        Set<WsContext> set = subscribers.get(projectId);
        return set == null ? 0 : set.size();
    }

    @Override
    public void phaseChanged(String projectId, Phase from, Phase to) {
        send(projectId, message("phase_change", "from_phase", from, "to_phase", to));
    }

    @Override
    public void streamChunk(String projectId, String text, boolean reasoning) {
        send(projectId, message("stream_chunk", "content", text, "is_reasoning", reasoning));
    }

    @Override
    public void toolCallStarted(String projectId, String toolName, JsonNode arguments) {
        send(projectId, message("tool_call", "tool_name", toolName, "arguments", arguments));
    }

    @Override
    public void toolCallFinished(String projectId, String toolName, ToolResult result) {
        Map<String, Object> payload = message("tool_result", "tool_name", toolName, "success", result.isSuccess());
        payload.put("message", result.getMessage());
        payload.put("data", result.getData());
        send(projectId, payload);
    }

    @Override
    public void tokenUsage(String projectId, int tokens, int limit) {
        send(projectId, message("token_update", "token_count", tokens, "token_limit", limit));
    }

    @Override
    public void progress(String projectId, WorkflowState state) {
        Map<String, Object> payload = message("progress", "phase", state.getPhase(),
            "progress_percentage", state.progressPercentage());
        payload.put("current_chunk", state.getCurrentItem());
        payload.put("total_chunks", state.getTotalItems());
        payload.put("total_iterations", state.getTotalIterations());
        send(projectId, payload);
    }

    @Override
    public void error(String projectId, String type, String message) {
        send(projectId, message("error", "error_type", type, "message", message));
    }

    @Override
    public void completed(String projectId, WorkflowState state) {
        Map<String, Object> payload = message("complete", "total_chunks", state.getTotalItems(),
            "total_iterations", state.getTotalIterations());
        payload.put("compressions", state.getCompressions());
        send(projectId, payload);
    }

    @Override
    public void requestApproval(String projectId, PendingApproval approval) {
        Map<String, Object> payload = message("approval_required", "approval_type", approval.getType(),
            "target_phase", approval.getTargetPhase());
        payload.put("data", approval.getData());
        send(projectId, payload);
    }

    private static Map<String, Object> message(String type, String k1, Object v1, String k2, Object v2) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put(k1, v1);
        payload.put(k2, v2);
        return payload;
    }

    private void send(String projectId, Map<String, Object> payload) {
        Set<WsContext> set = subscribers.get(projectId);
        if (set == null || set.isEmpty()) {
            return;
        }
        payload.put("project_id", projectId);
        for (WsContext ctx : set) {
            try {
                synchronized (ctx) {
                    ctx.send(payload);
                }
            } catch (RuntimeException e) {
                logger.warn("[WebSocket] Dropping client of " + projectId + ": " + e.getMessage());
                set.remove(ctx);
            }
        }
    }
}
