package com.novelforge.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelforge.AppLogger;
import com.novelforge.models.PendingApproval;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;
import com.novelforge.tools.ToolResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans events out to several observers. A failing sink is logged and skipped so it
 * cannot stop the generation loop.
 */
public class CompositeObserver implements GenerationObserver, ApprovalChannel {

    private final List<GenerationObserver> observers = new CopyOnWriteArrayList<>();
    private final List<ApprovalChannel> channels = new CopyOnWriteArrayList<>();
    private final AppLogger logger = AppLogger.get();

    public CompositeObserver add(GenerationObserver observer) {
        observers.add(observer);
        if (observer instanceof ApprovalChannel) {
            channels.add((ApprovalChannel) observer);
        }
        return this;
    }

    private void each(String event, Consumer<GenerationObserver> action) {
        for (GenerationObserver observer : observers) {
            try {
                action.accept(observer);
            } catch (RuntimeException e) {
                logger.warn("[Observer] " + observer.getClass().getSimpleName() + " failed on " + event
                    + ": " + e.getMessage());
            }
        }
    }

    @Override
    public void phaseChanged(String projectId, Phase from, Phase to) {
        each("phaseChanged", o -> o.phaseChanged(projectId, from, to));
    }

    @Override
    public void streamChunk(String projectId, String text, boolean reasoning) {
        each("streamChunk", o -> o.streamChunk(projectId, text, reasoning));
    }

    @Override
    public void toolCallStarted(String projectId, String toolName, JsonNode arguments) {
        each("toolCallStarted", o -> o.toolCallStarted(projectId, toolName, arguments));
    }

    @Override
    public void toolCallFinished(String projectId, String toolName, ToolResult result) {
        each("toolCallFinished", o -> o.toolCallFinished(projectId, toolName, result));
    }

    @Override
    public void tokenUsage(String projectId, int tokens, int limit) {
        each("tokenUsage", o -> o.tokenUsage(projectId, tokens, limit));
    }

    @Override
    public void progress(String projectId, WorkflowState state) {
        each("progress", o -> o.progress(projectId, state));
    }

    @Override
    public void error(String projectId, String type, String message) {
        each("error", o -> o.error(projectId, type, message));
    }

    @Override
    public void completed(String projectId, WorkflowState state) {
        each("completed", o -> o.completed(projectId, state));
    }

    @Override
    public void requestApproval(String projectId, PendingApproval approval) {
        for (ApprovalChannel channel : channels) {
            try {
                channel.requestApproval(projectId, approval);
            } catch (RuntimeException e) {
                logger.warn("[Observer] approval channel failed: " + e.getMessage());
            }
        }
    }
}
