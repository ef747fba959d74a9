package com.novelforge.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelforge.AppLogger;
import com.novelforge.models.PendingApproval;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;
import com.novelforge.tools.ToolResult;

/**
 * Prints a run to the terminal: streamed text inline, everything else as log lines.
 */
public class ConsoleObserver implements GenerationObserver, ApprovalChannel {

    private static final int ARG_PREVIEW_CHARS = 200;

    private final AppLogger logger = AppLogger.get();
    private final boolean showReasoning;
    private boolean midLine;

    public ConsoleObserver(boolean showReasoning) {
        this.showReasoning = showReasoning;
    }

    @Override
    public void phaseChanged(String projectId, Phase from, Phase to) {
        endLine();
        logger.console("");
        logger.console("========================================");
        logger.console("  PHASE: " + from + " -> " + to);
        logger.console("========================================");
    }

    @Override
    public synchronized void streamChunk(String projectId, String text, boolean reasoning) {
        if (reasoning && !showReasoning) {
            return;
        }
        logger.consoleInline(text);
        midLine = !text.endsWith("\n");
    }

    @Override
    public void toolCallStarted(String projectId, String toolName, JsonNode arguments) {
        endLine();
        String args = arguments == null ? "{}" : arguments.toString();
        if (args.length() > ARG_PREVIEW_CHARS) {
            args = args.substring(0, ARG_PREVIEW_CHARS) + "...";
        }
        logger.console("  -> " + toolName + " " + args);
    }

    @Override
    public void toolCallFinished(String projectId, String toolName, ToolResult result) {
        logger.console("  <- " + toolName + (result.isSuccess() ? " ok: " : " FAILED: ") + result.getMessage());
    }

    @Override
    public void tokenUsage(String projectId, int tokens, int limit) {
        endLine();
        logger.info(String.format("[%s] Context: %,d / %,d tokens", projectId, tokens, limit));
    }

    @Override
    public void progress(String projectId, WorkflowState state) {
        endLine();
        logger.info(String.format("[%s] %s iteration %d (total %d), progress %.1f%%", projectId,
            state.getPhase(), state.getCurrentPhaseIterations(), state.getTotalIterations(),
            state.progressPercentage()));
    }

    @Override
    public void error(String projectId, String type, String message) {
        endLine();
        logger.error("[" + projectId + "] " + type + ": " + message);
    }

    @Override
    public void completed(String projectId, WorkflowState state) {
        endLine();
        logger.console("");
        logger.console("========================================");
        logger.console("  COMPLETE: " + state.getApprovedItems().size() + " chunks approved in "
            + state.getTotalIterations() + " iterations");
        logger.console("========================================");
    }

    @Override
    public void requestApproval(String projectId, PendingApproval approval) {
        endLine();
        logger.console("");
        logger.console("  APPROVAL NEEDED (" + approval.getType() + "): " + approval.getFromPhase()
            + " -> " + approval.getTargetPhase());
        logger.console("  Approve or reject via POST /api/projects/" + projectId + "/approve");
    }

    private synchronized void endLine() {
        if (midLine) {
            logger.consoleInline("\n");
            midLine = false;
        }
    }
}
