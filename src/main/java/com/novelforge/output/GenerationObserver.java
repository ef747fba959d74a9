package com.novelforge.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;
import com.novelforge.tools.ToolResult;

/**
 * Receives progress of a generation run. All methods default to no-ops so sinks only
 * implement what they display.
 */
public interface GenerationObserver {

    default void phaseChanged(String projectId, Phase from, Phase to) {
    }

    default void streamChunk(String projectId, String text, boolean reasoning) {
    }

    default void toolCallStarted(String projectId, String toolName, JsonNode arguments) {
    }

    default void toolCallFinished(String projectId, String toolName, ToolResult result) {
    }

    default void tokenUsage(String projectId, int tokens, int limit) {
    }

    default void progress(String projectId, WorkflowState state) {
    }

    default void error(String projectId, String type, String message) {
    }

    default void completed(String projectId, WorkflowState state) {
    }

    GenerationObserver NONE = new GenerationObserver() {
    };
}
