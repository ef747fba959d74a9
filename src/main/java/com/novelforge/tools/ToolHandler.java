package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Implementation of one tool. Exceptions are caught by the dispatcher and reported to
 * the model as a failed result.
 */
@FunctionalInterface
public interface ToolHandler {
    ToolResult execute(JsonNode args, ToolExecutionContext context) throws Exception;
}
