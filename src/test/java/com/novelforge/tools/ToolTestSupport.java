package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.ProjectContext;
import com.novelforge.models.WorkflowState;

/**
 * Runs a registered tool the way the dispatcher does: validate, normalize, execute.
 */
final class ToolTestSupport {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private ToolTestSupport() {
    }

    static ToolExecutionContext context(ProjectContext project, WorkflowState state) {
        return new ToolExecutionContext(project, state, MAPPER);
    }

    static ToolResult run(ToolRegistry registry, String name, String argsJson, ToolExecutionContext ctx)
        throws Exception {
        ToolRegistry.RegisteredTool tool = registry.get(name);
        if (tool == null) {
            throw new IllegalArgumentException("No tool " + name);
        }
        JsonNode args = MAPPER.readTree(argsJson);
        String error = tool.getSchema().validate(args);
        if (error != null) {
            return ToolResult.failure(error);
        }
        return tool.getHandler().execute(tool.getSchema().normalizeArgsNode(args), ctx);
    }
}
