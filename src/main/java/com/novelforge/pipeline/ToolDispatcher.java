package com.novelforge.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.AppLogger;
import com.novelforge.ConfigurationException;
import com.novelforge.agents.AgentSession;
import com.novelforge.models.ToolCall;
import com.novelforge.output.GenerationObserver;
import com.novelforge.tools.ToolArgumentParser;
import com.novelforge.tools.ToolExecutionContext;
import com.novelforge.tools.ToolRegistry;
import com.novelforge.tools.ToolResult;
import com.novelforge.tools.TransitionRequest;

import java.util.List;

/**
 * Runs the tool calls of one assistant turn in order.
 *
 * Every call gets exactly one tool-result message, appended as soon as it finishes.
 * Transitions are collected rather than applied: the first one wins and is returned to
 * the caller, later ones are logged and dropped.
 */
public class ToolDispatcher {

    private final ObjectMapper mapper;
    private final ToolArgumentParser argumentParser;
    private final AppLogger logger = AppLogger.get();

    public ToolDispatcher(ObjectMapper mapper) {
        this.mapper = mapper;
        this.argumentParser = new ToolArgumentParser(mapper);
    }

    /**
     * @return the transition requested by the batch, or null
     * @throws ConfigurationException if a call names a tool the agent does not have
     */
    public TransitionRequest dispatch(AgentSession session, List<ToolCall> calls, ToolExecutionContext context,
                                      GenerationObserver observer) {
        return dispatch(session.getAgent().tools(), session, calls, context, observer);
    }

    public TransitionRequest dispatch(ToolRegistry registry, AgentSession session, List<ToolCall> calls,
                                      ToolExecutionContext context, GenerationObserver observer) {
        String projectId = context.getProject().getProjectId();
        TransitionRequest accepted = null;

        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            JsonNode args = argumentParser.parse(call.getFunctionName(), call.getArgumentsJson());
            observer.toolCallStarted(projectId, call.getFunctionName(), args);
            logger.debug("[Tools] " + call.getId() + " " + call.getFunctionName() + " args=" + args);

            ToolResult result;
            try {
                result = executeTool(registry, call.getFunctionName(), args, context);
            } catch (ConfigurationException e) {
                answerAbandoned(session, calls.subList(i, calls.size()), e.getMessage());
                throw e;
            }
            session.appendToolResult(call, toJson(result));
            observer.toolCallFinished(projectId, call.getFunctionName(), result);
            logger.info("[Tools] " + call.getFunctionName() + (result.isSuccess() ? " ok" : " failed: " + result.getMessage()));

            if (result.hasTransition()) {
                if (accepted == null) {
                    accepted = result.getTransition();
                } else {
                    logger.warn("[Tools] Ignoring extra transition " + result.getTransition()
                        + " from " + call.getFunctionName() + "; already accepted " + accepted);
                }
            }
        }
        return accepted;
    }

    public ToolResult executeTool(ToolRegistry registry, String name, JsonNode args, ToolExecutionContext context) {
        ToolRegistry.RegisteredTool tool = registry.get(name);
        if (tool == null) {
            throw new ConfigurationException("Unknown tool: " + name + " (available: " + registry.getToolNames() + ")");
        }
        String validationError = tool.getSchema().validate(args);
        if (validationError != null) {
            return ToolResult.failure("Invalid arguments for " + name + ": " + validationError);
        }
        try {
            ToolResult result = tool.getHandler().execute(tool.getSchema().normalizeArgsNode(args), context);
            return result != null ? result : ToolResult.failure("Tool " + name + " returned no result");
        } catch (Exception e) {
            logger.error("[Tools] " + name + " raised: " + e.getMessage(), e);
            return ToolResult.failure("Error executing tool: " + e.getMessage());
        }
    }

    /**
     * Give every call left in an aborted batch a failed result, so the saved history never
     * holds a tool call without its answer.
     */
    private void answerAbandoned(AgentSession session, List<ToolCall> remaining, String reason) {
        for (int i = 0; i < remaining.size(); i++) {
            ToolCall call = remaining.get(i);
            String message = i == 0 ? reason : "Not executed: batch aborted by " + remaining.get(0).getFunctionName();
            session.appendToolResult(call, toJson(ToolResult.failure(message)));
        }
        logger.warn("[Tools] Aborted batch: " + reason + " (" + (remaining.size() - 1) + " later call(s) skipped)");
    }

    private String toJson(ToolResult result) {
        return result.toJson(mapper).toString();
    }
}
