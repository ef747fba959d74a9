package com.novelforge.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.novelforge.models.Phase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one tool invocation. Serialized to JSON as the tool message content.
 */
public class ToolResult {
    private final boolean success;
    private final String message;
    private final Map<String, Object> data = new LinkedHashMap<>();
    private TransitionRequest transition;

    private ToolResult(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public static ToolResult success(String message) {
        return new ToolResult(true, message);
    }

    public static ToolResult failure(String message) {
        return new ToolResult(false, message);
    }

    public ToolResult with(String key, Object value) {
        data.put(key, value);
        return this;
    }

    public ToolResult transitionTo(Phase phase, Map<String, Object> transitionData) {
        this.transition = new TransitionRequest(phase, transitionData);
        return this;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    public TransitionRequest getTransition() {
        return transition;
    }

    public boolean hasTransition() {
        return transition != null;
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("success", success);
        node.put("message", message);
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            node.set(entry.getKey(), mapper.valueToTree(entry.getValue()));
        }
        if (transition != null) {
            ObjectNode t = node.putObject("transition");
            t.put("to_phase", transition.getToPhase().name());
            t.set("data", mapper.valueToTree(transition.getData()));
        }
        return node;
    }
}
