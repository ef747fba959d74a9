package com.novelforge.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.AppLogger;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses OpenAI-compatible server-sent event lines ({@code data: {...}}) into
 * {@link StreamEvent}s. Moonshot sends {@code reasoning_content}, DeepInfra may send
 * {@code reasoning}; both map to the reasoning channel.
 */
public class OpenAiSseEventParser {

    public static final String DONE = "[DONE]";

    private final ObjectMapper mapper;
    private final AppLogger logger = AppLogger.get();

    public OpenAiSseEventParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public boolean isDone(String line) {
        String payload = payload(line);
        return DONE.equals(payload);
    }

    /**
     * Returns the parsed event, or null for comments, keep-alives, blank lines, the
     * terminator, and chunks without any usable delta.
     */
    public StreamEvent parseOrNull(String line) {
        String payload = payload(line);
        if (payload == null || DONE.equals(payload)) {
            return null;
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (Exception e) {
            logger.warn("[SSE] Skipping unparseable chunk: " + truncate(payload, 120));
            return null;
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            String message = error.isObject() ? error.path("message").asText(error.toString()) : error.asText();
            throw new IllegalStateException("Provider stream error: " + message);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return null;
        }
        JsonNode choice = choices.get(0);
        JsonNode delta = choice.path("delta");
        String role = text(delta.get("role"));
        String reasoning = text(delta.get("reasoning_content"));
        if (reasoning == null) {
            reasoning = text(delta.get("reasoning"));
        }
        String content = text(delta.get("content"));
        String finishReason = text(choice.get("finish_reason"));

        List<ToolCallDelta> toolCalls = new ArrayList<>();
        JsonNode toolCallsNode = delta.path("tool_calls");
        if (toolCallsNode.isArray()) {
            int position = 0;
            for (JsonNode callNode : toolCallsNode) {
                JsonNode indexNode = callNode.get("index");
                int index = indexNode != null && indexNode.canConvertToInt() ? indexNode.asInt() : position;
                JsonNode function = callNode.path("function");
                toolCalls.add(new ToolCallDelta(
                    index,
                    text(callNode.get("id")),
                    text(function.get("name")),
                    text(function.get("arguments"))
                ));
                position++;
            }
        }

        if (role == null && reasoning == null && content == null && toolCalls.isEmpty() && finishReason == null) {
            return null;
        }
        return new StreamEvent(role, reasoning, content, toolCalls, finishReason);
    }

    private String payload(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith(":")) {
            return null;
        }
        if (!trimmed.startsWith("data:")) {
            return null;
        }
        String payload = trimmed.substring(5).trim();
        return payload.isEmpty() ? null : payload;
    }

    private String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
