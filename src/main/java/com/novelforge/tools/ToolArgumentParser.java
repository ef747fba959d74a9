package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.novelforge.AppLogger;

/**
 * Turns the raw argument string of a model tool call into a JSON object.
 * Malformed input yields an empty object so the call still runs and the tool can
 * report what is missing.
 */
public class ToolArgumentParser {

    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public ToolArgumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    public ObjectNode parse(String toolName, String raw) {
        if (raw == null) {
            return objectMapper.createObjectNode();
        }
        String trimmed = stripInvisibleEdgeChars(unwrapCodeFence(raw.trim()));
        if (trimmed.isEmpty()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            if (node != null && node.isObject()) {
                return (ObjectNode) node;
            }
            logger.warn("[Tools] Arguments for " + toolName + " are not a JSON object, using {}");
        } catch (Exception e) {
            logger.warn("[Tools] Malformed arguments for " + toolName + ", using {}: " + e.getMessage());
        }
        return objectMapper.createObjectNode();
    }

    private String unwrapCodeFence(String value) {
        if (!value.startsWith("```")) return value;
        String[] lines = value.split("\n", -1);
        if (lines.length < 3 || !"```".equals(lines[lines.length - 1].trim())) return value;
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < lines.length - 1; i++) {
            sb.append(lines[i]);
            if (i < lines.length - 2) sb.append("\n");
        }
        return sb.toString().trim();
    }

    private String stripInvisibleEdgeChars(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isInvisible(value.charAt(start))) {
            start++;
        }
        while (end > start && isInvisible(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end).trim();
    }

    private boolean isInvisible(char c) {
        return c == '\uFEFF' || c == '\u200B' || c == '\u200C' || c == '\u200D' || c == '\u2060';
    }
}
