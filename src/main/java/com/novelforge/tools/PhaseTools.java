package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared helpers for the phase tool sets.
 */
abstract class PhaseTools {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern CHUNK_COUNT = Pattern.compile("(\\d+)\\s+(?:chunks?|chapters?|sections?)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern CHUNK_HEADING = Pattern.compile("(?im)^#{1,6}\\s*(?:chunk|chapter)\\s+(\\d+)\\b");

    static String text(JsonNode args, String name) {
        JsonNode node = args.get(name);
        return node == null || node.isNull() ? null : node.asText();
    }

    static String text(JsonNode args, String name, String fallback) {
        String value = text(args, name);
        return value == null || value.isBlank() ? fallback : value;
    }

    static int integer(JsonNode args, String name) {
        return args.path(name).asInt(0);
    }

    static String header(String title, String status) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(title).append("\n\n");
        sb.append("**Date:** ").append(LocalDateTime.now().format(DATE)).append("\n\n");
        if (status != null) {
            sb.append("**Status:** ").append(status).append("\n\n");
        }
        sb.append("---\n\n");
        return sb.toString();
    }

    /**
     * Number of writing chunks stated in free text ("12 chunks", "8 chapters"), 0 if none.
     */
    static int detectChunkCount(String text) {
        if (text == null) {
            return 0;
        }
        Matcher m = CHUNK_COUNT.matcher(text);
        return m.find() ? Integer.parseInt(m.group(1)) : 0;
    }

    /**
     * Highest "Chunk N" / "Chapter N" heading in an outline, 0 if none.
     */
    static int countOutlineChunks(String outline) {
        if (outline == null) {
            return 0;
        }
        int max = 0;
        Matcher m = CHUNK_HEADING.matcher(outline);
        while (m.find()) {
            max = Math.max(max, Integer.parseInt(m.group(1)));
        }
        return max;
    }

    static String section(String label, String content) {
        return "=== " + label + " ===\n" + (content == null ? "(missing)" : content) + "\n\n";
    }
}
