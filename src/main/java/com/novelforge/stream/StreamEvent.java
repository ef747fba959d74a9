package com.novelforge.stream;

import java.util.List;

/**
 * One incremental event of a streamed model reply. Every field is optional.
 */
public class StreamEvent {
    private final String role;
    private final String reasoning;
    private final String content;
    private final List<ToolCallDelta> toolCalls;
    private final String finishReason;

    public StreamEvent(String role, String reasoning, String content, List<ToolCallDelta> toolCalls, String finishReason) {
        this.role = role;
        this.reasoning = reasoning;
        this.content = content;
        this.toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        this.finishReason = finishReason;
    }

    public static StreamEvent content(String text) {
        return new StreamEvent(null, null, text, null, null);
    }

    public static StreamEvent reasoning(String text) {
        return new StreamEvent(null, text, null, null, null);
    }

    public static StreamEvent toolCall(int index, String id, String name, String argumentsFragment) {
        return new StreamEvent(null, null, null, List.of(new ToolCallDelta(index, id, name, argumentsFragment)), null);
    }

    public String getRole() {
        return role;
    }

    public String getReasoning() {
        return reasoning;
    }

    public String getContent() {
        return content;
    }

    public List<ToolCallDelta> getToolCalls() {
        return toolCalls;
    }

    public String getFinishReason() {
        return finishReason;
    }
}
