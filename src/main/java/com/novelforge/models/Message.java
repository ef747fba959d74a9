package com.novelforge.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One entry of an agent conversation.
 * Assistant messages may carry tool calls; tool messages answer exactly one of them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    private String role;
    private String content;
    private String reasoning;
    private List<ToolCall> toolCalls;
    private String toolCallId;
    private String toolName;

    public Message() {
    }

    public Message(String role, String content) {
        this.role = role;
        this.content = content;
    }

    public static Message system(String content) {
        return new Message(SYSTEM, content);
    }

    public static Message user(String content) {
        return new Message(USER, content);
    }

    public static Message assistant(String content, String reasoning, List<ToolCall> toolCalls) {
        Message message = new Message(ASSISTANT, content);
        message.setReasoning(reasoning);
        if (toolCalls != null && !toolCalls.isEmpty()) {
            message.setToolCalls(new ArrayList<>(toolCalls));
        }
        return message;
    }

    public static Message toolResult(String toolCallId, String toolName, String content) {
        Message message = new Message(TOOL, content);
        message.setToolCallId(toolCallId);
        message.setToolName(toolName);
        return message;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getReasoning() {
        return reasoning;
    }

    public void setReasoning(String reasoning) {
        this.reasoning = reasoning;
    }

    public List<ToolCall> getToolCalls() {
        return toolCalls;
    }

    public void setToolCalls(List<ToolCall> toolCalls) {
        this.toolCalls = toolCalls;
    }

    public String getToolCallId() {
        return toolCallId;
    }

    public void setToolCallId(String toolCallId) {
        this.toolCallId = toolCallId;
    }

    public String getToolName() {
        return toolName;
    }

    public void setToolName(String toolName) {
        this.toolName = toolName;
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    @JsonIgnore
    public boolean isRole(String expected) {
        return expected.equals(role);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message other = (Message) o;
        return Objects.equals(role, other.role)
            && Objects.equals(content, other.content)
            && Objects.equals(reasoning, other.reasoning)
            && Objects.equals(toolCalls, other.toolCalls)
            && Objects.equals(toolCallId, other.toolCallId)
            && Objects.equals(toolName, other.toolName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content, reasoning, toolCalls, toolCallId, toolName);
    }
}
