package com.novelforge.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of one phase's conversation, enough to resume the agent after a crash.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckpointRecord {
    private String projectId;
    private Phase phase;
    private int iteration;
    private String timestamp;
    private int messageCount;
    private List<Message> messages = new ArrayList<>();

    public CheckpointRecord() {
    }

    public CheckpointRecord(String projectId, Phase phase, int iteration, String timestamp, List<Message> messages) {
        this.projectId = projectId;
        this.phase = phase;
        this.iteration = iteration;
        this.timestamp = timestamp;
        this.messages = messages != null ? new ArrayList<>(messages) : new ArrayList<>();
        this.messageCount = this.messages.size();
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }

    public int getIteration() {
        return iteration;
    }

    public void setIteration(int iteration) {
        this.iteration = iteration;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public int getMessageCount() {
        return messageCount;
    }

    public void setMessageCount(int messageCount) {
        this.messageCount = messageCount;
    }

    public List<Message> getMessages() {
        return messages;
    }

    public void setMessages(List<Message> messages) {
        this.messages = messages != null ? messages : new ArrayList<>();
    }
}
