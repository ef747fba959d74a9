package com.novelforge.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A phase transition waiting for a human decision.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PendingApproval {
    private String type;
    private Phase fromPhase;
    private Phase targetPhase;
    private Map<String, Object> data = new LinkedHashMap<>();
    private String requestedAt;

    public PendingApproval() {
    }

    public PendingApproval(String type, Phase fromPhase, Phase targetPhase, Map<String, Object> data, String requestedAt) {
        this.type = type;
        this.fromPhase = fromPhase;
        this.targetPhase = targetPhase;
        this.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
        this.requestedAt = requestedAt;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Phase getFromPhase() {
        return fromPhase;
    }

    public void setFromPhase(Phase fromPhase) {
        this.fromPhase = fromPhase;
    }

    public Phase getTargetPhase() {
        return targetPhase;
    }

    public void setTargetPhase(Phase targetPhase) {
        this.targetPhase = targetPhase;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public void setData(Map<String, Object> data) {
        this.data = data != null ? data : new LinkedHashMap<>();
    }

    public String getRequestedAt() {
        return requestedAt;
    }

    public void setRequestedAt(String requestedAt) {
        this.requestedAt = requestedAt;
    }
}
