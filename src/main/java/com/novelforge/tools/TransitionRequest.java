package com.novelforge.tools;

import com.novelforge.models.Phase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool's request to move the workflow to another phase. Applied by the orchestrator,
 * never by the tool itself.
 */
public class TransitionRequest {
    private final Phase toPhase;
    private final Map<String, Object> data;

    public TransitionRequest(Phase toPhase, Map<String, Object> data) {
        this.toPhase = toPhase;
        this.data = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
    }

    public Phase getToPhase() {
        return toPhase;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    @Override
    public String toString() {
        return "TransitionRequest{" + toPhase + ", " + data + "}";
    }
}
