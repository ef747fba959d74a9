package com.novelforge.models;

import java.util.EnumSet;
import java.util.Set;

/**
 * Workflow phases and the edges allowed between them.
 */
public enum Phase {
    PLANNING,
    PLAN_CRITIQUE,
    WRITING,
    WRITE_CRITIQUE,
    COMPLETE;

    public Set<Phase> allowedTargets() {
        switch (this) {
            case PLANNING:
                return EnumSet.of(PLAN_CRITIQUE);
            case PLAN_CRITIQUE:
                return EnumSet.of(WRITING);
            case WRITING:
                return EnumSet.of(WRITE_CRITIQUE);
            case WRITE_CRITIQUE:
                return EnumSet.of(WRITING, COMPLETE);
            case COMPLETE:
            default:
                return EnumSet.noneOf(Phase.class);
        }
    }

    public boolean canTransitionTo(Phase target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETE;
    }

    /**
     * Lenient lookup for names coming from model tool calls ("plan_critique", "WRITING").
     * Returns null when the name matches no phase.
     */
    public static Phase fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String normalized = name.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        for (Phase phase : values()) {
            if (phase.name().equals(normalized)) {
                return phase;
            }
        }
        return null;
    }
}
