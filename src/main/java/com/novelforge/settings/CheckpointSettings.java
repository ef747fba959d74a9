package com.novelforge.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.novelforge.models.Phase;

/**
 * Which phase transitions wait for a human approval.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckpointSettings {
    private boolean requirePlanApproval = true;
    private boolean requirePlanCritiqueApproval = false;
    private boolean requireChunkApproval = false;
    private boolean requireChunkCritiqueApproval = false;

    public boolean requiresApproval(Phase from, Phase to) {
        if (to == Phase.PLAN_CRITIQUE) {
            return requirePlanCritiqueApproval;
        }
        if (from == Phase.PLAN_CRITIQUE && to == Phase.WRITING) {
            return requirePlanApproval;
        }
        if (to == Phase.WRITE_CRITIQUE) {
            return requireChunkApproval;
        }
        if (from == Phase.WRITE_CRITIQUE) {
            return requireChunkCritiqueApproval;
        }
        return false;
    }

    public boolean isRequirePlanApproval() {
        return requirePlanApproval;
    }

    public void setRequirePlanApproval(boolean requirePlanApproval) {
        this.requirePlanApproval = requirePlanApproval;
    }

    public boolean isRequirePlanCritiqueApproval() {
        return requirePlanCritiqueApproval;
    }

    public void setRequirePlanCritiqueApproval(boolean requirePlanCritiqueApproval) {
        this.requirePlanCritiqueApproval = requirePlanCritiqueApproval;
    }

    public boolean isRequireChunkApproval() {
        return requireChunkApproval;
    }

    public void setRequireChunkApproval(boolean requireChunkApproval) {
        this.requireChunkApproval = requireChunkApproval;
    }

    public boolean isRequireChunkCritiqueApproval() {
        return requireChunkCritiqueApproval;
    }

    public void setRequireChunkCritiqueApproval(boolean requireChunkCritiqueApproval) {
        this.requireChunkCritiqueApproval = requireChunkCritiqueApproval;
    }
}
