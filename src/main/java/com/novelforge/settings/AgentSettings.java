package com.novelforge.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentSettings {
    private int maxPlanCritiqueIterations = 2;
    private int maxWriteCritiqueIterations = 2;
    private String planningPromptOverride;
    private String planCritiquePromptOverride;
    private String writingPromptOverride;
    private String writeCritiquePromptOverride;

    public int getMaxPlanCritiqueIterations() {
        return maxPlanCritiqueIterations;
    }

    public void setMaxPlanCritiqueIterations(int maxPlanCritiqueIterations) {
        this.maxPlanCritiqueIterations = maxPlanCritiqueIterations;
    }

    public int getMaxWriteCritiqueIterations() {
        return maxWriteCritiqueIterations;
    }

    public void setMaxWriteCritiqueIterations(int maxWriteCritiqueIterations) {
        this.maxWriteCritiqueIterations = maxWriteCritiqueIterations;
    }

    public String getPlanningPromptOverride() {
        return planningPromptOverride;
    }

    public void setPlanningPromptOverride(String planningPromptOverride) {
        this.planningPromptOverride = planningPromptOverride;
    }

    public String getPlanCritiquePromptOverride() {
        return planCritiquePromptOverride;
    }

    public void setPlanCritiquePromptOverride(String planCritiquePromptOverride) {
        this.planCritiquePromptOverride = planCritiquePromptOverride;
    }

    public String getWritingPromptOverride() {
        return writingPromptOverride;
    }

    public void setWritingPromptOverride(String writingPromptOverride) {
        this.writingPromptOverride = writingPromptOverride;
    }

    public String getWriteCritiquePromptOverride() {
        return writeCritiquePromptOverride;
    }

    public void setWriteCritiquePromptOverride(String writeCritiquePromptOverride) {
        this.writeCritiquePromptOverride = writeCritiquePromptOverride;
    }
}
