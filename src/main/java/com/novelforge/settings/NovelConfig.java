package com.novelforge.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-project configuration, stored as {@code .novel_config.json} in the project folder.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NovelConfig {
    private String projectId;
    private String projectName;
    private String theme;
    private String genre;
    private NovelLength novelLength = NovelLength.NOVEL;
    private Integer customWordCount;
    private WritingSampleSettings writingSample = new WritingSampleSettings();
    private CheckpointSettings checkpoints = new CheckpointSettings();
    private AgentSettings agent = new AgentSettings();
    private ApiSettings api = new ApiSettings();
    private String createdAt;
    private String updatedAt;

    /**
     * Check the fields a generation run depends on.
     *
     * @throws IllegalArgumentException describing the first invalid field
     */
    public void validate() {
        if (projectName == null || projectName.isBlank()) {
            throw new IllegalArgumentException("projectName is required");
        }
        if (theme == null || theme.isBlank()) {
            throw new IllegalArgumentException("theme is required");
        }
        if (novelLength == NovelLength.CUSTOM && (customWordCount == null || customWordCount < 1000)) {
            throw new IllegalArgumentException("customWordCount of at least 1000 is required for CUSTOM length");
        }
        if (api.getCompressionThreshold() >= api.getTokenLimit()) {
            throw new IllegalArgumentException("compressionThreshold must be below tokenLimit");
        }
        if (api.getMaxIterations() < 1) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        if (agent.getMaxPlanCritiqueIterations() < 1 || agent.getMaxWriteCritiqueIterations() < 1) {
            throw new IllegalArgumentException("critique iteration limits must be positive");
        }
    }

    public String lengthDescription() {
        if (novelLength == NovelLength.CUSTOM && customWordCount != null) {
            return String.format("Custom (%,d words)", customWordCount);
        }
        return novelLength.getLabel();
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getProjectName() {
        return projectName;
    }

    public void setProjectName(String projectName) {
        this.projectName = projectName;
    }

    public String getTheme() {
        return theme;
    }

    public void setTheme(String theme) {
        this.theme = theme;
    }

    public String getGenre() {
        return genre;
    }

    public void setGenre(String genre) {
        this.genre = genre;
    }

    public NovelLength getNovelLength() {
        return novelLength;
    }

    public void setNovelLength(NovelLength novelLength) {
        this.novelLength = novelLength != null ? novelLength : NovelLength.NOVEL;
    }

    public Integer getCustomWordCount() {
        return customWordCount;
    }

    public void setCustomWordCount(Integer customWordCount) {
        this.customWordCount = customWordCount;
    }

    public WritingSampleSettings getWritingSample() {
        return writingSample;
    }

    public void setWritingSample(WritingSampleSettings writingSample) {
        this.writingSample = writingSample != null ? writingSample : new WritingSampleSettings();
    }

    public CheckpointSettings getCheckpoints() {
        return checkpoints;
    }

    public void setCheckpoints(CheckpointSettings checkpoints) {
        this.checkpoints = checkpoints != null ? checkpoints : new CheckpointSettings();
    }

    public AgentSettings getAgent() {
        return agent;
    }

    public void setAgent(AgentSettings agent) {
        this.agent = agent != null ? agent : new AgentSettings();
    }

    public ApiSettings getApi() {
        return api;
    }

    public void setApi(ApiSettings api) {
        this.api = api != null ? api : new ApiSettings();
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }
}
