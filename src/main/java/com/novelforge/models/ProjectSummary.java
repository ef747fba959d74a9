package com.novelforge.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Listing entry for one project folder.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectSummary {
    private String projectId;
    private String projectName;
    private String theme;
    private String genre;
    private String novelLength;
    private Phase phase;
    private boolean paused;
    private String createdAt;
    private String lastUpdated;
    private double progressPercentage;

    public ProjectSummary() {
    }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }
    public String getProjectName() { return projectName; }
    public void setProjectName(String projectName) { this.projectName = projectName; }
    public String getTheme() { return theme; }
    public void setTheme(String theme) { this.theme = theme; }
    public String getGenre() { return genre; }
    public void setGenre(String genre) { this.genre = genre; }
    public String getNovelLength() { return novelLength; }
    public void setNovelLength(String novelLength) { this.novelLength = novelLength; }
    public Phase getPhase() { return phase; }
    public void setPhase(Phase phase) { this.phase = phase; }
    public boolean isPaused() { return paused; }
    public void setPaused(boolean paused) { this.paused = paused; }
    public String getCreatedAt() { return createdAt; }
    public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }
    public String getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(String lastUpdated) { this.lastUpdated = lastUpdated; }
    public double getProgressPercentage() { return progressPercentage; }
    public void setProgressPercentage(double progressPercentage) { this.progressPercentage = progressPercentage; }
}
