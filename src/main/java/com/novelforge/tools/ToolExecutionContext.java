package com.novelforge.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.ProjectContext;
import com.novelforge.models.WorkflowState;
import com.novelforge.settings.NovelConfig;

/**
 * What a tool may touch: the project folder and the in-memory workflow state.
 * The orchestrator persists the state after the iteration.
 */
public class ToolExecutionContext {
    private final ProjectContext project;
    private final WorkflowState state;
    private final ObjectMapper mapper;

    public ToolExecutionContext(ProjectContext project, WorkflowState state, ObjectMapper mapper) {
        this.project = project;
        this.state = state;
        this.mapper = mapper;
    }

    public ProjectContext getProject() {
        return project;
    }

    public WorkflowState getState() {
        return state;
    }

    public NovelConfig getConfig() {
        return project.getConfig();
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public ProjectFiles files() {
        return new ProjectFiles(project);
    }
}
