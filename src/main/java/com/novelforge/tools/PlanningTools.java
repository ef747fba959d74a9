package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelforge.ProjectContext;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.novelforge.tools.ToolArgSpec.Type.INT;
import static com.novelforge.tools.ToolArgSpec.Type.STRING;

/**
 * Tools of the Story Architect: build the four planning documents, then hand over to critique.
 */
public final class PlanningTools extends PhaseTools {

    static final int MIN_SUMMARY_WORDS = 50;

    private PlanningTools() {
    }

    public static ToolRegistry registry() {
        return new ToolRegistry()
            .register(new ToolSchema("create_project",
                    "Prepares the project folder (planning, manuscript and critiques subfolders).")
                    .arg("project_name", STRING, false, "Display name of the novel project"),
                PlanningTools::createProject)
            .register(new ToolSchema("create_story_summary",
                    "Creates planning/summary.md: concept, themes, central conflict and narrative arc.")
                    .arg("title", STRING, false, "Working title of the novel")
                    .arg("summary", STRING, true, "The complete story summary")
                    .alias("content", "summary"),
                PlanningTools::createStorySummary)
            .register(new ToolSchema("create_dramatis_personae",
                    "Creates planning/characters.md with all major and significant minor characters.")
                    .arg("characters", STRING, true, "Character profiles in markdown")
                    .alias("content", "characters"),
                (args, ctx) -> writePlanFile(ctx, "planning/characters.md", "Dramatis Personae",
                    text(args, "characters")))
            .register(new ToolSchema("create_story_structure",
                    "Creates planning/structure.md: POV, timeline, pacing and how the story divides into chunks.")
                    .arg("structure", STRING, true, "Structure description; state the number of chunks, e.g. '12 chunks'")
                    .arg("chunk_count", INT, false, "Number of writing chunks")
                    .alias("content", "structure"),
                PlanningTools::createStoryStructure)
            .register(new ToolSchema("create_plot_outline",
                    "Creates planning/outline.md with a chunk-by-chunk breakdown of the plot.")
                    .arg("outline", STRING, true, "Outline in markdown with one '## Chunk N' section per chunk")
                    .alias("content", "outline"),
                PlanningTools::createPlotOutline)
            .register(new ToolSchema("finalize_plan",
                    "Checks that all planning documents exist and submits the plan for critique.")
                    .arg("notes", STRING, false, "Optional notes about the completed plan"),
                PlanningTools::finalizePlan);
    }

    static ToolResult createProject(JsonNode args, ToolExecutionContext ctx) throws Exception {
        ProjectContext project = ctx.getProject();
        project.ensureLayout();
        return ToolResult.success("Project folder ready: " + project.getProjectId())
            .with("project_id", project.getProjectId())
            .with("folders", List.of(ProjectContext.PLANNING_DIR, ProjectContext.MANUSCRIPT_DIR,
                ProjectContext.CRITIQUES_DIR));
    }

    static ToolResult createStorySummary(JsonNode args, ToolExecutionContext ctx) throws Exception {
        String summary = text(args, "summary");
        int words = ProjectFiles.wordCount(summary);
        if (words < MIN_SUMMARY_WORDS) {
            return ToolResult.failure("Summary too short: " + words + " words, at least "
                + MIN_SUMMARY_WORDS + " required");
        }
        String title = text(args, "title", "Story Summary");
        return writePlanFile(ctx, "planning/summary.md", title, summary);
    }

    static ToolResult createStoryStructure(JsonNode args, ToolExecutionContext ctx) throws Exception {
        String structure = text(args, "structure");
        ToolResult result = writePlanFile(ctx, "planning/structure.md", "Story Structure", structure);
        int count = integer(args, "chunk_count");
        if (count <= 0) {
            count = detectChunkCount(structure);
        }
        if (count > 0) {
            ctx.getState().setTotalItems(count);
            result.with("total_chunks", count);
        }
        return result;
    }

    static ToolResult createPlotOutline(JsonNode args, ToolExecutionContext ctx) throws Exception {
        String outline = text(args, "outline");
        ToolResult result = writePlanFile(ctx, "planning/outline.md", "Plot Outline", outline);
        WorkflowState state = ctx.getState();
        if (state.getTotalItems() <= 0) {
            int count = countOutlineChunks(outline);
            if (count > 0) {
                state.setTotalItems(count);
                result.with("total_chunks", count);
            }
        }
        return result;
    }

    static ToolResult finalizePlan(JsonNode args, ToolExecutionContext ctx) {
        ProjectFiles files = ctx.files();
        List<String> missing = new ArrayList<>();
        for (String file : WorkflowState.PLAN_FILES) {
            if (!files.exists(file)) {
                missing.add(file);
            }
        }
        if (!missing.isEmpty()) {
            return ToolResult.failure("Cannot finalize plan, missing files: " + String.join(", ", missing))
                .with("missing_files", missing);
        }
        WorkflowState state = ctx.getState();
        if (state.getTotalItems() <= 0) {
            return ToolResult.failure("Cannot finalize plan: the story structure does not state how many chunks "
                + "to write. Call create_story_structure with chunk_count.");
        }
        return ToolResult.success("Plan finalized with " + state.getTotalItems() + " chunks, submitting for critique")
            .with("total_chunks", state.getTotalItems())
            .transitionTo(Phase.PLAN_CRITIQUE, Map.of("notes", text(args, "notes", "")));
    }

    static ToolResult writePlanFile(ToolExecutionContext ctx, String relativePath, String title, String content)
        throws Exception {
        ctx.files().write(relativePath, "# " + title + "\n\n" + content.trim() + "\n");
        ctx.getState().getPlanFilesCreated().put(relativePath, true);
        int words = ProjectFiles.wordCount(content);
        return ToolResult.success("Wrote " + relativePath + " (" + words + " words)")
            .with("file_path", relativePath)
            .with("word_count", words);
    }
}
