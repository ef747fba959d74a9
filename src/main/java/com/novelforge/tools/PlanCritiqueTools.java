package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;

import java.util.Map;

import static com.novelforge.tools.ToolArgSpec.Type.STRING;

/**
 * Tools of the Story Editor: review the plan, revise it, approve it for writing.
 */
public final class PlanCritiqueTools extends PhaseTools {

    private PlanCritiqueTools() {
    }

    public static ToolRegistry registry() {
        return new ToolRegistry()
            .register(new ToolSchema("load_plan_materials",
                    "Loads summary, characters, structure and outline for review."),
                PlanCritiqueTools::loadPlanMaterials)
            .register(new ToolSchema("critique_plan",
                    "Records a versioned critique of the planning materials in critiques/.")
                    .arg("critique_text", STRING, true, "Full critique in markdown"),
                PlanCritiqueTools::critiquePlan)
            .register(new ToolSchema("revise_summary", "Overwrites planning/summary.md with a revised version.")
                    .arg("new_summary", STRING, true, "Complete revised summary"),
                (args, ctx) -> PlanningTools.writePlanFile(ctx, "planning/summary.md", "Story Summary",
                    text(args, "new_summary")))
            .register(new ToolSchema("revise_characters", "Overwrites planning/characters.md with revised profiles.")
                    .arg("character_updates", STRING, true, "Complete revised character profiles"),
                (args, ctx) -> PlanningTools.writePlanFile(ctx, "planning/characters.md", "Dramatis Personae",
                    text(args, "character_updates")))
            .register(new ToolSchema("revise_structure", "Overwrites planning/structure.md with a revised structure.")
                    .arg("structure_updates", STRING, true, "Complete revised structure; state the chunk count"),
                PlanCritiqueTools::reviseStructure)
            .register(new ToolSchema("revise_outline", "Overwrites planning/outline.md with a revised outline.")
                    .arg("outline_updates", STRING, true, "Complete revised chunk-by-chunk outline"),
                (args, ctx) -> PlanningTools.writePlanFile(ctx, "planning/outline.md", "Plot Outline",
                    text(args, "outline_updates")))
            .register(new ToolSchema("approve_plan",
                    "Approves the plan and moves the project to the writing phase.")
                    .arg("approval_notes", STRING, true, "Why the plan is ready"),
                PlanCritiqueTools::approvePlan);
    }

    static ToolResult loadPlanMaterials(JsonNode args, ToolExecutionContext ctx) throws Exception {
        ProjectFiles files = ctx.files();
        StringBuilder sb = new StringBuilder();
        int found = 0;
        for (String file : WorkflowState.PLAN_FILES) {
            String content = files.read(file);
            if (content != null) {
                found++;
            }
            sb.append(section(file, content));
        }
        if (found == 0) {
            return ToolResult.failure("No planning materials found");
        }
        return ToolResult.success("Loaded " + found + " planning documents")
            .with("content", sb.toString());
    }

    static ToolResult critiquePlan(JsonNode args, ToolExecutionContext ctx) throws Exception {
        WorkflowState state = ctx.getState();
        int version = state.getPlanCritiqueIterations() + 1;
        state.setPlanCritiqueIterations(version);
        String path = "critiques/plan_critique_v" + version + ".md";
        ctx.files().write(path, header("Plan Critique - Version " + version, null) + text(args, "critique_text") + "\n");
        int max = ctx.getConfig().getAgent().getMaxPlanCritiqueIterations();
        ToolResult result = ToolResult.success("Critique saved to " + path)
            .with("file_path", path)
            .with("iteration", version)
            .with("max_iterations", max);
        if (version >= max) {
            result.with("note", "Critique iteration limit reached; finish revisions and call approve_plan.");
        }
        return result;
    }

    static ToolResult reviseStructure(JsonNode args, ToolExecutionContext ctx) throws Exception {
        String structure = text(args, "structure_updates");
        ToolResult result = PlanningTools.writePlanFile(ctx, "planning/structure.md", "Story Structure", structure);
        int count = detectChunkCount(structure);
        if (count > 0) {
            ctx.getState().setTotalItems(count);
            result.with("total_chunks", count);
        }
        return result;
    }

    static ToolResult approvePlan(JsonNode args, ToolExecutionContext ctx) throws Exception {
        WorkflowState state = ctx.getState();
        if (state.getTotalItems() <= 0) {
            return ToolResult.failure("Cannot approve: the structure does not state a chunk count. "
                + "Use revise_structure to add one.");
        }
        String path = "planning/plan_approval.md";
        ctx.files().write(path, header("Plan Approval", "APPROVED") + text(args, "approval_notes") + "\n");
        return ToolResult.success("Plan approved, moving to writing")
            .with("file_path", path)
            .with("critique_iterations", state.getPlanCritiqueIterations())
            .transitionTo(Phase.WRITING, Map.of(WorkflowState.CURRENT_ITEM, 1));
    }
}
