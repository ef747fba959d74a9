package com.novelforge.tools;

import com.novelforge.ProjectContext;
import com.novelforge.TestProjects;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static com.novelforge.tools.ToolTestSupport.run;
import static org.junit.jupiter.api.Assertions.*;

class PlanCritiqueToolsTest {

    @TempDir
    Path dir;

    private final ToolRegistry tools = PlanCritiqueTools.registry();
    private ProjectContext project;
    private WorkflowState state;
    private ToolExecutionContext ctx;

    @BeforeEach
    void setUp() throws Exception {
        project = TestProjects.create(dir);
        project.getConfig().getAgent().setMaxPlanCritiqueIterations(2);
        state = WorkflowState.create(project.getProjectId());
        state.setPhase(Phase.PLAN_CRITIQUE);
        ctx = ToolTestSupport.context(project, state);
    }

    @Test
    void loadingWithoutMaterialsFails() throws Exception {
        assertFalse(run(tools, "load_plan_materials", "{}", ctx).isSuccess());
        ctx.files().write("planning/summary.md", "# Summary");
        ToolResult loaded = run(tools, "load_plan_materials", "{}", ctx);
        assertTrue(loaded.isSuccess());
        assertTrue(loaded.getData().get("content").toString().contains("(missing)"));
    }

    @Test
    void critiquesAreVersionedWithLimitNote() throws Exception {
        ToolResult first = run(tools, "critique_plan", "{\"critique_text\": \"weak middle\"}", ctx);
        ToolResult second = run(tools, "critique_plan", "{\"critique_text\": \"better\"}", ctx);

        assertFalse(first.getData().containsKey("note"));
        assertTrue(second.getData().containsKey("note"));
        assertEquals(2, state.getPlanCritiqueIterations());
        assertTrue(Files.exists(project.critiquesDir().resolve("plan_critique_v2.md")));
    }

    @Test
    void revisedStructureUpdatesChunkCount() throws Exception {
        run(tools, "revise_structure", "{\"structure_updates\": \"Now 9 chunks in four parts.\"}", ctx);
        assertEquals(9, state.getTotalItems());
    }

    @Test
    void approvalStartsWritingAtFirstChunk() throws Exception {
        assertFalse(run(tools, "approve_plan", "{\"approval_notes\": \"ok\"}", ctx).isSuccess());

        state.setTotalItems(4);
        ToolResult result = run(tools, "approve_plan", "{\"approval_notes\": \"ok\"}", ctx);

        assertEquals(Phase.WRITING, result.getTransition().getToPhase());
        assertEquals(1, result.getTransition().getData().get(WorkflowState.CURRENT_ITEM));
        assertTrue(Files.exists(project.planningDir().resolve("plan_approval.md")));
    }
}
