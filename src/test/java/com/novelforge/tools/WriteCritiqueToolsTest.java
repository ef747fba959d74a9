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

class WriteCritiqueToolsTest {

    @TempDir
    Path dir;

    private final ToolRegistry tools = WriteCritiqueTools.registry();
    private ProjectContext project;
    private WorkflowState state;
    private ToolExecutionContext ctx;

    @BeforeEach
    void setUp() throws Exception {
        project = TestProjects.create(dir);
        project.getConfig().getAgent().setMaxWriteCritiqueIterations(2);
        state = WorkflowState.create(project.getProjectId());
        state.setPhase(Phase.WRITE_CRITIQUE);
        state.setTotalItems(2);
        ctx = ToolTestSupport.context(project, state);
        ctx.files().write("manuscript/chunk_01.md", "The lamp turned.\n");
        ctx.files().write("manuscript/chunk_02.md", "The ship arrived.\n");
    }

    @Test
    void approvingOneOfTwoMovesToNextChunk() throws Exception {
        ToolResult result = run(tools, "approve_chunk", "{\"chunk_number\": 1, \"approval_notes\": \"solid\"}", ctx);

        assertTrue(result.isSuccess());
        assertEquals(Phase.WRITING, result.getTransition().getToPhase());
        assertEquals(2, result.getTransition().getData().get(WorkflowState.CURRENT_ITEM));
        assertTrue(Files.exists(project.critiquesDir().resolve("chunk_01_approval.md")));
        assertFalse(state.allItemsApproved());
    }

    @Test
    void approvingLastChunkCompletesNovel() throws Exception {
        state.markApproved(1);

        ToolResult result = run(tools, "approve_chunk", "{\"chunk_number\": 2, \"approval_notes\": \"done\"}", ctx);

        assertEquals(Phase.COMPLETE, result.getTransition().getToPhase());
        assertTrue(state.allItemsApproved());
        assertEquals(Boolean.TRUE, result.getData().get("is_complete"));
    }

    @Test
    void approvingMissingChunkFails() throws Exception {
        ToolResult result = run(tools, "approve_chunk", "{\"chunk_number\": 5, \"approval_notes\": \"?\"}", ctx);
        assertFalse(result.isSuccess());
        assertFalse(result.hasTransition());
    }

    @Test
    void critiquesAreVersionedAndCounted() throws Exception {
        run(tools, "critique_chunk", "{\"chunk_number\": 1, \"critique_text\": \"pacing\"}", ctx);
        run(tools, "critique_chunk", "{\"chunk_number\": 1, \"critique_text\": \"better\"}", ctx);

        assertEquals(2, state.critiqueCount(1));
        assertTrue(Files.exists(project.critiquesDir().resolve("chunk_01_critique_v1.md")));
        assertTrue(Files.exists(project.critiquesDir().resolve("chunk_01_critique_v2.md")));
    }

    @Test
    void revisionRequestReturnsToWriting() throws Exception {
        run(tools, "critique_chunk", "{\"chunk_number\": 1, \"critique_text\": \"pacing\"}", ctx);

        ToolResult result = run(tools, "request_revision",
            "{\"chunk_number\": 1, \"revision_notes\": \"Slow the opening.\"}", ctx);

        assertTrue(result.isSuccess());
        assertEquals(Phase.WRITING, result.getTransition().getToPhase());
        assertEquals(1, result.getTransition().getData().get(WorkflowState.CURRENT_ITEM));
        String request = Files.readString(project.critiquesDir().resolve("chunk_01_revision_request_v1.md"));
        assertTrue(request.contains("Slow the opening."));
    }

    @Test
    void revisionLimitForcesApproval() throws Exception {
        state.incrementCritiqueCount(1);
        state.incrementCritiqueCount(1);

        ToolResult result = run(tools, "request_revision", "{\"chunk_number\": 1, \"revision_notes\": \"again\"}", ctx);

        assertFalse(result.isSuccess());
        assertFalse(result.hasTransition());
        assertEquals(Boolean.TRUE, result.getData().get("auto_approve"));
    }
}
