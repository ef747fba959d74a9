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
import java.util.List;

import static com.novelforge.tools.ToolTestSupport.run;
import static org.junit.jupiter.api.Assertions.*;

class WritingToolsTest {

    private static final String OUTLINE = "# Plot Outline\n\n## Chunk 1\nMara arrives.\n\n## Chunk 2\nThe ghost ship.\n\n## Chunk 3\nThe light fails.\n";

    @TempDir
    Path dir;

    private final ToolRegistry tools = WritingTools.registry();
    private ProjectContext project;
    private WorkflowState state;
    private ToolExecutionContext ctx;

    @BeforeEach
    void setUp() throws Exception {
        project = TestProjects.create(dir);
        state = WorkflowState.create(project.getProjectId());
        state.setPhase(Phase.WRITING);
        state.setTotalItems(3);
        ctx = ToolTestSupport.context(project, state);
        ctx.files().write("planning/outline.md", OUTLINE);
    }

    @Test
    void extractsOnlyTheRequestedOutlineSection() {
        String section = WritingTools.extractChunkSection(OUTLINE, 2);
        assertEquals("## Chunk 2\nThe ghost ship.", section);
        assertNull(WritingTools.extractChunkSection(OUTLINE, 9));
    }

    @Test
    void chunkContextSelectsCurrentItem() throws Exception {
        ToolResult result = run(tools, "get_chunk_context", "{\"chunk_number\": 2}", ctx);

        assertTrue(result.isSuccess());
        assertEquals(2, state.getCurrentItem());
        assertTrue(result.getData().get("content").toString().contains("The ghost ship."));
    }

    @Test
    void chunkNumbersOutsidePlanAreRejected() throws Exception {
        assertFalse(run(tools, "write_chunk", "{\"chunk_number\": 4, \"content\": \"x\"}", ctx).isSuccess());
        assertFalse(run(tools, "write_chunk", "{\"chunk_number\": 0, \"content\": \"x\"}", ctx).isSuccess());
    }

    @Test
    void writeThenFinalizeSubmitsForCritique() throws Exception {
        ToolResult written = run(tools, "write_chunk", "{\"chunk_number\": 1, \"content\": \"Mara climbed the stairs.\"}", ctx);
        assertTrue(written.isSuccess());
        assertTrue(written.getData().containsKey("warning"));
        assertEquals("Mara climbed the stairs.\n", Files.readString(project.chunkFile(1)));

        ToolResult finalized = run(tools, "finalize_chunk", "{\"chunk_number\": 1}", ctx);
        assertEquals(Phase.WRITE_CRITIQUE, finalized.getTransition().getToPhase());
        assertEquals(1, finalized.getTransition().getData().get(WorkflowState.CURRENT_ITEM));
    }

    @Test
    void finalizeBeforeWritingFails() throws Exception {
        ToolResult result = run(tools, "finalize_chunk", "{\"chunk_number\": 2}", ctx);
        assertFalse(result.isSuccess());
        assertFalse(result.hasTransition());
    }

    @Test
    void reviewPreviousWritingAcceptsRangesAndAll() throws Exception {
        ctx.files().write("manuscript/chunk_01.md", "One.");
        ctx.files().write("manuscript/chunk_02.md", "Two.");

        assertEquals(List.of(1, 2), run(tools, "review_previous_writing", "{\"chunk_range\": \"all\"}", ctx)
            .getData().get("chunks"));
        assertEquals(List.of(2), run(tools, "review_previous_writing", "{\"chunk_range\": \"2-3\"}", ctx)
            .getData().get("chunks"));
        assertFalse(run(tools, "review_previous_writing", "{\"chunk_range\": \"3-1\"}", ctx).isSuccess());
        assertFalse(run(tools, "review_previous_writing", "{\"chunk_range\": \"soon\"}", ctx).isSuccess());
    }
}
