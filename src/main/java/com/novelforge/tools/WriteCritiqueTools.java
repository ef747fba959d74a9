package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.novelforge.tools.ToolArgSpec.Type.INT;
import static com.novelforge.tools.ToolArgSpec.Type.STRING;

/**
 * Tools of the Content Editor: review one chunk, then approve it or send it back.
 */
public final class WriteCritiqueTools extends PhaseTools {

    static final int PREVIOUS_CHUNK_TAIL_CHARS = 4000;

    private WriteCritiqueTools() {
    }

    public static ToolRegistry registry() {
        return new ToolRegistry()
            .register(new ToolSchema("load_chunk_for_review", "Loads a chunk's text for review.")
                    .arg("chunk_number", INT, true, "Chunk number"),
                WriteCritiqueTools::loadChunkForReview)
            .register(new ToolSchema("load_context_for_critique",
                    "Loads the outline, characters and the end of the previous chunk.")
                    .arg("chunk_number", INT, true, "Chunk number"),
                WriteCritiqueTools::loadContextForCritique)
            .register(new ToolSchema("critique_chunk",
                    "Records a versioned critique of a chunk and counts it toward the revision limit.")
                    .arg("chunk_number", INT, true, "Chunk number")
                    .arg("critique_text", STRING, true, "Full critique in markdown"),
                WriteCritiqueTools::critiqueChunk)
            .register(new ToolSchema("approve_chunk",
                    "Approves a chunk. Moves on to the next chunk, or completes the novel after the last one.")
                    .arg("chunk_number", INT, true, "Chunk number")
                    .arg("approval_notes", STRING, true, "Why the chunk is ready"),
                WriteCritiqueTools::approveChunk)
            .register(new ToolSchema("request_revision",
                    "Sends a chunk back to the writer with revision notes.")
                    .arg("chunk_number", INT, true, "Chunk number")
                    .arg("revision_notes", STRING, true, "Concrete changes the writer must make"),
                WriteCritiqueTools::requestRevision);
    }

    static ToolResult loadChunkForReview(JsonNode args, ToolExecutionContext ctx) throws Exception {
        int chunk = integer(args, "chunk_number");
        String text = ctx.files().readChunk(chunk);
        if (text == null) {
            return ToolResult.failure("Chunk " + chunk + " not found");
        }
        return ToolResult.success("Loaded chunk " + chunk)
            .with("chunk_number", chunk)
            .with("word_count", ProjectFiles.wordCount(text))
            .with("critique_iteration", ctx.getState().critiqueCount(chunk))
            .with("content", text);
    }

    static ToolResult loadContextForCritique(JsonNode args, ToolExecutionContext ctx) throws Exception {
        int chunk = integer(args, "chunk_number");
        ProjectFiles files = ctx.files();
        String outline = files.read("planning/outline.md");
        StringBuilder sb = new StringBuilder();
        if (outline != null) {
            String focus = WritingTools.extractChunkSection(outline, chunk);
            sb.append(section("Outline for chunk " + chunk, focus != null ? focus : outline));
        }
        sb.append(section("planning/characters.md", files.read("planning/characters.md")));
        if (chunk > 1) {
            String previous = files.readChunk(chunk - 1);
            if (previous != null) {
                String tail = previous.length() > PREVIOUS_CHUNK_TAIL_CHARS
                    ? "..." + previous.substring(previous.length() - PREVIOUS_CHUNK_TAIL_CHARS)
                    : previous;
                sb.append(section("End of chunk " + (chunk - 1), tail));
            }
        }
        return ToolResult.success("Loaded critique context for chunk " + chunk)
            .with("content", sb.toString());
    }

    static ToolResult critiqueChunk(JsonNode args, ToolExecutionContext ctx) throws Exception {
        int chunk = integer(args, "chunk_number");
        if (!ctx.files().exists(ctx.files().chunkPath(chunk))) {
            return ToolResult.failure("Chunk " + chunk + " not found");
        }
        int version = ctx.getState().incrementCritiqueCount(chunk);
        String path = String.format("critiques/chunk_%02d_critique_v%d.md", chunk, version);
        ctx.files().write(path, header("Chunk " + chunk + " Critique - Version " + version, null)
            + text(args, "critique_text") + "\n");
        int max = ctx.getConfig().getAgent().getMaxWriteCritiqueIterations();
        return ToolResult.success("Critique saved to " + path)
            .with("file_path", path)
            .with("iteration", version)
            .with("max_iterations", max);
    }

    static ToolResult approveChunk(JsonNode args, ToolExecutionContext ctx) throws Exception {
        int chunk = integer(args, "chunk_number");
        WorkflowState state = ctx.getState();
        if (!ctx.files().exists(ctx.files().chunkPath(chunk))) {
            return ToolResult.failure("Chunk " + chunk + " not found");
        }
        String path = String.format("critiques/chunk_%02d_approval.md", chunk);
        ctx.files().write(path, header("Chunk " + chunk + " Approval", "APPROVED")
            + text(args, "approval_notes") + "\n");
        state.markCompleted(chunk);
        state.markApproved(chunk);

        if (state.allItemsApproved()) {
            return ToolResult.success("Chunk " + chunk + " approved. All " + state.getTotalItems()
                    + " chunks are approved; the novel is complete.")
                .with("file_path", path)
                .with("is_complete", true)
                .transitionTo(Phase.COMPLETE, Map.of("chunk_number", chunk));
        }
        int next = nextUnapproved(state, chunk);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("chunk_number", chunk);
        data.put(WorkflowState.CURRENT_ITEM, next);
        return ToolResult.success("Chunk " + chunk + " approved. Moving to chunk " + next + ".")
            .with("file_path", path)
            .with("is_complete", false)
            .with("next_chunk", next)
            .transitionTo(Phase.WRITING, data);
    }

    static ToolResult requestRevision(JsonNode args, ToolExecutionContext ctx) throws Exception {
        int chunk = integer(args, "chunk_number");
        WorkflowState state = ctx.getState();
        int max = ctx.getConfig().getAgent().getMaxWriteCritiqueIterations();
        int count = state.critiqueCount(chunk);
        if (count >= max) {
            return ToolResult.failure("Maximum critique iterations (" + max + ") reached for chunk " + chunk
                    + ". Approve the chunk instead to prevent an endless revision loop.")
                .with("auto_approve", true);
        }
        String path = String.format("critiques/chunk_%02d_revision_request_v%d.md", chunk, count);
        ctx.files().write(path, header("Chunk " + chunk + " Revision Request - Version " + count,
            "REVISION REQUESTED") + text(args, "revision_notes") + "\n");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(WorkflowState.CURRENT_ITEM, chunk);
        data.put("revision", true);
        return ToolResult.success("Revision requested for chunk " + chunk + ", returning to writing")
            .with("file_path", path)
            .transitionTo(Phase.WRITING, data);
    }

    private static int nextUnapproved(WorkflowState state, int after) {
        for (int i = after + 1; i <= state.getTotalItems(); i++) {
            if (!state.getApprovedItems().contains(i)) {
                return i;
            }
        }
        for (int i = 1; i <= after; i++) {
            if (!state.getApprovedItems().contains(i)) {
                return i;
            }
        }
        return after + 1;
    }
}
