package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.novelforge.models.Phase;
import com.novelforge.models.WorkflowState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.novelforge.tools.ToolArgSpec.Type.INT;
import static com.novelforge.tools.ToolArgSpec.Type.STRING;

/**
 * Tools of the Creative Writer: read the plan, write one chunk, submit it for critique.
 */
public final class WritingTools extends PhaseTools {

    static final int SHORT_CHUNK_WORDS = 500;
    private static final Pattern RANGE = Pattern.compile("\\s*(\\d+)\\s*-\\s*(\\d+)\\s*");
    private static final String SEPARATOR = "=".repeat(80);

    private WritingTools() {
    }

    public static ToolRegistry registry() {
        return new ToolRegistry()
            .register(new ToolSchema("load_approved_plan",
                    "Loads the approved planning documents to refresh the story blueprint."),
                WritingTools::loadApprovedPlan)
            .register(new ToolSchema("get_chunk_context",
                    "Loads the outline section for a chunk and makes it the current chunk.")
                    .arg("chunk_number", INT, true, "Chunk number, starting at 1"),
                WritingTools::getChunkContext)
            .register(new ToolSchema("write_chunk",
                    "Saves the complete text of a chunk to manuscript/chunk_NN.md, replacing any earlier draft.")
                    .arg("chunk_number", INT, true, "Chunk number")
                    .arg("content", STRING, true, "Complete chunk prose in markdown"),
                WritingTools::writeChunk)
            .register(new ToolSchema("review_previous_writing",
                    "Loads earlier chunks for continuity: 'all', a single number '3' or a range '1-3'.")
                    .arg("chunk_range", STRING, true, "'all', 'N' or 'A-B'"),
                WritingTools::reviewPreviousWriting)
            .register(new ToolSchema("finalize_chunk",
                    "Submits a written chunk for critique.")
                    .arg("chunk_number", INT, true, "Chunk number")
                    .arg("notes", STRING, false, "Optional notes for the editor"),
                WritingTools::finalizeChunk);
    }

    static ToolResult loadApprovedPlan(JsonNode args, ToolExecutionContext ctx) throws Exception {
        ProjectFiles files = ctx.files();
        StringBuilder sb = new StringBuilder();
        for (String file : WorkflowState.PLAN_FILES) {
            sb.append(section(file, files.read(file)));
        }
        String approval = files.read("planning/plan_approval.md");
        if (approval != null) {
            sb.append(section("planning/plan_approval.md", approval));
        }
        return ToolResult.success("Loaded approved plan")
            .with("content", sb.toString())
            .with("total_chunks", ctx.getState().getTotalItems());
    }

    static ToolResult getChunkContext(JsonNode args, ToolExecutionContext ctx) throws Exception {
        int chunk = integer(args, "chunk_number");
        WorkflowState state = ctx.getState();
        String rangeError = checkRange(chunk, state);
        if (rangeError != null) {
            return ToolResult.failure(rangeError);
        }
        String outline = ctx.files().read("planning/outline.md");
        if (outline == null) {
            return ToolResult.failure("Outline file not found");
        }
        state.setCurrentItem(chunk);
        state.getItemCritiqueCounts().putIfAbsent(chunk, 0);
        String focus = extractChunkSection(outline, chunk);
        StringBuilder sb = new StringBuilder();
        sb.append("CHUNK ").append(chunk).append(" CONTEXT\n\n");
        if (focus != null) {
            sb.append("Outline for this chunk:\n").append(focus).append("\n\n");
        }
        sb.append("Full outline for reference:\n").append(outline);
        return ToolResult.success("Context loaded for chunk " + chunk)
            .with("chunk_number", chunk)
            .with("content", sb.toString());
    }

    static ToolResult writeChunk(JsonNode args, ToolExecutionContext ctx) throws Exception {
        int chunk = integer(args, "chunk_number");
        String rangeError = checkRange(chunk, ctx.getState());
        if (rangeError != null) {
            return ToolResult.failure(rangeError);
        }
        String content = text(args, "content");
        ProjectFiles files = ctx.files();
        String path = files.chunkPath(chunk);
        files.write(path, content.trim() + "\n");
        int words = ProjectFiles.wordCount(content);
        ToolResult result = ToolResult.success("Chunk " + chunk + " saved (" + words + " words)")
            .with("file_path", path)
            .with("word_count", words);
        if (words < SHORT_CHUNK_WORDS) {
            result.with("warning", "Chunk is unusually short; consider expanding it before finalizing.");
        }
        return result;
    }

    static ToolResult reviewPreviousWriting(JsonNode args, ToolExecutionContext ctx) throws Exception {
        String range = text(args, "chunk_range", "").trim();
        ProjectFiles files = ctx.files();
        List<Integer> wanted = new ArrayList<>();
        if ("all".equalsIgnoreCase(range)) {
            wanted.addAll(files.listChunks());
        } else {
            Matcher m = RANGE.matcher(range);
            if (m.matches()) {
                int start = Integer.parseInt(m.group(1));
                int end = Integer.parseInt(m.group(2));
                if (end < start) {
                    return ToolResult.failure("Invalid chunk range: " + range);
                }
                for (int i = start; i <= end; i++) {
                    wanted.add(i);
                }
            } else {
                try {
                    wanted.add(Integer.parseInt(range));
                } catch (NumberFormatException e) {
                    return ToolResult.failure("Invalid chunk range: " + range);
                }
            }
        }
        StringBuilder sb = new StringBuilder();
        List<Integer> loaded = new ArrayList<>();
        for (int chunk : wanted) {
            String text = files.readChunk(chunk);
            if (text != null) {
                loaded.add(chunk);
                sb.append("\n").append(SEPARATOR).append("\n")
                    .append(files.chunkPath(chunk)).append("\n")
                    .append(SEPARATOR).append("\n")
                    .append(text);
            }
        }
        if (loaded.isEmpty()) {
            return ToolResult.failure("No chunks found for range: " + range);
        }
        return ToolResult.success("Loaded " + loaded.size() + " chunk(s)")
            .with("chunks", loaded)
            .with("content", sb.toString());
    }

    static ToolResult finalizeChunk(JsonNode args, ToolExecutionContext ctx) throws Exception {
        int chunk = integer(args, "chunk_number");
        ProjectFiles files = ctx.files();
        String text = files.readChunk(chunk);
        if (text == null) {
            return ToolResult.failure("Chunk " + chunk + " has not been written; call write_chunk first");
        }
        int words = ProjectFiles.wordCount(text);
        return ToolResult.success("Chunk " + chunk + " submitted for critique (" + words + " words)")
            .with("chunk_number", chunk)
            .with("word_count", words)
            .transitionTo(Phase.WRITE_CRITIQUE, Map.of(WorkflowState.CURRENT_ITEM, chunk,
                "notes", text(args, "notes", "")));
    }

    static String checkRange(int chunk, WorkflowState state) {
        if (chunk < 1) {
            return "chunk_number must be 1 or greater";
        }
        if (state.getTotalItems() > 0 && chunk > state.getTotalItems()) {
            return "chunk_number " + chunk + " exceeds the planned total of " + state.getTotalItems();
        }
        return null;
    }

    /**
     * The outline section headed "Chunk N" (or "Chapter N") up to the next heading of the same kind.
     */
    static String extractChunkSection(String outline, int chunk) {
        Pattern heading = Pattern.compile("(?im)^(#{1,6})\\s*(?:chunk|chapter)\\s+" + chunk + "\\b.*$");
        Matcher m = heading.matcher(outline);
        if (!m.find()) {
            return null;
        }
        int start = m.start();
        Pattern next = Pattern.compile("(?im)^#{1," + m.group(1).length() + "}\\s*(?:chunk|chapter)\\s+\\d+");
        Matcher n = next.matcher(outline);
        int end = outline.length();
        if (n.find(m.end())) {
            end = n.start();
        }
        return outline.substring(start, end).trim();
    }
}
