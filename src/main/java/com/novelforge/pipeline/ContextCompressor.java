package com.novelforge.pipeline;

import com.novelforge.AppLogger;
import com.novelforge.ProjectContext;
import com.novelforge.agents.AgentSession;
import com.novelforge.models.Message;
import com.novelforge.models.ToolCall;
import com.novelforge.models.WorkflowState;
import com.novelforge.output.GenerationObserver;
import com.novelforge.providers.chat.ModelProvider;
import com.novelforge.providers.chat.ModelRequest;
import com.novelforge.providers.tokens.TokenEstimator;
import com.novelforge.settings.ApiSettings;
import com.novelforge.storage.JsonStorage;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a conversation under the token budget by summarizing its middle.
 *
 * The system message and the last {@value #KEEP_RECENT} messages survive verbatim; everything
 * between is replaced by one user message holding a model-written summary. The recent
 * window never opens with a tool result, since its assistant turn would be summarized away.
 */
public class ContextCompressor {

    public static final int KEEP_RECENT = 10;
    public static final String SUMMARY_START = "[CONTEXT SUMMARY - Previous conversation compressed]";
    public static final String SUMMARY_END = "[END CONTEXT SUMMARY - Continuing from here...]";

    private static final int REASONING_PREVIEW = 500;
    private static final int TOOL_RESULT_PREVIEW = 200;
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final String SUMMARY_SYSTEM =
        "You are a helpful assistant that creates comprehensive summaries of conversations.";
    private static final String SUMMARY_PROMPT = "Please provide a comprehensive summary of the conversation history below. Include:\n"
        + "1. The main task or goal discussed\n"
        + "2. Key decisions made\n"
        + "3. Files created and their purposes\n"
        + "4. Progress made so far\n"
        + "5. Any important context for continuing the work\n\n"
        + "Conversation history to summarize:\n";

    private final ModelProvider provider;
    private final TokenEstimator estimator;
    private final AppLogger logger = AppLogger.get();

    public ContextCompressor(ModelProvider provider, TokenEstimator estimator) {
        this.provider = provider;
        this.estimator = estimator;
    }

    /**
     * Count the session's tokens, report them and compress when the threshold is reached.
     *
     * @return true if the history was replaced
     */
    public boolean compressIfNeeded(AgentSession session, ProjectContext project, WorkflowState state,
                                    GenerationObserver observer) throws InterruptedException {
        ApiSettings api = project.getConfig().getApi();
        int tokens = estimator.estimateTokens(api.getModelId(), session.history());
        observer.tokenUsage(project.getProjectId(), tokens, api.getTokenLimit());
        if (tokens < api.getCompressionThreshold()) {
            return false;
        }
        logger.info("[Compression] " + tokens + " tokens >= threshold " + api.getCompressionThreshold()
            + ", compressing " + session.size() + " messages");
        List<Message> compressed;
        try {
            compressed = compress(session.history(), api.getModelId(), project);
        } catch (IOException | RuntimeException e) {
            logger.error("[Compression] Failed, keeping full history: " + e.getMessage());
            observer.error(project.getProjectId(), "compression", e.getMessage());
            return false;
        }
        if (compressed.size() >= session.size()) {
            return false;
        }
        session.replaceHistory(compressed);
        state.recordCompression();
        int after = estimator.estimateTokens(api.getModelId(), compressed);
        logger.info("[Compression] History now " + compressed.size() + " messages, ~" + after + " tokens");
        observer.tokenUsage(project.getProjectId(), after, api.getTokenLimit());
        return true;
    }

    /**
     * Build the compressed history. Histories of at most KEEP_RECENT + 1 messages come back unchanged.
     */
    public List<Message> compress(List<Message> history, String model, ProjectContext project)
        throws IOException, InterruptedException {
        if (history.size() <= KEEP_RECENT + 1) {
            return history;
        }
        Message system = history.get(0).isRole(Message.SYSTEM) ? history.get(0) : null;
        int middleStart = system != null ? 1 : 0;
        int recentStart = history.size() - KEEP_RECENT;
        while (recentStart < history.size() && history.get(recentStart).isRole(Message.TOOL)) {
            recentStart++;
        }
        List<Message> middle = history.subList(middleStart, recentStart);
        if (middle.isEmpty()) {
            return history;
        }

        List<Message> request = List.of(
            Message.system(SUMMARY_SYSTEM),
            Message.user(SUMMARY_PROMPT + render(middle))
        );
        String summary = provider.complete(new ModelRequest(model, request, null, 0.7, 4096));

        if (project != null) {
            writeSummaryFile(project, summary, middle.size(), history.size() - recentStart);
        }

        List<Message> result = new ArrayList<>();
        if (system != null) {
            result.add(system);
        }
        result.add(Message.user(SUMMARY_START + "\n\n" + summary + "\n\n" + SUMMARY_END));
        result.addAll(history.subList(recentStart, history.size()));
        return result;
    }

    static String render(List<Message> messages) {
        StringBuilder sb = new StringBuilder();
        for (Message message : messages) {
            String content = message.getContent() == null ? "" : message.getContent();
            switch (message.getRole()) {
                case Message.ASSISTANT:
                    if (message.getReasoning() != null && !message.getReasoning().isEmpty()) {
                        sb.append("\n[Assistant Reasoning]: ").append(preview(message.getReasoning(), REASONING_PREVIEW)).append("\n");
                    }
                    if (message.hasToolCalls()) {
                        List<String> calls = new ArrayList<>();
                        for (ToolCall call : message.getToolCalls()) {
                            calls.add(call.getFunctionName() + "(" + call.getArgumentsJson() + ")");
                        }
                        sb.append("\n[Assistant Tool Calls]: ").append(String.join(", ", calls)).append("\n");
                    }
                    if (!content.isEmpty()) {
                        sb.append("\n[Assistant]: ").append(content).append("\n");
                    }
                    break;
                case Message.TOOL:
                    String name = message.getToolName() != null ? message.getToolName() : "unknown_tool";
                    sb.append("\n[Tool Result - ").append(name).append("]: ")
                        .append(preview(content, TOOL_RESULT_PREVIEW)).append("\n");
                    break;
                case Message.USER:
                    sb.append("\n[User]: ").append(content).append("\n");
                    break;
                default:
                    break;
            }
        }
        return sb.toString();
    }

    private static String preview(String text, int limit) {
        return text.length() <= limit ? text : text.substring(0, limit) + "...";
    }

    private void writeSummaryFile(ProjectContext project, String summary, int compressed, int retained) {
        LocalDateTime now = LocalDateTime.now();
        String body = "# Context Summary\n\n"
            + "**Generated:** " + now.format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")) + "\n\n"
            + "**Messages Compressed:** " + compressed + "\n\n"
            + "**Messages Retained:** " + retained + "\n\n"
            + "---\n\n" + summary;
        try {
            JsonStorage.writeAtomic(project.getRoot().resolve(".context_summary_" + now.format(FILE_STAMP) + ".md"), body);
        } catch (IOException e) {
            logger.warn("[Compression] Could not save summary file: " + e.getMessage());
        }
    }
}
