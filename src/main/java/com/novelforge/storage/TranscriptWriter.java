package com.novelforge.storage;

import com.novelforge.models.Message;
import com.novelforge.models.Phase;
import com.novelforge.models.ToolCall;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Human-readable markdown rendering of a phase conversation: {@code .conversation_log_{PHASE}.md}.
 */
public class TranscriptWriter {

    public static String fileName(Phase phase) {
        return ".conversation_log_" + phase.name() + ".md";
    }

    public Path write(Path projectRoot, String projectId, Phase phase, List<Message> history) throws IOException {
        Path file = projectRoot.resolve(fileName(phase));
        JsonStorage.writeAtomic(file, render(projectId, phase, history));
        return file;
    }

    String render(String projectId, Phase phase, List<Message> history) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Conversation Log: ").append(phase.name()).append("\n\n");
        sb.append("- Project: ").append(projectId).append("\n");
        sb.append("- Written: ").append(Instant.now()).append("\n");
        sb.append("- Messages: ").append(history.size()).append("\n\n---\n\n");

        int index = 1;
        for (Message message : history) {
            sb.append("## ").append(index++).append(". ").append(message.getRole().toUpperCase());
            if (message.getToolName() != null) {
                sb.append(" (").append(message.getToolName()).append(")");
            }
            sb.append("\n\n");
            if (message.getReasoning() != null && !message.getReasoning().isBlank()) {
                sb.append("<details><summary>Reasoning</summary>\n\n")
                    .append(message.getReasoning())
                    .append("\n\n</details>\n\n");
            }
            if (message.getContent() != null && !message.getContent().isBlank()) {
                sb.append(message.getContent()).append("\n\n");
            }
            if (message.hasToolCalls()) {
                for (ToolCall call : message.getToolCalls()) {
                    sb.append("**Tool call** `").append(call.getFunctionName()).append("` (")
                        .append(call.getId()).append(")\n\n```json\n")
                        .append(call.getArgumentsJson() == null ? "{}" : call.getArgumentsJson())
                        .append("\n```\n\n");
                }
            }
            sb.append("---\n\n");
        }
        return sb.toString();
    }
}
