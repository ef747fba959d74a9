package com.novelforge.storage;

import com.novelforge.models.Message;
import com.novelforge.models.Phase;
import com.novelforge.models.ToolCall;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranscriptWriterTest {

    @TempDir
    Path root;

    @Test
    void rendersEachMessageWithReasoningAndToolCalls() throws Exception {
        List<Message> history = List.of(
            Message.system("You are the Story Architect"),
            Message.user("Plan the novel"),
            Message.assistant("Starting", "Think about the theme first",
                List.of(new ToolCall("call_1", "create_story_summary", "{\"content\":\"A keeper\"}"))),
            Message.toolResult("call_1", "create_story_summary", "{\"success\":true}"));

        Path file = new TranscriptWriter().write(root, "novel-1", Phase.PLANNING, history);

        assertEquals(".conversation_log_PLANNING.md", file.getFileName().toString());
        String text = Files.readString(file);
        assertTrue(text.startsWith("# Conversation Log: PLANNING"));
        assertTrue(text.contains("- Messages: 4"));
        assertTrue(text.contains("## 3. ASSISTANT"));
        assertTrue(text.contains("<details><summary>Reasoning</summary>\n\nThink about the theme first"));
        assertTrue(text.contains("**Tool call** `create_story_summary` (call_1)"));
        assertTrue(text.contains("## 4. TOOL (create_story_summary)"));
    }
}
