package com.novelforge.providers.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.novelforge.models.Message;
import com.novelforge.models.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void encodesAssistantToolCallsInWireShape() {
        Message message = Message.assistant(null, null, List.of(new ToolCall("call_7", "write_chunk", "{\"chunk_number\":1}")));

        ObjectNode node = new MessageCodec(mapper, false).encode(message);

        assertEquals("assistant", node.get("role").asText());
        assertEquals("", node.get("content").asText());
        assertEquals("call_7", node.at("/tool_calls/0/id").asText());
        assertEquals("function", node.at("/tool_calls/0/type").asText());
        assertEquals("write_chunk", node.at("/tool_calls/0/function/name").asText());
        assertEquals("{\"chunk_number\":1}", node.at("/tool_calls/0/function/arguments").asText());
    }

    @Test
    void encodesToolResultWithCallId() {
        ObjectNode node = new MessageCodec(mapper, false)
            .encode(Message.toolResult("call_7", "write_chunk", "{\"success\":true}"));

        assertEquals("tool", node.get("role").asText());
        assertEquals("call_7", node.get("tool_call_id").asText());
        assertEquals("write_chunk", node.get("name").asText());
    }

    @Test
    void reasoningIsOptIn() {
        Message message = Message.assistant("done", "because", null);

        assertFalse(new MessageCodec(mapper, false).encode(message).has("reasoning_content"));
        assertEquals("because", new MessageCodec(mapper, true).encode(message).get("reasoning_content").asText());
        assertFalse(new MessageCodec(mapper, true).encode(message).has("tool_calls"));
    }
}
