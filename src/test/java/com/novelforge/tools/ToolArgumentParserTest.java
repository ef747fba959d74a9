package com.novelforge.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolArgumentParserTest {

    private final ToolArgumentParser parser = new ToolArgumentParser(new ObjectMapper());

    @Test
    void parsesPlainObject() {
        ObjectNode args = parser.parse("write_chunk", "{\"chunk_number\": 2, \"content\": \"text\"}");
        assertEquals(2, args.get("chunk_number").asInt());
        assertEquals("text", args.get("content").asText());
    }

    @Test
    void unwrapsCodeFence() {
        ObjectNode args = parser.parse("approve_plan", "```json\n{\"approval_notes\": \"ok\"}\n```");
        assertEquals("ok", args.get("approval_notes").asText());
    }

    @Test
    void stripsInvisibleCharactersAtEdges() {
        ObjectNode args = parser.parse("finalize_plan", "\uFEFF{\"notes\": \"n\"}\u200B");
        assertEquals("n", args.get("notes").asText());
    }

    @Test
    void malformedOrNonObjectInputYieldsEmptyObject() {
        assertEquals(0, parser.parse("write_chunk", "{\"chunk_number\": ").size());
        assertEquals(0, parser.parse("write_chunk", "[1, 2]").size());
        assertEquals(0, parser.parse("write_chunk", "   ").size());
        assertEquals(0, parser.parse("write_chunk", null).size());
    }
}
