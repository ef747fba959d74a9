package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static com.novelforge.tools.ToolArgSpec.Type.INT;
import static com.novelforge.tools.ToolArgSpec.Type.STRING;
import static org.junit.jupiter.api.Assertions.*;

class ToolSchemaTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ToolSchema schema() {
        return new ToolSchema("write_chunk", "Saves a chunk")
            .arg("chunk_number", INT, true, "Chunk number")
            .arg("content", STRING, true, "Prose")
            .alias("text", "content");
    }

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }

    @Test
    void acceptsCompleteArguments() throws Exception {
        assertNull(schema().validate(json("{\"chunk_number\": 1, \"content\": \"It began.\"}")));
    }

    @Test
    void reportsMissingWrongTypeAndUnknownArguments() throws Exception {
        assertEquals("missing-required:content", schema().validate(json("{\"chunk_number\": 1}")));
        assertEquals("missing-required:content", schema().validate(json("{\"chunk_number\": 1, \"content\": \"  \"}")));
        assertEquals("invalid-type:chunk_number", schema().validate(json("{\"chunk_number\": \"one\", \"content\": \"x\"}")));
        assertEquals("unknown-arg:mood", schema().validate(json("{\"chunk_number\": 1, \"content\": \"x\", \"mood\": \"dark\"}")));
        assertEquals("args-not-object", schema().validate(json("[]")));
    }

    @Test
    void normalizesAliasesAndKeySpelling() throws Exception {
        JsonNode args = json("{\"Chunk-Number\": 3, \"text\": \"prose\"}");

        JsonNode normalized = schema().normalizeArgsNode(args);

        assertEquals(3, normalized.get("chunk_number").asInt());
        assertEquals("prose", normalized.get("content").asText());
        assertFalse(normalized.has("text"));
        assertTrue(args.has("text"));
        assertNull(schema().validate(args));
    }

    @Test
    void rendersFunctionDefinition() {
        ArrayNode definitions = new ToolRegistry()
            .register(schema(), (args, ctx) -> ToolResult.success("ok"))
            .toDefinitions(mapper);

        ObjectNode function = (ObjectNode) definitions.get(0).get("function");
        assertEquals("function", definitions.get(0).get("type").asText());
        assertEquals("write_chunk", function.get("name").asText());
        assertEquals("integer", function.at("/parameters/properties/chunk_number/type").asText());
        assertEquals(2, function.at("/parameters/required").size());
    }
}
