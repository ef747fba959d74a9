package com.novelforge.stream;

import com.novelforge.models.Message;
import com.novelforge.models.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamAssemblerTest {

    @Test
    void concatenatesArgumentFragmentsPerIndex() throws Exception {
        List<StreamEvent> events = List.of(
            StreamEvent.toolCall(0, "call_1", "write_chunk", "{\"chunk_num"),
            StreamEvent.toolCall(0, null, null, "ber\": 1, \"content\": \"It was"),
            StreamEvent.toolCall(0, "", "", " dark.\"}")
        );

        Message message = new StreamAssembler().assemble(ModelStream.of(events));

        assertEquals(Message.ASSISTANT, message.getRole());
        assertNull(message.getContent());
        assertEquals(1, message.getToolCalls().size());
        ToolCall call = message.getToolCalls().get(0);
        assertEquals("call_1", call.getId());
        assertEquals("write_chunk", call.getFunctionName());
        assertEquals("{\"chunk_number\": 1, \"content\": \"It was dark.\"}", call.getArgumentsJson());
    }

    @Test
    void keepsIndexOrderForInterleavedCalls() throws Exception {
        List<StreamEvent> events = List.of(
            StreamEvent.toolCall(1, "call_b", "create_plot_outline", "{\"outline\":"),
            StreamEvent.toolCall(0, "call_a", "create_story_summary", "{\"summary\":"),
            StreamEvent.toolCall(1, null, null, "\"x\"}"),
            StreamEvent.toolCall(0, null, null, "\"y\"}")
        );

        Message message = new StreamAssembler().assemble(ModelStream.of(events));

        assertEquals("call_a", message.getToolCalls().get(0).getId());
        assertEquals("{\"summary\":\"y\"}", message.getToolCalls().get(0).getArgumentsJson());
        assertEquals("call_b", message.getToolCalls().get(1).getId());
        assertEquals("{\"outline\":\"x\"}", message.getToolCalls().get(1).getArgumentsJson());
    }

    @Test
    void synthesizesIdsWhenProviderOmitsThem() throws Exception {
        List<StreamEvent> events = List.of(
            StreamEvent.toolCall(0, null, "load_approved_plan", "{}"),
            StreamEvent.toolCall(1, null, "get_chunk_context", "{\"chunk_number\":2}")
        );

        Message message = new StreamAssembler().assemble(ModelStream.of(events));

        String first = message.getToolCalls().get(0).getId();
        String second = message.getToolCalls().get(1).getId();
        assertTrue(first.startsWith("call_") && first.endsWith("_0"), first);
        assertTrue(second.endsWith("_1"), second);
        assertNotEquals(first, second);
    }

    @Test
    void separatesReasoningFromContentAndNotifiesListener() throws Exception {
        List<String> seen = new ArrayList<>();
        StreamAssembler assembler = new StreamAssembler((text, reasoning) -> seen.add((reasoning ? "r:" : "c:") + text));
        List<StreamEvent> events = List.of(
            StreamEvent.reasoning("Let me "),
            StreamEvent.reasoning("think."),
            StreamEvent.content("Planning "),
            StreamEvent.content("now.")
        );

        Message message = assembler.assemble(ModelStream.of(events));

        assertEquals("Let me think.", message.getReasoning());
        assertEquals("Planning now.", message.getContent());
        assertFalse(message.hasToolCalls());
        assertEquals(List.of("r:Let me ", "r:think.", "c:Planning ", "c:now."), seen);
    }

    @Test
    void emptyStreamGivesEmptyAssistantMessage() throws Exception {
        Message message = new StreamAssembler().assemble(ModelStream.of(List.of()));
        assertNull(message.getContent());
        assertNull(message.getReasoning());
        assertFalse(message.hasToolCalls());
    }
}
