package com.novelforge.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.novelforge.models.Message;
import com.novelforge.models.ToolCall;
import com.novelforge.providers.StubHttpServer;
import com.novelforge.stream.StreamAssembler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleChatProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private StubHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubHttpServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private OpenAiCompatibleChatProvider provider(String name) {
        return new OpenAiCompatibleChatProvider(mapper, HttpClient.newHttpClient(), name, "sk-test",
            server.baseUrl() + "/", 10);
    }

    private ModelRequest request(ArrayNode tools) {
        return new ModelRequest("kimi-k2-thinking", List.of(
            Message.system("sys"),
            Message.assistant(null, "earlier thought", List.of(new ToolCall("c0", "create_project", "{}"))),
            Message.toolResult("c0", "create_project", "{\"success\":true}")
        ), tools, 1.0, null);
    }

    @Test
    void streamsServerSentEventsIntoAssistantMessage() throws Exception {
        server.respond(200, "text/event-stream",
            ": keep-alive\n\n"
                + "data: {\"choices\":[{\"delta\":{\"role\":\"assistant\",\"reasoning_content\":\"Plan first.\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":\"Starting.\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\",\"function\":{\"name\":\"create_project\",\"arguments\":\"{\\\"project_\"}}]}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"name\\\": \\\"Keeper\\\"}\"}}]}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}\n\n"
                + "data: [DONE]\n\n");
        ArrayNode tools = mapper.createArrayNode();
        tools.addObject().put("type", "function");

        Message reply = new StreamAssembler().assemble(provider("moonshot").openStream(request(tools)));

        assertEquals("Plan first.", reply.getReasoning());
        assertEquals("Starting.", reply.getContent());
        assertEquals("call_1", reply.getToolCalls().get(0).getId());
        assertEquals("{\"project_name\": \"Keeper\"}", reply.getToolCalls().get(0).getArgumentsJson());

        StubHttpServer.Recorded sent = server.requests().get(0);
        assertEquals("/v1/chat/completions", sent.path);
        assertEquals("Bearer sk-test", sent.authorization);
        JsonNode payload = mapper.readTree(sent.body);
        assertTrue(payload.get("stream").asBoolean());
        assertEquals("auto", payload.get("tool_choice").asText());
        assertFalse(payload.has("max_tokens"));
    }

    @Test
    void errorStatusBecomesIOExceptionWithBody() {
        server.respond(401, "application/json", "{\"error\":{\"message\":\"Invalid Authentication\"}}");

        IOException error = assertThrows(IOException.class,
            () -> provider("moonshot").openStream(request(null)));

        assertTrue(error.getMessage().startsWith("Chat request failed (401)"));
        assertTrue(error.getMessage().contains("Invalid Authentication"));
    }

    @Test
    void completeReturnsFirstChoiceContent() throws Exception {
        server.respond(200, "application/json",
            "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"A summary.\"}}]}");

        assertEquals("A summary.", provider("deepinfra").complete(request(null)));
        JsonNode payload = mapper.readTree(server.requests().get(0).body);
        assertFalse(payload.get("stream").asBoolean());
        assertFalse(payload.has("tools"));
    }

    @Test
    void emptyCompletionIsAnError() {
        server.respond(200, "application/json", "{\"choices\":[{\"message\":{\"content\":\"\"}}]}");
        assertThrows(IOException.class, () -> provider("deepinfra").complete(request(null)));
    }

    @Test
    void onlyMoonshotSendsReasoningBack() {
        ObjectNode moonshot = provider("moonshot").buildPayload(request(null), true);
        ObjectNode deepinfra = provider("deepinfra").buildPayload(request(null), true);

        assertEquals("earlier thought", moonshot.at("/messages/1/reasoning_content").asText());
        assertTrue(deepinfra.at("/messages/1/reasoning_content").isMissingNode());
    }

    @Test
    void baseUrlFallsBackPerProvider() {
        HttpClient client = HttpClient.newHttpClient();
        assertEquals("https://api.moonshot.ai/v1",
            new OpenAiCompatibleChatProvider(mapper, client, "moonshot", "k", null, null).getBaseUrl());
        assertEquals("https://api.deepinfra.com/v1/openai",
            new OpenAiCompatibleChatProvider(mapper, client, "deepinfra", "k", " ", null).getBaseUrl());
        assertEquals(server.baseUrl(), provider("moonshot").getBaseUrl());
    }

    @Test
    void stalledStreamTimesOutInsteadOfBlocking() throws Exception {
        server.respond(200, "text/event-stream",
                "data: {\"choices\":[{\"delta\":{\"content\":\"Once\"}}]}\n\n")
            .stallAfterBody(8000);
        OpenAiCompatibleChatProvider provider = new OpenAiCompatibleChatProvider(mapper, HttpClient.newHttpClient(),
            "moonshot", "sk-test", server.baseUrl(), 1);
        List<String> chunks = new ArrayList<>();

        long started = System.nanoTime();
        assertThrows(HttpTimeoutException.class,
            () -> new StreamAssembler((text, reasoning) -> chunks.add(text)).assemble(provider.openStream(request(null))));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertEquals(List.of("Once"), chunks);
        assertTrue(elapsedMillis < 5000, "blocked for " + elapsedMillis + " ms");
    }
}
