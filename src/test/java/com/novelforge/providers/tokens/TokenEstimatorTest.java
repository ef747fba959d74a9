package com.novelforge.providers.tokens;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.models.Message;
import com.novelforge.models.ToolCall;
import com.novelforge.providers.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenEstimatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private StubHttpServer server;

    private final List<Message> messages = List.of(
        Message.system("12345678"),
        Message.assistant("abcd", "efgh", List.of(new ToolCall("c", "tool", "{\"a\":1}")))
    );

    @BeforeEach
    void setUp() throws Exception {
        server = new StubHttpServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void characterEstimateCountsContentReasoningAndToolCalls() {
        // 8 + 4 + 4 + 4 + 7 = 27 chars
        assertEquals(6, new CharacterTokenEstimator().estimateTokens("m", messages));
        assertEquals(0, new CharacterTokenEstimator().estimateTokens("m", List.of()));
    }

    @Test
    void moonshotEstimateReadsTotalTokens() throws Exception {
        server.respond(200, "application/json", "{\"data\":{\"total_tokens\":4242}}");
        MoonshotTokenEstimator estimator = new MoonshotTokenEstimator(mapper, HttpClient.newHttpClient(),
            server.baseUrl(), "sk-test");

        assertEquals(4242, estimator.estimateTokens("kimi-k2-thinking", messages));

        StubHttpServer.Recorded sent = server.requests().get(0);
        assertEquals("/v1/tokenizers/estimate-token-count", sent.path);
        JsonNode payload = mapper.readTree(sent.body);
        assertEquals("kimi-k2-thinking", payload.get("model").asText());
        assertEquals(2, payload.get("messages").size());
    }

    @Test
    void moonshotEstimateFallsBackToCharacterCount() {
        server.respond(500, "application/json", "{\"error\":\"down\"}");
        MoonshotTokenEstimator estimator = new MoonshotTokenEstimator(mapper, HttpClient.newHttpClient(),
            server.baseUrl(), "sk-test");

        assertEquals(6, estimator.estimateTokens("kimi-k2-thinking", messages));
    }
}
