package com.novelforge.providers.tokens;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.novelforge.AppLogger;
import com.novelforge.models.Message;
import com.novelforge.providers.chat.MessageCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Uses Moonshot's tokenizer endpoint; falls back to the character estimate when the
 * endpoint is unreachable or answers with something unexpected.
 */
public class MoonshotTokenEstimator implements TokenEstimator {

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final MessageCodec codec;
    private final TokenEstimator fallback = new CharacterTokenEstimator();
    private final AppLogger logger = AppLogger.get();

    public MoonshotTokenEstimator(ObjectMapper mapper, HttpClient httpClient, String baseUrl, String apiKey) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.codec = new MessageCodec(mapper, true);
    }

    @Override
    public int estimateTokens(String model, List<Message> messages) {
        try {
            return remoteEstimate(model, messages);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("[Tokens] Estimate interrupted, using character count");
        } catch (IOException | RuntimeException e) {
            logger.warn("[Tokens] Estimate failed, using character count: " + e.getMessage());
        }
        return fallback.estimateTokens(model, messages);
    }

    int remoteEstimate(String model, List<Message> messages) throws IOException, InterruptedException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);
        payload.set("messages", codec.encode(messages));
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/tokenizers/estimate-token-count"))
            .timeout(Duration.ofSeconds(30))
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + apiKey)
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)))
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Token estimate failed (" + response.statusCode() + ")");
        }
        JsonNode total = mapper.readTree(response.body()).path("data").path("total_tokens");
        if (!total.isNumber()) {
            throw new IOException("Token estimate response missing data.total_tokens");
        }
        return total.asInt();
    }
}
