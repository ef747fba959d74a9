package com.novelforge.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.novelforge.stream.ModelStream;

import java.io.IOException;
import java.net.http.HttpClient;

/**
 * OpenAI-compatible chat provider.
 * Handles: moonshot (Kimi, keeps reasoning_content in history), deepinfra (strips it)
 */
public class OpenAiCompatibleChatProvider extends AbstractChatProvider {

    private final String providerName;
    private final String apiKey;
    private final String baseUrl;
    private final Integer timeoutSeconds;
    private final MessageCodec codec;

    public OpenAiCompatibleChatProvider(ObjectMapper mapper, HttpClient httpClient, String providerName,
                                        String apiKey, String baseUrl, Integer timeoutSeconds) {
        super(mapper, httpClient);
        this.providerName = providerName;
        this.apiKey = apiKey;
        this.baseUrl = normalizeBaseUrl(baseUrl, defaultBaseUrl(providerName));
        this.timeoutSeconds = timeoutSeconds;
        this.codec = new MessageCodec(mapper, "moonshot".equals(providerName));
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public ModelStream openStream(ModelRequest request) throws IOException, InterruptedException {
        ObjectNode payload = buildPayload(request, true);
        return openSse(baseUrl + "/chat/completions", payload, bearer(), timeoutSeconds);
    }

    @Override
    public String complete(ModelRequest request) throws IOException, InterruptedException {
        JsonNode response = sendJsonPost(baseUrl + "/chat/completions", buildPayload(request, false), bearer(),
            timeoutSeconds);
        JsonNode choices = response.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode message = choices.get(0).path("message");
            String content = message.path("content").asText("");
            if (!content.isBlank()) {
                return content;
            }
        }
        throw new IOException("Empty completion from " + providerName);
    }

    ObjectNode buildPayload(ModelRequest request, boolean stream) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", request.getModel());
        payload.set("messages", codec.encode(request.getMessages()));
        if (request.getTools() != null && request.getTools().size() > 0) {
            payload.set("tools", request.getTools());
            payload.put("tool_choice", "auto");
        }
        if (request.getTemperature() != null) {
            payload.put("temperature", request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            payload.put("max_tokens", request.getMaxTokens());
        }
        payload.put("stream", stream);
        return payload;
    }

    private String bearer() {
        return apiKey == null || apiKey.isBlank() ? null : "Bearer " + apiKey;
    }

    static String defaultBaseUrl(String provider) {
        switch (provider) {
            case "deepinfra":
                return "https://api.deepinfra.com/v1/openai";
            case "moonshot":
            default:
                return "https://api.moonshot.ai/v1";
        }
    }
}
