package com.novelforge.providers.chat;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.novelforge.models.Message;

import java.util.List;

/**
 * One chat completion request, independent of the provider wire format.
 */
public class ModelRequest {
    private final String model;
    private final List<Message> messages;
    private final ArrayNode tools;
    private final Double temperature;
    private final Integer maxTokens;

    public ModelRequest(String model, List<Message> messages, ArrayNode tools, Double temperature, Integer maxTokens) {
        this.model = model;
        this.messages = List.copyOf(messages);
        this.tools = tools;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    public String getModel() {
        return model;
    }

    public List<Message> getMessages() {
        return messages;
    }

    public ArrayNode getTools() {
        return tools;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }
}
