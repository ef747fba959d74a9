package com.novelforge.providers.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.novelforge.models.Message;
import com.novelforge.models.ToolCall;

import java.util.List;

/**
 * Converts history messages to the OpenAI chat wire format.
 */
public class MessageCodec {

    private final ObjectMapper mapper;
    private final boolean includeReasoning;

    /**
     * @param includeReasoning send assistant reasoning back as {@code reasoning_content};
     *                         thinking models on Moonshot require it alongside tool calls
     */
    public MessageCodec(ObjectMapper mapper, boolean includeReasoning) {
        this.mapper = mapper;
        this.includeReasoning = includeReasoning;
    }

    public ArrayNode encode(List<Message> messages) {
        ArrayNode array = mapper.createArrayNode();
        for (Message message : messages) {
            array.add(encode(message));
        }
        return array;
    }

    public ObjectNode encode(Message message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("role", message.getRole());
        if (message.getContent() != null) {
            node.put("content", message.getContent());
        } else if (message.isRole(Message.ASSISTANT)) {
            node.put("content", "");
        } else {
            node.putNull("content");
        }
        if (includeReasoning && message.getReasoning() != null) {
            node.put("reasoning_content", message.getReasoning());
        }
        if (message.hasToolCalls()) {
            ArrayNode calls = node.putArray("tool_calls");
            for (ToolCall call : message.getToolCalls()) {
                ObjectNode c = calls.addObject();
                c.put("id", call.getId());
                c.put("type", "function");
                ObjectNode function = c.putObject("function");
                function.put("name", call.getFunctionName());
                function.put("arguments", call.getArgumentsJson() == null ? "{}" : call.getArgumentsJson());
            }
        }
        if (message.getToolCallId() != null) {
            node.put("tool_call_id", message.getToolCallId());
        }
        if (message.getToolName() != null) {
            node.put("name", message.getToolName());
        }
        return node;
    }
}
