package com.novelforge.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed set of tools one agent exposes, in advertisement order.
 */
public class ToolRegistry {

    public static final class RegisteredTool {
        private final ToolSchema schema;
        private final ToolHandler handler;

        RegisteredTool(ToolSchema schema, ToolHandler handler) {
            this.schema = schema;
            this.handler = handler;
        }

        public ToolSchema getSchema() {
            return schema;
        }

        public ToolHandler getHandler() {
            return handler;
        }
    }

    private final Map<String, RegisteredTool> tools = new LinkedHashMap<>();

    public ToolRegistry register(ToolSchema schema, ToolHandler handler) {
        if (schema != null && schema.getName() != null && handler != null) {
            tools.put(schema.getName(), new RegisteredTool(schema, handler));
        }
        return this;
    }

    public boolean hasTool(String name) {
        return name != null && tools.containsKey(name);
    }

    public RegisteredTool get(String name) {
        return name != null ? tools.get(name) : null;
    }

    public Set<String> getToolNames() {
        return Collections.unmodifiableSet(tools.keySet());
    }

    public ArrayNode toDefinitions(ObjectMapper mapper) {
        ArrayNode array = mapper.createArrayNode();
        for (RegisteredTool tool : tools.values()) {
            array.add(tool.getSchema().toFunctionDefinition(mapper));
        }
        return array;
    }
}
