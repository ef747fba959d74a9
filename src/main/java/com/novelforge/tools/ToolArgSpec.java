package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public class ToolArgSpec {
    public enum Type {
        STRING("string"),
        INT("integer"),
        BOOLEAN("boolean"),
        STRING_ARRAY("array");

        private final String jsonType;

        Type(String jsonType) {
            this.jsonType = jsonType;
        }

        public String getJsonType() {
            return jsonType;
        }
    }

    private final String name;
    private final Type type;
    private final boolean required;
    private final String description;
    private final Set<String> allowedValues;

    public ToolArgSpec(String name, Type type, boolean required, String description) {
        this(name, type, required, description, null);
    }

    public ToolArgSpec(String name, Type type, boolean required, String description, Set<String> allowedValues) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.description = description;
        this.allowedValues = allowedValues == null ? null : new LinkedHashSet<>(allowedValues);
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDescription() {
        return description;
    }

    public Set<String> getAllowedValues() {
        return allowedValues == null ? Set.of() : Collections.unmodifiableSet(allowedValues);
    }

    /**
     * JSON-schema fragment advertised to the model for this argument.
     */
    public ObjectNode toJsonSchema(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", type.getJsonType());
        if (type == Type.STRING_ARRAY) {
            node.putObject("items").put("type", "string");
        }
        if (description != null && !description.isBlank()) {
            node.put("description", description);
        }
        if (allowedValues != null && !allowedValues.isEmpty()) {
            allowedValues.forEach(node.putArray("enum")::add);
        }
        return node;
    }

    public String validate(JsonNode node) {
        if (node == null || node.isNull()) {
            return required ? "missing-required:" + name : null;
        }
        switch (type) {
            case STRING:
                if (!node.isTextual()) {
                    return "invalid-type:" + name;
                }
                if (required && node.asText().isBlank()) {
                    return "missing-required:" + name;
                }
                if (allowedValues != null && !allowedValues.isEmpty() && !allowedValues.contains(node.asText())) {
                    return "invalid-enum:" + name;
                }
                return null;
            case INT:
                return node.isIntegralNumber() && node.canConvertToInt() ? null : "invalid-type:" + name;
            case BOOLEAN:
                return node.isBoolean() ? null : "invalid-type:" + name;
            case STRING_ARRAY:
                if (!node.isArray()) {
                    return "invalid-type:" + name;
                }
                for (JsonNode child : node) {
                    if (!child.isTextual()) {
                        return "invalid-type:" + name;
                    }
                }
                return null;
            default:
                return "invalid-type:" + name;
        }
    }
}
