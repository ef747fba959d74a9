package com.novelforge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Name, description and argument contract of one tool.
 */
public class ToolSchema {
    private final String name;
    private final String description;
    private final Map<String, ToolArgSpec> args = new LinkedHashMap<>();
    // Alias -> canonical arg name
    private final Map<String, String> argAliases = new HashMap<>();

    public ToolSchema(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public ToolSchema arg(String argName, ToolArgSpec.Type type, boolean required, String argDescription) {
        args.put(argName, new ToolArgSpec(argName, type, required, argDescription));
        return this;
    }

    public ToolSchema arg(String argName, ToolArgSpec.Type type, boolean required, String argDescription,
                          Set<String> allowedValues) {
        args.put(argName, new ToolArgSpec(argName, type, required, argDescription, allowedValues));
        return this;
    }

    public ToolSchema alias(String alias, String canonical) {
        if (alias == null || alias.isBlank() || canonical == null || canonical.isBlank()) {
            return this;
        }
        argAliases.put(normalizeArgKey(alias), canonical);
        return this;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, ToolArgSpec> getArgSpecs() {
        return Collections.unmodifiableMap(args);
    }

    /**
     * OpenAI-style function definition: {"type":"function","function":{name, description, parameters}}.
     */
    public ObjectNode toFunctionDefinition(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "function");
        ObjectNode function = root.putObject("function");
        function.put("name", name);
        function.put("description", description);
        ObjectNode parameters = function.putObject("parameters");
        parameters.put("type", "object");
        ObjectNode properties = parameters.putObject("properties");
        List<String> required = new ArrayList<>();
        for (ToolArgSpec spec : args.values()) {
            properties.set(spec.getName(), spec.toJsonSchema(mapper));
            if (spec.isRequired()) {
                required.add(spec.getName());
            }
        }
        required.forEach(parameters.putArray("required")::add);
        return root;
    }

    /**
     * Trim stray whitespace around keys and map separators/aliases onto canonical names.
     * Returns a copy; the input tree is left untouched.
     */
    public JsonNode normalizeArgsNode(JsonNode argsNode) {
        if (argsNode == null || !argsNode.isObject()) {
            return argsNode;
        }
        ObjectNode obj = ((ObjectNode) argsNode).deepCopy();
        List<String> keys = new ArrayList<>();
        Iterator<String> it = obj.fieldNames();
        while (it.hasNext()) {
            keys.add(it.next());
        }
        for (String key : keys) {
            if (args.containsKey(key)) continue;
            String norm = normalizeArgKey(key);
            String canonical = args.containsKey(norm) ? norm : argAliases.get(norm);
            if (canonical == null) continue;
            if (!obj.has(canonical)) {
                obj.set(canonical, obj.get(key));
            }
            obj.remove(key);
        }
        return obj;
    }

    private String normalizeArgKey(String key) {
        if (key == null) return "";
        return key.trim().toLowerCase().replace('-', '_').replace(' ', '_');
    }

    /**
     * Returns null when the arguments satisfy the schema, otherwise an error code such as
     * {@code missing-required:content} or {@code unknown-arg:foo}.
     */
    public String validate(JsonNode argsNode) {
        JsonNode normalized = normalizeArgsNode(argsNode);
        if (normalized == null || !normalized.isObject()) {
            return "args-not-object";
        }
        for (ToolArgSpec spec : args.values()) {
            String error = spec.validate(normalized.get(spec.getName()));
            if (error != null) {
                return error;
            }
        }
        Iterator<String> fields = normalized.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!args.containsKey(field)) {
                return "unknown-arg:" + field;
            }
        }
        return null;
    }
}
