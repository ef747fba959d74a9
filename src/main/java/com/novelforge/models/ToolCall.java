package com.novelforge.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A tool invocation requested by the model, in the single canonical shape used by
 * history, checkpoints and the dispatcher.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolCall {
    private String id;
    private String functionName;
    private String argumentsJson;

    public ToolCall() {
    }

    public ToolCall(String id, String functionName, String argumentsJson) {
        this.id = id;
        this.functionName = functionName;
        this.argumentsJson = argumentsJson;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getFunctionName() {
        return functionName;
    }

    public void setFunctionName(String functionName) {
        this.functionName = functionName;
    }

    public String getArgumentsJson() {
        return argumentsJson;
    }

    public void setArgumentsJson(String argumentsJson) {
        this.argumentsJson = argumentsJson;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolCall)) return false;
        ToolCall other = (ToolCall) o;
        return Objects.equals(id, other.id)
            && Objects.equals(functionName, other.functionName)
            && Objects.equals(argumentsJson, other.argumentsJson);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, functionName, argumentsJson);
    }

    @Override
    public String toString() {
        return "ToolCall{" + id + ", " + functionName + "}";
    }
}
