package com.novelforge.stream;

/**
 * Partial tool call carried by one stream event. Fragments sharing an index belong to
 * the same call.
 */
public class ToolCallDelta {
    private final int index;
    private final String id;
    private final String name;
    private final String argumentsFragment;

    public ToolCallDelta(int index, String id, String name, String argumentsFragment) {
        this.index = index;
        this.id = id;
        this.name = name;
        this.argumentsFragment = argumentsFragment;
    }

    public int getIndex() {
        return index;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getArgumentsFragment() {
        return argumentsFragment;
    }
}
