package com.novelforge.settings;

import java.util.List;

/**
 * Models the engine knows how to drive, with the provider that serves each.
 */
public final class ModelCatalog {

    public static final String DEFAULT_MODEL_ID = "kimi-k2-thinking";

    private static final List<ModelInfo> MODELS = List.of(
        new ModelInfo("kimi-k2-thinking", "Kimi K2 Thinking", "moonshot", 262_144, true,
            "Moonshot reasoning model with interleaved thinking and tool use"),
        new ModelInfo("zai-org/GLM-4.6", "GLM 4.6", "deepinfra", 202_752, true,
            "Zhipu GLM 4.6 served by DeepInfra")
    );

    private ModelCatalog() {
    }

    public static List<ModelInfo> all() {
        return MODELS;
    }

    public static ModelInfo find(String modelId) {
        if (modelId == null) {
            return null;
        }
        for (ModelInfo model : MODELS) {
            if (model.getId().equals(modelId)) {
                return model;
            }
        }
        return null;
    }

    /**
     * Provider for a model id; unknown ids are treated as Moonshot-hosted.
     */
    public static String providerFor(String modelId) {
        ModelInfo info = find(modelId);
        return info != null ? info.getProvider() : "moonshot";
    }

    public static class ModelInfo {
        private final String id;
        private final String name;
        private final String provider;
        private final int contextWindow;
        private final boolean supportsReasoning;
        private final String description;

        public ModelInfo(String id, String name, String provider, int contextWindow,
                         boolean supportsReasoning, String description) {
            this.id = id;
            this.name = name;
            this.provider = provider;
            this.contextWindow = contextWindow;
            this.supportsReasoning = supportsReasoning;
            this.description = description;
        }

        public String getId() { return id; }
        public String getName() { return name; }
        public String getProvider() { return provider; }
        public int getContextWindow() { return contextWindow; }
        public boolean isSupportsReasoning() { return supportsReasoning; }
        public String getDescription() { return description; }
    }
}
