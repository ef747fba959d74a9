package com.novelforge.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Model endpoint and loop budget settings.
 * The API key is optional here; providers fall back to MOONSHOT_API_KEY / DEEPINFRA_API_KEY.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiSettings {
    private String modelId = "kimi-k2-thinking";
    private String apiKey;
    private String baseUrl;
    private int tokenLimit = 200_000;
    private int compressionThreshold = 180_000;
    private int maxIterations = 300;
    private double temperature = 1.0;
    private Integer maxOutputTokens;
    private int timeoutSeconds = 120;

    public String getModelId() {
        return modelId;
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getTokenLimit() {
        return tokenLimit;
    }

    public void setTokenLimit(int tokenLimit) {
        this.tokenLimit = tokenLimit;
    }

    public int getCompressionThreshold() {
        return compressionThreshold;
    }

    public void setCompressionThreshold(int compressionThreshold) {
        this.compressionThreshold = compressionThreshold;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public void setMaxOutputTokens(Integer maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
