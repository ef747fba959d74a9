package com.novelforge.providers.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.ConfigurationException;
import com.novelforge.settings.ApiSettings;
import com.novelforge.settings.ModelCatalog;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Factory for creating and caching model provider instances.
 */
public class ChatProviderFactory {

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final Function<String, String> environment;
    private final Map<String, ModelProvider> providerCache = new ConcurrentHashMap<>();

    public ChatProviderFactory(ObjectMapper mapper) {
        this(mapper, System::getenv);
    }

    public ChatProviderFactory(ObjectMapper mapper, Function<String, String> environment) {
        this.mapper = mapper;
        this.environment = environment;
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    /**
     * Get the provider serving the configured model.
     * Providers are cached per provider, key and base URL.
     *
     * @throws ConfigurationException if the provider is unknown or no API key is available
     */
    public ModelProvider getProvider(ApiSettings api) {
        String providerName = ModelCatalog.providerFor(api.getModelId());
        String apiKey = resolveApiKey(providerName, api.getApiKey());
        String cacheKey = providerName + "|" + apiKey.hashCode() + "|" + api.getBaseUrl() + "|" + api.getTimeoutSeconds();
        return providerCache.computeIfAbsent(cacheKey, key -> createProvider(providerName, apiKey, api));
    }

    public String resolveApiKey(String providerName, String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        String variable = apiKeyVariable(providerName);
        String fromEnv = environment.apply(variable);
        if (fromEnv == null || fromEnv.isBlank()) {
            throw new ConfigurationException("No API key for " + providerName + ": set " + variable
                + " or api.apiKey in the project config");
        }
        return fromEnv.trim();
    }

    static String apiKeyVariable(String providerName) {
        switch (providerName) {
            case "moonshot":
                return "MOONSHOT_API_KEY";
            case "deepinfra":
                return "DEEPINFRA_API_KEY";
            default:
                throw new ConfigurationException("Unknown provider: " + providerName);
        }
    }

    private ModelProvider createProvider(String providerName, String apiKey, ApiSettings api) {
        switch (providerName) {
            case "moonshot":
            case "deepinfra":
                return new OpenAiCompatibleChatProvider(mapper, httpClient, providerName, apiKey,
                    api.getBaseUrl(), api.getTimeoutSeconds());
            default:
                throw new ConfigurationException("Unknown provider: " + providerName);
        }
    }
}
