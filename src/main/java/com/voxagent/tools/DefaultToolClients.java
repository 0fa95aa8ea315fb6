package com.voxagent.tools;

import com.voxagent.memory.DocumentStore;
import com.voxagent.memory.Embedder;
import com.voxagent.memory.EmbeddingCache;
import com.voxagent.shared.config.ToolsConfig;
import com.voxagent.shared.model.Capabilities;
import com.voxagent.tools.search.BraveSearchProvider;
import com.voxagent.tools.search.DuckDuckGoSearchProvider;
import com.voxagent.tools.search.SearchProvider;
import com.voxagent.tools.search.TavilySearchProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds tools lazily from agent capabilities and reuses them for the life of the
 * session. Owns the session's embedding cache.
 */
public class DefaultToolClients implements ToolClients {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolClients.class);

    private final ToolsConfig config;
    private final Map<String, String> apiKeys;
    private final DocumentStore store;
    private final EmbeddingCache embeddings;
    private final HttpClient httpClient;
    private final Map<Object, Tool> tools = new ConcurrentHashMap<>();

    public DefaultToolClients(ToolsConfig config, Map<String, String> apiKeys,
                              DocumentStore store, Embedder embedder, int embeddingCacheSize) {
        this.config = config;
        this.apiKeys = apiKeys == null ? Map.of() : apiKeys;
        this.store = store;
        this.embeddings = new EmbeddingCache(embedder, embeddingCacheSize);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public Tool retrieval(String agentId, Capabilities.RetrievalCapability capability) {
        var collection = capability.collectionRef() == null || capability.collectionRef().isBlank()
                ? RetrievalTool.defaultCollection(agentId)
                : capability.collectionRef();
        return tools.computeIfAbsent(Map.entry(ToolKind.RETRIEVAL, collection + "#" + capability.topK()),
                k -> new RetrievalTool(store, embeddings, collection, capability.topK()));
    }

    @Override
    public Tool weather(Capabilities.WeatherCapability capability) {
        return tools.computeIfAbsent(capability, k -> new WeatherTool(
                apiKeys.get("openweathermap"),
                config.weather().baseUrl(),
                capability.units(),
                Duration.ofSeconds(config.weather().timeoutSeconds()),
                httpClient));
    }

    @Override
    public Tool webSearch(Capabilities.WebSearchCapability capability) {
        return tools.computeIfAbsent(capability, k -> {
            var providerName = capability.provider() == null || capability.provider().isBlank()
                    ? config.webSearch().defaultProvider()
                    : capability.provider();
            var provider = searchProvider(providerName.toLowerCase(Locale.ROOT));
            if (provider == null) {
                log.warn("Unsupported search provider: {}", providerName);
                return q -> ToolResult.error("Unsupported search provider: " + providerName);
            }
            return new WebSearchTool(provider, capability.maxResults());
        });
    }


    private SearchProvider searchProvider(String name) {
        var timeout = Duration.ofSeconds(config.webSearch().timeoutSeconds());
        return switch (name) {
            case "duckduckgo" -> new DuckDuckGoSearchProvider(httpClient, timeout);
            case "brave" -> new BraveSearchProvider(httpClient, apiKeys.get("brave"), timeout);
            case "tavily" -> new TavilySearchProvider(httpClient, apiKeys.get("tavily"), timeout);
            default -> null;
        };
    }
}
