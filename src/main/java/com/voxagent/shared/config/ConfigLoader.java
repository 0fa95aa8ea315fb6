package com.voxagent.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    static final Path HOME = Path.of(System.getProperty("user.home"), ".voxagent");
    private static final Path DEFAULT_PATH = HOME.resolve("config.yaml");

    // api-keys entry -> environment variable that overrides it
    private static final Map<String, String> KEY_ENV = Map.of(
        "openai", "OPENAI_API_KEY",
        "groq", "GROQ_API_KEY",
        "openrouter", "OPENROUTER_API_KEY",
        "openweathermap", "OPENWEATHERMAP_API_KEY",
        "brave", "BRAVE_API_KEY",
        "tavily", "TAVILY_API_KEY"
    );

    public static VoxAgentConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static VoxAgentConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var providers = (Map<String, Object>) raw.getOrDefault("providers", Map.of());
        var keys = (Map<String, Object>) raw.getOrDefault("api-keys", Map.of());
        var tools = (Map<String, Object>) raw.getOrDefault("tools", Map.of());
        var dispatch = (Map<String, Object>) raw.getOrDefault("dispatch", Map.of());
        var retrieval = (Map<String, Object>) raw.getOrDefault("retrieval", Map.of());

        var apiKeys = new HashMap<String, String>();
        keys.forEach((k, v) -> apiKeys.put(k, String.valueOf(v)));
        KEY_ENV.forEach((name, env) -> {
            var val = System.getenv(env);
            if (val != null && !val.isBlank()) apiKeys.put(name, val);
        });

        return new VoxAgentConfig(
            Integer.parseInt(envOrDefault("VOXAGENT_PORT",
                String.valueOf(server.getOrDefault("port", 18790)))),
            String.valueOf(providers.getOrDefault("primary", "openai")),
            (List<String>) providers.getOrDefault("fallback", List.of()),
            Map.copyOf(apiKeys),
            envOrDefault("VOXAGENT_AGENTS_FILE",
                String.valueOf(raw.getOrDefault("agents-file", HOME.resolve("agents.yaml").toString()))),
            parseToolsConfig(tools),
            parseDispatchConfig(dispatch),
            parseRetrievalConfig(retrieval)
        );
    }

    @SuppressWarnings("unchecked")
    private static ToolsConfig parseToolsConfig(Map<String, Object> tools) {
        var search = (Map<String, Object>) tools.getOrDefault("web-search", Map.of());
        var weather = (Map<String, Object>) tools.getOrDefault("weather", Map.of());

        var def = ToolsConfig.defaults();
        var searchDef = def.webSearch();
        var weatherDef = def.weather();

        return new ToolsConfig(
            intValue(tools, "timeout", def.timeoutSeconds()),
            new ToolsConfig.WebSearchConfig(
                String.valueOf(search.getOrDefault("provider", searchDef.defaultProvider())),
                intValue(search, "max-context-chars", searchDef.maxContextChars()),
                intValue(search, "timeout", searchDef.timeoutSeconds())
            ),
            new ToolsConfig.WeatherConfig(
                String.valueOf(weather.getOrDefault("base-url", weatherDef.baseUrl())),
                intValue(weather, "timeout", weatherDef.timeoutSeconds())
            )
        );
    }

    private static DispatchConfig parseDispatchConfig(Map<String, Object> dispatch) {
        var def = DispatchConfig.defaults();
        return new DispatchConfig(
            Math.max(1, intValue(dispatch, "max-parallel-tasks", def.maxParallelTasks())),
            Math.max(1, intValue(dispatch, "worker-threads", def.workerThreads())),
            Math.max(0, intValue(dispatch, "history-limit", def.historyLimit()))
        );
    }

    private static RetrievalConfig parseRetrievalConfig(Map<String, Object> retrieval) {
        var def = RetrievalConfig.defaults();
        return new RetrievalConfig(
            String.valueOf(retrieval.getOrDefault("index-path", def.indexPath())),
            String.valueOf(retrieval.getOrDefault("embedding-base-url", def.embeddingBaseUrl())),
            String.valueOf(retrieval.getOrDefault("embedding-model", def.embeddingModel())),
            intValue(retrieval, "embedding-cache-size", def.embeddingCacheSize())
        );
    }

    private static int intValue(Map<String, Object> section, String key, int fallback) {
        return Integer.parseInt(String.valueOf(section.getOrDefault(key, fallback)));
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
