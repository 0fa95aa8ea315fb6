package com.voxagent.shared.config;

import com.voxagent.shared.model.Agent;
import com.voxagent.shared.model.Capabilities;
import com.voxagent.shared.model.ModelSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the agent catalogue from YAML into typed {@link Agent} records.
 *
 * <p>Unknown capability keys are logged rather than silently ignored so a typo such as
 * {@code web_serach} shows up in the startup log. An empty or missing catalogue yields
 * the single {@link Agent#defaultAgent() default agent}.
 */
public class AgentCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(AgentCatalogLoader.class);
    private static final Set<String> CAPABILITY_KEYS = Set.of(
            "web_search", "weather", "rag", "retrieval", "routing_keywords", "tools");

    public static List<Agent> load(Path path) {
        if (!Files.exists(path)) {
            log.warn("No agent catalogue at {}, using default agent", path);
            return List.of(Agent.defaultAgent());
        }
        try (var in = Files.newInputStream(path)) {
            Map<String, Object> raw = new Yaml().load(in);
            return parse(raw);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load agents: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    static List<Agent> parse(Map<String, Object> raw) {
        var entries = raw == null ? List.<Map<String, Object>>of()
                : (List<Map<String, Object>>) raw.getOrDefault("agents", List.of());
        var agents = new ArrayList<Agent>();
        var seenIds = new HashSet<String>();
        for (var entry : entries) {
            var name = string(entry, "name", null);
            if (name == null || name.isBlank()) {
                log.warn("Skipping agent without a name: {}", entry);
                continue;
            }
            var id = string(entry, "id", name);
            if (!seenIds.add(id)) {
                log.warn("Skipping duplicate agent id '{}'", id);
                continue;
            }
            if (Boolean.FALSE.equals(entry.get("active"))) continue;
            agents.add(new Agent(
                    id,
                    name,
                    string(entry, "description", null),
                    string(entry, "system_prompt", ""),
                    parseModelSettings((Map<String, Object>) entry.getOrDefault("model_settings", Map.of())),
                    parseCapabilities(name, (Map<String, Object>) entry.getOrDefault("capabilities", Map.of()))
            ));
        }
        if (agents.isEmpty()) {
            log.warn("Agent catalogue is empty, using default agent");
            return List.of(Agent.defaultAgent());
        }
        log.info("Loaded {} agents: {}", agents.size(), agents.stream().map(Agent::name).toList());
        return List.copyOf(agents);
    }

    private static ModelSettings parseModelSettings(Map<String, Object> raw) {
        var def = ModelSettings.defaults();
        return new ModelSettings(
                string(raw, "model_name", string(raw, "model", def.model())),
                Double.parseDouble(String.valueOf(raw.getOrDefault("temperature", def.temperature()))),
                integer(raw, "max_tokens", def.maxTokens())
        );
    }

    @SuppressWarnings("unchecked")
    private static Capabilities parseCapabilities(String agentName, Map<String, Object> raw) {
        for (var key : raw.keySet()) {
            if (!CAPABILITY_KEYS.contains(key)) {
                log.warn("Agent '{}' has unknown capability key '{}'", agentName, key);
            }
        }
        var search = (Map<String, Object>) raw.getOrDefault("web_search", Map.of());
        var weather = (Map<String, Object>) raw.getOrDefault("weather", Map.of());
        var retrieval = (Map<String, Object>) raw.getOrDefault("retrieval",
                raw.getOrDefault("rag", Map.of()));

        var searchDef = Capabilities.WebSearchCapability.disabled();
        var weatherDef = Capabilities.WeatherCapability.disabled();
        var retrievalDef = Capabilities.RetrievalCapability.disabled();

        var keywords = new LinkedHashSet<String>();
        for (var kw : (List<Object>) raw.getOrDefault("routing_keywords", List.of())) {
            var s = String.valueOf(kw).strip();
            if (!s.isEmpty()) keywords.add(s);
        }

        return new Capabilities(
                new Capabilities.WebSearchCapability(
                        Boolean.TRUE.equals(search.get("enabled")),
                        string(search, "provider", searchDef.provider()),
                        integer(search, "max_results", searchDef.maxResults())),
                new Capabilities.WeatherCapability(
                        Boolean.TRUE.equals(weather.get("enabled")),
                        string(weather, "units", weatherDef.units())),
                new Capabilities.RetrievalCapability(
                        Boolean.TRUE.equals(retrieval.get("enabled")),
                        string(retrieval, "collection_name", retrievalDef.collectionRef()),
                        integer(retrieval, "top_k", retrievalDef.topK())),
                keywords
        );
    }

    private static String string(Map<String, Object> raw, String key, String fallback) {
        var v = raw.get(key);
        return v != null ? String.valueOf(v) : fallback;
    }

    private static int integer(Map<String, Object> raw, String key, int fallback) {
        return Integer.parseInt(String.valueOf(raw.getOrDefault(key, fallback)));
    }
}
