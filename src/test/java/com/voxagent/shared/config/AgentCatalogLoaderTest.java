package com.voxagent.shared.config;

import com.voxagent.shared.model.Agent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AgentCatalogLoaderTest {

    @TempDir
    Path tempDir;

    private static List<Agent> parse(String yaml) {
        Map<String, Object> raw = new Yaml().load(yaml);
        return AgentCatalogLoader.parse(raw);
    }

    @Test
    void loadsAgentsWithCapabilities() throws IOException {
        var file = tempDir.resolve("agents.yaml");
        Files.writeString(file, """
            agents:
              - id: concierge
                name: Concierge
                system_prompt: You help hotel guests.
                model_settings:
                  model_name: gpt-4o-mini
                  temperature: 0.3
                  max_tokens: 200
                capabilities:
                  rag:
                    enabled: true
                    top_k: 3
                  routing_keywords: [checkout, breakfast, " "]
              - id: weather
                name: Weather Bot
                capabilities:
                  weather:
                    enabled: true
                    units: imperial
                  web_search:
                    enabled: true
                    provider: tavily
                    max_results: 2
            """);
        var agents = AgentCatalogLoader.load(file);

        assertEquals(2, agents.size());
        var concierge = agents.get(0);
        assertEquals("gpt-4o-mini", concierge.modelSettings().model());
        assertEquals(0.3, concierge.modelSettings().temperature());
        assertEquals(200, concierge.modelSettings().maxTokens());
        assertTrue(concierge.capabilities().retrieval().enabled());
        assertEquals(3, concierge.capabilities().retrieval().topK());
        assertNull(concierge.capabilities().retrieval().collectionRef());
        assertEquals(Set.of("checkout", "breakfast"), concierge.capabilities().routingKeywords());
        assertFalse(concierge.capabilities().weather().enabled());

        var weather = agents.get(1);
        assertEquals("imperial", weather.capabilities().weather().units());
        assertEquals("tavily", weather.capabilities().webSearch().provider());
        assertEquals(2, weather.capabilities().webSearch().maxResults());
        assertEquals("", weather.systemPrompt());
    }

    @Test
    void skipsDuplicatesInactiveAndNameless() {
        var agents = parse("""
            agents:
              - id: a
                name: Alpha
              - id: a
                name: Alpha Again
              - id: b
                name: Beta
                active: false
              - id: c
              - name: Gamma
            """);
        assertEquals(List.of("a", "Gamma"), agents.stream().map(Agent::id).toList());
    }

    @Test
    void emptyCatalogueFallsBackToDefaultAgent() {
        assertEquals(List.of(Agent.defaultAgent()), parse("agents: []"));
        assertEquals(List.of(Agent.defaultAgent()), AgentCatalogLoader.parse(null));
    }

    @Test
    void missingFileFallsBackToDefaultAgent() {
        assertEquals(List.of(Agent.defaultAgent()), AgentCatalogLoader.load(tempDir.resolve("none.yaml")));
    }
}
