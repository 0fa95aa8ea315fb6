package com.voxagent.tools;

import com.voxagent.memory.DocumentStore;
import com.voxagent.memory.Passage;
import com.voxagent.shared.config.ToolsConfig;
import com.voxagent.shared.model.Capabilities;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultToolClientsTest {

    private final DocumentStore store = new DocumentStore() {
        @Override public void add(String collection, String source, String content) {}
        @Override public boolean hasCollection(String collection) { return false; }
        @Override public List<Passage> search(String c, String q, float[] v, int k) { return List.of(); }
    };

    private final DefaultToolClients clients =
            new DefaultToolClients(ToolsConfig.defaults(), Map.of(), store, q -> null, 10);

    @Test
    void unsupportedSearchProviderYieldsErrorTool() {
        var tool = clients.webSearch(new Capabilities.WebSearchCapability(true, "altavista", 3));
        var result = tool.search("anything");
        assertTrue(result.isError());
        assertEquals("Unsupported search provider: altavista", result.output());
    }

    @Test
    void knownProvidersBuildWebSearchTools() {
        for (var name : List.of("duckduckgo", "brave", "tavily")) {
            var tool = clients.webSearch(new Capabilities.WebSearchCapability(true, name, 3));
            assertInstanceOf(WebSearchTool.class, tool);
            assertEquals(name, ((WebSearchTool) tool).providerName());
        }
    }

    @Test
    void toolsAreReusedForTheSameCapability() {
        var cap = new Capabilities.WeatherCapability(true, "metric");
        assertSame(clients.weather(cap), clients.weather(cap));
    }

    @Test
    void retrievalUsesDefaultCollectionWhenUnset() {
        var tool = (RetrievalTool) clients.retrieval("front-desk", new Capabilities.RetrievalCapability(true, null, 5));
        assertEquals("agent_front_desk_docs", tool.collection());

        var named = (RetrievalTool) clients.retrieval("front-desk", new Capabilities.RetrievalCapability(true, "hotel", 5));
        assertEquals("hotel", named.collection());
    }

    @Test
    void weatherWithoutKeyReportsIt() {
        var result = clients.weather(new Capabilities.WeatherCapability(true, "metric")).search("weather in Rome");
        assertTrue(result.isError());
    }
}
