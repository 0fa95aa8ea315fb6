package com.voxagent.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWhenFileIsEmpty() throws IOException {
        var cfg = writeAndLoad("");
        assertEquals("openai", cfg.primaryProvider());
        assertTrue(cfg.fallbackProviders().isEmpty());
        assertEquals(10, cfg.tools().timeoutSeconds());
        assertEquals("duckduckgo", cfg.tools().webSearch().defaultProvider());
        assertEquals(800, cfg.tools().webSearch().maxContextChars());
        assertEquals(4, cfg.dispatch().maxParallelTasks());
        assertEquals(20, cfg.dispatch().historyLimit());
        assertEquals(100, cfg.retrieval().embeddingCacheSize());
    }

    @Test
    void missingFileGivesDefaults() {
        var cfg = ConfigLoader.load(tempDir.resolve("absent.yaml"));
        assertEquals(DispatchConfig.defaults(), cfg.dispatch());
        assertEquals(ToolsConfig.defaults(), cfg.tools());
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            providers:
              primary: groq
              fallback: [openai, openrouter]
            api-keys:
              openweathermap: owm-test-key
            agents-file: /etc/voxagent/agents.yaml
            tools:
              timeout: 5
              web-search:
                provider: brave
                max-context-chars: 400
              weather:
                base-url: http://localhost:9999
            dispatch:
              max-parallel-tasks: 2
              worker-threads: 16
              history-limit: 6
            retrieval:
              index-path: /tmp/idx
              embedding-cache-size: 10
            """;
        var cfg = writeAndLoad(yaml);
        assertEquals("groq", cfg.primaryProvider());
        assertEquals(List.of("openai", "openrouter"), cfg.fallbackProviders());
        assertEquals("owm-test-key", cfg.apiKey("openweathermap"));
        assertEquals("", cfg.apiKey("nobody"));
        assertEquals(5, cfg.tools().timeoutSeconds());
        assertEquals("brave", cfg.tools().webSearch().defaultProvider());
        assertEquals(400, cfg.tools().webSearch().maxContextChars());
        assertEquals("http://localhost:9999", cfg.tools().weather().baseUrl());
        assertEquals(new DispatchConfig(2, 16, 6), cfg.dispatch());
        assertEquals("/tmp/idx", cfg.retrieval().indexPath());
        assertEquals(10, cfg.retrieval().embeddingCacheSize());
    }

    @Test
    void dispatchBoundsAreClamped() throws IOException {
        var cfg = writeAndLoad("""
            dispatch:
              max-parallel-tasks: 0
              history-limit: -3
            """);
        assertEquals(1, cfg.dispatch().maxParallelTasks());
        assertEquals(0, cfg.dispatch().historyLimit());
    }

    private VoxAgentConfig writeAndLoad(String yaml) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file);
    }
}
