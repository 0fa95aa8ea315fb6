package com.voxagent.shared.config;

import java.util.List;
import java.util.Map;

public record VoxAgentConfig(
    int serverPort,
    String primaryProvider,
    List<String> fallbackProviders,
    Map<String, String> apiKeys,
    String agentsFile,
    ToolsConfig tools,
    DispatchConfig dispatch,
    RetrievalConfig retrieval
) {
    public String apiKey(String name) {
        return apiKeys.getOrDefault(name, "");
    }
}
