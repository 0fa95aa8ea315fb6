package com.voxagent.providers;

import java.util.List;
import java.util.Map;

public record ChatRequest(
    String model,
    List<Map<String, Object>> messages,
    double temperature,
    Integer maxTokens
) {
    public ChatRequest(String model, List<Map<String, Object>> messages, double temperature) {
        this(model, messages, temperature, null);
    }

    public ChatRequest withModel(String other) {
        return new ChatRequest(other, messages, temperature, maxTokens);
    }
}
