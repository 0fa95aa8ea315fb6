package com.voxagent.shared.model;

public record ModelSettings(
    String model,
    double temperature,
    int maxTokens
) {
    public static ModelSettings defaults() {
        return new ModelSettings("gpt-4o-mini", 0.7, 1024);
    }
}
