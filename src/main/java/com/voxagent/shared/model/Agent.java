package com.voxagent.shared.model;

import java.util.Objects;

/**
 * A configured persona. Loaded once per session and never mutated afterwards.
 */
public record Agent(
    String id,
    String name,
    String description,
    String systemPrompt,
    ModelSettings modelSettings,
    Capabilities capabilities
) {
    public Agent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        systemPrompt = systemPrompt != null ? systemPrompt : "";
        modelSettings = modelSettings != null ? modelSettings : ModelSettings.defaults();
        capabilities = capabilities != null ? capabilities : Capabilities.none();
    }

    public Agent(String id, String name, String systemPrompt, Capabilities capabilities) {
        this(id, name, null, systemPrompt, null, capabilities);
    }

    public static Agent defaultAgent() {
        return new Agent("default", "Assistant", "You are a helpful AI assistant.", Capabilities.none());
    }
}
