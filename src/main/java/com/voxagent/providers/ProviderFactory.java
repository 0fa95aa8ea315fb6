package com.voxagent.providers;

import com.voxagent.shared.config.VoxAgentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;

public final class ProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    private ProviderFactory() {}

    /** Primary first, then configured fallbacks, wrapped for retry and failover. */
    public static ModelProvider fromConfig(VoxAgentConfig config) {
        var ids = new LinkedHashSet<String>();
        ids.add(config.primaryProvider());
        ids.addAll(config.fallbackProviders());

        var chain = new ArrayList<ModelProvider>();
        for (var id : ids) {
            var provider = create(id, config.apiKey(id));
            if (provider == null) {
                log.warn("Unknown model provider '{}', skipped", id);
                continue;
            }
            chain.add(provider);
        }
        if (chain.isEmpty()) {
            throw new IllegalStateException("No usable model provider in " + ids);
        }
        log.info("Model providers: {}", chain.stream().map(ModelProvider::id).toList());
        return new ReliableProvider(chain);
    }

    static ModelProvider create(String id, String apiKey) {
        return switch (id) {
            case "openai" -> new OpenAiProvider(apiKey);
            case "groq" -> new GroqProvider(apiKey);
            case "openrouter" -> new OpenRouterProvider(apiKey);
            default -> null;
        };
    }
}
