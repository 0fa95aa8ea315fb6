package com.voxagent.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decorator: retry per provider, then fall back to the next one. The requested model
 * only goes to the primary; fallbacks answer with their own default model.
 */
public class ReliableProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(ReliableProvider.class);

    private final List<ModelProvider> providers;
    private final int maxRetries;
    private final long baseDelayMs;

    public ReliableProvider(List<ModelProvider> providers) {
        this(providers, ResilientCall.MAX_RETRIES, ResilientCall.INITIAL_DELAY_MS);
    }

    public ReliableProvider(List<ModelProvider> providers, int maxRetries, long baseDelayMs) {
        if (providers.isEmpty()) throw new IllegalArgumentException("At least one provider is required");
        this.providers = List.copyOf(providers);
        this.maxRetries = maxRetries;
        this.baseDelayMs = Math.max(baseDelayMs, 1);
    }

    @Override
    public String id() { return "reliable"; }

    public List<ModelProvider> providers() { return providers; }

    @Override
    public ChatResponse chat(ChatRequest request) {
        var failures = new ArrayList<String>();
        for (int i = 0; i < providers.size(); i++) {
            var provider = providers.get(i);
            var req = i == 0 ? request : request.withModel(null);
            try {
                var resp = ResilientCall.execute(() -> provider.chat(req), maxRetries, baseDelayMs);
                if (i > 0) log.info("Recovered via fallback provider={}", provider.id());
                return resp;
            } catch (RuntimeException e) {
                failures.add(provider.id() + ": " + rootMessage(e));
                log.warn("Provider {} failed, trying next: {}", provider.id(), rootMessage(e));
            }
        }
        throw new RuntimeException("All providers failed:\n" + String.join("\n", failures));
    }

    private static String rootMessage(Throwable t) {
        while (t.getCause() != null) t = t.getCause();
        return t.getMessage();
    }
}
