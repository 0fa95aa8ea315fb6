package com.voxagent.shared.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-agent tool configuration. Every sub-structure is present; a capability the
 * agent does not use is represented by its {@code disabled()} instance, never null.
 */
public record Capabilities(
    WebSearchCapability webSearch,
    WeatherCapability weather,
    RetrievalCapability retrieval,
    Set<String> routingKeywords
) {
    public Capabilities {
        webSearch = webSearch != null ? webSearch : WebSearchCapability.disabled();
        weather = weather != null ? weather : WeatherCapability.disabled();
        retrieval = retrieval != null ? retrieval : RetrievalCapability.disabled();
        routingKeywords = routingKeywords != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(routingKeywords))
                : Set.of();
    }

    public record WebSearchCapability(boolean enabled, String provider, int maxResults) {
        public static WebSearchCapability disabled() {
            return new WebSearchCapability(false, "duckduckgo", 3);
        }
    }

    public record WeatherCapability(boolean enabled, String units) {
        public static WeatherCapability disabled() {
            return new WeatherCapability(false, "metric");
        }
    }

    /** {@code collectionRef} may be null, in which case the agent's default collection is used. */
    public record RetrievalCapability(boolean enabled, String collectionRef, int topK) {
        public static RetrievalCapability disabled() {
            return new RetrievalCapability(false, null, 5);
        }
    }

    public static Capabilities none() {
        return new Capabilities(null, null, null, null);
    }
}
