package com.voxagent.tools;

import com.voxagent.shared.model.Capabilities;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides which tools a task needs. Retrieval follows the agent's configuration alone;
 * weather and web-search also need a trigger phrase in the query, and web-search is
 * never chosen alongside weather.
 */
public class CapabilitySelector {

    static final List<String> WEATHER_TRIGGERS = List.of(
            "weather", "temperature", "forecast", "rain", "sunny", "cloudy",
            "hot", "cold", "humid", "wind", "snow", "storm");

    static final List<String> REALTIME_TRIGGERS = List.of(
            "news", "today", "current", "latest", "recent",
            "price", "stock", "bitcoin", "crypto",
            "who is", "when did", "what happened", "what is",
            "prime minister", "president", "election");

    public Set<ToolKind> select(String query, Capabilities capabilities) {
        var selected = EnumSet.noneOf(ToolKind.class);
        if (capabilities.retrieval().enabled()) {
            selected.add(ToolKind.RETRIEVAL);
        }
        if (capabilities.weather().enabled() && needsWeather(query)) {
            selected.add(ToolKind.WEATHER);
        }
        if (capabilities.webSearch().enabled() && needsRealtimeInfo(query)
                && !selected.contains(ToolKind.WEATHER)) {
            selected.add(ToolKind.WEB_SEARCH);
        }
        return selected;
    }

    public static boolean needsWeather(String query) {
        return containsAny(query, WEATHER_TRIGGERS);
    }

    public static boolean needsRealtimeInfo(String query) {
        return containsAny(query, REALTIME_TRIGGERS);
    }

    private static boolean containsAny(String query, List<String> triggers) {
        if (query == null) return false;
        var lower = query.toLowerCase(Locale.ROOT);
        for (var t : triggers) {
            if (lower.contains(t)) return true;
        }
        return false;
    }
}
