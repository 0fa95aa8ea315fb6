package com.voxagent.routing;

import com.voxagent.shared.model.Agent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks an agent for a query by counting how many of each agent's routing keywords
 * occur in it. No network call is involved.
 *
 * <p>Ties go to the agent listed first, and a query that matches nothing goes to the
 * first agent, so routing is total and deterministic.
 */
public class KeywordRouter {

    private static final Logger log = LoggerFactory.getLogger(KeywordRouter.class);
    private static final List<String> WEATHER_KEYWORDS = List.of("weather", "temperature", "forecast");

    private final List<Agent> agents;
    private final List<Set<String>> keywords;

    public KeywordRouter(List<Agent> agents) {
        if (agents == null || agents.isEmpty()) {
            throw new IllegalArgumentException("KeywordRouter requires at least one agent");
        }
        this.agents = List.copyOf(agents);
        this.keywords = new ArrayList<>(agents.size());
        for (var agent : this.agents) {
            var set = new LinkedHashSet<String>();
            for (var kw : agent.capabilities().routingKeywords()) {
                if (!kw.isBlank()) set.add(kw.toLowerCase(Locale.ROOT));
            }
            if (agent.capabilities().weather().enabled()) {
                set.addAll(WEATHER_KEYWORDS);
            }
            keywords.add(Set.copyOf(set));
            if (!set.isEmpty()) {
                log.debug("Agent '{}' routing keywords: {}", agent.name(), set);
            }
        }
    }

    public String route(String query) {
        return routeAgent(query).id();
    }

    public Agent routeAgent(String query) {
        var normalized = query == null ? "" : query.toLowerCase(Locale.ROOT);
        int best = 0;
        int bestScore = 0;
        for (int i = 0; i < agents.size(); i++) {
            int score = score(keywords.get(i), normalized);
            if (score > bestScore) {
                best = i;
                bestScore = score;
            }
        }
        var agent = agents.get(best);
        log.info("Fast route: '{}' -> {} (score {})", abbreviate(query), agent.name(), bestScore);
        return agent;
    }

    /** Resolves an agent by id; falls back to the first agent for an unknown id. */
    public Agent agent(String id) {
        for (var agent : agents) {
            if (agent.id().equals(id)) return agent;
        }
        return agents.get(0);
    }

    public Agent defaultAgent() {
        return agents.get(0);
    }

    public List<Agent> agents() {
        return agents;
    }

    public Set<String> keywordsFor(String agentId) {
        for (int i = 0; i < agents.size(); i++) {
            if (agents.get(i).id().equals(agentId)) return keywords.get(i);
        }
        return Set.of();
    }

    private static int score(Set<String> agentKeywords, String normalizedQuery) {
        int score = 0;
        for (var kw : agentKeywords) {
            if (normalizedQuery.contains(kw)) score++;
        }
        return score;
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 40 ? s : s.substring(0, 40) + "...";
    }
}
