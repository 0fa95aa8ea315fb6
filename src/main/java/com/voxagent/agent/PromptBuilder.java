package com.voxagent.agent;

import com.voxagent.shared.model.Agent;
import com.voxagent.tools.GroundingContext;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class PromptBuilder {

    private static final String GROUNDED_TEMPLATE = """
            You are %s. Answer in 1-2 sentences only.

            CRITICAL INSTRUCTION: You MUST use ONLY the information below to answer. \
            This is LIVE DATA from today (%s). DO NOT use your training data. Your training data is OUTDATED.

            LIVE DATA:
            %s

            Answer based ONLY on the LIVE DATA above. If it says someone is president, \
            that's the current president. Do not contradict it.""";

    private final Clock clock;

    public PromptBuilder() {
        this(Clock.systemDefaultZone());
    }

    public PromptBuilder(Clock clock) {
        this.clock = clock;
    }

    public String systemPrompt(Agent agent, GroundingContext grounding) {
        if (grounding != null && !grounding.isEmpty()) {
            return GROUNDED_TEMPLATE.formatted(agent.name(), LocalDate.now(clock), grounding.text());
        }
        return agent.name() + ": " + agent.systemPrompt() + "\n\nBe concise. 1-2 sentences max.";
    }

    public List<Map<String, Object>> build(GenerationRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("query must not be empty");
        }
        var messages = new ArrayList<Map<String, Object>>();
        messages.add(Map.of("role", "system", "content", systemPrompt(request.agent(), request.grounding())));
        for (var m : request.history()) {
            if (!"system".equals(m.get("role"))) messages.add(m);
        }
        messages.add(Map.of("role", "user", "content", request.query()));
        return messages;
    }
}
