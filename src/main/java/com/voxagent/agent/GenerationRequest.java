package com.voxagent.agent;

import com.voxagent.shared.model.Agent;
import com.voxagent.tools.GroundingContext;

import java.util.List;
import java.util.Map;

public record GenerationRequest(
    Agent agent,
    String query,
    GroundingContext grounding,
    List<Map<String, Object>> history
) {
    public GenerationRequest {
        grounding = grounding == null ? GroundingContext.empty() : grounding;
        history = history == null ? List.of() : List.copyOf(history);
    }
}
