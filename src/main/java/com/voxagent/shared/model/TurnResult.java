package com.voxagent.shared.model;

import com.voxagent.tools.ToolKind;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of one user turn: the reply plus the usage metadata handed to the session sink.
 */
public record TurnResult(
    String reply,
    String agentName,
    Set<ToolKind> toolsUsed,
    Set<String> agentsUsed,
    boolean parallel
) {
    public TurnResult {
        toolsUsed = Collections.unmodifiableSet(new LinkedHashSet<>(toolsUsed));
        agentsUsed = Collections.unmodifiableSet(new LinkedHashSet<>(agentsUsed));
    }
}
