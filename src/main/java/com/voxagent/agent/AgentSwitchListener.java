package com.voxagent.agent;

import com.voxagent.shared.model.Agent;

@FunctionalInterface
public interface AgentSwitchListener {
    /** {@code previous} is null only for the first agent of a session. */
    void onAgentSwitch(Agent previous, Agent current);
}
