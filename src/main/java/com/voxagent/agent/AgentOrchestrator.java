package com.voxagent.agent;

import com.voxagent.shared.model.Agent;
import com.voxagent.shared.model.TurnResult;

/**
 * Per-session entry point. One instance per voice session.
 */
public interface AgentOrchestrator extends AutoCloseable {

    /**
     * Handles one user utterance and blocks until the reply is ready.
     *
     * @throws java.util.concurrent.CancellationException if the turn was cancelled
     */
    TurnResult handleTurn(String query);

    /** Cancels the turn in flight, if any. */
    void cancelTurn();

    Agent currentAgent();

    String greeting();

    void addSwitchListener(AgentSwitchListener listener);

    @Override
    void close();
}
