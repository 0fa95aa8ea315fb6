package com.voxagent.sessions;

import com.voxagent.shared.model.Agent;
import com.voxagent.shared.model.TurnResult;

/**
 * Receives what a session did, for whoever persists history. Calls arrive on the
 * thread that ran the turn.
 */
public interface SessionSink {

    SessionSink NOOP = new SessionSink() {};

    default void sessionStarted(String sessionId, Agent initialAgent) {}

    default void agentSwitched(String sessionId, Agent previous, Agent current) {}

    default void turnCompleted(String sessionId, String query, TurnResult turn) {}

    default void sessionEnded(String sessionId) {}
}
