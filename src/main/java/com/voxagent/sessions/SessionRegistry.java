package com.voxagent.sessions;

import com.voxagent.agent.AgentOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Live sessions by id. Each session gets its own orchestrator from the factory;
 * nothing session-scoped is shared between entries.
 */
public class SessionRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, AgentOrchestrator> sessions = new ConcurrentHashMap<>();
    private final Function<String, AgentOrchestrator> factory;

    public SessionRegistry(Function<String, AgentOrchestrator> factory) {
        this.factory = factory;
    }

    public AgentOrchestrator getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            log.info("Opening session {}", id);
            return factory.apply(id);
        });
    }

    public Optional<AgentOrchestrator> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /** @return false if no such session was open */
    public boolean end(String sessionId) {
        var orchestrator = sessions.remove(sessionId);
        if (orchestrator == null) return false;
        orchestrator.close();
        return true;
    }

    public int size() {
        return sessions.size();
    }

    @Override
    public void close() {
        for (var id : sessions.keySet()) end(id);
    }
}
