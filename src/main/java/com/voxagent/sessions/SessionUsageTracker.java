package com.voxagent.sessions;

import com.voxagent.shared.model.Agent;
import com.voxagent.shared.model.TurnResult;
import com.voxagent.tools.ToolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accumulates per-session usage: turns, agent switches, tools and agents used.
 * Only sessions between {@code sessionStarted} and {@code sessionEnded} are tracked;
 * events for any other id are dropped.
 */
public class SessionUsageTracker implements SessionSink {

    private static final Logger log = LoggerFactory.getLogger(SessionUsageTracker.class);

    public record Summary(String sessionId, int turns, int parallelTurns, int agentSwitches,
                          Set<ToolKind> toolsUsed, Set<String> agentsUsed) {}

    private final Map<String, Usage> sessions = new ConcurrentHashMap<>();

    @Override
    public void sessionStarted(String sessionId, Agent initialAgent) {
        sessions.put(sessionId, new Usage());
        log.info("Session {} started with agent {}", sessionId, initialAgent.name());
    }

    @Override
    public void agentSwitched(String sessionId, Agent previous, Agent current) {
        var usage = sessions.get(sessionId);
        if (usage == null) return;
        usage.recordSwitch();
        log.info("Session {} switched agent: {} -> {}", sessionId,
                previous == null ? "-" : previous.name(), current.name());
    }

    @Override
    public void turnCompleted(String sessionId, String query, TurnResult turn) {
        var usage = sessions.get(sessionId);
        if (usage == null) {
            log.debug("Ignoring turn for session {} that is not open", sessionId);
            return;
        }
        usage.recordTurn(turn);
        log.info("Session {} turn done: agent={}, tools={}, agents={}, parallel={}",
                sessionId, turn.agentName(), turn.toolsUsed(), turn.agentsUsed(), turn.parallel());
    }

    @Override
    public void sessionEnded(String sessionId) {
        var usage = sessions.remove(sessionId);
        if (usage != null) {
            var s = usage.snapshot(sessionId);
            log.info("Session {} ended after {} turns, {} switches, tools {}",
                    sessionId, s.turns(), s.agentSwitches(), s.toolsUsed());
        }
    }

    public Optional<Summary> summary(String sessionId) {
        var usage = sessions.get(sessionId);
        return usage == null ? Optional.empty() : Optional.of(usage.snapshot(sessionId));
    }

    private static final class Usage {
        private int turns;
        private int parallelTurns;
        private int switches;
        private final Set<ToolKind> tools = EnumSet.noneOf(ToolKind.class);
        private final Set<String> agents = new LinkedHashSet<>();

        synchronized void recordSwitch() {
            switches++;
        }

        synchronized void recordTurn(TurnResult turn) {
            turns++;
            if (turn.parallel()) parallelTurns++;
            tools.addAll(turn.toolsUsed());
            agents.addAll(turn.agentsUsed());
        }

        synchronized Summary snapshot(String sessionId) {
            return new Summary(sessionId, turns, parallelTurns, switches,
                    Set.copyOf(tools), Set.copyOf(agents));
        }
    }
}
