package com.voxagent.agent;

import com.voxagent.shared.model.Agent;
import com.voxagent.tools.ToolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Agent identity of one session. Written only by the orchestrator that owns it.
 */
public class SessionAgentState {

    private static final Logger log = LoggerFactory.getLogger(SessionAgentState.class);

    private final List<AgentSwitchListener> listeners = new CopyOnWriteArrayList<>();
    private volatile Agent current;
    private volatile Set<ToolKind> lastToolsUsed = Set.of();

    public SessionAgentState(Agent initial) {
        this.current = initial;
    }

    public Agent current() { return current; }

    public Set<ToolKind> lastToolsUsed() { return lastToolsUsed; }

    public void setLastToolsUsed(Set<ToolKind> tools) {
        this.lastToolsUsed = tools.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(tools));
    }

    public void addListener(AgentSwitchListener listener) {
        listeners.add(listener);
    }

    public void removeListener(AgentSwitchListener listener) {
        listeners.remove(listener);
    }

    /**
     * Makes {@code next} current. Listeners run after the change, in registration
     * order; a throwing listener is logged and skipped.
     *
     * @return true if the agent changed
     */
    public boolean switchTo(Agent next) {
        var previous = current;
        if (previous != null && previous.id().equals(next.id())) return false;
        current = next;
        log.info("Agent switch: {} -> {}", previous == null ? "-" : previous.name(), next.name());
        for (var listener : listeners) {
            try {
                listener.onAgentSwitch(previous, next);
            } catch (RuntimeException e) {
                log.warn("Agent switch listener failed: {}", e.toString());
            }
        }
        return true;
    }
}
