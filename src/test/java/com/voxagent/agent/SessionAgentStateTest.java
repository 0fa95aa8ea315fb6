package com.voxagent.agent;

import com.voxagent.shared.model.Agent;
import com.voxagent.shared.model.Capabilities;
import com.voxagent.tools.ToolKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SessionAgentStateTest {

    private final Agent a = new Agent("a", "Alpha", "p", Capabilities.none());
    private final Agent b = new Agent("b", "Beta", "p", Capabilities.none());

    @Test
    void listenersRunInOrderAndFailuresAreIsolated() {
        var state = new SessionAgentState(a);
        var calls = new ArrayList<String>();
        state.addListener((prev, cur) -> calls.add("first:" + prev.id() + "->" + cur.id()));
        state.addListener((prev, cur) -> { throw new IllegalStateException("ui gone"); });
        state.addListener((prev, cur) -> calls.add("third:" + state.current().id()));

        assertTrue(state.switchTo(b));
        assertEquals(List.of("first:a->b", "third:b"), calls);
    }

    @Test
    void sameAgentIsNotASwitch() {
        var state = new SessionAgentState(a);
        var calls = new ArrayList<String>();
        state.addListener((prev, cur) -> calls.add(cur.id()));

        assertFalse(state.switchTo(a));
        assertTrue(calls.isEmpty());
    }

    @Test
    void removedListenerIsNotCalled() {
        var state = new SessionAgentState(a);
        var calls = new ArrayList<String>();
        AgentSwitchListener listener = (prev, cur) -> calls.add(cur.id());
        state.addListener(listener);
        state.removeListener(listener);
        state.switchTo(b);
        assertTrue(calls.isEmpty());
    }

    @Test
    void lastToolsUsed() {
        var state = new SessionAgentState(a);
        assertTrue(state.lastToolsUsed().isEmpty());
        state.setLastToolsUsed(Set.of(ToolKind.WEATHER));
        assertEquals(Set.of(ToolKind.WEATHER), state.lastToolsUsed());
        state.setLastToolsUsed(Set.of());
        assertTrue(state.lastToolsUsed().isEmpty());
    }
}
