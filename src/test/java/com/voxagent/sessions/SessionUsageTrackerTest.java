package com.voxagent.sessions;

import com.voxagent.shared.model.Agent;
import com.voxagent.shared.model.TurnResult;
import com.voxagent.tools.ToolKind;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SessionUsageTrackerTest {

    private final SessionUsageTracker tracker = new SessionUsageTracker();
    private final Agent a = Agent.defaultAgent();

    @Test
    void accumulatesTurnsPerSession() {
        tracker.sessionStarted("s1", a);
        tracker.turnCompleted("s1", "q1", new TurnResult("r", "Assistant",
                Set.of(ToolKind.WEATHER), Set.of("Weather Bot"), false));
        tracker.turnCompleted("s1", "q2", new TurnResult("r", "Assistant",
                Set.of(ToolKind.RETRIEVAL, ToolKind.WEATHER), Set.of("Weather Bot", "Guide"), true));
        tracker.agentSwitched("s1", a, a);

        var s = tracker.summary("s1").orElseThrow();
        assertEquals(2, s.turns());
        assertEquals(1, s.parallelTurns());
        assertEquals(1, s.agentSwitches());
        assertEquals(Set.of(ToolKind.RETRIEVAL, ToolKind.WEATHER), s.toolsUsed());
        assertEquals(Set.of("Weather Bot", "Guide"), s.agentsUsed());
        assertTrue(tracker.summary("s2").isEmpty());
    }

    @Test
    void endingDropsTheSession() {
        tracker.sessionStarted("s1", a);
        tracker.sessionEnded("s1");
        tracker.sessionEnded("s1");
        assertTrue(tracker.summary("s1").isEmpty());
    }

    @Test
    void lateEventsAfterEndAreDropped() {
        tracker.sessionStarted("s1", a);
        tracker.sessionEnded("s1");

        tracker.agentSwitched("s1", a, a);
        tracker.turnCompleted("s1", "late", new TurnResult("r", "Assistant", Set.of(), Set.of("Assistant"), false));

        assertTrue(tracker.summary("s1").isEmpty());
    }
}
