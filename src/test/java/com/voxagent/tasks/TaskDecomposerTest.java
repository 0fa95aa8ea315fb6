package com.voxagent.tasks;

import com.voxagent.routing.KeywordRouter;
import com.voxagent.shared.model.Agent;
import com.voxagent.shared.model.Capabilities;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskDecomposerTest {

    private final Agent concierge = new Agent("concierge", "Concierge", "prompt", Capabilities.none());
    private final Agent weather = new Agent("weather", "Weather Bot", "prompt", new Capabilities(
            null, new Capabilities.WeatherCapability(true, "metric"), null, Set.of()));
    private final Agent guide = new Agent("guide", "Travel Guide", "prompt", new Capabilities(
            null, null, null, Set.of("eiffel", "tower", "museum")));

    private final TaskDecomposer decomposer =
            new TaskDecomposer(new KeywordRouter(List.of(concierge, weather, guide)));

    @Test
    void compoundQueryWithTwoTaskClassesNeedsParallel() {
        assertTrue(decomposer.needsParallelExecution(
                "What's the weather in Paris and tell me about the Eiffel Tower"));
    }

    @Test
    void weatherAndPriceNeedParallel() {
        assertTrue(decomposer.needsParallelExecution(
                "What's the weather in Paris and what's the price of bitcoin"));
    }

    @Test
    void singleTopicCompoundSentenceDoesNotNeedParallel() {
        assertFalse(decomposer.needsParallelExecution(
                "What's the weather in Paris and the weather in London"));
    }

    @Test
    void twoClassesWithoutConjunctionDoNotNeedParallel() {
        assertFalse(decomposer.needsParallelExecution("Weather in Paris? Tell me about the Louvre"));
        assertFalse(decomposer.needsParallelExecution(""));
    }

    @Test
    void splitsWeatherAndInfoClausesAndRoutesEach() {
        var tasks = decomposer.decompose("What's the weather in Paris and tell me about the Eiffel Tower");

        assertEquals(2, tasks.size());
        assertEquals("What's the weather in Paris", tasks.get(0).query());
        assertEquals("weather", tasks.get(0).agentId());
        assertEquals(0, tasks.get(0).order());
        assertEquals("tell me about the Eiffel Tower", tasks.get(1).query());
        assertEquals("guide", tasks.get(1).agentId());
        assertEquals(1, tasks.get(1).order());
    }

    @Test
    void fallsBackToCommaAndSplit() {
        var tasks = decomposer.decompose("Book a table for two, and call a taxi for eight");
        assertEquals(List.of("Book a table for two", "call a taxi for eight"),
                tasks.stream().map(Task::query).toList());
    }

    @Test
    void fallsBackToSentenceSplit() {
        var tasks = decomposer.decompose("Book a table for two. What is the price of the menu?");
        assertEquals(2, tasks.size());
        assertEquals("What is the price of the menu?", tasks.get(1).query());
    }

    @Test
    void decimalPointIsNotASentenceBoundary() {
        var tasks = decomposer.decompose("Is the 3.5 star hotel near the museum");
        assertEquals(1, tasks.size());
        assertEquals("guide", tasks.get(0).agentId());
    }

    @Test
    void shortSegmentsAreDroppedAndSingleSurvivorKeepsWholeQuery() {
        var query = "ok, and tell me about Rome";
        var tasks = decomposer.decompose(query);
        assertEquals(1, tasks.size());
        assertEquals(query, tasks.get(0).query());
        assertEquals(0, tasks.get(0).order());
    }

    @Test
    void orderIndexesAreDenseAfterFiltering() {
        var tasks = decomposer.decompose("Hi. Book a table for two. Tell me about the museum.");
        assertEquals(2, tasks.size());
        assertEquals(0, tasks.get(0).order());
        assertEquals(1, tasks.get(1).order());
        assertEquals("guide", tasks.get(1).agentId());
    }

    @Test
    void decomposingAnAtomicSegmentIsIdempotent() {
        for (var task : decomposer.decompose("What's the weather in Paris and tell me about the Eiffel Tower")) {
            var again = decomposer.decompose(task.query());
            assertEquals(1, again.size());
            assertEquals(task.query(), again.get(0).query());
            assertEquals(task.agentId(), again.get(0).agentId());
        }
    }
}
