package com.voxagent.tasks;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskTypeRegistryTest {

    @Test
    void defaultsHoldSevenClassesInOrder() {
        var names = TaskTypeRegistry.defaults().types().stream().map(TaskTypeRegistry.TaskType::name).toList();
        assertEquals(List.of("weather", "contact", "booking", "price", "location", "hours", "info"), names);
    }

    @Test
    void detectsSeveralClassesCaseInsensitively() {
        var detected = TaskTypeRegistry.defaults().detect("What is the WEATHER IN Rome and how much is a taxi?");
        assertEquals(Set.of("weather", "price", "info"), detected);
    }

    @Test
    void detectsNothingForSmallTalk() {
        assertTrue(TaskTypeRegistry.defaults().detect("thanks, that was great").isEmpty());
        assertTrue(TaskTypeRegistry.defaults().detect(null).isEmpty());
    }

    @Test
    void customClassCanBeRegistered() {
        var registry = TaskTypeRegistry.defaults()
                .registerPatterns("translation", "translate\\s+");
        assertTrue(registry.detect("translate this to French").contains("translation"));

        registry.register("menu", q -> q.contains("menu"));
        assertTrue(registry.detect("show the menu").contains("menu"));
    }

    @Test
    void duplicateNameIsRejected() {
        var registry = TaskTypeRegistry.defaults();
        assertThrows(IllegalArgumentException.class, () -> registry.register("price", q -> true));
    }
}
