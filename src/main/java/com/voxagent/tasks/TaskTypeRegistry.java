package com.voxagent.tasks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Ordered set of task classes used to tell whether a query asks for more than one
 * kind of thing. Classes are matched independently; a query can fall into several.
 */
public class TaskTypeRegistry {

    public record TaskType(String name, Predicate<String> matcher) {}

    private final List<TaskType> types = new ArrayList<>();

    public static TaskTypeRegistry defaults() {
        var registry = new TaskTypeRegistry();
        registry.registerPatterns("weather",
                "weather\\s+(?:in|for|of|at)\\s+(\\w+)", "temperature\\s+(?:in|of)\\s+(\\w+)");
        registry.registerPatterns("contact",
                "contact\\s+(?:number|info|details)", "phone\\s+(?:number|of)", "call\\s+");
        registry.registerPatterns("booking",
                "book\\s+(?:a|the)?", "reserve\\s+", "reservation\\s+");
        registry.registerPatterns("price",
                "price\\s+(?:of|for)", "cost\\s+(?:of|for)", "how\\s+much");
        registry.registerPatterns("location",
                "where\\s+is", "address\\s+(?:of|for)", "location\\s+(?:of|for)");
        registry.registerPatterns("hours",
                "(?:open|opening|business)\\s+hours", "when\\s+(?:is|does)\\s+\\w+\\s+open");
        registry.registerPatterns("info",
                "tell\\s+me\\s+about", "what\\s+is", "who\\s+is", "information\\s+(?:about|on)");
        return registry;
    }

    public TaskTypeRegistry register(String name, Predicate<String> matcher) {
        for (var t : types) {
            if (t.name().equals(name)) {
                throw new IllegalArgumentException("Task type already registered: " + name);
            }
        }
        types.add(new TaskType(name, matcher));
        return this;
    }

    /** Registers a class matched when any of the case-insensitive patterns is found. */
    public TaskTypeRegistry registerPatterns(String name, String... regexes) {
        var patterns = new ArrayList<Pattern>();
        for (var regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return register(name, q -> patterns.stream().anyMatch(p -> p.matcher(q).find()));
    }

    public Set<String> detect(String query) {
        var detected = new LinkedHashSet<String>();
        if (query == null) return detected;
        for (var t : types) {
            if (t.matcher().test(query)) detected.add(t.name());
        }
        return detected;
    }

    public List<TaskType> types() {
        return Collections.unmodifiableList(types);
    }
}
