package com.voxagent.tasks;

import com.voxagent.routing.KeywordRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects compound requests and splits them into independently routed tasks.
 */
public class TaskDecomposer {

    private static final Logger log = LoggerFactory.getLogger(TaskDecomposer.class);

    static final List<String> CONJUNCTIONS = List.of(
            " and ", " also ", " plus ", " as well as ",
            " additionally ", " along with ", " together with ",
            ". also ", ". and ", ", and ");

    private static final Pattern AND_BEFORE_ACTION = Pattern.compile(
            "\\s+and\\s+(?=(?:the|what|where|how|tell|get|find|show)\\s+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMA_AND = Pattern.compile(",\\s*and\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SENTENCE_END = Pattern.compile("\\.(?=\\s|$)");
    private static final int MIN_SEGMENT_LENGTH = 5;

    private final KeywordRouter router;
    private final TaskTypeRegistry taskTypes;

    public TaskDecomposer(KeywordRouter router) {
        this(router, TaskTypeRegistry.defaults());
    }

    public TaskDecomposer(KeywordRouter router, TaskTypeRegistry taskTypes) {
        this.router = router;
        this.taskTypes = taskTypes;
    }

    /**
     * True only when the query has a conjunction marker and at least two distinct task
     * classes. Two cities' weather in one sentence stays a single task.
     */
    public boolean needsParallelExecution(String query) {
        if (query == null || query.isBlank()) return false;
        var lower = query.toLowerCase(Locale.ROOT);
        boolean hasConjunction = CONJUNCTIONS.stream().anyMatch(lower::contains);
        if (!hasConjunction) return false;
        var detected = taskTypes.detect(lower);
        if (detected.size() > 1) {
            log.debug("Multi-intent query, task types {}", detected);
            return true;
        }
        return false;
    }

    public List<Task> decompose(String query) {
        var segments = new ArrayList<String>();
        for (var s : split(query)) {
            var trimmed = s.strip();
            if (trimmed.length() >= MIN_SEGMENT_LENGTH) segments.add(trimmed);
        }
        if (segments.size() < 2) {
            var agent = router.routeAgent(query);
            return List.of(new Task(query, agent.id(), agent.name(), 0));
        }

        var tasks = new ArrayList<Task>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            var agent = router.routeAgent(segments.get(i));
            tasks.add(new Task(segments.get(i), agent.id(), agent.name(), i));
        }
        log.info("Decomposed query into {} parallel tasks", tasks.size());
        for (var t : tasks) {
            log.info("  -> [{}]: {}", t.agentName(), abbreviate(t.query()));
        }
        return List.copyOf(tasks);
    }

    static List<String> split(String query) {
        var segments = AND_BEFORE_ACTION.split(query);
        if (segments.length == 1) segments = COMMA_AND.split(query);
        if (segments.length == 1) segments = SENTENCE_END.split(query);
        return Arrays.stream(segments).filter(s -> !s.isBlank()).toList();
    }

    private static String abbreviate(String s) {
        return s.length() <= 50 ? s : s.substring(0, 50) + "...";
    }
}
