package com.voxagent.tasks;

import com.voxagent.tools.ToolKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Folds per-task results into one spoken reply. */
public class ResponseAggregator {

    public static final String NO_RESULTS = "I couldn't process your request.";
    public static final String SINGLE_FAILURE = "I encountered an error.";
    public static final String ALL_FAILED = "I encountered errors processing your requests.";

    public String aggregate(List<TaskResult> results) {
        if (results == null || results.isEmpty()) return NO_RESULTS;
        if (results.size() == 1) {
            var only = results.get(0);
            return only.success() ? only.response() : SINGLE_FAILURE;
        }

        var responses = new ArrayList<String>();
        for (var r : results) {
            if (r.success() && !r.response().isBlank()) responses.add(r.response().strip());
        }
        if (responses.isEmpty()) return ALL_FAILED;
        if (responses.size() == 1) return responses.get(0);
        if (responses.size() == 2) {
            var second = responses.get(1);
            if (Character.isUpperCase(second.charAt(0))) {
                second = Character.toLowerCase(second.charAt(0)) + second.substring(1);
            }
            return responses.get(0) + " Also, " + second;
        }
        return String.join(" ", responses);
    }

    public Set<ToolKind> allToolsUsed(List<TaskResult> results) {
        var tools = EnumSet.noneOf(ToolKind.class);
        for (var r : results) tools.addAll(r.toolsUsed());
        return tools;
    }

    public Set<String> allAgentsUsed(List<TaskResult> results) {
        var agents = new LinkedHashSet<String>();
        for (var r : results) agents.add(r.task().agentName());
        return agents;
    }
}
