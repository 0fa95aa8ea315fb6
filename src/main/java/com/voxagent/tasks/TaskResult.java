package com.voxagent.tasks;

import com.voxagent.tools.ToolKind;

import java.util.List;

public record TaskResult(Task task, String response, List<ToolKind> toolsUsed, boolean success, String error) {

    public TaskResult {
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
        response = response == null ? "" : response;
    }

    public static TaskResult succeeded(Task task, String response, List<ToolKind> toolsUsed) {
        return new TaskResult(task, response, toolsUsed, true, null);
    }

    public static TaskResult failed(Task task, String error) {
        return new TaskResult(task, "", List.of(), false, error);
    }

    /** Same outcome re-bound to {@code other}. */
    TaskResult withTask(Task other) {
        return new TaskResult(other, response, toolsUsed, success, error);
    }
}
