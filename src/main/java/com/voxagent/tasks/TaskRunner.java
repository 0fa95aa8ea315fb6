package com.voxagent.tasks;

import java.util.concurrent.CompletableFuture;

/** Runs the whole per-task pipeline: tool selection, tool calls, then generation. */
@FunctionalInterface
public interface TaskRunner {
    CompletableFuture<TaskResult> run(Task task);
}
