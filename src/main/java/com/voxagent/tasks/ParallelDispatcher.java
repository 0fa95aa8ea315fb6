package com.voxagent.tasks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a batch of tasks concurrently and completes once every task has settled.
 *
 * <p>The result list always lines up with the input list: {@code results[i].task()}
 * is {@code tasks[i]} whatever order the runs finish in. A runner that throws, returns
 * null or completes exceptionally yields a failed {@link TaskResult} for that slot only.
 * At most {@code maxInFlight} runs are outstanding; the next queued task starts when
 * one settles. The returned future never completes exceptionally unless cancelled,
 * and cancelling it stops further launches.
 */
public class ParallelDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ParallelDispatcher.class);

    private final int maxInFlight;

    public ParallelDispatcher(int maxInFlight) {
        if (maxInFlight < 1) throw new IllegalArgumentException("maxInFlight must be positive");
        this.maxInFlight = maxInFlight;
    }

    public int maxInFlight() { return maxInFlight; }

    @SuppressWarnings("unchecked")
    public CompletableFuture<List<TaskResult>> execute(List<Task> tasks, TaskRunner runner) {
        if (tasks.isEmpty()) return CompletableFuture.completedFuture(List.of());
        if (tasks.size() > 1) {
            log.info("Executing {} tasks in parallel (max {} in flight)", tasks.size(), maxInFlight);
        }

        var slots = new CompletableFuture[tasks.size()];
        for (int i = 0; i < slots.length; i++) slots[i] = new CompletableFuture<TaskResult>();

        var batch = new Batch(tasks, runner, slots);
        var done = CompletableFuture.allOf(slots).thenApply(v -> batch.collect());
        batch.result = done;
        int initial = Math.min(maxInFlight, tasks.size());
        for (int i = 0; i < initial; i++) batch.launchNext();
        return done;
    }

    private static final class Batch {
        private final List<Task> tasks;
        private final TaskRunner runner;
        private final CompletableFuture<TaskResult>[] slots;
        private final AtomicInteger cursor = new AtomicInteger();
        private volatile CompletableFuture<List<TaskResult>> result;

        Batch(List<Task> tasks, TaskRunner runner, CompletableFuture<TaskResult>[] slots) {
            this.tasks = tasks;
            this.runner = runner;
            this.slots = slots;
        }

        void launchNext() {
            if (result.isDone()) return;
            int i = cursor.getAndIncrement();
            if (i >= tasks.size()) return;
            var task = tasks.get(i);
            CompletableFuture<TaskResult> run;
            try {
                run = runner.run(task);
                if (run == null) {
                    run = CompletableFuture.failedFuture(new IllegalStateException("runner returned no result"));
                }
            } catch (RuntimeException e) {
                run = CompletableFuture.failedFuture(e);
            }
            run.handle((r, err) -> settle(task, r, err))
               .thenAccept(settled -> {
                   slots[i].complete(settled);
                   launchNext();
               });
        }

        List<TaskResult> collect() {
            var results = new ArrayList<TaskResult>(slots.length);
            for (var slot : slots) results.add(slot.join());
            long ok = results.stream().filter(TaskResult::success).count();
            log.info("Parallel execution complete: {}/{} successful", ok, results.size());
            return results;
        }

        private static TaskResult settle(Task task, TaskResult r, Throwable err) {
            if (err != null) {
                var cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                log.warn("Task {} [{}] failed: {}", task.order(), task.agentName(), cause.toString());
                return TaskResult.failed(task, String.valueOf(cause.getMessage()));
            }
            if (r == null) return TaskResult.failed(task, "no result");
            return r.task() == task ? r : r.withTask(task);
        }
    }
}
