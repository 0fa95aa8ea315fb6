package com.voxagent.tools;

import com.voxagent.observability.OrchestrationMetrics;
import com.voxagent.shared.concurrent.TurnScope;
import com.voxagent.shared.model.Agent;
import com.voxagent.shared.model.Capabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs the tools selected for one task concurrently and folds their output into a
 * {@link GroundingContext}.
 *
 * <p>Every call is isolated: an exception, an error result, an empty result or a
 * timeout turns into a "no contribution" outcome for that tool only. The returned
 * futures never complete exceptionally except on cancellation.
 */
public class ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);
    private static final String SEPARATOR = "\n\n";

    private final ToolClients clients;
    private final Executor executor;
    private final Duration timeout;
    private final int webSearchBudget;
    private final OrchestrationMetrics metrics;

    public ToolExecutor(ToolClients clients, Executor executor, Duration timeout,
                        int webSearchBudget, OrchestrationMetrics metrics) {
        this.clients = clients;
        this.executor = executor;
        this.timeout = timeout;
        this.webSearchBudget = webSearchBudget;
        this.metrics = metrics;
    }

    public CompletableFuture<ToolInvocationResult> retrieve(String query, String agentId,
                                                            Capabilities.RetrievalCapability capability) {
        return invoke(ToolKind.RETRIEVAL, query, () -> clients.retrieval(agentId, capability));
    }

    public CompletableFuture<ToolInvocationResult> weather(String query, Capabilities.WeatherCapability capability) {
        return invoke(ToolKind.WEATHER, query, () -> clients.weather(capability));
    }

    public CompletableFuture<ToolInvocationResult> webSearch(String query, Capabilities.WebSearchCapability capability) {
        return invoke(ToolKind.WEB_SEARCH, query, () -> clients.webSearch(capability));
    }

    public CompletableFuture<GroundingContext> gather(Set<ToolKind> kinds, String query, Agent agent) {
        return gather(kinds, query, agent, new TurnScope());
    }

    /**
     * Fans out one call per selected kind and joins them all before assembling the
     * context. Calls are registered with {@code scope} so a cancelled turn stops them.
     */
    public CompletableFuture<GroundingContext> gather(Set<ToolKind> kinds, String query, Agent agent,
                                                      TurnScope scope) {
        if (kinds.isEmpty()) {
            return CompletableFuture.completedFuture(GroundingContext.empty());
        }
        var caps = agent.capabilities();
        var calls = new ArrayList<CompletableFuture<ToolInvocationResult>>();
        for (var kind : ToolKind.values()) {
            if (!kinds.contains(kind)) continue;
            var call = switch (kind) {
                case RETRIEVAL -> retrieve(query, agent.id(), caps.retrieval());
                case WEATHER -> weather(query, caps.weather());
                case WEB_SEARCH -> webSearch(query, caps.webSearch());
            };
            calls.add(scope.track(call));
        }
        return CompletableFuture.allOf(calls.toArray(CompletableFuture[]::new))
                .thenApply(v -> assemble(calls.stream().map(CompletableFuture::join).toList()));
    }

    GroundingContext assemble(List<ToolInvocationResult> results) {
        var parts = new ArrayList<String>();
        var contributors = new ArrayList<ToolKind>();
        for (var kind : ToolKind.values()) {
            for (var r : results) {
                if (r.kind() != kind || !r.success()) continue;
                var text = r.text().strip();
                if (kind == ToolKind.WEB_SEARCH && text.length() > webSearchBudget) {
                    text = text.substring(0, webSearchBudget);
                }
                parts.add(text);
                contributors.add(kind);
            }
        }
        if (parts.isEmpty()) return GroundingContext.empty();
        var text = String.join(SEPARATOR, parts);
        log.info("Grounding context assembled from {} ({} chars)", contributors, text.length());
        return new GroundingContext(text, contributors);
    }

    private CompletableFuture<ToolInvocationResult> invoke(ToolKind kind, String query, Supplier<Tool> toolSupplier) {
        long start = System.nanoTime();
        // the timer is armed before submission, so it still holds when the pool runs the call inline
        var call = new CompletableFuture<ToolResult>().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            executor.execute(() -> {
                if (call.isDone()) return;
                try {
                    call.complete(toolSupplier.get().search(query));
                } catch (Throwable t) {
                    call.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            call.completeExceptionally(e);
        }
        return call.handle((result, error) -> {
            var outcome = error != null ? failed(kind, error) : interpret(kind, result);
            metrics.recordToolCall(kind, Duration.ofNanos(System.nanoTime() - start), outcome.success());
            return outcome;
        });
    }

    private ToolInvocationResult interpret(ToolKind kind, ToolResult result) {
        if (result == null || result.output() == null || result.output().isBlank()) {
            log.warn("Tool {} returned nothing", kind.id());
            return ToolInvocationResult.noContribution(kind, "empty result");
        }
        if (result.isError()) {
            log.warn("Tool {} failed: {}", kind.id(), result.output());
            return ToolInvocationResult.noContribution(kind, result.output());
        }
        if (result.isEmpty()) {
            log.info("Tool {} found nothing: {}", kind.id(), result.output());
            return ToolInvocationResult.noContribution(kind, result.output());
        }
        log.info("Tool {} done - got {} chars", kind.id(), result.output().length());
        return ToolInvocationResult.contributed(kind, result.output());
    }

    private ToolInvocationResult failed(ToolKind kind, Throwable error) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            log.warn("Tool {} timed out after {} ms", kind.id(), timeout.toMillis());
            return ToolInvocationResult.noContribution(kind, "timed out after " + timeout.toMillis() + " ms");
        }
        if (cause instanceof CancellationException) {
            return ToolInvocationResult.noContribution(kind, "cancelled");
        }
        log.warn("Tool {} threw: {}", kind.id(), cause.toString());
        return ToolInvocationResult.noContribution(kind, String.valueOf(cause.getMessage()));
    }
}
