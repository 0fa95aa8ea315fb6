package com.voxagent.agent;

import com.voxagent.observability.OrchestrationMetrics;
import com.voxagent.routing.KeywordRouter;
import com.voxagent.sessions.SessionSink;
import com.voxagent.shared.concurrent.TurnScope;
import com.voxagent.shared.model.Agent;
import com.voxagent.shared.model.TurnResult;
import com.voxagent.tasks.ParallelDispatcher;
import com.voxagent.tasks.ResponseAggregator;
import com.voxagent.tasks.Task;
import com.voxagent.tasks.TaskDecomposer;
import com.voxagent.tasks.TaskResult;
import com.voxagent.tools.CapabilitySelector;
import com.voxagent.tools.ToolClients;
import com.voxagent.tools.ToolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Session facade. Chooses between the single-task and the parallel path, keeps the
 * session's agent identity and conversation history, and reports usage to the sink.
 *
 * <p>Turns are serialized per instance. Tool and generation calls run on the shared
 * executor; the join and all state changes happen on the calling thread.
 */
public class DefaultAgentOrchestrator implements AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultAgentOrchestrator.class);

    private final String sessionId;
    private final KeywordRouter router;
    private final TaskDecomposer decomposer;
    private final CapabilitySelector selector = new CapabilitySelector();
    private final ToolExecutor toolExecutor;
    private final ParallelDispatcher dispatcher;
    private final ResponseAggregator aggregator = new ResponseAggregator();
    private final ResponseGenerator generator;
    private final SessionAgentState state;
    private final SessionSink sink;
    private final OrchestrationMetrics metrics;
    private final int historyLimit;
    private final List<Map<String, Object>> history = new ArrayList<>();

    private volatile TurnScope currentTurn;
    private volatile boolean closed;

    public DefaultAgentOrchestrator(String sessionId, List<Agent> agents, ToolClients tools,
                                    ResponseGenerator generator, Executor executor,
                                    OrchestratorSettings settings) {
        this(sessionId, agents, tools, generator, executor, settings, SessionSink.NOOP, new OrchestrationMetrics());
    }

    public DefaultAgentOrchestrator(String sessionId, List<Agent> agents, ToolClients tools,
                                    ResponseGenerator generator, Executor executor,
                                    OrchestratorSettings settings, SessionSink sink,
                                    OrchestrationMetrics metrics) {
        this.sessionId = sessionId;
        this.router = new KeywordRouter(agents);
        this.decomposer = new TaskDecomposer(router);
        this.toolExecutor = new ToolExecutor(tools, executor, settings.toolTimeout(),
                settings.webSearchCharBudget(), metrics);
        this.dispatcher = new ParallelDispatcher(settings.maxParallelTasks());
        this.generator = generator;
        this.sink = sink;
        this.metrics = metrics;
        this.historyLimit = settings.historyLimit();
        this.state = new SessionAgentState(router.defaultAgent());
        state.addListener((previous, current) -> sink.agentSwitched(sessionId, previous, current));
        report("sessionStarted", () -> sink.sessionStarted(sessionId, router.defaultAgent()));
    }

    @Override
    public synchronized TurnResult handleTurn(String query) {
        if (closed) throw new IllegalStateException("Session " + sessionId + " is closed");
        if (query == null) throw new IllegalArgumentException("query must not be null");
        var scope = new TurnScope();
        currentTurn = scope;
        state.setLastToolsUsed(Set.of());
        try {
            List<Task> tasks = null;
            if (decomposer.needsParallelExecution(query)) {
                tasks = decomposer.decompose(query);
            }
            boolean parallel = tasks != null && tasks.size() > 1;
            if (!parallel) {
                var agent = router.routeAgent(query);
                tasks = List.of(new Task(query, agent.id(), agent.name(), 0));
            }
            // for a parallel turn this is bookkeeping only; each task answers as its own agent
            state.switchTo(router.agent(tasks.get(0).agentId()));

            var historySnapshot = List.copyOf(history);
            var pending = scope.track(dispatcher.execute(tasks, task -> runTask(task, historySnapshot, scope)));
            var results = await(pending);
            if (scope.isCancelled()) throw new CancellationException("Turn cancelled");

            var reply = aggregator.aggregate(results);
            var toolsUsed = aggregator.allToolsUsed(results);
            var agentsUsed = aggregator.allAgentsUsed(results);
            state.setLastToolsUsed(toolsUsed);
            record(query, reply);

            metrics.turns(parallel).increment();
            results.stream().filter(r -> !r.success()).forEach(r -> metrics.taskFailures().increment());

            var turn = new TurnResult(reply, state.current().name(), toolsUsed, agentsUsed, parallel);
            report("turnCompleted", () -> sink.turnCompleted(sessionId, query, turn));
            return turn;
        } finally {
            currentTurn = null;
        }
    }

    private CompletableFuture<TaskResult> runTask(Task task, List<Map<String, Object>> history, TurnScope scope) {
        var agent = router.agent(task.agentId());
        var kinds = selector.select(task.query(), agent.capabilities());
        return toolExecutor.gather(kinds, task.query(), agent, scope)
                .thenCompose(grounding -> scope.track(generator.generate(
                                new GenerationRequest(agent, task.query(), grounding, history)))
                        .thenApply(reply -> {
                            if (reply == null || reply.isBlank()) {
                                throw new IllegalStateException("empty response from " + agent.name());
                            }
                            return TaskResult.succeeded(task, reply.strip(), grounding.contributors());
                        }));
    }

    private List<TaskResult> await(CompletableFuture<List<TaskResult>> pending) {
        try {
            return pending.join();
        } catch (CancellationException e) {
            log.info("Turn cancelled for session {}", sessionId);
            throw e;
        } catch (CompletionException e) {
            if (e.getCause() instanceof CancellationException ce) throw ce;
            throw e;
        }
    }

    private void record(String query, String reply) {
        history.add(Map.of("role", "user", "content", query));
        history.add(Map.of("role", "assistant", "content", reply));
        while (history.size() > historyLimit) history.remove(0);
    }

    @Override
    public void cancelTurn() {
        var scope = currentTurn;
        if (scope != null) scope.cancel();
    }

    @Override
    public Agent currentAgent() {
        return state.current();
    }

    public SessionAgentState state() {
        return state;
    }

    public String sessionId() {
        return sessionId;
    }

    @Override
    public String greeting() {
        var agents = router.agents();
        if (agents.size() > 1) {
            return "Hello! I'm your AI assistant with " + agents.size() + " specialized agents. How can I help?";
        }
        return "Hello! I'm " + agents.get(0).name() + ". How can I help?";
    }

    @Override
    public void addSwitchListener(AgentSwitchListener listener) {
        state.addListener(listener);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        cancelTurn();
        report("sessionEnded", () -> sink.sessionEnded(sessionId));
    }

    // a failing sink never costs the caller a finished turn
    private void report(String event, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Session sink failed on {} for session {}: {}", event, sessionId, e.toString());
        }
    }
}
