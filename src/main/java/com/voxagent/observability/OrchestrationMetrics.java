package com.voxagent.observability;

import com.voxagent.tools.ToolKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class OrchestrationMetrics {

    private final MeterRegistry registry = new SimpleMeterRegistry();

    public void recordToolCall(ToolKind kind, Duration elapsed, boolean contributed) {
        Timer.builder("voxagent.tool.latency")
                .tag("tool", kind.id())
                .register(registry)
                .record(elapsed);
        if (!contributed) {
            toolFailures(kind).increment();
        }
    }

    public Counter toolFailures(ToolKind kind) {
        return Counter.builder("voxagent.tool.failures").tag("tool", kind.id()).register(registry);
    }

    public Counter taskFailures() {
        return Counter.builder("voxagent.task.failures").register(registry);
    }

    public Counter turns(boolean parallel) {
        return Counter.builder("voxagent.turns")
                .tag("path", parallel ? "parallel" : "single")
                .register(registry);
    }
}
