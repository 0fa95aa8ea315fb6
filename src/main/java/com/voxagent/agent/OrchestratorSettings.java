package com.voxagent.agent;

import com.voxagent.shared.config.VoxAgentConfig;

import java.time.Duration;

public record OrchestratorSettings(
    int maxParallelTasks,
    int historyLimit,
    Duration toolTimeout,
    int webSearchCharBudget
) {
    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(4, 20, Duration.ofSeconds(10), 800);
    }

    public static OrchestratorSettings from(VoxAgentConfig config) {
        return new OrchestratorSettings(
            config.dispatch().maxParallelTasks(),
            config.dispatch().historyLimit(),
            Duration.ofSeconds(config.tools().timeoutSeconds()),
            config.tools().webSearch().maxContextChars());
    }
}
