package com.voxagent.shared.config;

public record DispatchConfig(
    int maxParallelTasks,
    int workerThreads,
    int historyLimit
) {
    public static DispatchConfig defaults() {
        return new DispatchConfig(4, 8, 20);
    }
}
