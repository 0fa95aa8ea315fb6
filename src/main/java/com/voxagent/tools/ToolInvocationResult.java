package com.voxagent.tools;

/**
 * What one tool call contributed to a task. {@code text} is null unless {@code success}.
 */
public record ToolInvocationResult(
    ToolKind kind,
    String text,
    boolean success,
    String error
) {
    public static ToolInvocationResult contributed(ToolKind kind, String text) {
        return new ToolInvocationResult(kind, text, true, null);
    }

    public static ToolInvocationResult noContribution(ToolKind kind, String reason) {
        return new ToolInvocationResult(kind, null, false, reason);
    }
}
