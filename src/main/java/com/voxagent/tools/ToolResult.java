package com.voxagent.tools;

/**
 * Raw output of a {@link Tool}. {@code isEmpty} marks a well-formed "nothing found"
 * answer, which contributes nothing to the grounding context.
 */
public record ToolResult(String output, boolean isError, boolean isEmpty) {

    public ToolResult(String output, boolean isError) {
        this(output, isError, false);
    }

    public static ToolResult ok(String output) {
        return new ToolResult(output, false);
    }

    public static ToolResult error(String message) {
        return new ToolResult(message, true);
    }

    public static ToolResult empty(String message) {
        return new ToolResult(message, false, true);
    }
}
