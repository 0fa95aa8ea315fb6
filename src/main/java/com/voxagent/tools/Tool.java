package com.voxagent.tools;

/**
 * A tool collaborator. Implementations report provider errors through
 * {@link ToolResult#error(String)} rather than throwing, but callers must still
 * tolerate exceptions.
 */
@FunctionalInterface
public interface Tool {
    ToolResult search(String query);
}
