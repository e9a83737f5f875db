package com.chessmatch.tool;

@FunctionalInterface
public interface ToolHandler {

    /**
     * Runs the tool. The returned value becomes the {@code data} of a successful result, unless
     * it already is a {@link ToolResult}.
     */
    Object handle(ToolArguments arguments);
}
