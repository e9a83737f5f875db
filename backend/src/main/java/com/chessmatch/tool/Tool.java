package com.chessmatch.tool;

import lombok.Value;

@Value
public class Tool {
    ToolDefinition definition;
    ToolHandler handler;

    public String getName() {
        return definition.getName();
    }
}
