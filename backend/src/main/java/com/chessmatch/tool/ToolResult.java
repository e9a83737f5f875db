package com.chessmatch.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {
    boolean success;
    Object data;
    String error;

    public static ToolResult ok(Object data) {
        return new ToolResult(true, data, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error);
    }

    public static ToolResult failure(String error, Object data) {
        return new ToolResult(false, data, error);
    }
}
