package com.chessmatch.tool;

import com.chessmatch.chess.PgnParseException;
import com.chessmatch.exception.MatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

// ========== Tool Dispatcher ==========
// Checks arguments against the declared parameters, runs the tool and folds every failure
// into a {success: false, error} result.
@Service
@Slf4j
public class ToolDispatcher {

    private final Map<String, Tool> tools;

    public ToolDispatcher(ChessTools chessTools) {
        Map<String, Tool> byName = new LinkedHashMap<>();
        for (Tool tool : chessTools.tools()) {
            byName.put(tool.getName(), tool);
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    public List<ToolDefinition> listTools() {
        return tools.values().stream()
            .map(Tool::getDefinition)
            .collect(Collectors.toList());
    }

    public ToolResult execute(String toolName, Map<String, Object> parameters) {
        Tool tool = tools.get(toolName);
        if (tool == null) {
            return ToolResult.failure("Unknown tool: " + toolName);
        }
        Map<String, Object> arguments = parameters == null ? Map.of() : parameters;

        for (String required : tool.getDefinition().getRequiredParameters()) {
            if (!arguments.containsKey(required) || arguments.get(required) == null) {
                return ToolResult.failure("Missing required parameter: " + required);
            }
        }
        for (ToolParameter parameter : tool.getDefinition().getParameters()) {
            Object value = arguments.get(parameter.getName());
            if (value != null && !parameter.getType().accepts(value)) {
                return ToolResult.failure("Invalid parameter type for " + parameter.getName() + ": expected "
                    + parameter.getType().getToken() + ", got " + describe(value));
            }
        }

        try {
            Object data = tool.getHandler().handle(new ToolArguments(arguments));
            if (data instanceof ToolResult) {
                return (ToolResult) data;
            }
            return ToolResult.ok(data);
        } catch (MatchException | PgnParseException | IllegalArgumentException e) {
            log.debug("Tool {} failed: {}", toolName, e.getMessage());
            return ToolResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Tool {} failed unexpectedly", toolName, e);
            return ToolResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private static String describe(Object value) {
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof List) {
            return "array";
        }
        if (value instanceof Map) {
            return "object";
        }
        return "string";
    }
}
