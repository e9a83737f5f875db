package com.chessmatch.tool;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Arguments of a single tool call, already checked against the tool's declared parameters.
 */
public class ToolArguments {

    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Collections.emptyMap() : values;
    }

    public String string(String name) {
        return optionalString(name)
            .orElseThrow(() -> new IllegalArgumentException("Missing required parameter: " + name));
    }

    public Optional<String> optionalString(String name) {
        Object value = values.get(name);
        if (value instanceof String && !((String) value).isBlank()) {
            return Optional.of((String) value);
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> object(String name) {
        Object value = values.get(name);
        return value instanceof Map ? Optional.of((Map<String, Object>) value) : Optional.empty();
    }
}
