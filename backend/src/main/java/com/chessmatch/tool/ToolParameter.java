package com.chessmatch.tool;

import lombok.Value;

import java.util.List;

@Value
public class ToolParameter {
    String name;
    ParameterType type;
    String description;
    boolean required;
    List<String> allowedValues;

    public static ToolParameter required(String name, String description) {
        return new ToolParameter(name, ParameterType.STRING, description, true, List.of());
    }

    public static ToolParameter optional(String name, String description) {
        return new ToolParameter(name, ParameterType.STRING, description, false, List.of());
    }

    public static ToolParameter optional(String name, String description, List<String> allowedValues) {
        return new ToolParameter(name, ParameterType.STRING, description, false, List.copyOf(allowedValues));
    }

    public static ToolParameter object(String name, String description) {
        return new ToolParameter(name, ParameterType.OBJECT, description, false, List.of());
    }
}
