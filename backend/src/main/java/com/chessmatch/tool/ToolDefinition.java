package com.chessmatch.tool;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Name, description and parameter schema of a tool. Serialized with a JSON-schema style
 * {@code inputSchema} so agent clients can discover the tools.
 */
@Value
@Builder
public class ToolDefinition {
    String name;
    String description;
    @Singular
    @JsonIgnore
    List<ToolParameter> parameters;

    public Map<String, Object> getInputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ToolParameter parameter : parameters) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", parameter.getType().getToken());
            property.put("description", parameter.getDescription());
            if (!parameter.getAllowedValues().isEmpty()) {
                property.put("enum", parameter.getAllowedValues());
            }
            properties.put(parameter.getName(), property);
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", getRequiredParameters());
        return schema;
    }

    @JsonIgnore
    public List<String> getRequiredParameters() {
        return parameters.stream()
            .filter(ToolParameter::isRequired)
            .map(ToolParameter::getName)
            .collect(Collectors.toList());
    }
}
