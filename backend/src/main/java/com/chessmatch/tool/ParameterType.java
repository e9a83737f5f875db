package com.chessmatch.tool;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

public enum ParameterType {
    STRING(String.class),
    OBJECT(Map.class);

    private final Class<?> javaType;

    ParameterType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public boolean accepts(Object value) {
        return javaType.isInstance(value);
    }

    @JsonValue
    public String getToken() {
        return name().toLowerCase(Locale.ROOT);
    }
}
