package com.chessmatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TimeControlType {
    UNLIMITED,
    FIXED,
    FISCHER;

    @JsonValue
    public String getToken() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TimeControlType parse(String token) {
        return valueOf(token.trim().toUpperCase(Locale.ROOT));
    }
}
