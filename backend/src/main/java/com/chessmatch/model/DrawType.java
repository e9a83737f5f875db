package com.chessmatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DrawType {
    STALEMATE("Draw by stalemate"),
    INSUFFICIENT_MATERIAL("Draw by insufficient material"),
    FIFTY_MOVE("Draw by the fifty-move rule"),
    AGREEMENT("Draw by mutual agreement");

    private final String description;

    DrawType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @JsonValue
    public String getToken() {
        return name().toLowerCase(Locale.ROOT);
    }
}
