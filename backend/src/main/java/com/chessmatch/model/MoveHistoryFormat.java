package com.chessmatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum MoveHistoryFormat {
    ALGEBRAIC,
    UCI,
    VERBOSE,
    WITH_FEN,
    DETAILED;

    @JsonCreator
    public static MoveHistoryFormat parse(String token) {
        try {
            return valueOf(token.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid format: " + token
                + ". Must be 'algebraic', 'UCI', 'verbose', 'with_fen', or 'detailed'", e);
        }
    }
}
