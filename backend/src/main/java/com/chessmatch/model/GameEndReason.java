package com.chessmatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GameEndReason {
    CHECKMATE,
    RESIGNATION,
    DRAW_AGREEMENT,
    STALEMATE,
    INSUFFICIENT_MATERIAL,
    FIFTY_MOVE_RULE,
    // Result set by an explicit completion call or taken from an imported transcript.
    DECLARED;

    @JsonValue
    public String getToken() {
        return name().toLowerCase(Locale.ROOT);
    }
}
