package com.chessmatch.chess;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlayerColor {
    WHITE("w", "white"),
    BLACK("b", "black");

    private final String fenToken;
    private final String label;

    PlayerColor(String fenToken, String label) {
        this.fenToken = fenToken;
        this.label = label;
    }

    public String getFenToken() {
        return fenToken;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public PlayerColor opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    public static PlayerColor fromFenToken(String token) {
        for (PlayerColor color : values()) {
            if (color.fenToken.equals(token)) {
                return color;
            }
        }
        throw new IllegalArgumentException("Unknown side to move: " + token);
    }
}
