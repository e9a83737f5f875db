package com.chessmatch.model;

import com.chessmatch.chess.PlayerColor;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Final result of a match, written in PGN notation. The web tokens ({@code white_wins} ...)
 * are accepted as input aliases.
 */
public enum GameResult {
    WHITE_WINS("1-0", "white_wins"),
    BLACK_WINS("0-1", "black_wins"),
    DRAW("1/2-1/2", "draw");

    private final String notation;
    private final String webToken;

    GameResult(String notation, String webToken) {
        this.notation = notation;
        this.webToken = webToken;
    }

    @JsonValue
    public String getNotation() {
        return notation;
    }

    public String getWebToken() {
        return webToken;
    }

    public static GameResult winFor(PlayerColor color) {
        return color == PlayerColor.WHITE ? WHITE_WINS : BLACK_WINS;
    }

    public static Optional<GameResult> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String trimmed = token.trim();
        for (GameResult result : values()) {
            if (result.notation.equals(trimmed) || result.webToken.equalsIgnoreCase(trimmed)
                || result.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static GameResult parse(String token) {
        return fromToken(token)
            .orElseThrow(() -> new IllegalArgumentException("Unknown game result: " + token));
    }
}
