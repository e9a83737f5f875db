package com.chessmatch.exception;

import lombok.Getter;

import java.util.Optional;

/**
 * The rules engine rejected a move. Carries the engine's reason and, where one could be
 * derived, a hint listing legal alternatives.
 */
public class InvalidMoveException extends MatchException {

    @Getter
    private final String move;
    private final String suggestion;

    public InvalidMoveException(String move, String reason, String suggestion) {
        super(reason);
        this.move = move;
        this.suggestion = suggestion;
    }

    public Optional<String> getSuggestion() {
        return Optional.ofNullable(suggestion);
    }
}
