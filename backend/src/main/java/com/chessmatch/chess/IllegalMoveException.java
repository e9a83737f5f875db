package com.chessmatch.chess;

import lombok.Getter;

/**
 * Raised by the rules engine when a move cannot be parsed or is not legal in the given position.
 */
@Getter
public class IllegalMoveException extends RuntimeException {

    private final String reason;
    private final String suggestion;

    public IllegalMoveException(String reason, String suggestion) {
        super(reason);
        this.reason = reason;
        this.suggestion = suggestion;
    }
}
