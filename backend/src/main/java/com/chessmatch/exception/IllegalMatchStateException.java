package com.chessmatch.exception;

/**
 * The operation is not allowed in the match's current status, or for the given participant.
 */
public class IllegalMatchStateException extends MatchException {

    public IllegalMatchStateException(String message) {
        super(message);
    }
}
