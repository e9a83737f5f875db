package com.chessmatch.exception;

/**
 * Base type for failures surfaced to callers of the match API. None of them is retried by the
 * service itself.
 */
public abstract class MatchException extends RuntimeException {

    protected MatchException(String message) {
        super(message);
    }

    protected MatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
