package com.chessmatch.exception;

import lombok.Getter;

/**
 * A stored match could not be rebuilt. The record stays unusable until repaired out of band;
 * other records are unaffected.
 */
@Getter
public class CorruptStateException extends MatchException {

    private final String matchId;

    public CorruptStateException(String matchId, String detail) {
        super("Stored game " + matchId + " is corrupt: " + detail);
        this.matchId = matchId;
    }

    public CorruptStateException(String matchId, String detail, Throwable cause) {
        super("Stored game " + matchId + " is corrupt: " + detail, cause);
        this.matchId = matchId;
    }
}
