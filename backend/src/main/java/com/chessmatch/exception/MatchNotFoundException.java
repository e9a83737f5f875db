package com.chessmatch.exception;

import lombok.Getter;

@Getter
public class MatchNotFoundException extends MatchException {

    private final String matchId;

    public MatchNotFoundException(String matchId) {
        super("Game not found: " + matchId);
        this.matchId = matchId;
    }
}
