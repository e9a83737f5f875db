package com.chessmatch.exception;

import lombok.Getter;

@Getter
public class CapacityExceededException extends MatchException {

    private final int ceiling;

    public CapacityExceededException(int ceiling) {
        super("Maximum number of concurrent games (" + ceiling + ") reached");
        this.ceiling = ceiling;
    }
}
