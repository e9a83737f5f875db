package com.chessmatch.chess;

public class PgnParseException extends RuntimeException {

    public PgnParseException(String message) {
        super(message);
    }
}
