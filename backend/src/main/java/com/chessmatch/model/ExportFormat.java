package com.chessmatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum ExportFormat {
    PGN,
    FEN;

    @JsonCreator
    public static ExportFormat parse(String token) {
        try {
            return valueOf(token.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported format: " + token + ". Use 'PGN' or 'FEN'", e);
        }
    }
}
