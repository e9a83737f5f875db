package com.chessmatch.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Summary of a transcript import. {@code result} is the PGN token, {@code *} when the imported
 * game is still in progress.
 */
@Value
@Builder
public class ImportResult {
    String gameId;
    int moves;
    String finalPosition;
    String result;
    MatchStatus status;
    boolean valid;
    @Singular
    List<String> warnings;
}
