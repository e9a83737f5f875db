package com.chessmatch.model;

import lombok.Builder;
import lombok.Value;

/**
 * Advisory draw bookkeeping for an active match. The flags warn callers; they never end the
 * game by themselves.
 */
@Value
@Builder
public class DrawStatus {
    int halfmoveClock;
    int movesUntilFiftyMove;
    int repetitionCount;
    boolean approachingFiftyMove;
    boolean approachingRepetition;
}
