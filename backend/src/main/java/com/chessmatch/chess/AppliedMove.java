package com.chessmatch.chess;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a move accepted by the rules engine.
 */
@Value
@Builder
public class AppliedMove {
    String san;
    String uci;
    String fen;
    boolean capture;
    boolean castling;
    boolean promotion;
    boolean check;
}
