package com.chessmatch.model;

import com.chessmatch.chess.PlayerColor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BoardState {
    String gameId;
    String fen;
    String board;
    PlayerColor currentTurn;
    int moveNumber;
    boolean check;
    List<String> legalMoves;
    MatchStatus status;
}
