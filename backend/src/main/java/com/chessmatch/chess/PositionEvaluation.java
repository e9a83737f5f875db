package com.chessmatch.chess;

import lombok.Builder;
import lombok.Value;

/**
 * Terminal-condition flags for a single position. The engine is stateless, so repetition is
 * not among them; callers that keep a game history track it themselves.
 */
@Value
@Builder
public class PositionEvaluation {
    boolean check;
    boolean checkmate;
    boolean stalemate;
    boolean insufficientMaterial;
    boolean fiftyMoveRule;

    public boolean isGameOver() {
        return checkmate || isDraw();
    }

    public boolean isDraw() {
        return stalemate || insufficientMaterial || fiftyMoveRule;
    }
}
