package com.chessmatch.chess;

/**
 * A fully resolved move on a {@link Board}: origin, destination, the moving piece and whatever
 * it displaces. Pieces use FEN letters (upper case for white).
 */
final class BoardMove {

    static final int NORMAL = 0;
    static final int DOUBLE_PUSH = 1;
    static final int EN_PASSANT = 2;
    static final int CASTLE_KINGSIDE = 3;
    static final int CASTLE_QUEENSIDE = 4;

    final int from;
    final int to;
    final char piece;
    final char captured;
    final char promotion;
    final int kind;

    BoardMove(int from, int to, char piece, char captured, char promotion, int kind) {
        this.from = from;
        this.to = to;
        this.piece = piece;
        this.captured = captured;
        this.promotion = promotion;
        this.kind = kind;
    }

    boolean isCapture() {
        return captured != Board.EMPTY;
    }

    boolean isCastle() {
        return kind == CASTLE_KINGSIDE || kind == CASTLE_QUEENSIDE;
    }

    boolean isPromotion() {
        return promotion != Board.EMPTY;
    }

    char pieceType() {
        return Character.toUpperCase(piece);
    }

    String uci() {
        String uci = Board.squareName(from) + Board.squareName(to);
        return isPromotion() ? uci + Character.toLowerCase(promotion) : uci;
    }
}
