package com.chessmatch.chess;

import java.util.List;
import java.util.Map;

/**
 * Chess rules capability consumed by the match layer: legality, move application, position
 * and game notation. Every call takes the position as FEN and keeps no state between calls.
 *
 * <p>Malformed FEN is reported with {@link IllegalArgumentException}; rejected moves with
 * {@link IllegalMoveException}; unreadable game transcripts with {@link PgnParseException}.
 */
public interface RulesEngine {

    String startingPosition();

    /**
     * Applies {@code move} (SAN or coordinate notation) to {@code fen}.
     *
     * @throws IllegalMoveException if the move cannot be parsed or is not legal
     */
    AppliedMove applyMove(String fen, String move);

    MoveValidation validateMove(String fen, String move);

    List<String> legalMoves(String fen);

    /**
     * Legal moves, in SAN, of the piece standing on {@code square}. Empty for an empty square,
     * an opponent's piece or a malformed square name.
     */
    List<String> legalMovesFrom(String fen, String square);

    List<String> legalMovesUci(String fen);

    PositionEvaluation evaluate(String fen);

    int halfmoveClock(String fen);

    PlayerColor sideToMove(String fen);

    String renderBoard(String fen);

    /**
     * Writes a transcript of {@code moves} played from the standard opening position.
     */
    String writePgn(Map<String, String> headers, List<String> moves, String result);

    /**
     * Reads a transcript and replays it from the standard opening position.
     *
     * @throws PgnParseException if the text is malformed or any move is illegal
     */
    PgnGame readPgn(String pgn);
}
