package com.chessmatch.chess;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Standard chess rules over a mailbox {@link Board}.
 */
@Component
@Slf4j
public class StandardRulesEngine implements RulesEngine {

    @Override
    public String startingPosition() {
        return Board.STARTING_FEN;
    }

    @Override
    public AppliedMove applyMove(String fen, String move) {
        Board board = Board.fromFen(fen);
        BoardMove resolved = MoveNotation.resolve(board, move);
        String san = board.san(resolved);

        Board next = board.copy();
        next.play(resolved);
        log.debug("Applied {} ({}) to {}", san, resolved.uci(), fen);

        return AppliedMove.builder()
            .san(san)
            .uci(resolved.uci())
            .fen(next.toFen())
            .capture(resolved.isCapture())
            .castling(resolved.isCastle())
            .promotion(resolved.isPromotion())
            .check(next.inCheck())
            .build();
    }

    @Override
    public MoveValidation validateMove(String fen, String move) {
        try {
            MoveNotation.resolve(Board.fromFen(fen), move);
            return MoveValidation.accepted();
        } catch (IllegalMoveException e) {
            return MoveValidation.rejected(e.getReason(), e.getSuggestion());
        }
    }

    @Override
    public List<String> legalMoves(String fen) {
        Board board = Board.fromFen(fen);
        List<BoardMove> legal = board.legalMoves();
        return legal.stream()
            .map(move -> board.san(move, legal))
            .collect(Collectors.toList());
    }

    @Override
    public List<String> legalMovesFrom(String fen, String square) {
        int from = Board.squareIndex(square);
        if (from < 0) {
            return List.of();
        }
        Board board = Board.fromFen(fen);
        List<BoardMove> legal = board.legalMoves();
        return legal.stream()
            .filter(move -> move.from == from)
            .map(move -> board.san(move, legal))
            .collect(Collectors.toList());
    }

    @Override
    public List<String> legalMovesUci(String fen) {
        return Board.fromFen(fen).legalMoves().stream()
            .map(BoardMove::uci)
            .collect(Collectors.toList());
    }

    @Override
    public PositionEvaluation evaluate(String fen) {
        Board board = Board.fromFen(fen);
        boolean check = board.inCheck();
        boolean noMoves = board.legalMoves().isEmpty();
        return PositionEvaluation.builder()
            .check(check)
            .checkmate(check && noMoves)
            .stalemate(!check && noMoves)
            .insufficientMaterial(board.hasInsufficientMaterial())
            .fiftyMoveRule(board.halfmoveClock() >= 100)
            .build();
    }

    @Override
    public int halfmoveClock(String fen) {
        return Board.fromFen(fen).halfmoveClock();
    }

    @Override
    public PlayerColor sideToMove(String fen) {
        return Board.fromFen(fen).sideToMove();
    }

    @Override
    public String renderBoard(String fen) {
        return Board.fromFen(fen).ascii();
    }

    @Override
    public String writePgn(Map<String, String> headers, List<String> moves, String result) {
        return PgnCodec.write(headers, moves, result);
    }

    @Override
    public PgnGame readPgn(String pgn) {
        PgnGame parsed = PgnCodec.read(pgn);
        String setup = parsed.getHeaders().get("FEN");
        if (setup != null && !setup.trim().equals(Board.STARTING_FEN)) {
            throw new PgnParseException("Games from a custom starting position are not supported");
        }

        Board board = Board.fromFen(Board.STARTING_FEN);
        List<String> moves = new ArrayList<>(parsed.getMoves().size());
        for (String token : parsed.getMoves()) {
            BoardMove move;
            try {
                move = MoveNotation.resolve(board, token);
            } catch (IllegalMoveException e) {
                throw new PgnParseException("Invalid move in PGN: " + token + " (" + e.getReason() + ")");
            }
            moves.add(board.san(move));
            board.play(move);
        }
        return new PgnGame(parsed.getHeaders(), moves, parsed.getResult());
    }
}
