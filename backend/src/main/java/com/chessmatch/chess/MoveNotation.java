package com.chessmatch.chess;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves move text against the legal moves of a board. Accepts SAN ({@code Nf3}, {@code exd5},
 * {@code e8=Q+}, {@code O-O}), over-disambiguated SAN ({@code Ngf3}) and coordinate notation
 * ({@code e2e4}, {@code e7e8q}).
 */
final class MoveNotation {

    private static final Pattern COORDINATE =
        Pattern.compile("^([a-h][1-8])-?([a-h][1-8])=?([qrbnQRBN])?$");
    private static final Pattern SAN =
        Pattern.compile("^([NBRQK])?([a-h])?([1-8])?(x)?([a-h][1-8])(?:=?([NBRQ]))?$");
    private static final Pattern CASTLE_KINGSIDE = Pattern.compile("^[O0]-[O0]$");
    private static final Pattern CASTLE_QUEENSIDE = Pattern.compile("^[O0]-[O0]-[O0]$");
    private static final int SUGGESTION_LIMIT = 5;

    private MoveNotation() {
    }

    static BoardMove resolve(Board board, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalMoveException("Invalid notation: move is empty",
                "Use algebraic notation (e.g., e4, Nf3) or coordinate notation (e.g., e2e4)");
        }
        String cleaned = text.trim().replaceAll("[+#!?]+$", "");
        List<BoardMove> legal = board.legalMoves();

        if (CASTLE_KINGSIDE.matcher(cleaned).matches()) {
            return single(board, text, legal, filter(legal, BoardMove.CASTLE_KINGSIDE));
        }
        if (CASTLE_QUEENSIDE.matcher(cleaned).matches()) {
            return single(board, text, legal, filter(legal, BoardMove.CASTLE_QUEENSIDE));
        }

        Matcher coordinate = COORDINATE.matcher(cleaned);
        if (coordinate.matches()) {
            int from = Board.squareIndex(coordinate.group(1));
            int to = Board.squareIndex(coordinate.group(2));
            String promotion = coordinate.group(3);
            List<BoardMove> candidates = new ArrayList<>();
            for (BoardMove move : legal) {
                if (move.from == from && move.to == to && promotionMatches(move, promotion)) {
                    candidates.add(move);
                }
            }
            return single(board, text, legal, candidates);
        }

        Matcher san = SAN.matcher(cleaned);
        if (san.matches()) {
            char type = san.group(1) == null ? 'P' : san.group(1).charAt(0);
            String fromFile = san.group(2);
            String fromRank = san.group(3);
            boolean capture = san.group(4) != null;
            int to = Board.squareIndex(san.group(5));
            String promotion = san.group(6);
            List<BoardMove> candidates = new ArrayList<>();
            for (BoardMove move : legal) {
                if (move.pieceType() != type || move.to != to || move.isCastle()) {
                    continue;
                }
                if (capture && !move.isCapture()) {
                    continue;
                }
                // pawns name their origin file exactly when capturing
                if (type == 'P' && (fromFile != null) != move.isCapture()) {
                    continue;
                }
                String origin = Board.squareName(move.from);
                if (fromFile != null && origin.charAt(0) != fromFile.charAt(0)) {
                    continue;
                }
                if (fromRank != null && origin.charAt(1) != fromRank.charAt(0)) {
                    continue;
                }
                if (promotionMatches(move, promotion)) {
                    candidates.add(move);
                }
            }
            return single(board, text, legal, candidates);
        }

        throw new IllegalMoveException("Invalid notation: \"" + text + "\"",
            "Use algebraic notation (e.g., e4, Nf3) or coordinate notation (e.g., e2e4)");
    }

    static String suggest(Board board, List<BoardMove> legal) {
        if (legal.isEmpty()) {
            return "No legal moves available";
        }
        String moves = legal.stream()
            .limit(SUGGESTION_LIMIT)
            .map(move -> board.san(move, legal))
            .collect(Collectors.joining(", "));
        return "Try one of: " + moves + (legal.size() > SUGGESTION_LIMIT ? "..." : "");
    }

    private static BoardMove single(Board board, String text, List<BoardMove> legal, List<BoardMove> candidates) {
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        if (candidates.isEmpty()) {
            throw new IllegalMoveException("Move \"" + text + "\" is not legal in current position",
                suggest(board, legal));
        }
        String options = candidates.stream()
            .map(move -> board.san(move, legal))
            .collect(Collectors.joining(", "));
        throw new IllegalMoveException("Move \"" + text + "\" is ambiguous", "Specify one of: " + options);
    }

    private static List<BoardMove> filter(List<BoardMove> legal, int kind) {
        List<BoardMove> matching = new ArrayList<>();
        for (BoardMove move : legal) {
            if (move.kind == kind) {
                matching.add(move);
            }
        }
        return matching;
    }

    private static boolean promotionMatches(BoardMove move, String promotion) {
        if (promotion == null) {
            return !move.isPromotion();
        }
        return move.isPromotion()
            && Character.toUpperCase(move.promotion) == Character.toUpperCase(promotion.charAt(0));
    }
}
