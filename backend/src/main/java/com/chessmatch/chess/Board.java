package com.chessmatch.chess;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Mutable 8x8 mailbox board. Squares are indexed {@code rank * 8 + file} with a1 = 0 and
 * h8 = 63; pieces are stored as FEN letters and empty squares as {@link #EMPTY}.
 *
 * <p>Not thread-safe. {@link StandardRulesEngine} builds a fresh board from FEN for every call.
 */
final class Board {

    static final char EMPTY = '.';
    static final String STARTING_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private static final int[][] KNIGHT_STEPS = {
        {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };
    private static final int[][] KING_STEPS = {
        {1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}
    };
    private static final int[][] ROOK_DIRECTIONS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    private static final int[][] BISHOP_DIRECTIONS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    private static final char[] PROMOTION_PIECES = {'Q', 'R', 'B', 'N'};

    private final char[] squares = new char[64];
    private PlayerColor sideToMove = PlayerColor.WHITE;
    private boolean whiteKingside;
    private boolean whiteQueenside;
    private boolean blackKingside;
    private boolean blackQueenside;
    private int enPassantSquare = -1;
    private int halfmoveClock;
    private int fullmoveNumber = 1;

    private Board() {
        Arrays.fill(squares, EMPTY);
    }

    // ========== FEN ==========

    static Board fromFen(String fen) {
        if (fen == null || fen.isBlank()) {
            throw new IllegalArgumentException("Invalid FEN: position is empty");
        }
        String[] fields = fen.trim().split("\\s+");
        if (fields.length != 4 && fields.length != 6) {
            throw invalidFen(fen, "expected 6 space-separated fields");
        }

        Board board = new Board();
        String[] ranks = fields[0].split("/");
        if (ranks.length != 8) {
            throw invalidFen(fen, "expected 8 ranks");
        }
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char c : ranks[i].toCharArray()) {
                if (c >= '1' && c <= '8') {
                    file += c - '0';
                } else if ("PNBRQKpnbrqk".indexOf(c) >= 0) {
                    if (file > 7) {
                        throw invalidFen(fen, "rank " + (rank + 1) + " has more than 8 squares");
                    }
                    board.squares[rank * 8 + file] = c;
                    file++;
                } else {
                    throw invalidFen(fen, "unknown piece '" + c + "'");
                }
            }
            if (file != 8) {
                throw invalidFen(fen, "rank " + (rank + 1) + " does not have 8 squares");
            }
        }

        if (!fields[1].equals("w") && !fields[1].equals("b")) {
            throw invalidFen(fen, "side to move must be 'w' or 'b'");
        }
        board.sideToMove = PlayerColor.fromFenToken(fields[1]);

        if (!fields[2].equals("-")) {
            for (char c : fields[2].toCharArray()) {
                switch (c) {
                    case 'K':
                        board.whiteKingside = true;
                        break;
                    case 'Q':
                        board.whiteQueenside = true;
                        break;
                    case 'k':
                        board.blackKingside = true;
                        break;
                    case 'q':
                        board.blackQueenside = true;
                        break;
                    default:
                        throw invalidFen(fen, "bad castling field '" + fields[2] + "'");
                }
            }
        }

        if (!fields[3].equals("-")) {
            int ep = squareIndex(fields[3]);
            if (ep < 0 || (ep / 8 != 2 && ep / 8 != 5)) {
                throw invalidFen(fen, "bad en passant square '" + fields[3] + "'");
            }
            board.enPassantSquare = ep;
        }

        if (fields.length == 6) {
            try {
                board.halfmoveClock = Integer.parseInt(fields[4]);
                board.fullmoveNumber = Integer.parseInt(fields[5]);
            } catch (NumberFormatException e) {
                throw invalidFen(fen, "move counters must be numbers");
            }
            if (board.halfmoveClock < 0 || board.fullmoveNumber < 1) {
                throw invalidFen(fen, "move counters out of range");
            }
        }

        if (board.count('K') != 1 || board.count('k') != 1) {
            throw invalidFen(fen, "each side needs exactly one king");
        }
        return board;
    }

    String toFen() {
        StringBuilder fen = new StringBuilder();
        for (int rank = 7; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < 8; file++) {
                char piece = squares[rank * 8 + file];
                if (piece == EMPTY) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    fen.append(empty);
                    empty = 0;
                }
                fen.append(piece);
            }
            if (empty > 0) {
                fen.append(empty);
            }
            if (rank > 0) {
                fen.append('/');
            }
        }

        StringBuilder castling = new StringBuilder();
        if (whiteKingside) castling.append('K');
        if (whiteQueenside) castling.append('Q');
        if (blackKingside) castling.append('k');
        if (blackQueenside) castling.append('q');

        fen.append(' ').append(sideToMove.getFenToken())
            .append(' ').append(castling.length() == 0 ? "-" : castling)
            .append(' ').append(enPassantField())
            .append(' ').append(halfmoveClock)
            .append(' ').append(fullmoveNumber);
        return fen.toString();
    }

    // The target square is only written when a pawn of the side to move stands ready to take
    // en passant, so positions that differ only by an unusable target compare equal.
    private String enPassantField() {
        if (enPassantSquare < 0) {
            return "-";
        }
        int file = enPassantSquare % 8;
        int capturerRank = enPassantSquare / 8 - forward(sideToMove);
        char pawn = pieceOf('P', sideToMove);
        for (int df = -1; df <= 1; df += 2) {
            int from = at(file + df, capturerRank);
            if (from >= 0 && squares[from] == pawn) {
                return squareName(enPassantSquare);
            }
        }
        return "-";
    }

    Board copy() {
        Board copy = new Board();
        System.arraycopy(squares, 0, copy.squares, 0, 64);
        copy.sideToMove = sideToMove;
        copy.whiteKingside = whiteKingside;
        copy.whiteQueenside = whiteQueenside;
        copy.blackKingside = blackKingside;
        copy.blackQueenside = blackQueenside;
        copy.enPassantSquare = enPassantSquare;
        copy.halfmoveClock = halfmoveClock;
        copy.fullmoveNumber = fullmoveNumber;
        return copy;
    }

    PlayerColor sideToMove() {
        return sideToMove;
    }

    int halfmoveClock() {
        return halfmoveClock;
    }

    // ========== Move generation ==========

    List<BoardMove> legalMoves() {
        List<BoardMove> pseudo = new ArrayList<>();
        for (int sq = 0; sq < 64; sq++) {
            char piece = squares[sq];
            if (!belongsTo(piece, sideToMove)) {
                continue;
            }
            switch (Character.toUpperCase(piece)) {
                case 'P':
                    addPawnMoves(sq, piece, pseudo);
                    break;
                case 'N':
                    addSteps(sq, piece, KNIGHT_STEPS, pseudo);
                    break;
                case 'B':
                    addSlides(sq, piece, BISHOP_DIRECTIONS, pseudo);
                    break;
                case 'R':
                    addSlides(sq, piece, ROOK_DIRECTIONS, pseudo);
                    break;
                case 'Q':
                    addSlides(sq, piece, ROOK_DIRECTIONS, pseudo);
                    addSlides(sq, piece, BISHOP_DIRECTIONS, pseudo);
                    break;
                default:
                    addSteps(sq, piece, KING_STEPS, pseudo);
                    addCastles(sq, piece, pseudo);
                    break;
            }
        }

        PlayerColor mover = sideToMove;
        List<BoardMove> legal = new ArrayList<>(pseudo.size());
        for (BoardMove move : pseudo) {
            Board next = copy();
            next.play(move);
            if (!next.isAttacked(next.kingSquare(mover), mover.opposite())) {
                legal.add(move);
            }
        }
        return legal;
    }

    private void addPawnMoves(int sq, char pawn, List<BoardMove> out) {
        int dir = forward(sideToMove);
        int file = sq % 8;
        int rank = sq / 8;
        int startRank = sideToMove == PlayerColor.WHITE ? 1 : 6;

        int one = at(file, rank + dir);
        if (one >= 0 && squares[one] == EMPTY) {
            addPawnAdvance(sq, one, pawn, EMPTY, out);
            int two = at(file, rank + 2 * dir);
            if (rank == startRank && squares[two] == EMPTY) {
                out.add(new BoardMove(sq, two, pawn, EMPTY, EMPTY, BoardMove.DOUBLE_PUSH));
            }
        }

        for (int df = -1; df <= 1; df += 2) {
            int target = at(file + df, rank + dir);
            if (target < 0) {
                continue;
            }
            if (belongsTo(squares[target], sideToMove.opposite())) {
                addPawnAdvance(sq, target, pawn, squares[target], out);
            } else if (target == enPassantSquare && squares[target] == EMPTY) {
                char victim = pieceOf('P', sideToMove.opposite());
                if (squares[at(file + df, rank)] == victim) {
                    out.add(new BoardMove(sq, target, pawn, victim, EMPTY, BoardMove.EN_PASSANT));
                }
            }
        }
    }

    private void addPawnAdvance(int from, int to, char pawn, char captured, List<BoardMove> out) {
        int lastRank = sideToMove == PlayerColor.WHITE ? 7 : 0;
        if (to / 8 != lastRank) {
            out.add(new BoardMove(from, to, pawn, captured, EMPTY, BoardMove.NORMAL));
            return;
        }
        for (char promotion : PROMOTION_PIECES) {
            out.add(new BoardMove(from, to, pawn, captured, pieceOf(promotion, sideToMove), BoardMove.NORMAL));
        }
    }

    private void addSteps(int sq, char piece, int[][] steps, List<BoardMove> out) {
        for (int[] step : steps) {
            int target = at(sq % 8 + step[0], sq / 8 + step[1]);
            if (target < 0 || belongsTo(squares[target], sideToMove)) {
                continue;
            }
            out.add(new BoardMove(sq, target, piece, squares[target], EMPTY, BoardMove.NORMAL));
        }
    }

    private void addSlides(int sq, char piece, int[][] directions, List<BoardMove> out) {
        for (int[] dir : directions) {
            int file = sq % 8 + dir[0];
            int rank = sq / 8 + dir[1];
            int target = at(file, rank);
            while (target >= 0) {
                char occupant = squares[target];
                if (belongsTo(occupant, sideToMove)) {
                    break;
                }
                out.add(new BoardMove(sq, target, piece, occupant, EMPTY, BoardMove.NORMAL));
                if (occupant != EMPTY) {
                    break;
                }
                file += dir[0];
                rank += dir[1];
                target = at(file, rank);
            }
        }
    }

    private void addCastles(int sq, char king, List<BoardMove> out) {
        PlayerColor enemy = sideToMove.opposite();
        if (king == 'K' && sq == 4) {
            if (whiteKingside && squares[7] == 'R' && squares[5] == EMPTY && squares[6] == EMPTY
                && !isAttacked(4, enemy) && !isAttacked(5, enemy) && !isAttacked(6, enemy)) {
                out.add(new BoardMove(4, 6, king, EMPTY, EMPTY, BoardMove.CASTLE_KINGSIDE));
            }
            if (whiteQueenside && squares[0] == 'R' && squares[1] == EMPTY && squares[2] == EMPTY
                && squares[3] == EMPTY && !isAttacked(4, enemy) && !isAttacked(3, enemy)
                && !isAttacked(2, enemy)) {
                out.add(new BoardMove(4, 2, king, EMPTY, EMPTY, BoardMove.CASTLE_QUEENSIDE));
            }
        } else if (king == 'k' && sq == 60) {
            if (blackKingside && squares[63] == 'r' && squares[61] == EMPTY && squares[62] == EMPTY
                && !isAttacked(60, enemy) && !isAttacked(61, enemy) && !isAttacked(62, enemy)) {
                out.add(new BoardMove(60, 62, king, EMPTY, EMPTY, BoardMove.CASTLE_KINGSIDE));
            }
            if (blackQueenside && squares[56] == 'r' && squares[57] == EMPTY && squares[58] == EMPTY
                && squares[59] == EMPTY && !isAttacked(60, enemy) && !isAttacked(59, enemy)
                && !isAttacked(58, enemy)) {
                out.add(new BoardMove(60, 58, king, EMPTY, EMPTY, BoardMove.CASTLE_QUEENSIDE));
            }
        }
    }

    void play(BoardMove move) {
        PlayerColor mover = sideToMove;
        squares[move.from] = EMPTY;
        squares[move.to] = move.isPromotion() ? move.promotion : move.piece;

        if (move.kind == BoardMove.EN_PASSANT) {
            squares[move.to - 8 * forward(mover)] = EMPTY;
        } else if (move.kind == BoardMove.CASTLE_KINGSIDE) {
            squares[move.to - 1] = squares[move.to + 1];
            squares[move.to + 1] = EMPTY;
        } else if (move.kind == BoardMove.CASTLE_QUEENSIDE) {
            squares[move.to + 1] = squares[move.to - 2];
            squares[move.to - 2] = EMPTY;
        }

        if (move.piece == 'K') {
            whiteKingside = false;
            whiteQueenside = false;
        } else if (move.piece == 'k') {
            blackKingside = false;
            blackQueenside = false;
        }
        revokeCastlingAt(move.from);
        revokeCastlingAt(move.to);

        enPassantSquare = move.kind == BoardMove.DOUBLE_PUSH ? (move.from + move.to) / 2 : -1;
        halfmoveClock = move.pieceType() == 'P' || move.isCapture() ? 0 : halfmoveClock + 1;
        if (mover == PlayerColor.BLACK) {
            fullmoveNumber++;
        }
        sideToMove = mover.opposite();
    }

    private void revokeCastlingAt(int sq) {
        switch (sq) {
            case 0:
                whiteQueenside = false;
                break;
            case 7:
                whiteKingside = false;
                break;
            case 56:
                blackQueenside = false;
                break;
            case 63:
                blackKingside = false;
                break;
            default:
                break;
        }
    }

    // ========== Attacks & status ==========

    boolean isAttacked(int sq, PlayerColor by) {
        int file = sq % 8;
        int rank = sq / 8;

        char pawn = pieceOf('P', by);
        for (int df = -1; df <= 1; df += 2) {
            int from = at(file + df, rank - forward(by));
            if (from >= 0 && squares[from] == pawn) {
                return true;
            }
        }
        if (stepAttack(file, rank, KNIGHT_STEPS, pieceOf('N', by))
            || stepAttack(file, rank, KING_STEPS, pieceOf('K', by))) {
            return true;
        }
        return slideAttack(file, rank, ROOK_DIRECTIONS, pieceOf('R', by), pieceOf('Q', by))
            || slideAttack(file, rank, BISHOP_DIRECTIONS, pieceOf('B', by), pieceOf('Q', by));
    }

    private boolean stepAttack(int file, int rank, int[][] steps, char attacker) {
        for (int[] step : steps) {
            int from = at(file + step[0], rank + step[1]);
            if (from >= 0 && squares[from] == attacker) {
                return true;
            }
        }
        return false;
    }

    private boolean slideAttack(int file, int rank, int[][] directions, char slider, char queen) {
        for (int[] dir : directions) {
            int f = file + dir[0];
            int r = rank + dir[1];
            int from = at(f, r);
            while (from >= 0) {
                char occupant = squares[from];
                if (occupant == slider || occupant == queen) {
                    return true;
                }
                if (occupant != EMPTY) {
                    break;
                }
                f += dir[0];
                r += dir[1];
                from = at(f, r);
            }
        }
        return false;
    }

    boolean inCheck() {
        return isAttacked(kingSquare(sideToMove), sideToMove.opposite());
    }

    /**
     * Bare kings, a single minor piece, or any number of bishops all standing on squares of
     * one colour.
     */
    boolean hasInsufficientMaterial() {
        int knights = 0;
        int bishops = 0;
        int bishopSquareColors = 0;
        for (int sq = 0; sq < 64; sq++) {
            char type = Character.toUpperCase(squares[sq]);
            if (squares[sq] == EMPTY || type == 'K') {
                continue;
            }
            if (type == 'N') {
                knights++;
            } else if (type == 'B') {
                bishops++;
                bishopSquareColors |= 1 << ((sq % 8 + sq / 8) % 2);
            } else {
                return false;
            }
        }
        if (knights + bishops <= 1) {
            return true;
        }
        return knights == 0 && bishopSquareColors != 3;
    }

    // ========== Notation ==========

    String san(BoardMove move) {
        return san(move, legalMoves());
    }

    String san(BoardMove move, List<BoardMove> legal) {
        StringBuilder san = new StringBuilder();
        if (move.kind == BoardMove.CASTLE_KINGSIDE) {
            san.append("O-O");
        } else if (move.kind == BoardMove.CASTLE_QUEENSIDE) {
            san.append("O-O-O");
        } else if (move.pieceType() == 'P') {
            if (move.isCapture()) {
                san.append(squareName(move.from).charAt(0)).append('x');
            }
            san.append(squareName(move.to));
            if (move.isPromotion()) {
                san.append('=').append(Character.toUpperCase(move.promotion));
            }
        } else {
            san.append(move.pieceType()).append(disambiguation(move, legal));
            if (move.isCapture()) {
                san.append('x');
            }
            san.append(squareName(move.to));
        }

        Board after = copy();
        after.play(move);
        if (after.inCheck()) {
            san.append(after.legalMoves().isEmpty() ? '#' : '+');
        }
        return san.toString();
    }

    private String disambiguation(BoardMove move, List<BoardMove> legal) {
        boolean ambiguous = false;
        boolean sameFile = false;
        boolean sameRank = false;
        for (BoardMove other : legal) {
            if (other.from == move.from || other.to != move.to || other.piece != move.piece) {
                continue;
            }
            ambiguous = true;
            sameFile |= other.from % 8 == move.from % 8;
            sameRank |= other.from / 8 == move.from / 8;
        }
        if (!ambiguous) {
            return "";
        }
        String from = squareName(move.from);
        if (!sameFile) {
            return from.substring(0, 1);
        }
        return sameRank ? from : from.substring(1);
    }

    String ascii() {
        StringBuilder out = new StringBuilder("   +------------------------+\n");
        for (int rank = 7; rank >= 0; rank--) {
            out.append(' ').append(rank + 1).append(" |");
            for (int file = 0; file < 8; file++) {
                out.append(' ').append(squares[rank * 8 + file]).append(' ');
            }
            out.append("|\n");
        }
        out.append("   +------------------------+\n");
        out.append("     a  b  c  d  e  f  g  h");
        return out.toString();
    }

    // ========== Helpers ==========

    static String squareName(int sq) {
        return "" + (char) ('a' + sq % 8) + (char) ('1' + sq / 8);
    }

    static int squareIndex(String name) {
        if (name == null || name.length() != 2) {
            return -1;
        }
        int file = name.charAt(0) - 'a';
        int rank = name.charAt(1) - '1';
        return at(file, rank);
    }

    private static int at(int file, int rank) {
        return file < 0 || file > 7 || rank < 0 || rank > 7 ? -1 : rank * 8 + file;
    }

    private static int forward(PlayerColor color) {
        return color == PlayerColor.WHITE ? 1 : -1;
    }

    private static char pieceOf(char type, PlayerColor color) {
        return color == PlayerColor.WHITE ? type : Character.toLowerCase(type);
    }

    private static boolean belongsTo(char piece, PlayerColor color) {
        return piece != EMPTY && Character.isUpperCase(piece) == (color == PlayerColor.WHITE);
    }

    private int kingSquare(PlayerColor color) {
        char king = pieceOf('K', color);
        for (int sq = 0; sq < 64; sq++) {
            if (squares[sq] == king) {
                return sq;
            }
        }
        throw new IllegalStateException("No " + color.getLabel() + " king on the board");
    }

    private int count(char piece) {
        int n = 0;
        for (char c : squares) {
            if (c == piece) {
                n++;
            }
        }
        return n;
    }

    private static IllegalArgumentException invalidFen(String fen, String detail) {
        return new IllegalArgumentException("Invalid FEN '" + fen + "': " + detail);
    }
}
