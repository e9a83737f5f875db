package com.chessmatch.model;

import com.chessmatch.chess.PlayerColor;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Move list of a match rendered in one of the {@link MoveHistoryFormat}s. The set of variants
 * is closed; each one carries only the entries its format defines.
 */
public abstract class MoveHistory {

    private MoveHistory() {
    }

    public abstract MoveHistoryFormat getFormat();

    public abstract int size();

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Algebraic extends MoveHistory {
        List<String> moves;

        @Override
        public MoveHistoryFormat getFormat() {
            return MoveHistoryFormat.ALGEBRAIC;
        }

        @Override
        public int size() {
            return moves.size();
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Uci extends MoveHistory {
        List<String> moves;

        @Override
        public MoveHistoryFormat getFormat() {
            return MoveHistoryFormat.UCI;
        }

        @Override
        public int size() {
            return moves.size();
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Verbose extends MoveHistory {
        List<VerboseMove> moves;

        @Override
        public MoveHistoryFormat getFormat() {
            return MoveHistoryFormat.VERBOSE;
        }

        @Override
        public int size() {
            return moves.size();
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class WithFen extends MoveHistory {
        List<PositionedMove> moves;

        @Override
        public MoveHistoryFormat getFormat() {
            return MoveHistoryFormat.WITH_FEN;
        }

        @Override
        public int size() {
            return moves.size();
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Detailed extends MoveHistory {
        List<DetailedMove> moves;

        @Override
        public MoveHistoryFormat getFormat() {
            return MoveHistoryFormat.DETAILED;
        }

        @Override
        public int size() {
            return moves.size();
        }
    }

    // ========== Entries ==========

    /** moveNumber is the full-move number, shared by a white move and the black reply. */
    @Value
    public static class VerboseMove {
        int moveNumber;
        PlayerColor color;
        String playerId;
        String move;
    }

    @Value
    public static class PositionedMove {
        int ply;
        String move;
        String fen;
    }

    @Value
    public static class DetailedMove {
        int ply;
        String move;
        String uci;
        String fen;
        boolean check;
        boolean capture;
        boolean castling;
        boolean promotion;
    }
}
