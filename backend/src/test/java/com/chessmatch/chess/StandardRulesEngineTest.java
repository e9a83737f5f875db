package com.chessmatch.chess;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StandardRulesEngineTest {

    private final StandardRulesEngine engine = new StandardRulesEngine();

    @Test
    void openingPositionHasTwentyMoves() {
        String start = engine.startingPosition();

        assertThat(engine.legalMoves(start)).hasSize(20).contains("e4", "Nf3", "a3");
        assertThat(engine.legalMovesUci(start)).contains("e2e4", "g1f3");
        assertThat(engine.sideToMove(start)).isEqualTo(PlayerColor.WHITE);
    }

    @Test
    void pawnPushWritesNoUnusableEnPassantTarget() {
        AppliedMove move = engine.applyMove(engine.startingPosition(), "e4");

        assertThat(move.getSan()).isEqualTo("e4");
        assertThat(move.getUci()).isEqualTo("e2e4");
        assertThat(move.getFen()).isEqualTo("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq - 0 1");
    }

    @Test
    void coordinateAndSanNotationResolveToSameMove() {
        String start = engine.startingPosition();

        assertThat(engine.applyMove(start, "g1f3").getSan()).isEqualTo("Nf3");
        assertThat(engine.applyMove(start, "Nf3").getFen()).isEqualTo(engine.applyMove(start, "g1f3").getFen());
    }

    @Test
    void castlingKingsideMovesRookAndDropsRights() {
        AppliedMove move = engine.applyMove("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1", "O-O");

        assertThat(move.getSan()).isEqualTo("O-O");
        assertThat(move.isCastling()).isTrue();
        assertThat(move.getFen()).isEqualTo("r3k2r/8/8/8/8/8/8/R4RK1 b kq - 1 1");
    }

    @Test
    void castlingThroughAttackedSquareIsRejected() {
        // black rook on f8 covers f1
        String fen = "4kr2/8/8/8/8/8/8/4K2R w K - 0 1";

        assertThat(engine.legalMoves(fen)).doesNotContain("O-O");
        assertThatThrownBy(() -> engine.applyMove(fen, "O-O"))
            .isInstanceOf(IllegalMoveException.class);
    }

    @Test
    void enPassantCaptureRemovesPassedPawn() {
        String fen = "rnbqkbnr/ppp1p1pp/8/3pPp2/8/8/PPPP1PPP/RNBQKBNR w KQkq f6 0 3";

        AppliedMove move = engine.applyMove(fen, "exf6");

        assertThat(move.isCapture()).isTrue();
        assertThat(move.getFen()).isEqualTo("rnbqkbnr/ppp1p1pp/5P2/3p4/8/8/PPPP1PPP/RNBQKBNR b KQkq - 0 3");
    }

    @Test
    void promotionAcceptsBothNotations() {
        String fen = "8/P7/8/8/8/8/8/k6K w - - 0 1";

        AppliedMove san = engine.applyMove(fen, "a8=Q");
        AppliedMove coordinate = engine.applyMove(fen, "a7a8q");

        assertThat(san.isPromotion()).isTrue();
        assertThat(san.getSan()).startsWith("a8=Q");
        assertThat(coordinate.getFen()).isEqualTo(san.getFen());
        assertThat(engine.applyMove(fen, "a8=N").getFen()).startsWith("N7/");
    }

    @Test
    void ambiguousSanAsksForDisambiguation() {
        String fen = "4k3/8/8/8/8/5N2/8/1N2K3 w - - 0 1";

        assertThat(engine.legalMoves(fen)).contains("Nbd2", "Nfd2");
        assertThatThrownBy(() -> engine.applyMove(fen, "Nd2"))
            .isInstanceOf(IllegalMoveException.class)
            .hasMessageContaining("ambiguous");
        assertThat(engine.applyMove(fen, "Nbd2").getSan()).isEqualTo("Nbd2");
    }

    @Test
    void illegalMoveCarriesSuggestion() {
        String start = engine.startingPosition();

        assertThatThrownBy(() -> engine.applyMove(start, "e5"))
            .isInstanceOfSatisfying(IllegalMoveException.class, e -> {
                assertThat(e.getReason()).contains("not legal");
                assertThat(e.getSuggestion()).startsWith("Try one of: ").endsWith("...");
            });
    }

    @Test
    void pawnPushTextIsNotPlayedAsCapture() {
        // 1. d4 e5: only dxe5 reaches e5
        String fen = engine.applyMove(engine.applyMove(engine.startingPosition(), "d4").getFen(), "e5").getFen();

        assertThat(engine.validateMove(fen, "e5").isValid()).isFalse();
        assertThatThrownBy(() -> engine.applyMove(fen, "e5"))
            .isInstanceOf(IllegalMoveException.class)
            .hasMessageContaining("not legal");
        assertThat(engine.applyMove(fen, "dxe5").getSan()).isEqualTo("dxe5");
        assertThat(engine.validateMove(fen, "d4e5").isValid()).isTrue();
    }

    @Test
    void captureMarkerRequiresCapture() {
        String start = engine.startingPosition();

        assertThat(engine.validateMove(start, "Nxf3").isValid()).isFalse();
        assertThat(engine.validateMove(start, "exd3").isValid()).isFalse();
        assertThat(engine.validateMove(start, "Nf3").isValid()).isTrue();
    }

    @Test
    void validateMoveReportsUnparseableText() {
        MoveValidation validation = engine.validateMove(engine.startingPosition(), "hello");

        assertThat(validation.isValid()).isFalse();
        assertThat(validation.getReason()).contains("Invalid notation");
        assertThat(engine.validateMove(engine.startingPosition(), "d4").isValid()).isTrue();
    }

    @Test
    void foolsMateIsCheckmate() {
        String fen = engine.startingPosition();
        AppliedMove last = null;
        for (String move : List.of("f3", "e5", "g4", "Qh4")) {
            last = engine.applyMove(fen, move);
            fen = last.getFen();
        }

        assertThat(last.getSan()).isEqualTo("Qh4#");
        PositionEvaluation evaluation = engine.evaluate(fen);
        assertThat(evaluation.isCheckmate()).isTrue();
        assertThat(evaluation.isGameOver()).isTrue();
        assertThat(evaluation.isDraw()).isFalse();
    }

    @Test
    void stalemateIsDrawWithoutCheck() {
        PositionEvaluation evaluation = engine.evaluate("7k/5Q2/6K1/8/8/8/8/8 b - - 0 1");

        assertThat(evaluation.isStalemate()).isTrue();
        assertThat(evaluation.isCheck()).isFalse();
        assertThat(evaluation.isDraw()).isTrue();
    }

    @Test
    void insufficientMaterialCases() {
        assertThat(engine.evaluate("8/8/8/4k3/8/8/8/4K3 w - - 0 1").isInsufficientMaterial()).isTrue();
        assertThat(engine.evaluate("8/8/8/4k3/8/8/8/4KN2 w - - 0 1").isInsufficientMaterial()).isTrue();
        assertThat(engine.evaluate("8/8/8/4k3/8/8/8/4KR2 w - - 0 1").isInsufficientMaterial()).isFalse();
        assertThat(engine.evaluate("8/8/8/4k3/8/8/8/4KNN1 w - - 0 1").isInsufficientMaterial()).isFalse();
    }

    @Test
    void fiftyMoveRuleFromHalfmoveClock() {
        String fen = "8/8/8/4k3/8/8/8/R3K3 w - - 100 80";

        assertThat(engine.halfmoveClock(fen)).isEqualTo(100);
        assertThat(engine.evaluate(fen).isFiftyMoveRule()).isTrue();
    }

    @Test
    void legalMovesFromSquare() {
        String start = engine.startingPosition();

        assertThat(engine.legalMovesFrom(start, "g1")).containsExactlyInAnyOrder("Nf3", "Nh3");
        assertThat(engine.legalMovesFrom(start, "e7")).isEmpty();
        assertThat(engine.legalMovesFrom(start, "z9")).isEmpty();
    }

    @Test
    void malformedFenIsRejected() {
        assertThatThrownBy(() -> engine.legalMoves("not a fen"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void renderBoardShowsFilesAndPieces() {
        String board = engine.renderBoard(engine.startingPosition());

        assertThat(board).contains("a  b  c  d  e  f  g  h");
        assertThat(board).contains(" r  n  b  q  k  b  n  r ");
    }

    @Test
    void writesPgnWithHeadersAndMoveNumbers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("White", "alice");
        headers.put("Black", "bob");

        String pgn = engine.writePgn(headers, List.of("e4", "e5", "Nf3"), "*");

        assertThat(pgn).startsWith("[White \"alice\"]\n[Black \"bob\"]\n\n");
        assertThat(pgn).endsWith("1. e4 e5 2. Nf3 *");
    }

    @Test
    void readsPgnSkippingCommentsAndVariations() {
        String pgn = "[Event \"Casual\"]\n[White \"alice\"]\n\n"
            + "1. e4 {best by test} e5 (1... c5 2. Nf3) 2. g1f3 $1 Nc6 ; main line\n1-0";

        PgnGame game = engine.readPgn(pgn);

        assertThat(game.getMoves()).containsExactly("e4", "e5", "Nf3", "Nc6");
        assertThat(game.getResult()).isEqualTo("1-0");
        assertThat(game.getHeaders()).containsEntry("White", "alice");
    }

    @Test
    void readPgnRejectsIllegalMove() {
        assertThatThrownBy(() -> engine.readPgn("1. e4 e5 2. Ke3 *"))
            .isInstanceOf(PgnParseException.class)
            .hasMessageContaining("Invalid move in PGN");
    }

    @Test
    void readPgnRejectsEmptyText() {
        assertThatThrownBy(() -> engine.readPgn("  "))
            .isInstanceOf(PgnParseException.class);
    }
}
