package com.chessmatch.model;

import com.chessmatch.chess.AppliedMove;
import com.chessmatch.chess.IllegalMoveException;
import com.chessmatch.chess.MoveValidation;
import com.chessmatch.chess.PgnGame;
import com.chessmatch.chess.PlayerColor;
import com.chessmatch.chess.PositionEvaluation;
import com.chessmatch.chess.RulesEngine;
import com.chessmatch.exception.CorruptStateException;
import com.chessmatch.exception.IllegalMatchStateException;
import com.chessmatch.exception.InvalidMoveException;
import com.chessmatch.model.mongo.MatchDocument;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A single chess game between two participants. Owns the position, the move list, the
 * lifecycle status and the draw bookkeeping; the chess rules themselves come from the
 * {@link RulesEngine} it was built with.
 *
 * <p>Not thread-safe. Callers serialize access per match id.
 */
@Slf4j
public class Match {

    private static final String UNFINISHED = "*";
    private static final int FIFTY_MOVE_HALFMOVES = 100;
    private static final int FIFTY_MOVE_WARNING_HALFMOVES = 80;
    private static final int REPETITION_WARNING_COUNT = 2;
    private static final DateTimeFormatter PGN_DATE = DateTimeFormatter.ofPattern("yyyy.MM.dd");

    private final RulesEngine rulesEngine;

    @Getter
    private final String id;
    @Getter
    private final String whitePlayerId;
    @Getter
    private final String blackPlayerId;
    private final TimeControl timeControl;
    @Getter
    private final LocalDateTime createdAt;

    @Getter
    private MatchStatus status;
    @Getter
    private String fen;
    private final List<String> moveHistory;
    private final Map<String, Integer> positionHistory;

    private GameResult result;
    private GameEndReason endReason;
    private DrawDetails drawDetails;

    private Long whiteTimeRemaining;
    private Long blackTimeRemaining;

    private String drawOfferFrom;
    private String pauseRequestedBy;

    @Getter
    private LocalDateTime updatedAt;
    private LocalDateTime lastMoveAt;

    private Match(RulesEngine rulesEngine, String id, String whitePlayerId, String blackPlayerId,
                  TimeControl timeControl, LocalDateTime createdAt, String fen,
                  List<String> moveHistory, Map<String, Integer> positionHistory) {
        this.rulesEngine = rulesEngine;
        this.id = id;
        this.whitePlayerId = whitePlayerId;
        this.blackPlayerId = blackPlayerId;
        this.timeControl = timeControl == null ? null : timeControl.toBuilder().build();
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.fen = fen;
        this.moveHistory = moveHistory;
        this.positionHistory = positionHistory;
        this.status = MatchStatus.ACTIVE;
    }

    // ========== Creation ==========

    public static Match create(String whitePlayerId, String blackPlayerId, TimeControl timeControl,
                               RulesEngine rulesEngine) {
        requireParticipantId(whitePlayerId, "whitePlayerId");
        requireParticipantId(blackPlayerId, "blackPlayerId");

        String start = rulesEngine.startingPosition();
        Map<String, Integer> positions = new LinkedHashMap<>();
        positions.put(fingerprint(start), 1);

        Match match = new Match(rulesEngine, UUID.randomUUID().toString(), whitePlayerId, blackPlayerId,
            timeControl, now(), start, new ArrayList<>(), positions);
        match.startClocks();
        return match;
    }

    /**
     * Builds a match from a parsed transcript. A terminal final position ends the match with the
     * result the position dictates; otherwise a decisive result token ends it as declared.
     * Disagreements between the two are added to {@code warnings}.
     */
    public static Match fromTranscript(PgnGame game, String whitePlayerId, String blackPlayerId,
                                       TimeControl timeControl, RulesEngine rulesEngine,
                                       List<String> warnings) {
        requireParticipantId(whitePlayerId, "whitePlayerId");
        requireParticipantId(blackPlayerId, "blackPlayerId");

        String position = rulesEngine.startingPosition();
        Map<String, Integer> positions = new LinkedHashMap<>();
        positions.put(fingerprint(position), 1);
        List<String> moves = new ArrayList<>();
        for (String move : game.getMoves()) {
            AppliedMove applied = rulesEngine.applyMove(position, move);
            position = applied.getFen();
            moves.add(applied.getSan());
            positions.merge(fingerprint(position), 1, Integer::sum);
        }

        Match match = new Match(rulesEngine, UUID.randomUUID().toString(), whitePlayerId, blackPlayerId,
            timeControl, now(), position, moves, positions);
        match.startClocks();
        if (!moves.isEmpty()) {
            match.lastMoveAt = match.createdAt;
        }

        Optional<GameResult> declared = GameResult.fromToken(game.getResult());
        boolean terminal = match.concludeIfTerminal(moves.isEmpty() ? null : match.getCurrentTurn().opposite());
        if (terminal) {
            if (declared.isPresent() && declared.get() != match.result) {
                warnings.add("Declared result " + declared.get().getNotation() + " does not match the final position ("
                    + match.result.getNotation() + "); using " + match.result.getNotation());
            } else if (declared.isEmpty()) {
                warnings.add("Transcript has no result but the final position is terminal; recorded "
                    + match.result.getNotation());
            }
        } else if (declared.isPresent()) {
            match.finish(declared.get(), GameEndReason.DECLARED, null);
        }
        if (match.getRepetitionCount() >= 3) {
            warnings.add("Final position has occurred " + match.getRepetitionCount() + " times");
        }
        return match;
    }

    // ========== Moves ==========

    /**
     * Plays {@code move} for the side to move and returns it in SAN. Checkmate, stalemate,
     * insufficient material and the fifty-move rule end the match on the spot.
     *
     * @throws IllegalMatchStateException if the match is paused or completed
     * @throws InvalidMoveException if the rules engine rejects the move
     */
    public String applyMove(String move) {
        requireActive("Game is paused", "Cannot make moves in inactive games");

        AppliedMove applied;
        try {
            applied = rulesEngine.applyMove(fen, move);
        } catch (IllegalMoveException e) {
            throw new InvalidMoveException(move, e.getReason(), e.getSuggestion());
        }

        PlayerColor mover = getCurrentTurn();
        LocalDateTime now = now();
        fen = applied.getFen();
        moveHistory.add(applied.getSan());
        positionHistory.merge(fingerprint(fen), 1, Integer::sum);
        lastMoveAt = now;
        updatedAt = now;
        creditIncrement(mover);

        // An offer lapses once its recipient plays on.
        if (drawOfferFrom != null && !drawOfferFrom.equals(participantOf(mover))) {
            drawOfferFrom = null;
        }

        concludeIfTerminal(mover);
        log.debug("Game {}: {} played {}", id, mover.getLabel(), applied.getSan());
        return applied.getSan();
    }

    public MoveValidation validateMove(String move) {
        if (status == MatchStatus.PAUSED) {
            return MoveValidation.rejected("Game is paused", "Resume the game to make moves");
        }
        if (status != MatchStatus.ACTIVE) {
            return MoveValidation.rejected("Cannot validate moves in inactive games", "Game must be active to validate moves");
        }
        return rulesEngine.validateMove(fen, move);
    }

    public List<String> getLegalMoves() {
        return rulesEngine.legalMoves(fen);
    }

    public List<String> getLegalMovesFrom(String square) {
        return rulesEngine.legalMovesFrom(fen, square);
    }

    // ========== Lifecycle ==========

    public void completeGame(GameResult result) {
        Objects.requireNonNull(result, "result");
        finish(result, GameEndReason.DECLARED, null);
    }

    public void resign(String participantId) {
        requireActive("Can only resign active games", "Can only resign active games");
        PlayerColor color = requireParticipant(participantId);
        finish(GameResult.winFor(color.opposite()), GameEndReason.RESIGNATION, null);
    }

    public void offerDraw(String participantId) {
        requireActive("Can only offer draw in active games", "Can only offer draw in active games");
        requireParticipant(participantId);
        drawOfferFrom = participantId;
        updatedAt = now();
    }

    public void acceptDraw(String participantId) {
        requireActive("Can only accept draw in active games", "Can only accept draw in active games");
        if (drawOfferFrom == null) {
            throw new IllegalMatchStateException("No draw offer to accept");
        }
        requireParticipant(participantId);
        if (drawOfferFrom.equals(participantId)) {
            throw new IllegalMatchStateException("Cannot accept own draw offer");
        }
        finish(GameResult.DRAW, GameEndReason.DRAW_AGREEMENT, DrawDetails.of(DrawType.AGREEMENT));
    }

    public void declineDraw() {
        if (drawOfferFrom == null) {
            throw new IllegalMatchStateException("No draw offer to decline");
        }
        drawOfferFrom = null;
        updatedAt = now();
    }

    public void pause(String participantId) {
        if (status == MatchStatus.COMPLETED) {
            throw new IllegalMatchStateException("Cannot pause completed game");
        }
        if (status == MatchStatus.PAUSED) {
            throw new IllegalMatchStateException("Game is already paused");
        }
        requireParticipant(participantId);
        status = MatchStatus.PAUSED;
        pauseRequestedBy = participantId;
        // offers are only valid while the game is running
        drawOfferFrom = null;
        updatedAt = now();
    }

    public void resume() {
        if (status == MatchStatus.COMPLETED) {
            throw new IllegalMatchStateException("Cannot resume completed game");
        }
        if (status != MatchStatus.PAUSED) {
            throw new IllegalMatchStateException("Game is not paused");
        }
        status = MatchStatus.ACTIVE;
        pauseRequestedBy = null;
        updatedAt = now();
    }

    // ========== Draw Bookkeeping ==========

    /**
     * Advisory draw flags. Empty unless the match is active.
     */
    public Optional<DrawStatus> getDrawStatus() {
        if (status != MatchStatus.ACTIVE) {
            return Optional.empty();
        }
        int halfmoves = rulesEngine.halfmoveClock(fen);
        int repetitions = getRepetitionCount();
        return Optional.of(DrawStatus.builder()
            .halfmoveClock(halfmoves)
            .movesUntilFiftyMove(FIFTY_MOVE_HALFMOVES / 2 - halfmoves / 2)
            .repetitionCount(repetitions)
            .approachingFiftyMove(halfmoves >= FIFTY_MOVE_WARNING_HALFMOVES)
            .approachingRepetition(repetitions >= REPETITION_WARNING_COUNT)
            .build());
    }

    public int getRepetitionCount() {
        return positionHistory.getOrDefault(fingerprint(fen), 0);
    }

    /**
     * Identity of a position for repetition purposes: placement, side to move, castling rights
     * and en-passant square. The move counters are left out.
     */
    public static String fingerprint(String fen) {
        String[] fields = fen.trim().split("\\s+");
        return String.join(" ", Arrays.copyOf(fields, Math.min(4, fields.length)));
    }

    // ========== Views ==========

    public PlayerColor getCurrentTurn() {
        return rulesEngine.sideToMove(fen);
    }

    public Optional<GameResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<GameEndReason> getEndReason() {
        return Optional.ofNullable(endReason);
    }

    public Optional<DrawDetails> getDrawDetails() {
        return Optional.ofNullable(drawDetails);
    }

    public Optional<TimeControl> getTimeControl() {
        return Optional.ofNullable(timeControl).map(control -> control.toBuilder().build());
    }

    public Optional<Long> getTimeRemaining(PlayerColor color) {
        return Optional.ofNullable(color == PlayerColor.WHITE ? whiteTimeRemaining : blackTimeRemaining);
    }

    public Optional<String> getDrawOfferFrom() {
        return Optional.ofNullable(drawOfferFrom);
    }

    public Optional<String> getPauseRequestedBy() {
        return Optional.ofNullable(pauseRequestedBy);
    }

    public Optional<LocalDateTime> getLastMoveAt() {
        return Optional.ofNullable(lastMoveAt);
    }

    public List<String> getMoveHistory() {
        return Collections.unmodifiableList(new ArrayList<>(moveHistory));
    }

    public Map<String, Integer> getPositionHistory() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(positionHistory));
    }

    public boolean isParticipant(String participantId) {
        return colorOf(participantId).isPresent();
    }

    public Optional<PlayerColor> colorOf(String participantId) {
        if (whitePlayerId.equals(participantId)) {
            return Optional.of(PlayerColor.WHITE);
        }
        if (blackPlayerId.equals(participantId)) {
            return Optional.of(PlayerColor.BLACK);
        }
        return Optional.empty();
    }

    public String participantOf(PlayerColor color) {
        return color == PlayerColor.WHITE ? whitePlayerId : blackPlayerId;
    }

    public MoveHistory getMoveHistory(MoveHistoryFormat format) {
        switch (format) {
            case ALGEBRAIC:
                return new MoveHistory.Algebraic(getMoveHistory());
            case UCI: {
                List<String> uci = new ArrayList<>();
                replay().forEach(applied -> uci.add(applied.getUci()));
                return new MoveHistory.Uci(uci);
            }
            case VERBOSE: {
                List<MoveHistory.VerboseMove> verbose = new ArrayList<>();
                for (int ply = 0; ply < moveHistory.size(); ply++) {
                    PlayerColor color = ply % 2 == 0 ? PlayerColor.WHITE : PlayerColor.BLACK;
                    verbose.add(new MoveHistory.VerboseMove(ply / 2 + 1, color, participantOf(color), moveHistory.get(ply)));
                }
                return new MoveHistory.Verbose(verbose);
            }
            case WITH_FEN: {
                List<MoveHistory.PositionedMove> positioned = new ArrayList<>();
                List<AppliedMove> applied = replay();
                for (int ply = 0; ply < applied.size(); ply++) {
                    positioned.add(new MoveHistory.PositionedMove(ply + 1, applied.get(ply).getSan(), applied.get(ply).getFen()));
                }
                return new MoveHistory.WithFen(positioned);
            }
            case DETAILED: {
                List<MoveHistory.DetailedMove> detailed = new ArrayList<>();
                List<AppliedMove> applied = replay();
                for (int ply = 0; ply < applied.size(); ply++) {
                    AppliedMove move = applied.get(ply);
                    detailed.add(new MoveHistory.DetailedMove(ply + 1, move.getSan(), move.getUci(), move.getFen(),
                        move.isCheck(), move.isCapture(), move.isCastling(), move.isPromotion()));
                }
                return new MoveHistory.Detailed(detailed);
            }
            default:
                throw new IllegalArgumentException("Unsupported history format: " + format);
        }
    }

    public String getPgn() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Event", "Chess Match");
        headers.put("Site", "ChessMatch Server");
        headers.put("Date", createdAt.format(PGN_DATE));
        headers.put("Round", "1");
        headers.put("White", whitePlayerId);
        headers.put("Black", blackPlayerId);
        headers.put("Result", resultToken());
        return rulesEngine.writePgn(headers, moveHistory, resultToken());
    }

    public GameExport exportGame(ExportFormat format) {
        String content = format == ExportFormat.FEN ? fen : getPgn();
        return GameExport.builder()
            .gameId(id)
            .format(format)
            .content(content)
            .metadata(GameExport.Metadata.builder()
                .whitePlayer(whitePlayerId)
                .blackPlayer(blackPlayerId)
                .result(resultToken())
                .gameStatus(status)
                .date(createdAt.toLocalDate().toString())
                .build())
            .build();
    }

    public BoardState getBoardState() {
        PositionEvaluation evaluation = rulesEngine.evaluate(fen);
        return BoardState.builder()
            .gameId(id)
            .fen(fen)
            .board(rulesEngine.renderBoard(fen))
            .currentTurn(getCurrentTurn())
            .moveNumber(moveHistory.size() / 2 + 1)
            .check(evaluation.isCheck())
            .legalMoves(status == MatchStatus.ACTIVE ? getLegalMoves() : List.of())
            .status(status)
            .build();
    }

    // ========== Snapshot ==========

    public MatchDocument toDocument() {
        return MatchDocument.builder()
            .id(id)
            .whitePlayerId(whitePlayerId)
            .blackPlayerId(blackPlayerId)
            .fen(fen)
            .pgn(getPgn())
            .status(status)
            .result(result)
            .endReason(endReason)
            .drawDetails(drawDetails)
            .timeControl(timeControl == null ? null : timeControl.toBuilder().build())
            .whiteTimeRemaining(whiteTimeRemaining)
            .blackTimeRemaining(blackTimeRemaining)
            .drawOfferFrom(drawOfferFrom)
            .pauseRequestedBy(pauseRequestedBy)
            .moveHistory(new ArrayList<>(moveHistory))
            .positionHistory(new LinkedHashMap<>(positionHistory))
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .lastMoveAt(lastMoveAt)
            .build();
    }

    /**
     * Rebuilds a match from its snapshot. The move list is replayed from the opening position
     * and must arrive at the stored position; the side to move is taken from that position.
     *
     * @throws CorruptStateException if the snapshot is incomplete or inconsistent
     */
    public static Match restore(MatchDocument document, RulesEngine rulesEngine) {
        String id = document.getId();
        if (id == null || document.getFen() == null || document.getStatus() == null
            || document.getWhitePlayerId() == null || document.getBlackPlayerId() == null
            || document.getCreatedAt() == null) {
            throw new CorruptStateException(id, "required fields are missing");
        }
        if (document.getStatus() == MatchStatus.COMPLETED && document.getResult() == null) {
            throw new CorruptStateException(id, "completed game has no result");
        }
        if (document.getStatus() != MatchStatus.COMPLETED && document.getResult() != null) {
            throw new CorruptStateException(id, "unfinished game carries a result");
        }
        if (document.getDrawOfferFrom() != null && document.getStatus() != MatchStatus.ACTIVE) {
            throw new CorruptStateException(id, "draw offer outstanding on an inactive game");
        }

        List<String> moves = document.getMoveHistory() == null
            ? new ArrayList<>() : new ArrayList<>(document.getMoveHistory());
        Map<String, Integer> replayedPositions = new LinkedHashMap<>();
        String position = rulesEngine.startingPosition();
        replayedPositions.put(fingerprint(position), 1);
        for (String move : moves) {
            try {
                position = rulesEngine.applyMove(position, move).getFen();
            } catch (IllegalMoveException e) {
                throw new CorruptStateException(id, "move " + move + " cannot be replayed: " + e.getReason(), e);
            }
            replayedPositions.merge(fingerprint(position), 1, Integer::sum);
        }
        if (!position.equals(document.getFen().trim())) {
            throw new CorruptStateException(id, "stored position does not match the move history");
        }

        Map<String, Integer> positions = document.getPositionHistory() == null || document.getPositionHistory().isEmpty()
            ? replayedPositions : new LinkedHashMap<>(document.getPositionHistory());

        Match match = new Match(rulesEngine, id, document.getWhitePlayerId(), document.getBlackPlayerId(),
            document.getTimeControl(), document.getCreatedAt(), position, moves, positions);
        match.status = document.getStatus();
        match.result = document.getResult();
        match.endReason = document.getEndReason();
        match.drawDetails = document.getDrawDetails();
        match.whiteTimeRemaining = document.getWhiteTimeRemaining();
        match.blackTimeRemaining = document.getBlackTimeRemaining();
        match.drawOfferFrom = document.getDrawOfferFrom();
        match.pauseRequestedBy = document.getPauseRequestedBy();
        match.updatedAt = document.getUpdatedAt() == null ? document.getCreatedAt() : document.getUpdatedAt();
        match.lastMoveAt = document.getLastMoveAt();
        return match;
    }

    // ========== Internals ==========

    private boolean concludeIfTerminal(PlayerColor mover) {
        PositionEvaluation evaluation = rulesEngine.evaluate(fen);
        if (evaluation.isCheckmate() && mover != null) {
            finish(GameResult.winFor(mover), GameEndReason.CHECKMATE, null);
        } else if (evaluation.isStalemate()) {
            finish(GameResult.DRAW, GameEndReason.STALEMATE, DrawDetails.of(DrawType.STALEMATE));
        } else if (evaluation.isInsufficientMaterial()) {
            finish(GameResult.DRAW, GameEndReason.INSUFFICIENT_MATERIAL, DrawDetails.of(DrawType.INSUFFICIENT_MATERIAL));
        } else if (evaluation.isFiftyMoveRule()) {
            finish(GameResult.DRAW, GameEndReason.FIFTY_MOVE_RULE, DrawDetails.of(DrawType.FIFTY_MOVE));
        } else {
            return false;
        }
        return true;
    }

    private void finish(GameResult result, GameEndReason reason, DrawDetails details) {
        if (status == MatchStatus.COMPLETED) {
            throw new IllegalMatchStateException("Game is already completed");
        }
        if (status == MatchStatus.PAUSED) {
            throw new IllegalMatchStateException("Cannot complete a paused game; resume it first");
        }
        this.status = MatchStatus.COMPLETED;
        this.result = result;
        this.endReason = reason;
        this.drawDetails = details;
        this.drawOfferFrom = null;
        this.updatedAt = now();
        log.info("Game {} completed: {} ({})", id, result.getNotation(), reason.getToken());
    }

    private void requireActive(String pausedMessage, String inactiveMessage) {
        if (status == MatchStatus.PAUSED) {
            throw new IllegalMatchStateException(pausedMessage);
        }
        if (status != MatchStatus.ACTIVE) {
            throw new IllegalMatchStateException(inactiveMessage);
        }
    }

    private PlayerColor requireParticipant(String participantId) {
        return colorOf(participantId)
            .orElseThrow(() -> new IllegalMatchStateException("You are not a player in this game"));
    }

    private void startClocks() {
        if (timeControl != null && timeControl.getType() != TimeControlType.UNLIMITED
            && timeControl.getInitialTime() != null) {
            whiteTimeRemaining = timeControl.getInitialTime();
            blackTimeRemaining = timeControl.getInitialTime();
        }
    }

    private void creditIncrement(PlayerColor mover) {
        if (timeControl == null || timeControl.getType() != TimeControlType.FISCHER || timeControl.getIncrement() == null) {
            return;
        }
        if (mover == PlayerColor.WHITE && whiteTimeRemaining != null) {
            whiteTimeRemaining += timeControl.getIncrement();
        } else if (mover == PlayerColor.BLACK && blackTimeRemaining != null) {
            blackTimeRemaining += timeControl.getIncrement();
        }
    }

    private List<AppliedMove> replay() {
        List<AppliedMove> applied = new ArrayList<>();
        String position = rulesEngine.startingPosition();
        for (String move : moveHistory) {
            AppliedMove next = rulesEngine.applyMove(position, move);
            applied.add(next);
            position = next.getFen();
        }
        return applied;
    }

    private String resultToken() {
        return result == null ? UNFINISHED : result.getNotation();
    }

    private static void requireParticipantId(String participantId, String field) {
        if (participantId == null || participantId.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static LocalDateTime now() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
