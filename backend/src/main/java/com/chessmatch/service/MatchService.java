package com.chessmatch.service;

import com.chessmatch.chess.MoveValidation;
import com.chessmatch.chess.PgnGame;
import com.chessmatch.chess.PlayerColor;
import com.chessmatch.chess.RulesEngine;
import com.chessmatch.config.MatchProperties;
import com.chessmatch.exception.CapacityExceededException;
import com.chessmatch.exception.IllegalMatchStateException;
import com.chessmatch.exception.MatchNotFoundException;
import com.chessmatch.model.BoardState;
import com.chessmatch.model.DrawStatus;
import com.chessmatch.model.ExportFormat;
import com.chessmatch.model.GameExport;
import com.chessmatch.model.GameResult;
import com.chessmatch.model.ImportResult;
import com.chessmatch.model.Match;
import com.chessmatch.model.MatchStatus;
import com.chessmatch.model.MoveHistory;
import com.chessmatch.model.MoveHistoryFormat;
import com.chessmatch.model.TimeControl;
import com.chessmatch.repository.MatchStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.function.Function;

// ========== Match Service ==========
// Session manager: admits new games under the concurrency ceiling and runs every change as
// load, mutate, save while holding the game's lock. Rule and state errors from Match
// propagate unchanged.
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchService {

    private static final String UNKNOWN_PLAYER = "Unknown";

    private final MatchStore matchStore;
    private final RulesEngine rulesEngine;
    private final MatchProperties matchProperties;

    // Guards count-then-insert so one service instance never admits past the ceiling.
    private final Object admissionLock = new Object();
    private final ConcurrentMap<String, Object> matchLocks = new ConcurrentHashMap<>();

    // ========== Creation ==========

    public Match createMatch(String whitePlayerId, String blackPlayerId, TimeControl timeControl) {
        synchronized (admissionLock) {
            requireCapacity();
            Match match = Match.create(whitePlayerId, blackPlayerId, timeControl, rulesEngine);
            matchStore.save(match);
            log.info("Created game {}: {} (white) vs {} (black)", match.getId(), whitePlayerId, blackPlayerId);
            return match;
        }
    }

    /**
     * Imports a PGN transcript as a new game. Participant ids default to the White and Black
     * header tags. A transcript that leaves the game in progress takes an active slot and is
     * admitted like a newly created game.
     */
    public ImportResult importMatch(String pgn, String whitePlayerId, String blackPlayerId) {
        PgnGame game = rulesEngine.readPgn(pgn);
        String white = participantOrHeader(whitePlayerId, game.getHeaders().get("White"));
        String black = participantOrHeader(blackPlayerId, game.getHeaders().get("Black"));
        List<String> warnings = new ArrayList<>();
        Match match = Match.fromTranscript(game, white, black, null, rulesEngine, warnings);

        synchronized (admissionLock) {
            if (match.getStatus() == MatchStatus.ACTIVE) {
                requireCapacity();
            }
            matchStore.save(match);
        }
        log.info("Imported game {} ({} moves, status {})", match.getId(), match.getMoveHistory().size(), match.getStatus());
        warnings.forEach(warning -> log.warn("Import of game {}: {}", match.getId(), warning));

        return ImportResult.builder()
            .gameId(match.getId())
            .moves(match.getMoveHistory().size())
            .finalPosition(match.getFen())
            .result(match.getResult().map(GameResult::getNotation).orElse("*"))
            .status(match.getStatus())
            .valid(warnings.isEmpty())
            .warnings(warnings)
            .build();
    }

    // ========== Lookup ==========

    public Optional<Match> getMatch(String id) {
        return matchStore.load(id);
    }

    public Match requireMatch(String id) {
        return matchStore.load(id).orElseThrow(() -> new MatchNotFoundException(id));
    }

    public boolean matchExists(String id) {
        return matchStore.existsById(id);
    }

    public List<Match> listAll() {
        return matchStore.loadAll();
    }

    public List<Match> listByStatus(MatchStatus status) {
        return matchStore.loadByStatus(status);
    }

    public List<Match> listByParticipant(String participantId) {
        return matchStore.loadByParticipant(participantId);
    }

    public long countActive() {
        return matchStore.countActive();
    }

    public boolean deleteMatch(String id) {
        synchronized (lockFor(id)) {
            boolean deleted = matchStore.delete(id);
            matchLocks.remove(id);
            if (deleted) {
                log.info("Deleted game {}", id);
            }
            return deleted;
        }
    }

    // ========== Mutations ==========

    public Match applyMove(String id, String move) {
        return mutate(id, match -> match.applyMove(move));
    }

    /**
     * Plays a move on behalf of {@code participantId}, who must be in the game and on turn.
     */
    public Match applyMove(String id, String participantId, String move) {
        return mutate(id, match -> {
            PlayerColor color = match.colorOf(participantId)
                .orElseThrow(() -> new IllegalMatchStateException("You are not a player in this game"));
            if (match.getStatus() == MatchStatus.ACTIVE && match.getCurrentTurn() != color) {
                throw new IllegalMatchStateException("It is not your turn");
            }
            match.applyMove(move);
        });
    }

    public Match resign(String id, String participantId) {
        return mutate(id, match -> match.resign(participantId));
    }

    public Match offerDraw(String id, String participantId) {
        return mutate(id, match -> match.offerDraw(participantId));
    }

    public Match acceptDraw(String id, String participantId) {
        return mutate(id, match -> match.acceptDraw(participantId));
    }

    public Match declineDraw(String id, String participantId) {
        return mutate(id, match -> {
            if (!match.isParticipant(participantId)) {
                throw new IllegalMatchStateException("You are not a player in this game");
            }
            match.declineDraw();
        });
    }

    public Match pause(String id, String participantId) {
        return mutate(id, match -> match.pause(participantId));
    }

    // Resuming does not pass admission; a resumed game may take the active count past the ceiling.
    public Match resume(String id) {
        return mutate(id, Match::resume);
    }

    public Match completeMatch(String id, GameResult result) {
        return mutate(id, match -> match.completeGame(result));
    }

    // ========== Reads ==========

    public MoveValidation validateMove(String id, String move) {
        return read(id, match -> match.validateMove(move));
    }

    public Optional<DrawStatus> getDrawStatus(String id) {
        return read(id, Match::getDrawStatus);
    }

    public List<String> getLegalMoves(String id, String square) {
        return read(id, match -> square == null || square.isBlank()
            ? match.getLegalMoves() : match.getLegalMovesFrom(square.trim().toLowerCase(Locale.ROOT)));
    }

    public MoveHistory getMoveHistory(String id, MoveHistoryFormat format) {
        return read(id, match -> match.getMoveHistory(format));
    }

    public GameExport exportMatch(String id, ExportFormat format) {
        return read(id, match -> match.exportGame(format));
    }

    public BoardState getBoardState(String id) {
        return read(id, Match::getBoardState);
    }

    // ========== Store Lifecycle ==========

    public boolean healthCheck() {
        return matchStore.healthCheck();
    }

    @PreDestroy
    public void close() {
        log.info("Closing game store");
        matchStore.close();
    }

    // ========== Internals ==========

    private void requireCapacity() {
        long active = matchStore.countActive();
        int ceiling = matchProperties.getMaxConcurrentMatches();
        if (active >= ceiling) {
            log.warn("Rejected new game: {} active games, ceiling is {}", active, ceiling);
            throw new CapacityExceededException(ceiling);
        }
    }

    private Match mutate(String id, Consumer<Match> operation) {
        Object lock = lockFor(id);
        synchronized (lock) {
            Optional<Match> loaded = matchStore.load(id);
            if (loaded.isEmpty()) {
                matchLocks.remove(id, lock);
                throw new MatchNotFoundException(id);
            }
            Match match = loaded.get();
            // a stored completed game accepts no further mutation, so its lock can go
            if (match.getStatus() == MatchStatus.COMPLETED) {
                matchLocks.remove(id, lock);
            }
            operation.accept(match);
            matchStore.save(match);
            if (match.getStatus() == MatchStatus.COMPLETED) {
                matchLocks.remove(id, lock);
            }
            return match;
        }
    }

    private <T> T read(String id, Function<Match, T> query) {
        return query.apply(requireMatch(id));
    }

    private static String participantOrHeader(String participantId, String header) {
        if (participantId != null && !participantId.isBlank()) {
            return participantId;
        }
        if (header != null && !header.isBlank() && !"?".equals(header.trim())) {
            return header.trim();
        }
        return UNKNOWN_PLAYER;
    }

    private Object lockFor(String id) {
        return matchLocks.computeIfAbsent(id, key -> new Object());
    }

    int trackedLockCount() {
        return matchLocks.size();
    }
}
