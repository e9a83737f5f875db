package com.chessmatch.service;

import com.chessmatch.chess.PlayerColor;
import com.chessmatch.chess.StandardRulesEngine;
import com.chessmatch.config.MatchProperties;
import com.chessmatch.exception.CapacityExceededException;
import com.chessmatch.exception.IllegalMatchStateException;
import com.chessmatch.exception.InvalidMoveException;
import com.chessmatch.exception.MatchNotFoundException;
import com.chessmatch.model.GameResult;
import com.chessmatch.model.ImportResult;
import com.chessmatch.model.Match;
import com.chessmatch.model.MatchStatus;
import com.chessmatch.repository.InMemoryMatchStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchServiceTest {

    private final StandardRulesEngine engine = new StandardRulesEngine();
    private InMemoryMatchStore store;
    private MatchService matchService;

    @BeforeEach
    void setUp() {
        store = new InMemoryMatchStore(engine);
        MatchProperties properties = new MatchProperties();
        properties.setMaxConcurrentMatches(5);
        matchService = new MatchService(store, engine, properties);
    }

    // ========== Admission ==========

    @Test
    void sixthActiveMatchIsRejected() {
        for (int i = 0; i < 5; i++) {
            matchService.createMatch("white" + i, "black" + i, null);
        }

        assertThatThrownBy(() -> matchService.createMatch("late", "comer", null))
            .isInstanceOf(CapacityExceededException.class)
            .hasMessage("Maximum number of concurrent games (5) reached");
        assertThat(matchService.listAll()).hasSize(5);
    }

    @Test
    void completingOrPausingFreesSlot() {
        List<Match> created = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            created.add(matchService.createMatch("white" + i, "black" + i, null));
        }

        matchService.resign(created.get(0).getId(), "white0");
        matchService.createMatch("sixth", "player", null);

        matchService.pause(created.get(1).getId(), "black1");
        matchService.createMatch("seventh", "player", null);

        assertThat(matchService.countActive()).isEqualTo(5);
        assertThatThrownBy(() -> matchService.createMatch("eighth", "player", null))
            .isInstanceOf(CapacityExceededException.class);
    }

    @Test
    void concurrentCreationNeverExceedsCeiling() throws Exception {
        int callers = 20;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                int caller = i;
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        matchService.createMatch("w" + caller, "b" + caller, null);
                        return true;
                    } catch (CapacityExceededException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(5);
            assertThat(store.countActive()).isEqualTo(5);
        } finally {
            executor.shutdownNow();
        }
    }

    // ========== Moves ==========

    @Test
    void pauseAndResumeScenario() {
        Match match = matchService.createMatch("alice", "bob", null);
        String id = match.getId();

        matchService.applyMove(id, "e4");
        matchService.applyMove(id, "e5");
        matchService.pause(id, "alice");

        assertThatThrownBy(() -> matchService.applyMove(id, "Nf3"))
            .isInstanceOf(IllegalMatchStateException.class)
            .hasMessageContaining("paused");

        matchService.resume(id);
        Match after = matchService.applyMove(id, "Nf3");

        assertThat(after.getMoveHistory()).containsExactly("e4", "e5", "Nf3");
        assertThat(after.getCurrentTurn()).isEqualTo(PlayerColor.BLACK);
        assertThat(matchService.requireMatch(id).getMoveHistory()).containsExactly("e4", "e5", "Nf3");
    }

    @Test
    void concurrentMovesOnSameMatchAreSerialized() throws Exception {
        String id = matchService.createMatch("alice", "bob", null).getId();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Match>> attempts = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                attempts.add(executor.submit(() -> {
                    start.await();
                    return matchService.applyMove(id, "e4");
                }));
            }
            start.countDown();

            int accepted = 0;
            int rejected = 0;
            for (Future<Match> attempt : attempts) {
                try {
                    attempt.get(10, TimeUnit.SECONDS);
                    accepted++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(InvalidMoveException.class);
                    rejected++;
                }
            }
            assertThat(accepted).isEqualTo(1);
            assertThat(rejected).isEqualTo(1);
            assertThat(matchService.requireMatch(id).getMoveHistory()).containsExactly("e4");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void participantMoveChecksMembershipAndTurn() {
        String id = matchService.createMatch("alice", "bob", null).getId();

        assertThatThrownBy(() -> matchService.applyMove(id, "bob", "e5"))
            .isInstanceOf(IllegalMatchStateException.class)
            .hasMessage("It is not your turn");
        assertThatThrownBy(() -> matchService.applyMove(id, "mallory", "e4"))
            .isInstanceOf(IllegalMatchStateException.class)
            .hasMessage("You are not a player in this game");

        assertThat(matchService.applyMove(id, "alice", "e4").getMoveHistory()).containsExactly("e4");
    }

    @Test
    void unknownMatchFailsWithNotFound() {
        assertThatThrownBy(() -> matchService.applyMove("missing", "e4"))
            .isInstanceOf(MatchNotFoundException.class)
            .hasMessage("Game not found: missing");
        assertThatThrownBy(() -> matchService.getBoardState("missing"))
            .isInstanceOf(MatchNotFoundException.class);
        assertThat(matchService.getMatch("missing")).isEmpty();
    }

    @Test
    void failedOperationIsNotPersisted() {
        String id = matchService.createMatch("alice", "bob", null).getId();

        assertThatThrownBy(() -> matchService.applyMove(id, "Ke2")).isInstanceOf(InvalidMoveException.class);

        assertThat(matchService.requireMatch(id).getMoveHistory()).isEmpty();
    }

    // ========== Draws ==========

    @Test
    void drawAgreementThroughService() {
        String id = matchService.createMatch("alice", "bob", null).getId();

        matchService.offerDraw(id, "alice");
        assertThatThrownBy(() -> matchService.acceptDraw(id, "alice")).isInstanceOf(IllegalMatchStateException.class);
        Match drawn = matchService.acceptDraw(id, "bob");

        assertThat(drawn.getResult()).contains(GameResult.DRAW);
        assertThat(matchService.listByStatus(MatchStatus.COMPLETED)).extracting(Match::getId).containsExactly(id);
    }

    @Test
    void finishedGamesReleaseTheirLocks() {
        String resigned = matchService.createMatch("alice", "bob", null).getId();
        String ongoing = matchService.createMatch("carol", "dave", null).getId();

        matchService.applyMove(resigned, "alice", "e4");
        matchService.applyMove(ongoing, "carol", "d4");
        assertThat(matchService.trackedLockCount()).isEqualTo(2);

        matchService.resign(resigned, "bob");
        assertThat(matchService.trackedLockCount()).isEqualTo(1);

        assertThatThrownBy(() -> matchService.applyMove(resigned, "black", "e5"))
            .isInstanceOf(IllegalMatchStateException.class);
        assertThatThrownBy(() -> matchService.resign(resigned, "alice"))
            .isInstanceOf(IllegalMatchStateException.class);
        assertThat(matchService.trackedLockCount()).isEqualTo(1);
    }

    @Test
    void declineRequiresParticipant() {
        String id = matchService.createMatch("alice", "bob", null).getId();
        matchService.offerDraw(id, "alice");

        assertThatThrownBy(() -> matchService.declineDraw(id, "mallory"))
            .isInstanceOf(IllegalMatchStateException.class);

        assertThat(matchService.declineDraw(id, "bob").getDrawOfferFrom()).isEmpty();
    }

    @Test
    void repetitionVisibleThroughDrawStatus() {
        String id = matchService.createMatch("alice", "bob", null).getId();
        for (String move : List.of("Nf3", "Nf6", "Ng1", "Ng8")) {
            matchService.applyMove(id, move);
        }

        assertThat(matchService.getDrawStatus(id)).hasValueSatisfying(status -> {
            assertThat(status.getRepetitionCount()).isEqualTo(2);
            assertThat(status.isApproachingRepetition()).isTrue();
        });
    }

    // ========== Import & Lookup ==========

    @Test
    void importedGameInProgressNeedsFreeSlot() {
        for (int i = 0; i < 5; i++) {
            matchService.createMatch("white" + i, "black" + i, null);
        }

        assertThatThrownBy(() -> matchService.importMatch("1. e4 e5 *", "alice", "bob"))
            .isInstanceOf(CapacityExceededException.class);

        ImportResult finished = matchService.importMatch("1. e4 e5 1/2-1/2", "alice", "bob");
        assertThat(finished.getStatus()).isEqualTo(MatchStatus.COMPLETED);
        assertThat(finished.getResult()).isEqualTo("1/2-1/2");
    }

    @Test
    void importDefaultsParticipantsToHeaders() {
        ImportResult result = matchService.importMatch(
            "[White \"carol\"]\n[Black \"?\"]\n\n1. d4 d5 2. c4 *", null, null);

        Match imported = matchService.requireMatch(result.getGameId());
        assertThat(imported.getWhitePlayerId()).isEqualTo("carol");
        assertThat(imported.getBlackPlayerId()).isEqualTo("Unknown");
        assertThat(result.getMoves()).isEqualTo(3);
        assertThat(result.getResult()).isEqualTo("*");
        assertThat(result.isValid()).isTrue();
        assertThat(result.getFinalPosition()).isEqualTo(imported.getFen());
    }

    @Test
    void deleteAndLegalMoveQueries() {
        String id = matchService.createMatch("alice", "bob", null).getId();

        assertThat(matchService.getLegalMoves(id, null)).hasSize(20);
        assertThat(matchService.getLegalMoves(id, "B1")).containsExactlyInAnyOrder("Na3", "Nc3");

        assertThat(matchService.deleteMatch(id)).isTrue();
        assertThat(matchService.matchExists(id)).isFalse();
        assertThat(matchService.deleteMatch(id)).isFalse();
    }

    @Test
    void listByParticipantCoversBothColours() {
        Match first = matchService.createMatch("alice", "bob", null);
        Match second = matchService.createMatch("carol", "alice", null);
        matchService.createMatch("dave", "erin", null);

        assertThat(matchService.listByParticipant("alice"))
            .extracting(Match::getId)
            .containsExactlyInAnyOrder(first.getId(), second.getId());
    }
}
