package com.chessmatch.repository;

import com.chessmatch.chess.StandardRulesEngine;
import com.chessmatch.exception.CorruptStateException;
import com.chessmatch.model.Match;
import com.chessmatch.model.MatchStatus;
import com.chessmatch.model.mongo.MatchDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMatchStoreTest {

    private final StandardRulesEngine engine = new StandardRulesEngine();
    private InMemoryMatchStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryMatchStore(engine);
    }

    @Test
    void loadReturnsIndependentCopies() {
        Match match = Match.create("alice", "bob", null, engine);
        store.save(match);

        Match first = store.load(match.getId()).orElseThrow();
        first.applyMove("e4");
        Match second = store.load(match.getId()).orElseThrow();

        assertThat(second.getMoveHistory()).isEmpty();
        assertThat(second).isNotSameAs(first);
    }

    @Test
    void savedMatchIsDetachedFromCaller() {
        Match match = Match.create("alice", "bob", null, engine);
        store.save(match);

        match.applyMove("e4");

        assertThat(store.load(match.getId()).orElseThrow().getMoveHistory()).isEmpty();
    }

    @Test
    void missingMatchLoadsEmpty() {
        assertThat(store.load("nope")).isEmpty();
        assertThat(store.existsById("nope")).isFalse();
        assertThat(store.delete("nope")).isFalse();
    }

    @Test
    void deleteRemovesMatch() {
        Match match = Match.create("alice", "bob", null, engine);
        store.save(match);

        assertThat(store.delete(match.getId())).isTrue();
        assertThat(store.existsById(match.getId())).isFalse();
        assertThat(store.loadAll()).isEmpty();
    }

    @Test
    void filtersByStatusAndParticipant() {
        Match active = Match.create("alice", "bob", null, engine);
        Match paused = Match.create("carol", "alice", null, engine);
        paused.pause("carol");
        Match other = Match.create("dave", "erin", null, engine);
        store.save(active);
        store.save(paused);
        store.save(other);

        assertThat(store.countActive()).isEqualTo(2);
        assertThat(ids(store.loadByStatus(MatchStatus.PAUSED))).containsExactly(paused.getId());
        assertThat(ids(store.loadByParticipant("alice"))).containsExactlyInAnyOrder(active.getId(), paused.getId());
        assertThat(store.loadAll()).hasSize(3);
    }

    @Test
    void corruptRecordIsSkippedInListingsButFailsOnLoad() {
        Match good = Match.create("alice", "bob", null, engine);
        store.save(good);
        MatchDocument broken = Match.create("carol", "dave", null, engine).toDocument();
        broken.setMoveHistory(List.of("Ke2"));
        store.put(broken);

        assertThat(ids(store.loadAll())).containsExactly(good.getId());
        assertThatThrownBy(() -> store.load(broken.getId())).isInstanceOf(CorruptStateException.class);
    }

    @Test
    void closeDiscardsEverything() {
        store.save(Match.create("alice", "bob", null, engine));

        store.close();

        assertThat(store.loadAll()).isEmpty();
        assertThat(store.healthCheck()).isTrue();
    }

    private static List<String> ids(List<Match> matches) {
        return matches.stream().map(Match::getId).toList();
    }
}
