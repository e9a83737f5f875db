package com.chessmatch.repository;

import com.chessmatch.chess.RulesEngine;
import com.chessmatch.model.Match;
import com.chessmatch.model.MatchStatus;
import com.chessmatch.model.mongo.MatchDocument;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

// ========== In-Memory Store ==========
// Process-local and lost on restart. Holds private copies of the snapshots it is given.
@Slf4j
public class InMemoryMatchStore extends AbstractMatchStore {

    private static final Comparator<MatchDocument> MOST_RECENT_FIRST =
        Comparator.comparing(MatchDocument::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final Map<String, MatchDocument> documents = new ConcurrentHashMap<>();

    public InMemoryMatchStore(RulesEngine rulesEngine) {
        super(rulesEngine);
    }

    @Override
    public void save(Match match) {
        documents.put(match.getId(), match.toDocument());
    }

    @Override
    public Optional<Match> load(String id) {
        return restore(Optional.ofNullable(documents.get(id)).map(InMemoryMatchStore::copy));
    }

    @Override
    public boolean delete(String id) {
        return documents.remove(id) != null;
    }

    @Override
    public boolean existsById(String id) {
        return documents.containsKey(id);
    }

    @Override
    public List<Match> loadAll() {
        return restoreAll(select(document -> true));
    }

    @Override
    public List<Match> loadByStatus(MatchStatus status) {
        return restoreAll(select(document -> document.getStatus() == status));
    }

    @Override
    public List<Match> loadByParticipant(String participantId) {
        return restoreAll(select(document -> participantId.equals(document.getWhitePlayerId())
            || participantId.equals(document.getBlackPlayerId())));
    }

    @Override
    public long countActive() {
        return documents.values().stream()
            .filter(document -> document.getStatus() == MatchStatus.ACTIVE)
            .count();
    }

    @Override
    public boolean healthCheck() {
        return true;
    }

    @Override
    public void close() {
        log.info("Closing in-memory game store ({} games discarded)", documents.size());
        documents.clear();
    }

    /** Stores a raw snapshot as-is. Used to seed records that did not come from a live match. */
    void put(MatchDocument document) {
        documents.put(document.getId(), copy(document));
    }

    private List<MatchDocument> select(Predicate<MatchDocument> filter) {
        return documents.values().stream()
            .filter(filter)
            .sorted(MOST_RECENT_FIRST)
            .map(InMemoryMatchStore::copy)
            .collect(Collectors.toList());
    }

    private static MatchDocument copy(MatchDocument document) {
        return document.toBuilder()
            .moveHistory(document.getMoveHistory() == null ? null : new ArrayList<>(document.getMoveHistory()))
            .positionHistory(document.getPositionHistory() == null ? null : new LinkedHashMap<>(document.getPositionHistory()))
            .timeControl(document.getTimeControl() == null ? null : document.getTimeControl().toBuilder().build())
            .build();
    }
}
