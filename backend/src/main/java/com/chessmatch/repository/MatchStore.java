package com.chessmatch.repository;

import com.chessmatch.model.Match;
import com.chessmatch.model.MatchStatus;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for matches. Implementations keep an independent copy of what they are
 * given and hand out a fresh, independent {@link Match} on every read.
 *
 * <p>{@link #load} propagates {@link com.chessmatch.exception.CorruptStateException} for a
 * record that cannot be rebuilt; the listing methods skip such records.
 */
public interface MatchStore {

    void save(Match match);

    Optional<Match> load(String id);

    boolean delete(String id);

    boolean existsById(String id);

    /** All matches, most recently updated first. */
    List<Match> loadAll();

    List<Match> loadByStatus(MatchStatus status);

    /** Matches in which the participant plays either colour. */
    List<Match> loadByParticipant(String participantId);

    long countActive();

    boolean healthCheck();

    void close();
}
