package com.chessmatch.repository;

import com.chessmatch.chess.RulesEngine;
import com.chessmatch.exception.CorruptStateException;
import com.chessmatch.model.Match;
import com.chessmatch.model.mongo.MatchDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared snapshot handling: stores persist {@link MatchDocument}s and rebuild matches through
 * {@link Match#restore}.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractMatchStore implements MatchStore {

    protected final RulesEngine rulesEngine;

    protected Optional<Match> restore(Optional<MatchDocument> document) {
        return document.map(found -> Match.restore(found, rulesEngine));
    }

    protected List<Match> restoreAll(List<MatchDocument> documents) {
        List<Match> matches = new ArrayList<>(documents.size());
        for (MatchDocument document : documents) {
            try {
                matches.add(Match.restore(document, rulesEngine));
            } catch (CorruptStateException e) {
                log.warn("Skipping unreadable game {}: {}", document.getId(), e.getMessage());
            }
        }
        return matches;
    }
}
