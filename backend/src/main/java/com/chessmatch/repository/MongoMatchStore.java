package com.chessmatch.repository;

import com.chessmatch.chess.RulesEngine;
import com.chessmatch.model.Match;
import com.chessmatch.model.MatchStatus;
import com.chessmatch.model.mongo.MatchDocument;
import com.chessmatch.repository.mongo.MatchDocumentRepository;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;
import java.util.Optional;

// ========== MongoDB Store ==========
// Durable store backed by the "matches" collection. Snapshots are written whole on every save.
@Slf4j
public class MongoMatchStore extends AbstractMatchStore {

    private final MatchDocumentRepository matchDocumentRepository;
    private final MongoTemplate mongoTemplate;

    public MongoMatchStore(RulesEngine rulesEngine, MatchDocumentRepository matchDocumentRepository,
                           MongoTemplate mongoTemplate) {
        super(rulesEngine);
        this.matchDocumentRepository = matchDocumentRepository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void save(Match match) {
        matchDocumentRepository.save(match.toDocument());
    }

    @Override
    public Optional<Match> load(String id) {
        return restore(matchDocumentRepository.findById(id));
    }

    @Override
    public boolean delete(String id) {
        if (!matchDocumentRepository.existsById(id)) {
            return false;
        }
        matchDocumentRepository.deleteById(id);
        return true;
    }

    @Override
    public boolean existsById(String id) {
        return matchDocumentRepository.existsById(id);
    }

    @Override
    public List<Match> loadAll() {
        return restoreAll(matchDocumentRepository.findAllByOrderByUpdatedAtDesc());
    }

    @Override
    public List<Match> loadByStatus(MatchStatus status) {
        return restoreAll(matchDocumentRepository.findByStatusOrderByUpdatedAtDesc(status));
    }

    @Override
    public List<Match> loadByParticipant(String participantId) {
        return restoreAll(matchDocumentRepository.findByParticipant(participantId));
    }

    @Override
    public long countActive() {
        return matchDocumentRepository.countByStatus(MatchStatus.ACTIVE);
    }

    @Override
    public boolean healthCheck() {
        try {
            Document reply = mongoTemplate.executeCommand(new Document("ping", 1));
            return reply.get("ok") != null && ((Number) reply.get("ok")).doubleValue() == 1.0;
        } catch (DataAccessException e) {
            log.warn("MongoDB health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        // The Mongo client belongs to the Spring context and is closed with it.
        log.info("Closing MongoDB game store");
    }
}
