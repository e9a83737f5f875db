package com.chessmatch.repository.mongo;

import com.chessmatch.model.MatchStatus;
import com.chessmatch.model.mongo.MatchDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

// ========== Match Document Repository ==========
@Repository
public interface MatchDocumentRepository extends MongoRepository<MatchDocument, String> {

    List<MatchDocument> findAllByOrderByUpdatedAtDesc();

    List<MatchDocument> findByStatusOrderByUpdatedAtDesc(MatchStatus status);

    @Query(value = "{ $or: [ { 'whitePlayerId': ?0 }, { 'blackPlayerId': ?0 } ] }",
        sort = "{ 'updatedAt': -1 }")
    List<MatchDocument> findByParticipant(String participantId);

    long countByStatus(MatchStatus status);
}
