package com.chessmatch.config;

import com.chessmatch.chess.RulesEngine;
import com.chessmatch.repository.InMemoryMatchStore;
import com.chessmatch.repository.MatchStore;
import com.chessmatch.repository.MongoMatchStore;
import com.chessmatch.repository.mongo.MatchDocumentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

// ========== Storage Selection ==========
// MatchService closes the store on shutdown, so the beans declare no destroy method.
@Configuration
@Slf4j
public class StorageConfig {

    @Bean(destroyMethod = "")
    @ConditionalOnProperty(prefix = "chessmatch.storage", name = "type", havingValue = "mongo")
    public MatchStore mongoMatchStore(RulesEngine rulesEngine, MatchDocumentRepository matchDocumentRepository,
                                      MongoTemplate mongoTemplate) {
        log.info("Game storage: MongoDB");
        return new MongoMatchStore(rulesEngine, matchDocumentRepository, mongoTemplate);
    }

    @Bean(destroyMethod = "")
    @ConditionalOnProperty(prefix = "chessmatch.storage", name = "type", havingValue = "memory", matchIfMissing = true)
    public MatchStore inMemoryMatchStore(RulesEngine rulesEngine) {
        log.info("Game storage: in-memory (games are lost on restart)");
        return new InMemoryMatchStore(rulesEngine);
    }
}
