package com.chessmatch.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

// Repositories exist only when games are kept in MongoDB.
@Configuration
@ConditionalOnProperty(prefix = "chessmatch.storage", name = "type", havingValue = "mongo")
@EnableMongoRepositories(basePackages = "com.chessmatch.repository.mongo")
public class DatabaseConfig {}
