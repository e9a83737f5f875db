package com.chessmatch;

import com.chessmatch.config.MatchProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MatchProperties.class)
@Slf4j
public class ChessMatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChessMatchApplication.class, args);
    }

    @PreDestroy
    public void onExit() {
        log.info("Application is shutting down. Closing resources...");
    }
}
