package com.chessmatch.config;

import com.chessmatch.service.MatchService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("matchStore")
@RequiredArgsConstructor
public class MatchStoreHealthIndicator implements HealthIndicator {

    private final MatchService matchService;
    private final MatchProperties matchProperties;

    @Override
    public Health health() {
        if (!matchService.healthCheck()) {
            return Health.down()
                .withDetail("storage", matchProperties.getStorage().getType())
                .build();
        }
        return Health.up()
            .withDetail("storage", matchProperties.getStorage().getType())
            .withDetail("activeGames", matchService.countActive())
            .withDetail("maxConcurrentGames", matchProperties.getMaxConcurrentMatches())
            .build();
    }
}
