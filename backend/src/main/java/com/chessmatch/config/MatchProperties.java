package com.chessmatch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under {@code chessmatch.*}.
 */
@ConfigurationProperties(prefix = "chessmatch")
@Validated
@Data
public class MatchProperties {

    /** Ceiling on simultaneously ACTIVE games. Paused and completed games do not count. */
    @Min(1)
    private int maxConcurrentMatches = 5;

    @Valid
    private Storage storage = new Storage();

    @Data
    public static class Storage {
        @NotNull
        private StorageType type = StorageType.MEMORY;
    }

    public enum StorageType {
        MEMORY,
        MONGO
    }
}
