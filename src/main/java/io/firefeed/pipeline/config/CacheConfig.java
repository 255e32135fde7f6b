package io.firefeed.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "cache")
public record CacheConfig(
        Duration defaultTtl,
        int maxSize,
        Duration cleanupInterval
) {
    public long getCleanupIntervalMs() {
        return cleanupInterval.toMillis();
    }
}
