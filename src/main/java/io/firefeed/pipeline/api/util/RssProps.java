package io.firefeed.pipeline.api.util;

import io.firefeed.pipeline.config.CacheConfig;
import io.firefeed.pipeline.config.DeduplicationConfig;
import io.firefeed.pipeline.config.RssConfig;
import io.firefeed.pipeline.config.TranslationConfig;
import org.springframework.stereotype.Component;

@Component
public class RssProps {
    private final int maxAttempts;
    private final long retryDelay;
    private final long scheduleIntervalMs;
    private final long initialDelayMs;
    private final long cacheCleanupIntervalMs;
    private final long modelCleanupIntervalMs;
    private final long backfillIntervalMs;

    public RssProps(RssConfig config,
                    CacheConfig cacheConfig,
                    TranslationConfig translationConfig,
                    DeduplicationConfig deduplicationConfig) {
        this.maxAttempts = config.http().maxRetries();
        this.retryDelay = config.http().retryDelay();
        this.scheduleIntervalMs = config.processing().getScheduleIntervalMs();
        this.initialDelayMs = config.processing().getInitialDelayMs();
        this.cacheCleanupIntervalMs = cacheConfig.getCleanupIntervalMs();
        this.modelCleanupIntervalMs = translationConfig.modelCleanupInterval().toMillis();
        this.backfillIntervalMs = deduplicationConfig.backfillInterval().toMillis();
    }

    // retry
    public int getMaxAttempts() { return maxAttempts; }
    public long getRetryDelay() { return retryDelay; }

    // schedule
    public long getScheduleIntervalMs() { return scheduleIntervalMs; }
    public long getInitialDelayMs() { return initialDelayMs; }

    // maintenance
    public long getCacheCleanupIntervalMs() { return cacheCleanupIntervalMs; }
    public long getModelCleanupIntervalMs() { return modelCleanupIntervalMs; }
    public long getBackfillIntervalMs() { return backfillIntervalMs; }
}
