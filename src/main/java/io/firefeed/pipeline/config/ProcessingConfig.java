package io.firefeed.pipeline.config;

import java.time.Duration;

public record ProcessingConfig(
        Duration scheduleInterval,
        Duration initialDelay,
        boolean enableScheduling,
        int maxConcurrentFeeds,
        int maxEntriesPerFeed,
        int minTitleWords,
        int minContentWords,
        Duration fetchTimeout,
        long maxVideoBytes
) {
    public long getScheduleIntervalMs() {
        return scheduleInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }
}
