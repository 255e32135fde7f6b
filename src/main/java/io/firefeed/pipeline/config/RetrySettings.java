package io.firefeed.pipeline.config;

import java.time.Duration;

public record RetrySettings(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        boolean jitter
) {}
