package io.firefeed.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "deduplication")
public record DeduplicationConfig(
        boolean enabled,
        double similarityThreshold,
        Duration lookbackWindow,
        Duration linkTtl,
        int backfillBatchSize,
        Duration backfillInterval,
        EmbeddingConfig embedding
) {}
