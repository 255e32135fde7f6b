package io.firefeed.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "queue")
public record QueueConfig(
        int maxSize,
        int defaultWorkers,
        Duration taskTimeout,
        Duration enqueueTimeout,
        int maxBatchSize
) {}
