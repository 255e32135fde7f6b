package io.firefeed.pipeline.config;

import java.time.Duration;

public record EmbeddingConfig(
        String baseUrl,
        String modelName,
        int dimension,
        int maxChars,
        Duration timeout
) {}
