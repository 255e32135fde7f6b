package io.firefeed.pipeline.config;

import java.time.Duration;

public record OllamaModelConfig(
        String baseUrl,
        String modelName,
        Duration requestTimeout,
        double temperature
) {}
