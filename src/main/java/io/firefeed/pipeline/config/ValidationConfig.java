package io.firefeed.pipeline.config;

import java.time.Duration;

public record ValidationConfig(
        Duration cacheTtl,
        Duration requestTimeout
) {}
