package io.firefeed.pipeline.api.dto;

import java.time.Instant;

public record Translation(
        Long id,
        String newsId,
        String language,
        String title,
        String content,
        Instant createdAt
) {}
