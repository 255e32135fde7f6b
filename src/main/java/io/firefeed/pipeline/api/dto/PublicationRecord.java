package io.firefeed.pipeline.api.dto;

import java.time.Instant;

/**
 * One delivered message. {@code translationId} is null when the original text was sent.
 */
public record PublicationRecord(
        Long id,
        String newsId,
        Long translationId,
        RecipientType recipientType,
        long recipientId,
        Long messageId,
        String language,
        Instant sentAt
) {}
