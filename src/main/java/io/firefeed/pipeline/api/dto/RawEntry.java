package io.firefeed.pipeline.api.dto;

import java.time.Instant;

/**
 * A cleaned feed entry, not yet deduplicated or stored.
 */
public record RawEntry(
        String title,
        String content,
        String link,
        Instant publishedAt,
        MediaUrls media,
        long feedId
) {
    public String embeddingText() {
        return title + " " + content;
    }
}
