package io.firefeed.pipeline.api.dto;

import org.apache.commons.codec.digest.DigestUtils;

import java.time.Instant;

public record NewsItem(
        String id,
        String title,
        String content,
        String language,
        String category,
        Long categoryId,
        long feedId,
        String sourceUrl,
        float[] embedding,
        String imageUrl,
        String videoUrl,
        Instant createdAt
) {

    public static NewsItem fromEntry(RawEntry entry, FeedSource feed, float[] embedding, Instant createdAt) {
        return new NewsItem(
                newsId(entry.title(), entry.content(), entry.link(), feed.id()),
                entry.title(),
                entry.content(),
                feed.language(),
                feed.category(),
                feed.categoryId(),
                feed.id(),
                entry.link(),
                embedding,
                entry.media().imageUrl(),
                entry.media().videoUrl(),
                createdAt
        );
    }

    /**
     * SHA-256 hex of title, content, link and feed id concatenated.
     */
    public static String newsId(String title, String content, String link, long feedId) {
        return DigestUtils.sha256Hex(title + content + link + feedId);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public NewsItem withEmbedding(float[] newEmbedding) {
        return new NewsItem(id, title, content, language, category, categoryId, feedId, sourceUrl,
                newEmbedding, imageUrl, videoUrl, createdAt);
    }
}
