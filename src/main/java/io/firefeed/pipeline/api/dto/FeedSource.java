package io.firefeed.pipeline.api.dto;

/**
 * An active RSS feed as configured in {@code rss_feeds}.
 */
public record FeedSource(
        long id,
        String sourceName,
        String url,
        String language,
        String category,
        Long categoryId,
        int cooldownMinutes,
        int maxNewsPerHour,
        boolean active
) {
    public static final int DEFAULT_COOLDOWN_MINUTES = 10;
    public static final int DEFAULT_MAX_NEWS_PER_HOUR = 10;

    public String getDisplayName() {
        return sourceName + " (" + language + ")";
    }
}
