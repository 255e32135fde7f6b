package io.firefeed.pipeline.support;

import io.firefeed.pipeline.api.dto.FeedSource;
import io.firefeed.pipeline.api.dto.MediaUrls;
import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.RawEntry;

import java.time.Instant;

public final class TestData {

    private TestData() {
    }

    public static FeedSource feed(long id, String language) {
        return new FeedSource(id, "Source " + id, "https://feeds.example.com/" + id + ".xml", language,
                "world", 1L, FeedSource.DEFAULT_COOLDOWN_MINUTES, FeedSource.DEFAULT_MAX_NEWS_PER_HOUR, true);
    }

    public static FeedSource feed(long id, String language, int cooldownMinutes, int maxNewsPerHour) {
        return new FeedSource(id, "Source " + id, "https://feeds.example.com/" + id + ".xml", language,
                "world", 1L, cooldownMinutes, maxNewsPerHour, true);
    }

    public static RawEntry entry(long feedId, String title, String content, String link) {
        return new RawEntry(title, content, link, Instant.parse("2024-05-01T10:00:00Z"), MediaUrls.none(), feedId);
    }

    public static NewsItem item(String id, FeedSource feed, Instant createdAt) {
        return new NewsItem(id, "Title " + id, "Content of " + id, feed.language(), feed.category(),
                feed.categoryId(), feed.id(), "https://news.example.com/" + id, null, null, null, createdAt);
    }
}
