package io.firefeed.pipeline.support;

import io.firefeed.pipeline.api.dto.FeedFetchResult;
import io.firefeed.pipeline.api.dto.FeedSource;
import io.firefeed.pipeline.api.dto.RawEntry;
import io.firefeed.pipeline.api.exception.ErrorCategory;
import io.firefeed.pipeline.api.service.feed.FeedFetcher;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;

public class StubFeedFetcher implements FeedFetcher {

    private final Map<Long, List<RawEntry>> entries = new ConcurrentHashMap<>();
    private final Map<Long, ErrorCategory> failures = new ConcurrentHashMap<>();
    private volatile CountDownLatch gate;
    private final CountDownLatch arrived = new CountDownLatch(1);

    public void serve(long feedId, List<RawEntry> feedEntries) {
        entries.put(feedId, feedEntries);
    }

    public void fail(long feedId, ErrorCategory category) {
        failures.put(feedId, category);
    }

    /**
     * Blocks every fetch until the latch is released.
     *
     * @return latch that opens once a fetch is waiting
     */
    public CountDownLatch holdUntil(CountDownLatch latch) {
        this.gate = latch;
        return arrived;
    }

    @Override
    public FeedFetchResult fetch(FeedSource feed) {
        CountDownLatch latch = gate;
        if (latch != null) {
            arrived.countDown();
            try {
                latch.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FeedFetchResult.failure(feed, ErrorCategory.UNKNOWN, "interrupted", 0);
            }
        }
        ErrorCategory failure = failures.get(feed.id());
        if (failure != null) {
            return FeedFetchResult.failure(feed, failure, "stubbed failure", 0);
        }
        return FeedFetchResult.success(feed, entries.getOrDefault(feed.id(), List.of()), 1);
    }

    @Override
    public List<FeedFetchResult> fetchAll(List<FeedSource> feeds) {
        return feeds.stream().map(this::fetch).toList();
    }
}
