package io.firefeed.pipeline.api.service.feed;

import io.firefeed.pipeline.api.dto.FeedFetchResult;
import io.firefeed.pipeline.api.dto.FeedSource;

import java.util.List;

public interface FeedFetcher {

    /**
     * Fetch one feed. Failures are returned as a failed result, never thrown.
     */
    FeedFetchResult fetch(FeedSource feed);

    /**
     * Fetch all feeds concurrently; results are in the order of {@code feeds}.
     */
    List<FeedFetchResult> fetchAll(List<FeedSource> feeds);
}
