package io.firefeed.pipeline.api.dto;

import io.firefeed.pipeline.api.exception.ErrorCategory;

import java.util.List;

public record FeedFetchResult(
        FeedSource feed,
        List<RawEntry> entries,
        ErrorCategory error,
        String errorMessage,
        long durationMs
) {

    public static FeedFetchResult success(FeedSource feed, List<RawEntry> entries, long durationMs) {
        return new FeedFetchResult(feed, List.copyOf(entries), null, null, durationMs);
    }

    public static FeedFetchResult failure(FeedSource feed, ErrorCategory error, String message, long durationMs) {
        return new FeedFetchResult(feed, List.of(), error, message, durationMs);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
