package io.firefeed.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.firefeed.pipeline.api.dto.PassReport;

import java.time.LocalDateTime;
import java.time.ZoneId;

public record BatchProcessedEvent(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("feedsTotal") int feedsTotal,
        @JsonProperty("feedsFailed") int feedsFailed,
        @JsonProperty("totalArticles") int totalArticles,
        @JsonProperty("newArticles") int newArticles,
        @JsonProperty("duplicates") int duplicates,
        @JsonProperty("published") int published,
        @JsonProperty("translationFallbacks") int translationFallbacks,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("processedAt")
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime processedAt
) {
    public static BatchProcessedEvent from(PassReport report) {
        return new BatchProcessedEvent(
                report.passId(),
                report.feedsTotal(),
                report.feedsFailed(),
                report.entriesFetched(),
                report.persisted(),
                report.duplicates(),
                report.published(),
                report.translationFallbacks(),
                report.durationMs(),
                LocalDateTime.ofInstant(report.startedAt(), ZoneId.systemDefault())
        );
    }
}
