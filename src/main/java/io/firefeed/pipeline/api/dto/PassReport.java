package io.firefeed.pipeline.api.dto;

import java.time.Instant;

/**
 * Counters collected over one pipeline pass.
 */
public record PassReport(
        String passId,
        Instant startedAt,
        long durationMs,
        int feedsTotal,
        int feedsFailed,
        int entriesFetched,
        int duplicates,
        int dedupFailures,
        int persisted,
        int persistFailures,
        int translationsStored,
        int translationFallbacks,
        int published,
        int admissionRejections,
        int publishFailures
) {}
