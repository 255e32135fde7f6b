package io.firefeed.pipeline.api.service;

import io.firefeed.pipeline.api.dto.PassReport;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe counters filled in while a pass runs.
 */
public class PassCounters {

    private final AtomicInteger feedsTotal = new AtomicInteger();
    private final AtomicInteger feedsFailed = new AtomicInteger();
    private final AtomicInteger entriesFetched = new AtomicInteger();
    private final AtomicInteger duplicates = new AtomicInteger();
    private final AtomicInteger dedupFailures = new AtomicInteger();
    private final AtomicInteger persisted = new AtomicInteger();
    private final AtomicInteger persistFailures = new AtomicInteger();
    private final AtomicInteger translationsStored = new AtomicInteger();
    private final AtomicInteger translationFallbacks = new AtomicInteger();
    private final AtomicInteger published = new AtomicInteger();
    private final AtomicInteger admissionRejections = new AtomicInteger();
    private final AtomicInteger publishFailures = new AtomicInteger();

    public void feeds(int count) { feedsTotal.addAndGet(count); }
    public void feedFailed() { feedsFailed.incrementAndGet(); }
    public void entriesFetched(int count) { entriesFetched.addAndGet(count); }
    public void duplicate() { duplicates.incrementAndGet(); }
    public void dedupFailed() { dedupFailures.incrementAndGet(); }
    public void persisted() { persisted.incrementAndGet(); }
    public void persistFailed() { persistFailures.incrementAndGet(); }
    public void translationStored() { translationsStored.incrementAndGet(); }
    public void translationFallback() { translationFallbacks.incrementAndGet(); }
    public void published() { published.incrementAndGet(); }
    public void admissionRejected() { admissionRejections.incrementAndGet(); }
    public void publishFailed() { publishFailures.incrementAndGet(); }

    public PassReport toReport(String passId, Instant startedAt, long durationMs) {
        return new PassReport(
                passId,
                startedAt,
                durationMs,
                feedsTotal.get(),
                feedsFailed.get(),
                entriesFetched.get(),
                duplicates.get(),
                dedupFailures.get(),
                persisted.get(),
                persistFailures.get(),
                translationsStored.get(),
                translationFallbacks.get(),
                published.get(),
                admissionRejections.get(),
                publishFailures.get()
        );
    }
}
