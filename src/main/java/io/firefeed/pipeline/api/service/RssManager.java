package io.firefeed.pipeline.api.service;

import io.firefeed.pipeline.api.dto.DuplicateVerdict;
import io.firefeed.pipeline.api.dto.FeedFetchResult;
import io.firefeed.pipeline.api.dto.FeedSource;
import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.PassReport;
import io.firefeed.pipeline.api.dto.RawEntry;
import io.firefeed.pipeline.api.dto.TranslationOutcome;
import io.firefeed.pipeline.api.exception.StorageException;
import io.firefeed.pipeline.api.service.dedup.DuplicateDetector;
import io.firefeed.pipeline.api.service.feed.FeedFetcher;
import io.firefeed.pipeline.api.service.publication.EventPublisherService;
import io.firefeed.pipeline.api.service.publication.PublicationService;
import io.firefeed.pipeline.api.service.storage.StorageGateway;
import io.firefeed.pipeline.api.service.translation.ModelManager;
import io.firefeed.pipeline.api.service.translation.TranslationService;
import io.firefeed.pipeline.config.RssConfig;
import io.firefeed.pipeline.config.TranslationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs ingestion passes: fetch every active feed, drop duplicates, store new items
 * with their translations, then publish what the rate limiter admits.
 * <p>
 * Feeds are processed in parallel, entries of one feed in document order. Only one
 * pass runs at a time.
 */
@Service
public class RssManager {

    private static final Logger logger = LoggerFactory.getLogger(RssManager.class);

    private final StorageGateway storage;
    private final FeedFetcher feedFetcher;
    private final DuplicateDetector duplicateDetector;
    private final TranslationService translationService;
    private final PublicationService publicationService;
    private final ModelManager modelManager;
    private final EventPublisherService eventPublisher;
    private final RetryTemplate persistRetryTemplate;
    private final ExecutorService feedExecutor;
    private final RssConfig rssConfig;
    private final TranslationConfig translationConfig;
    private final Clock clock;

    private final ReentrantLock passLock = new ReentrantLock();
    private final AtomicReference<PassReport> lastReport = new AtomicReference<>();

    public RssManager(StorageGateway storage,
                      FeedFetcher feedFetcher,
                      DuplicateDetector duplicateDetector,
                      TranslationService translationService,
                      PublicationService publicationService,
                      ModelManager modelManager,
                      EventPublisherService eventPublisher,
                      @Qualifier("persistRetryTemplate") RetryTemplate persistRetryTemplate,
                      @Qualifier("pipelineFeedExecutor") ExecutorService feedExecutor,
                      RssConfig rssConfig,
                      TranslationConfig translationConfig,
                      Clock clock) {
        this.storage = storage;
        this.feedFetcher = feedFetcher;
        this.duplicateDetector = duplicateDetector;
        this.translationService = translationService;
        this.publicationService = publicationService;
        this.modelManager = modelManager;
        this.eventPublisher = eventPublisher;
        this.persistRetryTemplate = persistRetryTemplate;
        this.feedExecutor = feedExecutor;
        this.rssConfig = rssConfig;
        this.translationConfig = translationConfig;
        this.clock = clock;
    }

    @Scheduled(
            fixedRateString = "#{@rssProps.scheduleIntervalMs}",
            initialDelayString = "#{@rssProps.initialDelayMs}"
    )
    public void scheduledPass() {
        if (!rssConfig.processing().enableScheduling()) {
            return;
        }
        if (passLock.isLocked()) {
            logger.info("Previous pass still running, skipping scheduled pass");
            return;
        }
        try {
            runOnce();
        } catch (IllegalStateException e) {
            logger.info("Skipping scheduled pass: {}", e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Scheduled pass failed", e);
        }
    }

    /**
     * Run one full pass.
     *
     * @throws IllegalStateException if another pass is running
     */
    public PassReport runOnce() {
        if (!passLock.tryLock()) {
            throw new IllegalStateException("A pass is already running");
        }
        try {
            return doRun();
        } finally {
            passLock.unlock();
        }
    }

    public Optional<PassReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public boolean isRunning() {
        return passLock.isLocked();
    }

    private PassReport doRun() {
        String passId = "pass-" + UUID.randomUUID();
        Instant startedAt = clock.instant();
        long start = System.currentTimeMillis();
        PassCounters counters = new PassCounters();

        List<FeedSource> feeds = storage.listActiveFeeds();
        counters.feeds(feeds.size());
        logger.info("Starting pass {} for {} active feeds", passId, feeds.size());

        if (!feeds.isEmpty()) {
            duplicateDetector.refreshIndex();
            List<FeedFetchResult> results = feedFetcher.fetchAll(feeds);

            List<CompletableFuture<Void>> processing = results.stream()
                    .map(result -> CompletableFuture.runAsync(() -> processFeed(result, counters), feedExecutor))
                    .toList();

            for (int i = 0; i < processing.size(); i++) {
                try {
                    processing.get(i).join();
                } catch (CompletionException e) {
                    counters.feedFailed();
                    logger.error("Processing of feed {} failed: {}",
                            results.get(i).feed().getDisplayName(), e.getMessage(), e.getCause());
                }
            }
        }

        long duration = System.currentTimeMillis() - start;
        PassReport report = counters.toReport(passId, startedAt, duration);
        lastReport.set(report);

        int released = modelManager.sweepIdle(translationConfig.modelIdleTimeout());
        if (released > 0) {
            logger.info("Released {} idle translation models after pass", released);
        }
        eventPublisher.publishBatchProcessed(report);

        logger.info("Pass {} completed in {}ms: {} feeds ({} failed), {} entries, {} duplicates, {} stored, {} published, {} deferred",
                passId, duration, report.feedsTotal(), report.feedsFailed(), report.entriesFetched(),
                report.duplicates(), report.persisted(), report.published(), report.admissionRejections());
        return report;
    }

    void processFeed(FeedFetchResult result, PassCounters counters) {
        FeedSource feed = result.feed();
        if (!result.isSuccess()) {
            counters.feedFailed();
            logger.warn("Feed {} failed ({}): {}", feed.getDisplayName(), result.error(), result.errorMessage());
        } else {
            markFetched(feed);
            counters.entriesFetched(result.entries().size());

            int stored = 0;
            for (RawEntry entry : result.entries()) {
                if (ingest(entry, feed, counters)) {
                    stored++;
                }
            }
            logger.info("Processed {}: {} entries, {} new in {}ms",
                    feed.getDisplayName(), result.entries().size(), stored, result.durationMs());
        }

        // items stored by earlier passes may be waiting for their slot even when this fetch failed
        try {
            publicationService.publishPending(feed, counters);
        } catch (StorageException e) {
            logger.error("Failed to load pending items of feed {}: {}", feed.getDisplayName(), e.getMessage());
        }
    }

    private boolean ingest(RawEntry entry, FeedSource feed, PassCounters counters) {
        DuplicateVerdict verdict = duplicateDetector.check(entry);
        if (verdict.failed()) {
            counters.dedupFailed();
        }
        if (verdict.duplicate()) {
            counters.duplicate();
            return false;
        }

        NewsItem item = NewsItem.fromEntry(entry, feed, verdict.embedding(), clock.instant());
        boolean inserted;
        try {
            inserted = persistRetryTemplate.execute(context -> storage.saveItem(item));
        } catch (StorageException e) {
            counters.persistFailed();
            duplicateDetector.release(item.id());
            logger.error("Failed to store {} from {}, will retry next pass: {}", entry.link(), feed.getDisplayName(), e.getMessage());
            return false;
        }

        duplicateDetector.remember(item.id(), entry.link(), item.embedding());
        if (!inserted) {
            counters.duplicate();
            return false;
        }
        counters.persisted();

        if (translationConfig.enabled()) {
            storeTranslations(item, counters);
        }
        return true;
    }

    private void storeTranslations(NewsItem item, PassCounters counters) {
        Map<String, TranslationOutcome> outcomes =
                translationService.translateItem(item, translationConfig.targetLanguages());

        for (TranslationOutcome outcome : outcomes.values()) {
            if (!outcome.success()) {
                logger.debug("No {} translation for {}: {}", outcome.language(), item.id(), outcome.failureReason());
                continue;
            }
            try {
                storage.saveTranslation(item.id(), outcome.language(), outcome.title(), outcome.content());
                counters.translationStored();
            } catch (StorageException e) {
                logger.error("Failed to store {} translation of {}: {}", outcome.language(), item.id(), e.getMessage());
            }
        }
    }

    private void markFetched(FeedSource feed) {
        try {
            storage.markFetched(feed.id(), clock.instant());
        } catch (StorageException e) {
            logger.warn("Failed to update fetch time of feed {}: {}", feed.getDisplayName(), e.getMessage());
        }
    }
}
