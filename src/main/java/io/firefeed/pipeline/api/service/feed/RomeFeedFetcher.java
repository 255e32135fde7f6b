package io.firefeed.pipeline.api.service.feed;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import io.firefeed.pipeline.api.dto.FeedFetchResult;
import io.firefeed.pipeline.api.dto.FeedSource;
import io.firefeed.pipeline.api.dto.MediaUrls;
import io.firefeed.pipeline.api.dto.RawEntry;
import io.firefeed.pipeline.api.exception.ErrorCategory;
import io.firefeed.pipeline.api.exception.FeedFetchException;
import io.firefeed.pipeline.config.ProcessingConfig;
import io.firefeed.pipeline.config.RssConfig;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class RomeFeedFetcher implements FeedFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RomeFeedFetcher.class);

    private final FeedDocumentClient documentClient;
    private final MediaExtractor mediaExtractor;
    private final ProcessingConfig processing;
    private final ExecutorService fanOutExecutor;
    private final ExecutorService downloadExecutor;
    private final Clock clock;
    private final Semaphore permits;
    private final AtomicInteger inFlight = new AtomicInteger();

    public RomeFeedFetcher(FeedDocumentClient documentClient,
                           MediaExtractor mediaExtractor,
                           RssConfig rssConfig,
                           @Qualifier("feedFanOutExecutor") ExecutorService fanOutExecutor,
                           @Qualifier("feedDownloadExecutor") ExecutorService downloadExecutor,
                           Clock clock) {
        this.documentClient = documentClient;
        this.mediaExtractor = mediaExtractor;
        this.processing = rssConfig.processing();
        this.fanOutExecutor = fanOutExecutor;
        this.downloadExecutor = downloadExecutor;
        this.clock = clock;
        this.permits = new Semaphore(Math.max(1, processing.maxConcurrentFeeds()), true);
    }

    @Override
    public List<FeedFetchResult> fetchAll(List<FeedSource> feeds) {
        List<CompletableFuture<FeedFetchResult>> futures = feeds.stream()
                .map(feed -> CompletableFuture.supplyAsync(() -> fetch(feed), fanOutExecutor))
                .toList();

        List<FeedFetchResult> results = new ArrayList<>(feeds.size());
        for (int i = 0; i < futures.size(); i++) {
            FeedSource feed = feeds.get(i);
            try {
                results.add(futures.get(i).join());
            } catch (CancellationException | CompletionException e) {
                logger.error("Fetch task for {} did not complete: {}", feed.url(), e.getMessage());
                results.add(FeedFetchResult.failure(feed, ErrorCategory.UNKNOWN, e.getMessage(), 0));
            }
        }

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        logger.info("Fetched {} feeds ({} failed)", results.size(), failed);
        return results;
    }

    @Override
    public FeedFetchResult fetch(FeedSource feed) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FeedFetchResult.failure(feed, ErrorCategory.UNKNOWN, "Interrupted while waiting for a fetch slot", 0);
        }

        long start = clock.millis();
        inFlight.incrementAndGet();
        Future<SyndFeed> download = null;
        try {
            download = downloadExecutor.submit(() -> documentClient.fetchFeed(feed.url()));
            SyndFeed document = download.get(processing.fetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
            List<RawEntry> entries = toEntries(document, feed);

            long duration = clock.millis() - start;
            logger.debug("Fetched {}: {} entries in {}ms", feed.getDisplayName(), entries.size(), duration);
            return FeedFetchResult.success(feed, entries, duration);

        } catch (TimeoutException e) {
            download.cancel(true);
            logger.warn("Fetch timed out after {} for {}", processing.fetchTimeout(), feed.url());
            return FeedFetchResult.failure(feed, ErrorCategory.TIMEOUT, "Fetch timed out", clock.millis() - start);

        } catch (ExecutionException e) {
            return handleFetchError(feed, e.getCause(), clock.millis() - start);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (download != null) {
                download.cancel(true);
            }
            return FeedFetchResult.failure(feed, ErrorCategory.UNKNOWN, "Interrupted", clock.millis() - start);

        } finally {
            inFlight.decrementAndGet();
            permits.release();
        }
    }

    public int getInFlight() {
        return inFlight.get();
    }

    private FeedFetchResult handleFetchError(FeedSource feed, Throwable cause, long duration) {
        if (cause instanceof FeedFetchException e) {
            switch (e.getCategory()) {
                case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, SERVER_UNAVAILABLE, SERVER_ERROR, IO_ERROR, RATE_LIMITED ->
                        logger.warn("Temporary error for {}: {}", feed.url(), e.getMessage());
                case NOT_FOUND, ACCESS_FORBIDDEN, AUTH_REQUIRED, INVALID_URL, DNS_ERROR ->
                        logger.error("Permanent error for {}: {}", feed.url(), e.getMessage());
                default -> logger.warn("Fetch failed for {} ({}): {}", feed.url(), e.getCategory(), e.getMessage());
            }
            return FeedFetchResult.failure(feed, e.getCategory(), e.getMessage(), duration);
        }
        logger.error("Unexpected error fetching {}: {}", feed.url(), cause == null ? "unknown" : cause.getMessage(), cause);
        return FeedFetchResult.failure(feed, ErrorCategory.UNKNOWN, cause == null ? null : cause.getMessage(), duration);
    }

    List<RawEntry> toEntries(SyndFeed document, FeedSource feed) {
        List<SyndEntry> syndEntries = document.getEntries();
        if (syndEntries == null || syndEntries.isEmpty()) {
            logger.debug("Feed has no entries: {}", feed.url());
            return List.of();
        }

        List<RawEntry> entries = new ArrayList<>();
        int limit = Math.min(syndEntries.size(), processing.maxEntriesPerFeed());
        for (SyndEntry syndEntry : syndEntries.subList(0, limit)) {
            RawEntry entry = convertEntry(syndEntry, feed);
            if (entry != null) {
                entries.add(entry);
            }
        }
        return entries;
    }

    private RawEntry convertEntry(SyndEntry entry, FeedSource feed) {
        String title = cleanText(entry.getTitle());
        String content = cleanText(rawContent(entry));
        String link = resolveLink(feed.url(), entry.getLink() != null ? entry.getLink() : entry.getUri());

        if (link == null) {
            logger.debug("Skipping entry without usable link: '{}'", title);
            return null;
        }
        if (wordCount(title) < processing.minTitleWords() || wordCount(content) < processing.minContentWords()) {
            logger.debug("Skipping short entry: '{}'", title);
            return null;
        }

        MediaUrls media = mediaExtractor.extract(entry);
        return new RawEntry(title, content, link, publishedAt(entry), media, feed.id());
    }

    private String rawContent(SyndEntry entry) {
        if (entry.getDescription() != null && entry.getDescription().getValue() != null
                && !entry.getDescription().getValue().isBlank()) {
            return entry.getDescription().getValue();
        }
        for (SyndContent content : entry.getContents()) {
            if (content.getValue() != null && !content.getValue().isBlank()) {
                return content.getValue();
            }
        }
        return "";
    }

    private Instant publishedAt(SyndEntry entry) {
        if (entry.getPublishedDate() != null) {
            return entry.getPublishedDate().toInstant();
        }
        if (entry.getUpdatedDate() != null) {
            return entry.getUpdatedDate().toInstant();
        }
        return clock.instant();
    }

    static String resolveLink(String feedUrl, String link) {
        if (link == null || link.isBlank()) {
            return null;
        }
        try {
            URI resolved = URI.create(feedUrl.trim()).resolve(link.trim());
            String scheme = resolved.getScheme() == null ? "" : resolved.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }
            return resolved.toString();
        } catch (IllegalArgumentException e) {
            logger.debug("Unresolvable link '{}' in {}: {}", link, feedUrl, e.getMessage());
            return null;
        }
    }

    static String cleanText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text().replaceAll("\\s+", " ").trim();
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
