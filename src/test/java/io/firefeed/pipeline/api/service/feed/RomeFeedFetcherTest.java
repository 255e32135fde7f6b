package io.firefeed.pipeline.api.service.feed;

import com.rometools.rome.feed.synd.SyndContentImpl;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndEntryImpl;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndFeedImpl;
import io.firefeed.pipeline.api.dto.FeedFetchResult;
import io.firefeed.pipeline.api.dto.FeedSource;
import io.firefeed.pipeline.api.dto.RawEntry;
import io.firefeed.pipeline.api.exception.ErrorCategory;
import io.firefeed.pipeline.api.exception.FeedFetchException;
import io.firefeed.pipeline.support.TestConfigs;
import io.firefeed.pipeline.support.TestData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RomeFeedFetcherTest {

    @Mock
    private FeedDocumentClient documentClient;

    private ExecutorService fanOut;
    private ExecutorService downloads;

    @BeforeEach
    void setUp() {
        fanOut = Executors.newCachedThreadPool();
        downloads = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        fanOut.shutdownNow();
        downloads.shutdownNow();
    }

    @Test
    @DisplayName("Should never run more fetches than the concurrency limit")
    void shouldBoundConcurrentFetches() throws Exception {
        RomeFeedFetcher fetcher = fetcher(2, Duration.ofSeconds(5));
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(documentClient.fetchFeed(anyString())).thenAnswer(invocation -> {
            peak.accumulateAndGet(current.incrementAndGet(), Math::max);
            Thread.sleep(100);
            current.decrementAndGet();
            return feedWith(List.of());
        });

        List<FeedSource> feeds = IntStream.rangeClosed(1, 5).mapToObj(i -> TestData.feed(i, "en")).toList();

        long start = System.nanoTime();
        List<FeedFetchResult> results = fetcher.fetchAll(feeds);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(results).hasSize(5).allMatch(FeedFetchResult::isSuccess);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(300);
        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(fetcher.getInFlight()).isZero();
    }

    @Test
    @DisplayName("Should keep results in feed order and isolate failures")
    void shouldIsolateFailures() throws Exception {
        RomeFeedFetcher fetcher = fetcher(4, Duration.ofSeconds(5));
        FeedSource good = TestData.feed(1, "en");
        FeedSource missing = TestData.feed(2, "en");
        when(documentClient.fetchFeed(good.url())).thenReturn(feedWith(List.of(
                entry("Markets rally", "<p>Stocks rose sharply on <b>Monday</b> morning</p>", "https://news.example.com/a"))));
        when(documentClient.fetchFeed(missing.url()))
                .thenThrow(new FeedFetchException("Feed not found (404)", ErrorCategory.NOT_FOUND));

        List<FeedFetchResult> results = fetcher.fetchAll(List.of(good, missing));

        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(0).entries()).hasSize(1);
        assertThat(results.get(1).isSuccess()).isFalse();
        assertThat(results.get(1).error()).isEqualTo(ErrorCategory.NOT_FOUND);
    }

    @Test
    @DisplayName("Should report a timeout when the download exceeds the fetch deadline")
    void shouldTimeOutSlowFeeds() throws Exception {
        RomeFeedFetcher fetcher = fetcher(2, Duration.ofMillis(100));
        when(documentClient.fetchFeed(anyString())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return feedWith(List.of());
        });

        FeedFetchResult result = fetcher.fetch(TestData.feed(1, "en"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).isEqualTo(ErrorCategory.TIMEOUT);
    }

    @Test
    @DisplayName("Should clean text, resolve links and drop entries without a link or too short")
    void shouldConvertEntries() {
        RomeFeedFetcher fetcher = fetcher(2, Duration.ofSeconds(5));
        FeedSource feed = TestData.feed(7, "en");
        SyndEntry dated = entry("Election results", "<div>Votes counted   in all <i>regions</i></div>", "/news/1");
        dated.setPublishedDate(new Date(1714557600000L));

        List<RawEntry> entries = fetcher.toEntries(feedWith(List.of(
                dated,
                entry("No link here", "Body with enough words", null),
                entry("Short", "two words", "https://news.example.com/short")
        )), feed);

        assertThat(entries).hasSize(1);
        RawEntry converted = entries.get(0);
        assertThat(converted.content()).isEqualTo("Votes counted in all regions");
        assertThat(converted.link()).isEqualTo("https://feeds.example.com/news/1");
        assertThat(converted.publishedAt().toEpochMilli()).isEqualTo(1714557600000L);
        assertThat(converted.feedId()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should reject links that are not http or https")
    void shouldRejectNonHttpLinks() {
        assertThat(RomeFeedFetcher.resolveLink("https://example.com/rss", "javascript:alert(1)")).isNull();
        assertThat(RomeFeedFetcher.resolveLink("https://example.com/rss", "  ")).isNull();
        assertThat(RomeFeedFetcher.resolveLink("https://example.com/rss", "https://other.com/x")).isEqualTo("https://other.com/x");
        assertThat(RomeFeedFetcher.wordCount("  one two  three ")).isEqualTo(3);
    }

    private RomeFeedFetcher fetcher(int limit, Duration fetchTimeout) {
        return new RomeFeedFetcher(documentClient, new MediaExtractor(1024), TestConfigs.rss(limit, fetchTimeout),
                fanOut, downloads, Clock.systemUTC());
    }

    private static SyndFeed feedWith(List<SyndEntry> entries) {
        SyndFeed feed = new SyndFeedImpl();
        feed.setFeedType("rss_2.0");
        feed.setEntries(new ArrayList<>(entries));
        return feed;
    }

    private static SyndEntry entry(String title, String description, String link) {
        SyndEntry entry = new SyndEntryImpl();
        entry.setTitle(title);
        entry.setLink(link);
        SyndContentImpl content = new SyndContentImpl();
        content.setType("text/html");
        content.setValue(description);
        entry.setDescription(content);
        return entry;
    }
}
