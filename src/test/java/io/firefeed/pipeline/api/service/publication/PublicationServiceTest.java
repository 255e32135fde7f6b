package io.firefeed.pipeline.api.service.publication;

import io.firefeed.pipeline.api.dto.FeedSource;
import io.firefeed.pipeline.api.dto.PassReport;
import io.firefeed.pipeline.api.dto.PublicationRecord;
import io.firefeed.pipeline.api.dto.Translation;
import io.firefeed.pipeline.api.service.PassCounters;
import io.firefeed.pipeline.support.InMemoryStorageGateway;
import io.firefeed.pipeline.support.MutableClock;
import io.firefeed.pipeline.support.RecordingPublicationChannel;
import io.firefeed.pipeline.support.TestConfigs;
import io.firefeed.pipeline.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PublicationServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private MutableClock clock;
    private InMemoryStorageGateway storage;
    private RecordingPublicationChannel channel;
    private PublicationService publicationService;
    private FeedSource feed;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        storage = new InMemoryStorageGateway(clock);
        channel = new RecordingPublicationChannel();
        publicationService = new PublicationService(
                storage,
                new StorageBackedRateLimiter(storage),
                channel,
                TestConfigs.publication(),
                TestConfigs.translation(List.of("en", "ru", "de")),
                TestConfigs.deduplication(0.9),
                clock
        );
        feed = TestData.feed(1, "en");
        storage.addFeed(feed);
    }

    @Test
    @DisplayName("Should publish the original and every translated variant")
    void shouldPublishAllVariants() {
        storage.saveItem(TestData.item("n1", feed, T0));
        Translation ru = storage.saveTranslation("n1", "ru", "Заголовок", "Текст");
        Translation de = storage.saveTranslation("n1", "de", "Titel", "Inhalt");

        PassCounters counters = new PassCounters();
        int published = publicationService.publishPending(feed, counters);

        assertThat(published).isEqualTo(1);
        assertThat(channel.sent())
                .extracting(RecordingRow::of)
                .containsExactly(
                        new RecordingRow("en", 101L, null, "Title n1"),
                        new RecordingRow("ru", 102L, ru.id(), "Заголовок"),
                        new RecordingRow("de", 103L, de.id(), "Titel"));
        assertThat(storage.publications()).hasSize(3);

        PassReport report = counters.toReport("p", T0, 0);
        assertThat(report.published()).isEqualTo(1);
        assertThat(report.translationFallbacks()).isZero();
    }

    @Test
    @DisplayName("Should send the original text where a translation is missing")
    void shouldFallBackToOriginalText() {
        storage.saveItem(TestData.item("n1", feed, T0));
        storage.saveTranslation("n1", "ru", "Заголовок", "Текст");

        PassCounters counters = new PassCounters();
        publicationService.publishPending(feed, counters);

        RecordingPublicationChannel.Sent german = channel.sent().stream()
                .filter(sent -> sent.language().equals("de"))
                .findFirst()
                .orElseThrow();
        assertThat(german.title()).isEqualTo("Title n1");
        assertThat(german.translationId()).isNull();
        assertThat(german.recipientId()).isEqualTo(103L);

        PublicationRecord record = storage.publications().stream()
                .filter(p -> p.language().equals("de"))
                .findFirst()
                .orElseThrow();
        assertThat(record.translationId()).isNull();
        assertThat(counters.toReport("p", T0, 0).translationFallbacks()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should publish one item per interval and defer the rest")
    void shouldDeferItemsBeyondRateLimit() {
        storage.saveItem(TestData.item("n1", feed, T0.minusSeconds(60)));
        storage.saveItem(TestData.item("n2", feed, T0));
        storage.saveTranslation("n1", "ru", "a", "b");
        storage.saveTranslation("n1", "de", "c", "d");

        PassCounters first = new PassCounters();
        assertThat(publicationService.publishPending(feed, first)).isEqualTo(1);
        assertThat(first.toReport("p", T0, 0).admissionRejections()).isEqualTo(1);
        assertThat(channel.sent()).allMatch(sent -> sent.newsId().equals("n1"));

        clock.advance(Duration.ofMinutes(7));
        PassCounters second = new PassCounters();
        assertThat(publicationService.publishPending(feed, second)).isEqualTo(1);
        assertThat(second.toReport("p", T0, 0).admissionRejections()).isZero();
        assertThat(channel.sent()).anyMatch(sent -> sent.newsId().equals("n2"));
    }

    @Test
    @DisplayName("Should count failed sends and keep delivering other languages")
    void shouldCountPublishFailures() {
        storage.saveItem(TestData.item("n1", feed, T0));
        storage.saveTranslation("n1", "ru", "a", "b");
        storage.saveTranslation("n1", "de", "c", "d");
        channel.failFor("ru");

        PassCounters counters = new PassCounters();
        publicationService.publishPending(feed, counters);

        PassReport report = counters.toReport("p", T0, 0);
        assertThat(report.publishFailures()).isEqualTo(1);
        assertThat(report.published()).isEqualTo(1);
        assertThat(channel.sent()).extracting(RecordingPublicationChannel.Sent::language)
                .containsExactly("en", "de");
    }

    @Test
    @DisplayName("Should ignore items older than the lookback window")
    void shouldSkipStaleItems() {
        storage.saveItem(TestData.item("old", feed, T0.minus(Duration.ofHours(49))));

        PassCounters counters = new PassCounters();
        assertThat(publicationService.publishPending(feed, counters)).isZero();
        assertThat(channel.sent()).isEmpty();
    }

    private record RecordingRow(String language, long recipientId, Long translationId, String title) {
        static RecordingRow of(RecordingPublicationChannel.Sent sent) {
            return new RecordingRow(sent.language(), sent.recipientId(), sent.translationId(), sent.title());
        }
    }
}
