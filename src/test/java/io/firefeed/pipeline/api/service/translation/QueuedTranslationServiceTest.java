package io.firefeed.pipeline.api.service.translation;

import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.TranslationOutcome;
import io.firefeed.pipeline.api.exception.TranslationException;
import io.firefeed.pipeline.api.service.cache.TtlCache;
import io.firefeed.pipeline.config.TranslationConfig;
import io.firefeed.pipeline.support.TestConfigs;
import io.firefeed.pipeline.support.TestData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueuedTranslationServiceTest {

    private FakeModelLoader loader;
    private ModelManager modelManager;
    private TranslationTaskQueue queue;
    private TranslationCache cache;
    private QueuedTranslationService service;

    @BeforeEach
    void setUp() {
        loader = new FakeModelLoader();
        modelManager = new ModelManager(loader, 4, Duration.ofSeconds(5), Clock.systemUTC());
        queue = new TranslationTaskQueue(modelManager, 10, 1, 4, Duration.ofSeconds(5), Duration.ofSeconds(1));
        queue.start();
        cache = new TranslationCache(new TtlCache<>("translation", 100, Duration.ofHours(1), Clock.systemUTC()));

        TranslationConfig config = TestConfigs.translation(List.of("en", "ru", "de"));
        RetryTemplate retry = RetryTemplate.builder()
                .maxAttempts(config.retry().maxAttempts())
                .noBackoff()
                .retryOn(TranslationException.class)
                .build();
        service = new QueuedTranslationService(queue, cache, config, retry);
    }

    @AfterEach
    void tearDown() {
        queue.close();
        modelManager.close();
    }

    @Test
    @DisplayName("Should return same-language text unchanged without a model")
    void shouldSkipSameLanguage() throws Exception {
        assertThat(service.translate("Bonjour", "fr", "FR")).isEqualTo("Bonjour");
        assertThat(loader.loads.get()).isZero();
    }

    @Test
    @DisplayName("Should route configured directions through the pivot language")
    void shouldCascadeThroughPivot() throws Exception {
        String translated = service.translate("Privet mir", "ru", "de");

        assertThat(translated).isEqualTo("[de] [en] Privet mir");
        assertThat(loader.loadedKeys).containsExactly(ModelKey.of("ru", "en"), ModelKey.of("en", "de"));
    }

    @Test
    @DisplayName("Should serve repeated requests from the cache")
    void shouldUseCache() throws Exception {
        service.translate("Good morning everyone", "en", "ru");
        service.translate("Good morning everyone", "en", "ru");

        assertThat(loader.translations.get()).isEqualTo(1);
        assertThat(cache.stats().hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should translate an item into every other target language")
    void shouldTranslateItem() {
        NewsItem item = TestData.item("n1", TestData.feed(1, "en"), Instant.now());

        Map<String, TranslationOutcome> outcomes = service.translateItem(item, List.of("en", "ru", "de"));

        assertThat(outcomes).containsOnlyKeys("ru", "de");
        assertThat(outcomes.get("ru").success()).isTrue();
        assertThat(outcomes.get("ru").title()).isEqualTo("[ru] Title n1");
        assertThat(outcomes.get("de").content()).isEqualTo("[de] Content of n1");
    }

    @Test
    @DisplayName("Should retry broken output and report failure when it persists")
    void shouldReportBrokenOutput() {
        loader.output = (key, text) -> key.targetLang().equals("de") ? "la la la la la" : "[" + key.targetLang() + "] " + text;
        NewsItem item = TestData.item("n2", TestData.feed(1, "en"), Instant.now());

        Map<String, TranslationOutcome> outcomes = service.translateItem(item, List.of("ru", "de"));

        assertThat(outcomes.get("ru").success()).isTrue();
        assertThat(outcomes.get("de").success()).isFalse();
        assertThat(outcomes.get("de").failureReason()).contains("Broken translation");
        assertThat(cache.get("Title n2", "en", "de")).isEmpty();
    }

    @Test
    @DisplayName("Should flag empty and repetitive output as broken")
    void shouldDetectBrokenOutput() {
        assertThat(QueuedTranslationService.isBroken("")).isTrue();
        assertThat(QueuedTranslationService.isBroken("   ")).isTrue();
        assertThat(QueuedTranslationService.isBroken("the the the cat")).isTrue();
        assertThat(QueuedTranslationService.isBroken("the the cat sat")).isFalse();
        assertThat(QueuedTranslationService.isBroken("ok ok")).isFalse();
    }
}
