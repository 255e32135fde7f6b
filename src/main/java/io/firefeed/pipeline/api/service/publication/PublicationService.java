package io.firefeed.pipeline.api.service.publication;

import io.firefeed.pipeline.api.dto.FeedSource;
import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.PublicationRecord;
import io.firefeed.pipeline.api.dto.Recipient;
import io.firefeed.pipeline.api.dto.Translation;
import io.firefeed.pipeline.api.exception.PublicationException;
import io.firefeed.pipeline.api.exception.StorageException;
import io.firefeed.pipeline.api.service.PassCounters;
import io.firefeed.pipeline.api.service.cache.TtlCache;
import io.firefeed.pipeline.api.service.storage.StorageGateway;
import io.firefeed.pipeline.config.DeduplicationConfig;
import io.firefeed.pipeline.config.PublicationConfig;
import io.firefeed.pipeline.config.TranslationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Gates and publishes the stored, not yet published items of a feed.
 * <p>
 * Each admitted item is sent once per language: in its own language, and in every
 * target language with a channel. A missing translation sends the original text to
 * that language's channel.
 */
@Service
public class PublicationService {

    private static final Logger logger = LoggerFactory.getLogger(PublicationService.class);

    private static final int MAX_FALLBACK_MARKS = 10_000;

    private final StorageGateway storage;
    private final PublicationRateLimiter rateLimiter;
    private final PublicationChannel channel;
    private final PublicationConfig publicationConfig;
    private final TranslationConfig translationConfig;
    private final Duration lookback;
    private final Clock clock;
    private final TtlCache<String, Boolean> reportedFallbacks;

    public PublicationService(StorageGateway storage,
                              PublicationRateLimiter rateLimiter,
                              PublicationChannel channel,
                              PublicationConfig publicationConfig,
                              TranslationConfig translationConfig,
                              DeduplicationConfig deduplicationConfig,
                              Clock clock) {
        this.storage = storage;
        this.rateLimiter = rateLimiter;
        this.channel = channel;
        this.publicationConfig = publicationConfig;
        this.translationConfig = translationConfig;
        this.lookback = deduplicationConfig.lookbackWindow();
        this.clock = clock;
        this.reportedFallbacks = new TtlCache<>("translation-fallbacks", MAX_FALLBACK_MARKS, Duration.ofDays(1), clock);
    }

    /**
     * @return number of items published
     */
    public int publishPending(FeedSource feed, PassCounters counters) {
        Instant since = clock.instant().minus(lookback);
        List<NewsItem> pending = storage.findUnpublishedItems(feed.id(), since, Math.max(1, publicationConfig.maxPendingPerFeed()));
        if (pending.isEmpty()) {
            return 0;
        }

        int publishedItems = 0;
        for (NewsItem item : pending) {
            Optional<Integer> sent = rateLimiter.runIfAdmitted(feed, clock.instant(),
                    () -> publishVariants(item, counters));
            if (sent.isEmpty()) {
                counters.admissionRejected();
                logger.debug("Publication of {} from feed {} deferred by rate limit", item.id(), feed.id());
                continue;
            }
            if (sent.get() > 0) {
                publishedItems++;
                counters.published();
            }
        }

        logger.info("Feed {}: published {}/{} pending items", feed.getDisplayName(), publishedItems, pending.size());
        return publishedItems;
    }

    private int publishVariants(NewsItem item, PassCounters counters) {
        Map<String, Translation> translations = storage.findTranslations(item.id());
        int sent = 0;

        for (String language : languagesFor(item)) {
            Long channelId = publicationConfig.channelFor(language);
            if (channelId == null) {
                logger.debug("No channel configured for {}, skipping", language);
                continue;
            }

            Translation translation = null;
            if (!language.equalsIgnoreCase(item.language())) {
                translation = translations.get(language);
                if (translation == null) {
                    reportFallback(item, language, counters);
                }
            }

            if (send(item, translation, Recipient.channel(channelId, language))) {
                sent++;
            } else {
                counters.publishFailed();
            }
        }
        return sent;
    }

    private boolean send(NewsItem item, Translation translation, Recipient recipient) {
        try {
            long messageId = channel.publish(item, translation, recipient);
            storage.recordPublication(new PublicationRecord(
                    null,
                    item.id(),
                    translation == null ? null : translation.id(),
                    recipient.type(),
                    recipient.id(),
                    messageId,
                    recipient.language(),
                    clock.instant()
            ));
            return true;
        } catch (PublicationException | StorageException e) {
            logger.error("Failed to publish {} to {} {}: {}", item.id(), recipient.type(), recipient.id(), e.getMessage());
            return false;
        }
    }

    private Set<String> languagesFor(NewsItem item) {
        Set<String> languages = new LinkedHashSet<>();
        languages.add(item.language());
        if (translationConfig.enabled()) {
            languages.addAll(translationConfig.targetLanguages());
        }
        return languages;
    }

    private void reportFallback(NewsItem item, String language, PassCounters counters) {
        counters.translationFallback();
        String key = item.id() + ":" + language;
        if (reportedFallbacks.get(key).isEmpty()) {
            reportedFallbacks.put(key, Boolean.TRUE);
            logger.warn("No {} translation for {}, publishing original {} text", language, item.id(), item.language());
        }
    }
}
