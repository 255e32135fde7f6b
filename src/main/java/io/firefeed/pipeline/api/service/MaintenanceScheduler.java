package io.firefeed.pipeline.api.service;

import io.firefeed.pipeline.api.service.dedup.EmbeddingBackfillService;
import io.firefeed.pipeline.api.service.feed.HttpFeedValidator;
import io.firefeed.pipeline.api.service.translation.ModelKey;
import io.firefeed.pipeline.api.service.translation.ModelManager;
import io.firefeed.pipeline.api.service.translation.TranslationCache;
import io.firefeed.pipeline.config.TranslationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Background housekeeping: expired cache entries, idle translation models and
 * items stored without an embedding.
 */
@Service
public class MaintenanceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final TranslationCache translationCache;
    private final HttpFeedValidator feedValidator;
    private final ModelManager modelManager;
    private final EmbeddingBackfillService backfillService;
    private final TranslationConfig translationConfig;

    public MaintenanceScheduler(TranslationCache translationCache,
                                HttpFeedValidator feedValidator,
                                ModelManager modelManager,
                                EmbeddingBackfillService backfillService,
                                TranslationConfig translationConfig) {
        this.translationCache = translationCache;
        this.feedValidator = feedValidator;
        this.modelManager = modelManager;
        this.backfillService = backfillService;
        this.translationConfig = translationConfig;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void preloadModels() {
        if (!translationConfig.enabled() || translationConfig.preloadDirections() == null
                || translationConfig.preloadDirections().isEmpty()) {
            return;
        }
        List<ModelKey> keys = translationConfig.preloadDirections().stream()
                .map(ModelKey::parse)
                .toList();
        modelManager.preload(keys);
    }

    @Scheduled(
            fixedRateString = "#{@rssProps.cacheCleanupIntervalMs}",
            initialDelayString = "#{@rssProps.cacheCleanupIntervalMs}"
    )
    public void sweepCaches() {
        int translations = translationCache.sweepExpired();
        int verdicts = feedValidator.sweepExpired();
        if (translations + verdicts > 0) {
            logger.info("Cache sweep removed {} translations and {} validation verdicts", translations, verdicts);
        }
    }

    @Scheduled(
            fixedRateString = "#{@rssProps.modelCleanupIntervalMs}",
            initialDelayString = "#{@rssProps.modelCleanupIntervalMs}"
    )
    public void sweepIdleModels() {
        int released = modelManager.sweepIdle(translationConfig.modelIdleTimeout());
        logger.debug("Idle model sweep released {} models, {} resident", released, modelManager.stats().residentModels());
    }

    @Scheduled(
            fixedDelayString = "#{@rssProps.backfillIntervalMs}",
            initialDelayString = "#{@rssProps.backfillIntervalMs}"
    )
    public void backfillEmbeddings() {
        try {
            backfillService.backfill();
        } catch (RuntimeException e) {
            logger.error("Embedding backfill failed: {}", e.getMessage(), e);
        }
    }
}
