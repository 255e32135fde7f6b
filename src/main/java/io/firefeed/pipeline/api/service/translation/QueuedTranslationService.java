package io.firefeed.pipeline.api.service.translation;

import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.TranslationOutcome;
import io.firefeed.pipeline.api.exception.QueueFullException;
import io.firefeed.pipeline.api.exception.TranslationException;
import io.firefeed.pipeline.config.TranslationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Translation front end: cache, concurrency permits, queue submission and cascade routes.
 */
@Service
public class QueuedTranslationService implements TranslationService {

    private static final Logger logger = LoggerFactory.getLogger(QueuedTranslationService.class);

    private static final int MIN_TOKENS_FOR_REPEAT_CHECK = 4;
    private static final double MAX_REPEATED_TOKEN_SHARE = 0.5;

    private final TranslationTaskQueue taskQueue;
    private final TranslationCache cache;
    private final TranslationConfig config;
    private final RetryTemplate retryTemplate;
    private final Semaphore permits;

    public QueuedTranslationService(TranslationTaskQueue taskQueue,
                                    TranslationCache cache,
                                    TranslationConfig config,
                                    @Qualifier("translationRetryTemplate") RetryTemplate retryTemplate) {
        this.taskQueue = taskQueue;
        this.cache = cache;
        this.config = config;
        this.retryTemplate = retryTemplate;
        this.permits = new Semaphore(Math.max(1, config.maxConcurrent()), true);
    }

    @Override
    public String translate(String text, String sourceLang, String targetLang) throws TranslationException {
        return translate(text, sourceLang, targetLang, null);
    }

    private String translate(String text, String sourceLang, String targetLang, String newsId)
            throws TranslationException {
        if (text == null || text.isBlank() || sourceLang.equalsIgnoreCase(targetLang)) {
            return text;
        }

        var cached = cache.get(text, sourceLang, targetLang);
        if (cached.isPresent()) {
            logger.debug("Translation cache hit for {}-{}", sourceLang, targetLang);
            return cached.get();
        }

        String pivot = config.pivotFor(sourceLang, targetLang);
        String translated;
        if (pivot != null && !pivot.equalsIgnoreCase(sourceLang) && !pivot.equalsIgnoreCase(targetLang)) {
            logger.debug("Cascading {}-{} through {}", sourceLang, targetLang, pivot);
            String intermediate = translate(text, sourceLang, pivot, newsId);
            translated = translate(intermediate, pivot, targetLang, newsId);
        } else {
            translated = translateDirect(text, sourceLang, targetLang, newsId);
        }

        cache.put(text, sourceLang, targetLang, translated);
        return translated;
    }

    @Override
    public Map<String, TranslationOutcome> translateItem(NewsItem item, List<String> targetLanguages) {
        Map<String, TranslationOutcome> outcomes = new LinkedHashMap<>();
        for (String target : targetLanguages) {
            if (target.equalsIgnoreCase(item.language())) {
                continue;
            }
            outcomes.put(target, translateWithRetry(item, target));
        }
        return outcomes;
    }

    private TranslationOutcome translateWithRetry(NewsItem item, String target) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    logger.debug("Retrying translation of {} to {} (attempt {})", item.id(), target, context.getRetryCount() + 1);
                }
                String title = translate(item.title(), item.language(), target, item.id());
                String content = translate(item.content(), item.language(), target, item.id());
                return TranslationOutcome.translated(target, title, content);
            }, context -> {
                Throwable last = context.getLastThrowable();
                return TranslationOutcome.failed(target, last == null ? "unknown" : last.getMessage());
            });
        } catch (TranslationException e) {
            return TranslationOutcome.failed(target, e.getMessage());
        }
    }

    private String translateDirect(String text, String sourceLang, String targetLang, String newsId)
            throws TranslationException {
        boolean acquired;
        try {
            acquired = permits.tryAcquire(config.awaitTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Interrupted waiting for a translation slot", e,
                    TranslationException.Reason.CANCELLED);
        }
        if (!acquired) {
            throw new TranslationException("No translation slot free within " + config.awaitTimeout(),
                    TranslationException.Reason.TIMEOUT);
        }

        try {
            TaskHandle handle;
            try {
                handle = taskQueue.enqueue(TranslationTask.create(text, sourceLang, targetLang, newsId));
            } catch (QueueFullException e) {
                throw new TranslationException(e.getMessage(), e, TranslationException.Reason.QUEUE_FULL);
            }

            String translated;
            try {
                translated = handle.await(config.awaitTimeout());
            } catch (TranslationException e) {
                handle.cancel();
                throw e;
            }

            if (isBroken(translated)) {
                throw new TranslationException("Broken translation output for " + sourceLang + "-" + targetLang,
                        TranslationException.Reason.BROKEN_OUTPUT);
            }
            return translated.trim();
        } finally {
            permits.release();
        }
    }

    /**
     * Empty output, or one token making up more than half of a text of several tokens.
     */
    static boolean isBroken(String translated) {
        if (translated == null || translated.isBlank()) {
            return true;
        }
        String[] tokens = translated.trim().toLowerCase().split("\\s+");
        if (tokens.length < MIN_TOKENS_FOR_REPEAT_CHECK) {
            return false;
        }
        Map<String, Integer> counts = new HashMap<>();
        int max = 0;
        for (String token : tokens) {
            max = Math.max(max, counts.merge(token, 1, Integer::sum));
        }
        return (double) max / tokens.length > MAX_REPEATED_TOKEN_SHARE;
    }
}
