package io.firefeed.pipeline.api.service.translation;

import java.util.UUID;

/**
 * One text to translate. Higher {@code priority} values are taken first.
 */
public record TranslationTask(
        String id,
        String text,
        String sourceLang,
        String targetLang,
        String newsId,
        int priority
) {
    public static final int DEFAULT_PRIORITY = 0;

    public static TranslationTask create(String text, String sourceLang, String targetLang, String newsId) {
        return new TranslationTask(UUID.randomUUID().toString(), text, sourceLang, targetLang, newsId, DEFAULT_PRIORITY);
    }

    public ModelKey modelKey() {
        return ModelKey.of(sourceLang, targetLang);
    }
}
