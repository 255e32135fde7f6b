package io.firefeed.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Translation engine settings. {@code cascade} maps a direction such as {@code ru-de}
 * to the pivot language used to reach it.
 */
@ConfigurationProperties(prefix = "translation")
public record TranslationConfig(
        boolean enabled,
        List<String> targetLanguages,
        int maxConcurrent,
        int maxCachedModels,
        Duration modelCleanupInterval,
        Duration modelIdleTimeout,
        Duration modelLoadTimeout,
        Duration awaitTimeout,
        Map<String, String> cascade,
        List<String> preloadDirections,
        OllamaModelConfig ollama,
        RetrySettings retry
) {
    public String pivotFor(String sourceLang, String targetLang) {
        if (cascade == null) return null;
        return cascade.get(sourceLang + "-" + targetLang);
    }
}
