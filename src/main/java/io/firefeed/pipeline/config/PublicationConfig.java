package io.firefeed.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Publication settings. {@code channels} maps a language code to the channel that
 * receives items in that language.
 */
@ConfigurationProperties(prefix = "publication")
public record PublicationConfig(
        Map<String, Long> channels,
        int persistMaxAttempts,
        Duration persistRetryDelay,
        Duration publishTimeout,
        int maxPendingPerFeed
) {
    public Long channelFor(String language) {
        if (channels == null || language == null) return null;
        return channels.get(language);
    }
}
