package io.firefeed.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rss")
public record RssConfig(
        ProcessingConfig processing,
        HttpConfig http,
        ValidationConfig validation
) {}
