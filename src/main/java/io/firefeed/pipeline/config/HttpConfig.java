package io.firefeed.pipeline.config;

import java.util.List;

public record HttpConfig(
        int connectTimeout,
        int readTimeout,
        int maxRetries,
        int retryDelay,
        long maxDocumentBytes,
        List<String> userAgents
) {}
