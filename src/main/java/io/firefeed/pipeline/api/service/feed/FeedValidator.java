package io.firefeed.pipeline.api.service.feed;

import io.firefeed.pipeline.api.dto.ValidationResult;

public interface FeedValidator {

    /**
     * Checks that {@code url} serves a parseable feed with at least one entry.
     */
    ValidationResult validate(String url);
}
