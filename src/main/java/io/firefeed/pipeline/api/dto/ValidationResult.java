package io.firefeed.pipeline.api.dto;

import io.firefeed.pipeline.api.exception.ErrorCategory;

public record ValidationResult(boolean ok, String reason, ErrorCategory category, int entryCount) {

    public static ValidationResult valid(int entryCount) {
        return new ValidationResult(true, null, null, entryCount);
    }

    public static ValidationResult invalid(String reason, ErrorCategory category) {
        return new ValidationResult(false, reason, category, 0);
    }
}
