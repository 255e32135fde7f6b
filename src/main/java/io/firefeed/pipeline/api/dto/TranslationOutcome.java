package io.firefeed.pipeline.api.dto;

public record TranslationOutcome(
        String language,
        String title,
        String content,
        boolean success,
        String failureReason
) {

    public static TranslationOutcome translated(String language, String title, String content) {
        return new TranslationOutcome(language, title, content, true, null);
    }

    public static TranslationOutcome failed(String language, String reason) {
        return new TranslationOutcome(language, null, null, false, reason);
    }
}
