package io.firefeed.pipeline.api.service.translation;

import java.util.Locale;

/**
 * A translation direction such as {@code en-ru}.
 */
public record ModelKey(String sourceLang, String targetLang) {

    public ModelKey {
        sourceLang = sourceLang.toLowerCase(Locale.ROOT);
        targetLang = targetLang.toLowerCase(Locale.ROOT);
    }

    public static ModelKey of(String sourceLang, String targetLang) {
        return new ModelKey(sourceLang, targetLang);
    }

    public static ModelKey parse(String direction) {
        String[] parts = direction.trim().split("-");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Invalid translation direction: " + direction);
        }
        return new ModelKey(parts[0], parts[1]);
    }

    @Override
    public String toString() {
        return sourceLang + "-" + targetLang;
    }
}
