package io.firefeed.pipeline.api.service.translation;

import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.TranslationOutcome;
import io.firefeed.pipeline.api.exception.TranslationException;

import java.util.List;
import java.util.Map;

public interface TranslationService {

    /**
     * Translate one text. Same-language requests return the text unchanged.
     */
    String translate(String text, String sourceLang, String targetLang) throws TranslationException;

    /**
     * Translate title and content of an item into each target language other than its own.
     * Every requested language gets an outcome; failures are reported, not thrown.
     */
    Map<String, TranslationOutcome> translateItem(NewsItem item, List<String> targetLanguages);
}
