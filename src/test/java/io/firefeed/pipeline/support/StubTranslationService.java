package io.firefeed.pipeline.support;

import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.TranslationOutcome;
import io.firefeed.pipeline.api.exception.TranslationException;
import io.firefeed.pipeline.api.service.translation.TranslationService;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Translates by tagging text with the target language; chosen languages always fail.
 */
public class StubTranslationService implements TranslationService {

    private final Set<String> failingLanguages = ConcurrentHashMap.newKeySet();

    public void failFor(String language) {
        failingLanguages.add(language);
    }

    @Override
    public String translate(String text, String sourceLang, String targetLang) throws TranslationException {
        if (failingLanguages.contains(targetLang)) {
            throw new TranslationException("model unavailable for " + targetLang,
                    TranslationException.Reason.MODEL_LOAD_FAILED);
        }
        return sourceLang.equals(targetLang) ? text : "[" + targetLang + "] " + text;
    }

    @Override
    public Map<String, TranslationOutcome> translateItem(NewsItem item, List<String> targetLanguages) {
        Map<String, TranslationOutcome> outcomes = new LinkedHashMap<>();
        for (String target : targetLanguages) {
            if (target.equals(item.language())) {
                continue;
            }
            try {
                outcomes.put(target, TranslationOutcome.translated(target,
                        translate(item.title(), item.language(), target),
                        translate(item.content(), item.language(), target)));
            } catch (TranslationException e) {
                outcomes.put(target, TranslationOutcome.failed(target, e.getMessage()));
            }
        }
        return outcomes;
    }
}
