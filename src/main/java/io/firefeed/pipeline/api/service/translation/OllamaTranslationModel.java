package io.firefeed.pipeline.api.service.translation;

import dev.langchain4j.model.chat.ChatLanguageModel;
import io.firefeed.pipeline.api.exception.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One translation direction served by an Ollama chat model.
 */
public class OllamaTranslationModel implements TranslationModel {

    private static final Logger logger = LoggerFactory.getLogger(OllamaTranslationModel.class);

    private static final String PROMPT = """
            Translate the following news text from %s to %s.
            Reply with the translation only, without notes or quotes.

            %s""";

    private final ModelKey key;
    private final ChatLanguageModel chatModel;
    private final Runnable release;
    private final AtomicBoolean closed = new AtomicBoolean();

    public OllamaTranslationModel(ModelKey key, ChatLanguageModel chatModel, Runnable release) {
        this.key = key;
        this.chatModel = chatModel;
        this.release = release;
    }

    @Override
    public ModelKey key() {
        return key;
    }

    @Override
    public String translate(String text) throws TranslationException {
        if (closed.get()) {
            throw new TranslationException("Model " + key + " is unloaded", TranslationException.Reason.EXECUTION_FAILED);
        }
        try {
            String answer = chatModel.generate(PROMPT.formatted(languageName(key.sourceLang()),
                    languageName(key.targetLang()), text));
            return answer == null ? "" : answer.trim();
        } catch (RuntimeException e) {
            throw new TranslationException("Model " + key + " failed: " + e.getMessage(), e,
                    TranslationException.Reason.EXECUTION_FAILED);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.debug("Releasing model {}", key);
            release.run();
        }
    }

    private static String languageName(String code) {
        String name = Locale.forLanguageTag(code).getDisplayLanguage(Locale.ENGLISH);
        return name.isBlank() ? code : name;
    }
}
