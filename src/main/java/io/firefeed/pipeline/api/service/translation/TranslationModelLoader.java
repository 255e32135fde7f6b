package io.firefeed.pipeline.api.service.translation;

import io.firefeed.pipeline.api.exception.TranslationException;

@FunctionalInterface
public interface TranslationModelLoader {

    TranslationModel load(ModelKey key) throws TranslationException;
}
