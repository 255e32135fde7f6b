package io.firefeed.pipeline.api.service.translation;

import io.firefeed.pipeline.api.exception.TranslationException;

/**
 * A loaded translation model for one direction. {@link #close()} releases the memory
 * the model holds and must be safe to call more than once.
 */
public interface TranslationModel extends AutoCloseable {

    ModelKey key();

    String translate(String text) throws TranslationException;

    @Override
    void close();
}
