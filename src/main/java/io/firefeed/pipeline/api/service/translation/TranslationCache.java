package io.firefeed.pipeline.api.service.translation;

import io.firefeed.pipeline.api.service.cache.TtlCache;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Optional;

/**
 * Finished translations keyed by text fingerprint and direction.
 */
public class TranslationCache {

    private final TtlCache<Key, String> cache;

    public TranslationCache(TtlCache<Key, String> cache) {
        this.cache = cache;
    }

    public Optional<String> get(String text, String sourceLang, String targetLang) {
        return cache.get(Key.of(text, sourceLang, targetLang));
    }

    public void put(String text, String sourceLang, String targetLang, String translated) {
        cache.put(Key.of(text, sourceLang, targetLang), translated);
    }

    public int sweepExpired() {
        return cache.sweepExpired();
    }

    public TtlCache.CacheStats stats() {
        return cache.stats();
    }

    public record Key(String textHash, String sourceLang, String targetLang) {

        static Key of(String text, String sourceLang, String targetLang) {
            return new Key(DigestUtils.sha256Hex(text), sourceLang, targetLang);
        }
    }
}
