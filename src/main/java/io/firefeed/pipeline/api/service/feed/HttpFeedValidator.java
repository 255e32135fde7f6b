package io.firefeed.pipeline.api.service.feed;

import com.rometools.rome.feed.synd.SyndFeed;
import io.firefeed.pipeline.api.dto.ValidationResult;
import io.firefeed.pipeline.api.exception.ErrorCategory;
import io.firefeed.pipeline.api.exception.FeedFetchException;
import io.firefeed.pipeline.api.service.cache.TtlCache;
import io.firefeed.pipeline.config.RssConfig;
import io.firefeed.pipeline.config.ValidationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class HttpFeedValidator implements FeedValidator {

    private static final Logger logger = LoggerFactory.getLogger(HttpFeedValidator.class);

    private static final int MAX_CACHED_VERDICTS = 1000;

    private final FeedDocumentClient documentClient;
    private final ValidationConfig validationConfig;
    private final TtlCache<String, ValidationResult> verdicts;

    public HttpFeedValidator(FeedDocumentClient documentClient, RssConfig rssConfig, Clock clock) {
        this.documentClient = documentClient;
        this.validationConfig = rssConfig.validation();
        this.verdicts = new TtlCache<>("feed-validation", MAX_CACHED_VERDICTS, validationConfig.cacheTtl(), clock);
    }

    @Override
    public ValidationResult validate(String url) {
        String key = url == null ? "" : url.trim();
        var cached = verdicts.get(key);
        if (cached.isPresent()) {
            logger.debug("Validation cache hit for {}", key);
            return cached.get();
        }

        ValidationResult result = probe(key);
        verdicts.put(key, result);
        return result;
    }

    private ValidationResult probe(String url) {
        try {
            SyndFeed feed = documentClient.probe(url, (int) validationConfig.requestTimeout().toMillis());
            int entries = feed.getEntries() == null ? 0 : feed.getEntries().size();
            if (entries == 0) {
                logger.info("Feed {} parsed but has no entries", url);
                return ValidationResult.invalid("Feed has no entries", ErrorCategory.EMPTY_FEED);
            }
            logger.info("Feed {} is valid ({} entries)", url, entries);
            return ValidationResult.valid(entries);

        } catch (FeedFetchException e) {
            logger.warn("Feed {} failed validation ({}): {}", url, e.getCategory(), e.getMessage());
            return ValidationResult.invalid(e.getMessage(), e.getCategory());
        }
    }

    public int sweepExpired() {
        return verdicts.sweepExpired();
    }

    public TtlCache.CacheStats cacheStats() {
        return verdicts.stats();
    }
}
