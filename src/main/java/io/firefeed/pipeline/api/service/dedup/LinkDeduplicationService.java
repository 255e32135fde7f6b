package io.firefeed.pipeline.api.service.dedup;

import io.firefeed.pipeline.config.DeduplicationConfig;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Marks of entry links that were already stored, kept in Redis with a TTL.
 */
@Service
public class LinkDeduplicationService {

    private static final String RSS_ARTICLE_PREFIX = "rss:article:";

    private final RedisTemplate<String, String> redisTemplate;
    private final Duration markTtl;
    private final Clock clock;

    public LinkDeduplicationService(RedisTemplate<String, String> redisTemplate,
                                    DeduplicationConfig deduplicationConfig,
                                    Clock clock) {
        this.redisTemplate = redisTemplate;
        this.markTtl = deduplicationConfig.linkTtl();
        this.clock = clock;
    }

    public boolean isAlreadyProcessed(String link) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(generateKey(link)));
    }

    public void markAsProcessed(String link) {
        String value = LocalDateTime.now(clock).toString();
        redisTemplate.opsForValue().set(generateKey(link), value, markTtl);
    }

    static String generateKey(String link) {
        return RSS_ARTICLE_PREFIX + DigestUtils.md5Hex(link.trim());
    }
}
