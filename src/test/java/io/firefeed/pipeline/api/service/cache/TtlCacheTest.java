package io.firefeed.pipeline.api.service.cache;

import io.firefeed.pipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TtlCacheTest {

    private MutableClock clock;
    private TtlCache<String, String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        cache = new TtlCache<>("test", 3, Duration.ofSeconds(60), clock);
    }

    @Test
    @DisplayName("Should return value before expiry and nothing after")
    void shouldExpireEntriesAfterTtl() {
        cache.put("a", "1");

        clock.advance(Duration.ofSeconds(59));
        assertThat(cache.get("a")).contains("1");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.stats().expirations()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should honor an explicit ttl per entry")
    void shouldHonorExplicitTtl() {
        cache.put("short", "1", Duration.ofSeconds(5));
        cache.put("long", "2");

        clock.advance(Duration.ofSeconds(10));

        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("long")).contains("2");
    }

    @Test
    @DisplayName("Should evict exactly the least recently used entry when full")
    void shouldEvictLeastRecentlyUsed() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");

        cache.get("a");
        cache.put("d", "4");

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).contains("1");
        assertThat(cache.get("c")).contains("3");
        assertThat(cache.get("d")).contains("4");
        assertThat(cache.stats().evictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should remove only expired entries on sweep")
    void shouldSweepExpiredEntries() {
        cache.put("a", "1", Duration.ofSeconds(10));
        cache.put("b", "2", Duration.ofSeconds(100));

        clock.advance(Duration.ofSeconds(30));

        assertThat(cache.sweepExpired()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("b")).contains("2");
    }

    @Test
    @DisplayName("Should compute missing values once and serve them from cache")
    void shouldComputeMissingValues() {
        int[] calls = {0};

        String first = cache.getOrCompute("k", key -> key + (++calls[0]));
        String second = cache.getOrCompute("k", key -> key + (++calls[0]));

        assertThat(first).isEqualTo("k1");
        assertThat(second).isEqualTo("k1");
        assertThat(calls[0]).isEqualTo(1);
        assertThat(cache.stats().getHitRate()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should drop entries on invalidate and clear")
    void shouldInvalidateAndClear() {
        cache.put("a", "1");
        cache.put("b", "2");

        assertThat(cache.invalidate("a")).isTrue();
        assertThat(cache.invalidate("a")).isFalse();

        cache.clear();
        assertThat(cache.size()).isZero();
        assertThat(cache.getName()).isEqualTo("test");
    }

    @Test
    @DisplayName("Should reject a non-positive size bound")
    void shouldRejectInvalidSize() {
        assertThatThrownBy(() -> new TtlCache<String, String>("bad", 0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
