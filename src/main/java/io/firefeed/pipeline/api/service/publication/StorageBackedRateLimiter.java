package io.firefeed.pipeline.api.service.publication;

import io.firefeed.pipeline.api.dto.FeedSource;
import io.firefeed.pipeline.api.service.storage.StorageGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-feed admission computed from stored publication history.
 * <p>
 * The effective interval is the smaller of {@code 60 / maxNewsPerHour} minutes and the
 * feed's cooldown. A feed is admitted when fewer than {@code maxNewsPerHour} distinct
 * items were published within the interval and the last publication is at least one
 * interval old. A non-positive hourly limit counts as 1.
 */
@Service
public class StorageBackedRateLimiter implements PublicationRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(StorageBackedRateLimiter.class);

    private static final long MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final StorageGateway storage;
    private final ConcurrentHashMap<Long, ReentrantLock> feedLocks = new ConcurrentHashMap<>();

    public StorageBackedRateLimiter(StorageGateway storage) {
        this.storage = storage;
    }

    @Override
    public boolean mayPublish(FeedSource feed, Instant now) {
        ReentrantLock lock = lockFor(feed);
        lock.lock();
        try {
            return admits(feed, now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> Optional<T> runIfAdmitted(FeedSource feed, Instant now, Supplier<T> action) {
        ReentrantLock lock = lockFor(feed);
        lock.lock();
        try {
            if (!admits(feed, now)) {
                return Optional.empty();
            }
            return Optional.ofNullable(action.get());
        } finally {
            lock.unlock();
        }
    }

    static Duration effectiveInterval(FeedSource feed) {
        int maxPerHour = effectiveMaxPerHour(feed);
        Duration perItem = Duration.ofMillis(MILLIS_PER_HOUR / maxPerHour);
        Duration cooldown = Duration.ofMinutes(Math.max(0, feed.cooldownMinutes()));
        return perItem.compareTo(cooldown) <= 0 ? perItem : cooldown;
    }

    private static int effectiveMaxPerHour(FeedSource feed) {
        return feed.maxNewsPerHour() <= 0 ? 1 : feed.maxNewsPerHour();
    }

    private boolean admits(FeedSource feed, Instant now) {
        Duration interval = effectiveInterval(feed);
        int maxPerHour = effectiveMaxPerHour(feed);

        int recent = storage.countPublications(feed.id(), now.minus(interval));
        if (recent >= maxPerHour) {
            logger.debug("Feed {} rejected: {} publications within {} (limit {})", feed.id(), recent, interval, maxPerHour);
            return false;
        }

        Optional<Instant> last = storage.lastPublicationTime(feed.id());
        if (last.isPresent()) {
            Duration elapsed = Duration.between(last.get(), now);
            if (elapsed.compareTo(interval) < 0) {
                logger.debug("Feed {} rejected: last publication {} ago, interval {}", feed.id(), elapsed, interval);
                return false;
            }
        }
        return true;
    }

    private ReentrantLock lockFor(FeedSource feed) {
        return feedLocks.computeIfAbsent(feed.id(), id -> new ReentrantLock());
    }
}
