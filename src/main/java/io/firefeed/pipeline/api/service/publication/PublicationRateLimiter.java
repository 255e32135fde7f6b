package io.firefeed.pipeline.api.service.publication;

import io.firefeed.pipeline.api.dto.FeedSource;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

public interface PublicationRateLimiter {

    /**
     * Whether the feed may publish one more item at {@code now}.
     */
    boolean mayPublish(FeedSource feed, Instant now);

    /**
     * Run {@code action} only if the feed is admitted, holding the feed's admission lock
     * until the action returns so that concurrent checks see its publications.
     *
     * @return the action's result, or empty when admission was refused
     */
    <T> Optional<T> runIfAdmitted(FeedSource feed, Instant now, Supplier<T> action);
}
