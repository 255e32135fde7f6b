package io.firefeed.pipeline.api.service.dedup;

import io.firefeed.pipeline.api.dto.DuplicateVerdict;
import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.RawEntry;
import io.firefeed.pipeline.api.service.storage.StorageGateway;
import io.firefeed.pipeline.config.DeduplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Two-stage duplicate check: exact link marks in Redis, then cosine similarity of
 * sentence embeddings against items from the lookback window.
 * <p>
 * A similarity at or above the threshold is a duplicate. A failed link lookup still
 * runs the similarity check; any other failure treats the entry as unique. Both set
 * {@code failed} on the verdict.
 * <p>
 * A unique entry is reserved in the index until {@link #remember} or {@link #release},
 * so parallel feeds carrying the same story cannot both pass.
 */
@Service
public class EmbeddingDuplicateDetector implements DuplicateDetector {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingDuplicateDetector.class);

    private final LinkDeduplicationService linkDeduplication;
    private final EmbeddingService embeddingService;
    private final EmbeddingIndex index;
    private final StorageGateway storage;
    private final DeduplicationConfig config;
    private final Clock clock;

    public EmbeddingDuplicateDetector(LinkDeduplicationService linkDeduplication,
                                      EmbeddingService embeddingService,
                                      EmbeddingIndex index,
                                      StorageGateway storage,
                                      DeduplicationConfig config,
                                      Clock clock) {
        this.linkDeduplication = linkDeduplication;
        this.embeddingService = embeddingService;
        this.index = index;
        this.storage = storage;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void refreshIndex() {
        if (!config.enabled()) {
            return;
        }
        try {
            Instant since = clock.instant().minus(config.lookbackWindow());
            Map<String, float[]> recent = storage.queryRecentEmbeddings(since);
            index.replaceAll(recent);
            logger.info("Duplicate index loaded with {} items since {}", recent.size(), since);
        } catch (RuntimeException e) {
            logger.error("Failed to refresh duplicate index, keeping {} cached items: {}", index.size(), e.getMessage(), e);
        }
    }

    @Override
    public DuplicateVerdict check(RawEntry entry) {
        if (!config.enabled()) {
            return DuplicateVerdict.unique(null, 0.0);
        }

        boolean linkCheckFailed = false;
        try {
            if (linkDeduplication.isAlreadyProcessed(entry.link())) {
                logger.debug("Link already processed: {}", entry.link());
                return DuplicateVerdict.sameLink();
            }
        } catch (RuntimeException e) {
            linkCheckFailed = true;
            logger.error("Link check failed for {}, comparing embeddings only: {}", entry.link(), e.getMessage());
        }

        try {
            float[] embedding = embeddingService.embed(entry.title(), entry.content());
            String candidateId = NewsItem.newsId(entry.title(), entry.content(), entry.link(), entry.feedId());
            var nearest = index.reserveIfNoneSimilar(candidateId, embedding, config.similarityThreshold());
            if (nearest.isPresent() && nearest.get().similarity() >= config.similarityThreshold()) {
                var match = nearest.get();
                logger.info("Entry '{}' duplicates {} (similarity {})",
                        abbreviate(entry.title()), match.newsId(), String.format("%.4f", match.similarity()));
                return DuplicateVerdict.similar(match.newsId(), match.similarity(), embedding)
                        .withFailure(linkCheckFailed);
            }
            return DuplicateVerdict.unique(embedding, nearest.map(EmbeddingIndex.Match::similarity).orElse(0.0))
                    .withFailure(linkCheckFailed);

        } catch (RuntimeException e) {
            logger.error("Duplicate check failed for {}, treating as unique: {}", entry.link(), e.getMessage(), e);
            return DuplicateVerdict.failedOpen();
        }
    }

    @Override
    public void remember(String newsId, String link, float[] embedding) {
        index.add(newsId, embedding);
        try {
            linkDeduplication.markAsProcessed(link);
        } catch (RuntimeException e) {
            logger.error("Failed to mark link {} as processed: {}", link, e.getMessage());
        }
    }

    @Override
    public void release(String newsId) {
        index.release(newsId);
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}
