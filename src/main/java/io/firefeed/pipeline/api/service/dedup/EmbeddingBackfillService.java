package io.firefeed.pipeline.api.service.dedup;

import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.service.storage.StorageGateway;
import io.firefeed.pipeline.config.DeduplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Computes embeddings for stored items that were saved without one.
 */
@Service
public class EmbeddingBackfillService {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingBackfillService.class);

    private final StorageGateway storage;
    private final EmbeddingService embeddingService;
    private final EmbeddingIndex index;
    private final DeduplicationConfig config;

    public EmbeddingBackfillService(StorageGateway storage,
                                    EmbeddingService embeddingService,
                                    EmbeddingIndex index,
                                    DeduplicationConfig config) {
        this.storage = storage;
        this.embeddingService = embeddingService;
        this.index = index;
        this.config = config;
    }

    /**
     * @return number of items that received an embedding
     */
    public int backfill() {
        if (!config.enabled()) {
            return 0;
        }

        List<NewsItem> pending = storage.findItemsWithoutEmbedding(Math.max(1, config.backfillBatchSize()));
        if (pending.isEmpty()) {
            return 0;
        }

        int embedded = 0;
        for (NewsItem item : pending) {
            try {
                float[] vector = embeddingService.embed(item.title(), item.content());
                storage.updateEmbedding(item.id(), vector);
                index.add(item.id(), vector);
                embedded++;
            } catch (RuntimeException e) {
                logger.warn("Embedding backfill failed for {}: {}", item.id(), e.getMessage());
            }
        }

        logger.info("Embedding backfill: {}/{} items embedded", embedded, pending.size());
        return embedded;
    }
}
