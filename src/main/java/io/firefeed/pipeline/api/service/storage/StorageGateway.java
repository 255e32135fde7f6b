package io.firefeed.pipeline.api.service.storage;

import io.firefeed.pipeline.api.dto.FeedSource;
import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.PublicationRecord;
import io.firefeed.pipeline.api.dto.Translation;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence operations used by the pipeline. Implementations throw
 * {@link io.firefeed.pipeline.api.exception.StorageException} on failure.
 */
public interface StorageGateway {

    List<FeedSource> listActiveFeeds();

    void markFetched(long feedId, Instant fetchedAt);

    /**
     * @return true if the item was inserted, false if an item with the same id already exists
     */
    boolean saveItem(NewsItem item);

    /**
     * Insert or replace the translation of a news item into one language.
     */
    Translation saveTranslation(String newsId, String language, String title, String content);

    /**
     * Append a publication record. A record that already exists for the same
     * news item, translation and recipient is left untouched.
     *
     * @return the stored record, or empty when it already existed
     */
    Optional<PublicationRecord> recordPublication(PublicationRecord record);

    /**
     * Embeddings of items created at or after {@code since}, keyed by news id.
     */
    Map<String, float[]> queryRecentEmbeddings(Instant since);

    /**
     * Number of distinct news items of the feed published at or after {@code since}.
     */
    int countPublications(long feedId, Instant since);

    Optional<Instant> lastPublicationTime(long feedId);

    /**
     * Items of the feed created at or after {@code since} that have no publication record, oldest first.
     */
    List<NewsItem> findUnpublishedItems(long feedId, Instant since, int limit);

    /**
     * Stored translations of a news item keyed by language.
     */
    Map<String, Translation> findTranslations(String newsId);

    List<NewsItem> findItemsWithoutEmbedding(int limit);

    void updateEmbedding(String newsId, float[] embedding);
}
