package io.firefeed.pipeline.api.service.storage;

import io.firefeed.pipeline.api.dto.FeedSource;
import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.PublicationRecord;
import io.firefeed.pipeline.api.dto.Translation;
import io.firefeed.pipeline.api.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL storage with pgvector embeddings, written with plain SQL over {@link JdbcTemplate}.
 */
@Repository
public class JdbcStorageGateway implements StorageGateway {

    private static final Logger logger = LoggerFactory.getLogger(JdbcStorageGateway.class);

    private static final String NEWS_COLUMNS = """
            n.news_id, n.original_title, n.original_content, n.original_language, n.category_id,
            c.name AS category_name, n.rss_feed_id, n.source_url, n.embedding::text AS embedding_text,
            n.image_filename, n.video_filename, n.created_at
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcStorageGateway(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<FeedSource> listActiveFeeds() {
        String sql = """
                SELECT f.id, f.url, f.language, f.category_id, c.name AS category_name,
                       COALESCE(s.name, f.name) AS source_name,
                       f.cooldown_minutes, f.max_news_per_hour, f.is_active
                FROM rss_feeds f
                LEFT JOIN sources s ON s.id = f.source_id
                LEFT JOIN categories c ON c.id = f.category_id
                WHERE f.is_active = TRUE
                ORDER BY f.id
                """;
        return execute("listActiveFeeds", () -> jdbcTemplate.query(sql, feedMapper()));
    }

    @Override
    public void markFetched(long feedId, Instant fetchedAt) {
        execute("markFetched", () ->
                jdbcTemplate.update("UPDATE rss_feeds SET updated_at = ? WHERE id = ?", toTimestamp(fetchedAt), feedId));
    }

    @Override
    public boolean saveItem(NewsItem item) {
        String sql = """
                INSERT INTO published_news_data (news_id, original_title, original_content, original_language,
                    category_id, rss_feed_id, source_url, embedding, image_filename, video_filename, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, CAST(CAST(? AS TEXT) AS vector), ?, ?, ?)
                ON CONFLICT (news_id) DO NOTHING
                """;
        String vector = PgVectors.toLiteral(item.embedding());
        int inserted = execute("saveItem", () -> jdbcTemplate.update(sql,
                item.id(),
                item.title(),
                item.content(),
                item.language(),
                item.categoryId(),
                item.feedId(),
                item.sourceUrl(),
                vector,
                item.imageUrl(),
                item.videoUrl(),
                toTimestamp(item.createdAt())));
        if (inserted == 0) {
            logger.debug("News item {} already stored", item.id());
        }
        return inserted > 0;
    }

    @Override
    public Translation saveTranslation(String newsId, String language, String title, String content) {
        String sql = """
                INSERT INTO news_translations (news_id, language, translated_title, translated_content, created_at)
                VALUES (?, ?, ?, ?, now())
                ON CONFLICT (news_id, language) DO UPDATE
                    SET translated_title = EXCLUDED.translated_title,
                        translated_content = EXCLUDED.translated_content,
                        updated_at = now()
                RETURNING id, news_id, language, translated_title, translated_content, created_at
                """;
        return execute("saveTranslation", () ->
                jdbcTemplate.queryForObject(sql, translationMapper(), newsId, language, title, content));
    }

    @Override
    public Optional<PublicationRecord> recordPublication(PublicationRecord record) {
        String sql = """
                INSERT INTO rss_items_telegram_bot_published
                    (news_id, translation_id, recipient_type, recipient_id, message_id, language, sent_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT ON CONSTRAINT uq_publication DO NOTHING
                RETURNING id
                """;
        List<Long> ids = execute("recordPublication", () -> jdbcTemplate.query(sql,
                (rs, rowNum) -> rs.getLong("id"),
                record.newsId(),
                record.translationId(),
                record.recipientType().dbValue(),
                record.recipientId(),
                record.messageId(),
                record.language(),
                toTimestamp(record.sentAt())));
        if (ids.isEmpty()) {
            logger.debug("Publication of {} to {} {} already recorded",
                    record.newsId(), record.recipientType(), record.recipientId());
            return Optional.empty();
        }
        return Optional.of(new PublicationRecord(ids.get(0), record.newsId(), record.translationId(),
                record.recipientType(), record.recipientId(), record.messageId(), record.language(), record.sentAt()));
    }

    @Override
    public Map<String, float[]> queryRecentEmbeddings(Instant since) {
        String sql = """
                SELECT news_id, embedding::text AS embedding_text
                FROM published_news_data
                WHERE embedding IS NOT NULL AND created_at >= ?
                ORDER BY created_at
                """;
        Map<String, float[]> embeddings = new LinkedHashMap<>();
        execute("queryRecentEmbeddings", () -> {
            jdbcTemplate.query(sql, rs -> {
                float[] vector = PgVectors.parse(rs.getString("embedding_text"));
                if (vector != null) {
                    embeddings.put(rs.getString("news_id"), vector);
                }
            }, toTimestamp(since));
            return null;
        });
        return embeddings;
    }

    @Override
    public int countPublications(long feedId, Instant since) {
        String sql = """
                SELECT COUNT(DISTINCT p.news_id)
                FROM rss_items_telegram_bot_published p
                JOIN published_news_data n ON n.news_id = p.news_id
                WHERE n.rss_feed_id = ? AND p.sent_at >= ?
                """;
        Integer count = execute("countPublications", () ->
                jdbcTemplate.queryForObject(sql, Integer.class, feedId, toTimestamp(since)));
        return count == null ? 0 : count;
    }

    @Override
    public Optional<Instant> lastPublicationTime(long feedId) {
        String sql = """
                SELECT MAX(p.sent_at)
                FROM rss_items_telegram_bot_published p
                JOIN published_news_data n ON n.news_id = p.news_id
                WHERE n.rss_feed_id = ?
                """;
        OffsetDateTime last = execute("lastPublicationTime", () ->
                jdbcTemplate.queryForObject(sql, OffsetDateTime.class, feedId));
        return Optional.ofNullable(last).map(OffsetDateTime::toInstant);
    }

    @Override
    public List<NewsItem> findUnpublishedItems(long feedId, Instant since, int limit) {
        String sql = "SELECT " + NEWS_COLUMNS + """
                FROM published_news_data n
                LEFT JOIN categories c ON c.id = n.category_id
                WHERE n.rss_feed_id = ? AND n.created_at >= ?
                  AND NOT EXISTS (SELECT 1 FROM rss_items_telegram_bot_published p WHERE p.news_id = n.news_id)
                ORDER BY n.created_at, n.news_id
                LIMIT ?
                """;
        return execute("findUnpublishedItems", () ->
                jdbcTemplate.query(sql, newsMapper(), feedId, toTimestamp(since), limit));
    }

    @Override
    public Map<String, Translation> findTranslations(String newsId) {
        String sql = """
                SELECT id, news_id, language, translated_title, translated_content, created_at
                FROM news_translations
                WHERE news_id = ?
                """;
        List<Translation> rows = execute("findTranslations", () -> jdbcTemplate.query(sql, translationMapper(), newsId));
        Map<String, Translation> byLanguage = new LinkedHashMap<>();
        rows.forEach(t -> byLanguage.put(t.language(), t));
        return byLanguage;
    }

    @Override
    public List<NewsItem> findItemsWithoutEmbedding(int limit) {
        String sql = "SELECT " + NEWS_COLUMNS + """
                FROM published_news_data n
                LEFT JOIN categories c ON c.id = n.category_id
                WHERE n.embedding IS NULL
                ORDER BY n.created_at DESC
                LIMIT ?
                """;
        return execute("findItemsWithoutEmbedding", () -> jdbcTemplate.query(sql, newsMapper(), limit));
    }

    @Override
    public void updateEmbedding(String newsId, float[] embedding) {
        String literal = PgVectors.toLiteral(embedding);
        if (literal == null) {
            return;
        }
        execute("updateEmbedding", () -> jdbcTemplate.update(
                "UPDATE published_news_data SET embedding = CAST(? AS vector), updated_at = now() WHERE news_id = ?",
                literal, newsId));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageException("Storage operation " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static Long readNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private RowMapper<FeedSource> feedMapper() {
        return (rs, rowNum) -> new FeedSource(
                rs.getLong("id"),
                rs.getString("source_name"),
                rs.getString("url"),
                rs.getString("language"),
                rs.getString("category_name"),
                readNullableLong(rs, "category_id"),
                rs.getInt("cooldown_minutes"),
                rs.getInt("max_news_per_hour"),
                rs.getBoolean("is_active")
        );
    }

    private RowMapper<NewsItem> newsMapper() {
        return (rs, rowNum) -> new NewsItem(
                rs.getString("news_id"),
                rs.getString("original_title"),
                rs.getString("original_content"),
                rs.getString("original_language"),
                rs.getString("category_name"),
                readNullableLong(rs, "category_id"),
                rs.getLong("rss_feed_id"),
                rs.getString("source_url"),
                PgVectors.parse(rs.getString("embedding_text")),
                rs.getString("image_filename"),
                rs.getString("video_filename"),
                readInstant(rs, "created_at")
        );
    }

    private RowMapper<Translation> translationMapper() {
        return (rs, rowNum) -> new Translation(
                rs.getLong("id"),
                rs.getString("news_id"),
                rs.getString("language"),
                rs.getString("translated_title"),
                rs.getString("translated_content"),
                readInstant(rs, "created_at")
        );
    }
}
