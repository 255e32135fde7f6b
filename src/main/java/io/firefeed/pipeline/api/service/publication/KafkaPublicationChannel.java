package io.firefeed.pipeline.api.service.publication;

import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.Recipient;
import io.firefeed.pipeline.api.dto.Translation;
import io.firefeed.pipeline.api.dto.kafka.NewsPublishedEvent;
import io.firefeed.pipeline.api.exception.PublicationException;
import io.firefeed.pipeline.config.KafkaProperties;
import io.firefeed.pipeline.config.PublicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes items as {@link NewsPublishedEvent}s; the delivering bot consumes the topic.
 * The message reference is the Kafka offset of the event.
 */
@Service
public class KafkaPublicationChannel implements PublicationChannel {

    private static final Logger logger = LoggerFactory.getLogger(KafkaPublicationChannel.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties kafkaProperties;
    private final PublicationConfig publicationConfig;
    private final Clock clock;

    public KafkaPublicationChannel(KafkaTemplate<String, Object> kafkaTemplate,
                                   KafkaProperties kafkaProperties,
                                   PublicationConfig publicationConfig,
                                   Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaProperties = kafkaProperties;
        this.publicationConfig = publicationConfig;
        this.clock = clock;
    }

    @Override
    public long publish(NewsItem item, Translation translation, Recipient recipient) {
        NewsPublishedEvent event = new NewsPublishedEvent(
                item.id(),
                translation == null ? null : translation.id(),
                recipient.type().dbValue(),
                recipient.id(),
                recipient.language(),
                translation == null ? item.title() : translation.title(),
                translation == null ? item.content() : translation.content(),
                item.category(),
                item.sourceUrl(),
                item.imageUrl(),
                item.videoUrl(),
                LocalDateTime.now(clock)
        );

        try {
            SendResult<String, Object> result = kafkaTemplate
                    .send(kafkaProperties.newsPublished(), item.id(), event)
                    .get(publicationConfig.publishTimeout().toMillis(), TimeUnit.MILLISECONDS);
            long offset = result.getRecordMetadata().offset();
            logger.debug("Sent news {} ({}) to {} {} at offset {}",
                    item.id(), recipient.language(), recipient.type(), recipient.id(), offset);
            return offset;

        } catch (ExecutionException e) {
            throw new PublicationException("Failed to send news " + item.id() + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new PublicationException("Timed out sending news " + item.id(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublicationException("Interrupted sending news " + item.id(), e);
        }
    }
}
