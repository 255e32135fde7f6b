package io.firefeed.pipeline.api.service.publication;

import io.firefeed.pipeline.api.dto.PassReport;
import io.firefeed.pipeline.api.dto.kafka.BatchProcessedEvent;
import io.firefeed.pipeline.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties kafkaProperties;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties kafkaProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaProperties = kafkaProperties;
    }

    public void publishBatchProcessed(PassReport report) {
        try {
            BatchProcessedEvent event = BatchProcessedEvent.from(report);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(kafkaProperties.batchProcessed(), event.batchId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent batch processed event: {} ({} new of {} articles from {} feeds)",
                            event.batchId(), event.newArticles(), event.totalArticles(), event.feedsTotal());
                } else {
                    logger.error("Failed to send batch processed event: {}", event.batchId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing batch processed event for pass: {}", report.passId(), e);
        }
    }
}
