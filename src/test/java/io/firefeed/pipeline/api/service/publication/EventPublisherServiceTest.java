package io.firefeed.pipeline.api.service.publication;

import io.firefeed.pipeline.api.dto.PassReport;
import io.firefeed.pipeline.api.dto.kafka.BatchProcessedEvent;
import io.firefeed.pipeline.config.KafkaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventPublisherServiceTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private EventPublisherService service;

    private final PassReport report = new PassReport("pass-1", Instant.parse("2024-05-01T10:00:00Z"), 1200,
            3, 1, 40, 10, 0, 30, 0, 60, 2, 5, 25, 0);

    @BeforeEach
    void setUp() {
        service = new EventPublisherService(kafkaTemplate, new KafkaProperties("test-news-published", "test-batch-processed"));
    }

    @Test
    void shouldPublishBatchProcessedEvent() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        service.publishBatchProcessed(report);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("test-batch-processed"), eq("pass-1"), payload.capture());
        BatchProcessedEvent event = (BatchProcessedEvent) payload.getValue();
        assertThat(event.totalArticles()).isEqualTo(40);
        assertThat(event.newArticles()).isEqualTo(30);
        assertThat(event.translationFallbacks()).isEqualTo(2);
    }

    @Test
    void shouldNotThrowWhenKafkaIsUnavailable() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("no broker"));

        assertThatCode(() -> service.publishBatchProcessed(report)).doesNotThrowAnyException();
    }
}
