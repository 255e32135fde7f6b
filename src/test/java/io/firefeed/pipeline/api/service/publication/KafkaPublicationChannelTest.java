package io.firefeed.pipeline.api.service.publication;

import io.firefeed.pipeline.api.dto.NewsItem;
import io.firefeed.pipeline.api.dto.Recipient;
import io.firefeed.pipeline.api.dto.Translation;
import io.firefeed.pipeline.api.dto.kafka.NewsPublishedEvent;
import io.firefeed.pipeline.api.exception.PublicationException;
import io.firefeed.pipeline.config.KafkaProperties;
import io.firefeed.pipeline.support.MutableClock;
import io.firefeed.pipeline.support.TestConfigs;
import io.firefeed.pipeline.support.TestData;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KafkaPublicationChannelTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private KafkaPublicationChannel channel;
    private NewsItem item;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        channel = new KafkaPublicationChannel(kafkaTemplate,
                new KafkaProperties("test-news-published", "test-batch-processed"),
                TestConfigs.publication(), clock);
        item = TestData.item("n1", TestData.feed(1, "en"), clock.instant());
    }

    @Test
    @DisplayName("Should send the translated text and return the record offset")
    void shouldPublishTranslation() {
        when(kafkaTemplate.send(eq("test-news-published"), eq("n1"), any()))
                .thenReturn(CompletableFuture.completedFuture(sendResult(42L)));
        Translation translation = new Translation(7L, "n1", "de", "Titel", "Inhalt", Instant.now());

        long messageId = channel.publish(item, translation, Recipient.channel(103L, "de"));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("test-news-published"), eq("n1"), payload.capture());
        NewsPublishedEvent event = (NewsPublishedEvent) payload.getValue();
        assertThat(messageId).isEqualTo(42L);
        assertThat(event.title()).isEqualTo("Titel");
        assertThat(event.translationId()).isEqualTo(7L);
        assertThat(event.recipientType()).isEqualTo("channel");
        assertThat(event.recipientId()).isEqualTo(103L);
    }

    @Test
    @DisplayName("Should send the original text when there is no translation")
    void shouldPublishOriginal() {
        when(kafkaTemplate.send(eq("test-news-published"), eq("n1"), any()))
                .thenReturn(CompletableFuture.completedFuture(sendResult(1L)));

        channel.publish(item, null, Recipient.channel(103L, "de"));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("test-news-published"), eq("n1"), payload.capture());
        NewsPublishedEvent event = (NewsPublishedEvent) payload.getValue();
        assertThat(event.title()).isEqualTo("Title n1");
        assertThat(event.translationId()).isNull();
        assertThat(event.language()).isEqualTo("de");
    }

    @Test
    @DisplayName("Should wrap a failed send in a PublicationException")
    void shouldWrapSendFailure() {
        when(kafkaTemplate.send(eq("test-news-published"), eq("n1"), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatThrownBy(() -> channel.publish(item, null, Recipient.channel(101L, "en")))
                .isInstanceOf(PublicationException.class)
                .hasMessageContaining("broker down");
    }

    private static SendResult<String, Object> sendResult(long offset) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition("test-news-published", 0), offset, 0,
                System.currentTimeMillis(), 0, 0);
        return new SendResult<>(new ProducerRecord<>("test-news-published", "n1", "payload"), metadata);
    }
}
