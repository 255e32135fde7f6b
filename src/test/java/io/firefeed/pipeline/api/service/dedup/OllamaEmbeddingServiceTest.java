package io.firefeed.pipeline.api.service.dedup;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.firefeed.pipeline.support.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OllamaEmbeddingServiceTest {

    @Mock
    private EmbeddingModel embeddingModel;

    private OllamaEmbeddingService service;

    @BeforeEach
    void setUp() {
        service = new OllamaEmbeddingService(embeddingModel, TestConfigs.deduplication(0.9));
    }

    @Test
    @DisplayName("Should embed title and content as one normalized vector of the configured dimension")
    void shouldReturnNormalizedVector() {
        when(embeddingModel.embed("Flood warning Rivers rising fast"))
                .thenReturn(Response.from(Embedding.from(new float[]{3f, 4f})));

        float[] vector = service.embed("Flood   warning", " Rivers\nrising fast ");

        assertThat(vector).hasSize(4);
        assertThat(vector[0]).isCloseTo(0.6f, within(1e-6f));
        assertThat(vector[1]).isCloseTo(0.8f, within(1e-6f));
        assertThat(vector[2]).isZero();
    }

    @Test
    @DisplayName("Should refuse to embed empty text")
    void shouldRejectEmptyText() {
        assertThatThrownBy(() -> service.embed(" ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should zero non-finite components before scaling")
    void shouldDropNonFiniteValues() {
        float[] vector = OllamaEmbeddingService.normalize(new float[]{Float.NaN, 2f, Float.POSITIVE_INFINITY}, 3);

        assertThat(vector).containsExactly(0f, 1f, 0f);
    }

    @Test
    @DisplayName("Should truncate long text to the character limit")
    void shouldTruncateText() {
        String longContent = "word ".repeat(1000);

        assertThat(service.buildText("Title", longContent)).hasSize(2000);
    }
}
