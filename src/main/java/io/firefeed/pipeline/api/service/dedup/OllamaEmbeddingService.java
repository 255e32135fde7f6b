package io.firefeed.pipeline.api.service.dedup;

import dev.langchain4j.model.embedding.EmbeddingModel;
import io.firefeed.pipeline.config.DeduplicationConfig;
import io.firefeed.pipeline.config.EmbeddingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sentence embeddings from an Ollama embedding model.
 */
@Service
public class OllamaEmbeddingService implements EmbeddingService {

    private static final Logger logger = LoggerFactory.getLogger(OllamaEmbeddingService.class);

    private final EmbeddingModel embeddingModel;
    private final int dimension;
    private final int maxChars;

    public OllamaEmbeddingService(EmbeddingModel embeddingModel, DeduplicationConfig deduplicationConfig) {
        EmbeddingConfig config = deduplicationConfig.embedding();
        this.embeddingModel = embeddingModel;
        this.dimension = config.dimension();
        this.maxChars = Math.max(100, config.maxChars());
    }

    @Override
    public float[] embed(String title, String content) {
        String text = buildText(title, content);
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Nothing to embed");
        }
        float[] raw = embeddingModel.embed(text).content().vector();
        if (raw == null || raw.length == 0) {
            throw new IllegalStateException("Embedding model returned an empty vector");
        }
        if (raw.length != dimension) {
            logger.warn("Embedding dimension {} differs from configured {}", raw.length, dimension);
        }
        return normalize(raw, dimension);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    String buildText(String title, String content) {
        StringBuilder sb = new StringBuilder();
        if (title != null && !title.isBlank()) {
            sb.append(title.trim());
        }
        if (content != null && !content.isBlank()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(content.trim());
        }
        String text = sb.toString().replaceAll("\\s+", " ").trim();
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    /**
     * Pads or truncates to {@code targetDim}, replaces non-finite values with zero and scales to unit length.
     */
    static float[] normalize(float[] vector, int targetDim) {
        float[] out = new float[Math.max(1, targetDim)];
        int copy = Math.min(out.length, vector.length);
        for (int i = 0; i < copy; i++) {
            out[i] = Float.isFinite(vector[i]) ? vector[i] : 0.0f;
        }
        double norm = 0.0;
        for (float v : out) {
            norm += (double) v * v;
        }
        if (norm <= 0.0) {
            return out;
        }
        double scale = 1.0 / Math.sqrt(norm);
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) (out[i] * scale);
        }
        return out;
    }
}
