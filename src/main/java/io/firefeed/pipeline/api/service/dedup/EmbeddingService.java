package io.firefeed.pipeline.api.service.dedup;

public interface EmbeddingService {

    /**
     * Embed title and content as one text. The result is L2-normalised and has the
     * configured dimension.
     *
     * @throws RuntimeException when the embedding model cannot be reached
     */
    float[] embed(String title, String content);

    int dimension();
}
