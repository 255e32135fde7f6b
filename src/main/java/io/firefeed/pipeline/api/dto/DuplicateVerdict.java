package io.firefeed.pipeline.api.dto;

/**
 * Result of a duplicate check. {@code embedding} is the candidate's vector when one
 * was computed, so it can be stored with the item.
 */
public record DuplicateVerdict(
        boolean duplicate,
        Match match,
        String matchedId,
        double similarity,
        float[] embedding,
        boolean failed
) {

    public enum Match {
        NONE,
        SAME_LINK,
        SIMILAR_CONTENT
    }

    public static DuplicateVerdict unique(float[] embedding, double bestSimilarity) {
        return new DuplicateVerdict(false, Match.NONE, null, bestSimilarity, embedding, false);
    }

    public static DuplicateVerdict sameLink() {
        return new DuplicateVerdict(true, Match.SAME_LINK, null, 1.0, null, false);
    }

    public static DuplicateVerdict similar(String matchedId, double similarity, float[] embedding) {
        return new DuplicateVerdict(true, Match.SIMILAR_CONTENT, matchedId, similarity, embedding, false);
    }

    public static DuplicateVerdict failedOpen() {
        return new DuplicateVerdict(false, Match.NONE, null, 0.0, null, true);
    }

    /**
     * Same verdict, marked as reached with part of the check unavailable.
     */
    public DuplicateVerdict withFailure(boolean failed) {
        return failed == this.failed ? this
                : new DuplicateVerdict(duplicate, match, matchedId, similarity, embedding, failed);
    }
}
