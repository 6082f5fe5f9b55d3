package com.account.relationship.similarity;

import java.util.Objects;

/**
 * An integer similarity score in [0, 100] and what was compared to get it.
 *
 * @param score       the clamped score
 * @param explanation the normalized values compared, or why no comparison was possible
 * @param sufficient  false when one side had no usable data
 */
public record SimilarityScore(int score, String explanation, boolean sufficient) {

    public SimilarityScore {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score must be between 0 and 100, got " + score);
        }
        Objects.requireNonNull(explanation, "explanation is required");
    }

    public static SimilarityScore of(double similarity, String explanation) {
        long rounded = Math.round(similarity * 100.0);
        return new SimilarityScore((int) Math.max(0, Math.min(100, rounded)), explanation, true);
    }

    /**
     * A zero score for a comparison that could not be made.
     */
    public static SimilarityScore insufficient(String reason) {
        return new SimilarityScore(0, "insufficient data: " + reason, false);
    }
}
