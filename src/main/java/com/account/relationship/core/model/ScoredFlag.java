package com.account.relationship.core.model;

import java.util.Objects;

/**
 * A 0-100 score with the explanation of how it was reached.
 * Used for customer consistency and customer/shell coherence.
 */
public record ScoredFlag(int score, String explanation) {

    public ScoredFlag {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score must be between 0 and 100, got " + score);
        }
        Objects.requireNonNull(explanation, "explanation is required");
        if (explanation.isBlank()) {
            throw new IllegalArgumentException("explanation must not be blank");
        }
    }

    /**
     * Creates a flag after clamping the score into [0, 100].
     */
    public static ScoredFlag clamped(int score, String explanation) {
        return new ScoredFlag(Math.max(0, Math.min(100, score)), explanation);
    }

    public static ScoredFlag zero(String explanation) {
        return new ScoredFlag(0, explanation);
    }
}
