package com.account.relationship.coherence;

import com.account.relationship.similarity.SimilarityScore;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The score one field pair produced.
 */
record PairScore(String label, SimilarityScore similarity) {

    int score() {
        return similarity.score();
    }

    String describe() {
        return label + " (" + similarity.score() + "): " + similarity.explanation();
    }

    /**
     * Highest score; the earliest pair wins ties.
     */
    static Optional<PairScore> best(List<PairScore> scores) {
        PairScore best = null;
        for (PairScore candidate : scores) {
            if (best == null || candidate.score() > best.score()) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    static boolean anySufficient(List<PairScore> scores) {
        return scores.stream().anyMatch(s -> s.similarity().sufficient());
    }

    static String describeOthers(List<PairScore> scores, PairScore chosen) {
        return scores.stream()
                .filter(s -> s != chosen)
                .map(s -> s.label() + " (" + s.score() + ")")
                .collect(Collectors.joining(", "));
    }
}
