package com.account.relationship.assessment;

import java.util.concurrent.CompletableFuture;

/**
 * The external reasoning step that turns a payload into a final confidence score.
 * Implementations own the transport; the flag engine itself never calls out.
 */
public interface ConfidenceScorer {

    /**
     * Scores one record. Implementations should report failures through
     * {@link ConfidenceAssessment#failed} rather than throw.
     */
    ConfidenceAssessment score(AssessmentPayload payload);

    default CompletableFuture<ConfidenceAssessment> scoreAsync(AssessmentPayload payload) {
        return CompletableFuture.supplyAsync(() -> score(payload));
    }

    String getProviderName();

    boolean isAvailable();
}
