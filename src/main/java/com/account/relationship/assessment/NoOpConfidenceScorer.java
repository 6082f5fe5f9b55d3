package com.account.relationship.assessment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scorer used when no external scoring service is configured.
 */
public class NoOpConfidenceScorer implements ConfidenceScorer {
    private static final Logger log = LoggerFactory.getLogger(NoOpConfidenceScorer.class);

    static final String UNAVAILABLE = "AI scoring unavailable - no confidence scorer configured";

    @Override
    public ConfidenceAssessment score(AssessmentPayload payload) {
        log.debug("NoOp confidence scorer called for record '{}'", payload.getRecordId());
        return ConfidenceAssessment.unavailable(UNAVAILABLE);
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
