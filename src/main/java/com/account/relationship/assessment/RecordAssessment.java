package com.account.relationship.assessment;

import com.account.relationship.api.EvaluationResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Evaluation, payload and (when scored) confidence verdict for one record.
 */
public record RecordAssessment(EvaluationResult evaluation, AssessmentPayload payload,
                               ConfidenceAssessment confidence) {

    public RecordAssessment {
        Objects.requireNonNull(evaluation, "evaluation is required");
        Objects.requireNonNull(payload, "payload is required");
    }

    public String recordId() {
        return evaluation.recordId();
    }

    /**
     * Empty for records stopped by the bad-domain gate, which are never sent for scoring.
     */
    public Optional<ConfidenceAssessment> confidenceAssessment() {
        return Optional.ofNullable(confidence);
    }
}
