package com.account.relationship.assessment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * The external step's verdict on a record: a 0-100 confidence that the parent link is valid
 * and a few explanation bullets.
 *
 * @param confidenceScore    clamped to [0, 100]; 0 when the reply could not be used
 * @param explanationBullets the reasoning, or the failure description
 * @param success            false when the scorer failed or its reply was unusable
 * @param error              failure description, null on success
 * @param rawResponse        the unparsed reply, when there was one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfidenceAssessment(
        @JsonProperty("confidence_score") int confidenceScore,
        @JsonProperty("explanation_bullets") List<String> explanationBullets,
        @JsonProperty("success") boolean success,
        @JsonProperty("error") String error,
        @JsonIgnore String rawResponse
) {

    public ConfidenceAssessment {
        if (confidenceScore < 0 || confidenceScore > 100) {
            throw new IllegalArgumentException("confidenceScore must be between 0 and 100, got " + confidenceScore);
        }
        explanationBullets = List.copyOf(Objects.requireNonNull(explanationBullets, "explanationBullets is required"));
    }

    public static ConfidenceAssessment of(int confidenceScore, List<String> explanationBullets, String rawResponse) {
        return new ConfidenceAssessment(confidenceScore, explanationBullets, true, null, rawResponse);
    }

    public static ConfidenceAssessment failed(String error, String rawResponse) {
        return new ConfidenceAssessment(0, List.of("\u274C " + error), false, error, rawResponse);
    }

    /**
     * No scorer is configured or reachable.
     */
    public static ConfidenceAssessment unavailable(String reason) {
        return new ConfidenceAssessment(0, List.of("\u26A0\uFE0F " + reason), false, reason, null);
    }
}
