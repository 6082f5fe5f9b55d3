package com.account.relationship.assessment;

import java.util.List;

/**
 * Outcome of assessing a list of requested record ids.
 *
 * @param assessments one entry per found record, in request order
 * @param invalidIds  ids rejected before lookup, with the reason
 * @param notFoundIds well-formed ids the record source did not return
 */
public record AssessmentBatchResult(List<RecordAssessment> assessments,
                                    List<InvalidId> invalidIds,
                                    List<String> notFoundIds) {

    public AssessmentBatchResult {
        assessments = List.copyOf(assessments);
        invalidIds = List.copyOf(invalidIds);
        notFoundIds = List.copyOf(notFoundIds);
    }

    public record InvalidId(String id, String reason) {
    }
}
