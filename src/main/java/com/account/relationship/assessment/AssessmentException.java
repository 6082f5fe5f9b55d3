package com.account.relationship.assessment;

/**
 * Thrown when an assessment payload cannot be produced or serialized.
 */
public class AssessmentException extends RuntimeException {

    public AssessmentException(String message) {
        super(message);
    }

    public AssessmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
