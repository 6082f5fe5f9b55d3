package com.account.relationship.api;

/**
 * Thrown when a batch evaluation cannot complete, typically because its deadline expired.
 */
public class BatchEvaluationException extends RuntimeException {

    public BatchEvaluationException(String message) {
        super(message);
    }

    public BatchEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
