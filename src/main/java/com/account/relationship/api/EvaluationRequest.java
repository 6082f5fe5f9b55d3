package com.account.relationship.api;

import com.account.relationship.core.model.AccountRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * A record to evaluate and, when it links to one, its resolved parent.
 *
 * @param record the record whose flags are computed
 * @param parent the resolved parent record, or {@code null} when there is no link or the
 *               linked parent could not be resolved
 */
public record EvaluationRequest(AccountRecord record, AccountRecord parent) {

    public EvaluationRequest {
        Objects.requireNonNull(record, "record is required");
    }

    public static EvaluationRequest of(AccountRecord record) {
        return new EvaluationRequest(record, null);
    }

    public static EvaluationRequest of(AccountRecord record, AccountRecord parent) {
        return new EvaluationRequest(record, parent);
    }

    public Optional<AccountRecord> parentRecord() {
        return Optional.ofNullable(parent);
    }
}
