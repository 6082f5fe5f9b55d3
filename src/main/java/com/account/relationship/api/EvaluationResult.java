package com.account.relationship.api;

import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.core.model.RelationshipFlags;

import java.util.Objects;
import java.util.Optional;

/**
 * The flags computed for one record, together with the records they were computed from.
 */
public record EvaluationResult(AccountRecord record, AccountRecord parent, RelationshipFlags flags) {

    public EvaluationResult {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(flags, "flags is required");
    }

    public String recordId() {
        return record.getId();
    }

    public Optional<AccountRecord> parentRecord() {
        return Optional.ofNullable(parent);
    }
}
