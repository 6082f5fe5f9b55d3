package com.account.relationship.coherence;

import com.account.relationship.core.model.AccountRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A labelled pair of field extractors. The left value is read from the first record and the
 * right value from the second, which may be the same record.
 */
record FieldPair(String label,
                 Function<AccountRecord, String> left,
                 Function<AccountRecord, String> right) {

    FieldPair {
        Objects.requireNonNull(label, "label is required");
        Objects.requireNonNull(left, "left is required");
        Objects.requireNonNull(right, "right is required");
    }

    /**
     * Named field extractor.
     */
    record Field(String label, Function<AccountRecord, String> extractor) {
    }

    /**
     * Every combination of the two field lists, left-major, labelled "Left vs Right".
     */
    static List<FieldPair> crossProduct(List<Field> leftFields, List<Field> rightFields) {
        List<FieldPair> pairs = new ArrayList<>();
        for (Field l : leftFields) {
            for (Field r : rightFields) {
                pairs.add(new FieldPair(l.label() + " vs " + r.label(), l.extractor(), r.extractor()));
            }
        }
        return List.copyOf(pairs);
    }
}
