package com.account.relationship.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Whether the customer and parent billing addresses agree.
 *
 * @param consistent     true when the compared addresses match
 * @param explanation    always names the compared field sets when a comparison happened
 * @param comparedFields the field sets compared, {@code null} when no comparable data existed
 */
public record AddressConsistencyFlag(boolean consistent, String explanation, ComparedFields comparedFields) {

    public static final String NO_DATA_EXPLANATION = "no comparable address data";

    public AddressConsistencyFlag {
        Objects.requireNonNull(explanation, "explanation is required");
        if (explanation.isBlank()) {
            throw new IllegalArgumentException("explanation must not be blank");
        }
    }

    public static AddressConsistencyFlag noComparableData() {
        return new AddressConsistencyFlag(false, NO_DATA_EXPLANATION, null);
    }

    public static AddressConsistencyFlag failed(String explanation) {
        return new AddressConsistencyFlag(false, explanation, null);
    }

    public Optional<ComparedFields> fieldsCompared() {
        return Optional.ofNullable(comparedFields);
    }
}
