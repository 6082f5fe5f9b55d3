package com.account.relationship.assessment;

import com.account.relationship.core.model.TrustLevel;

import java.util.Objects;

/**
 * One value handed to the reasoning step, with where it came from and how far it can be trusted.
 *
 * @param section which part of the payload the field belongs to
 * @param name    field name as it appears in the serialized payload
 * @param value   a string, boolean or nested map; may be null for an empty field
 * @param trust   trust tier of the value
 */
public record AnnotatedField(Section section, String name, Object value, TrustLevel trust) {

    public enum Section {
        CUSTOMER,
        PARENT,
        FLAGS
    }

    public AnnotatedField {
        Objects.requireNonNull(section, "section is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(trust, "trust is required");
    }
}
