package com.account.relationship.core.model;

/**
 * State, country and postal code of a billing address.
 * Blank components are stored as {@code null}.
 */
public record PostalAddress(String state, String country, String postalCode) {

    private static final PostalAddress EMPTY = new PostalAddress(null, null, null);

    public PostalAddress {
        state = clean(state);
        country = clean(country);
        postalCode = clean(postalCode);
    }

    public static PostalAddress empty() {
        return EMPTY;
    }

    public static PostalAddress of(String state, String country, String postalCode) {
        return new PostalAddress(state, country, postalCode);
    }

    public boolean hasState() {
        return state != null;
    }

    public boolean hasCountry() {
        return country != null;
    }

    public boolean hasPostalCode() {
        return postalCode != null;
    }

    /**
     * True when at least one component is present.
     */
    public boolean isUsable() {
        return state != null || country != null || postalCode != null;
    }

    /**
     * Renders the present components as "State, Country, Postal", or {@code null} when empty.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        append(sb, state);
        append(sb, country);
        append(sb, postalCode);
        return sb.length() == 0 ? null : sb.toString();
    }

    private static void append(StringBuilder sb, String part) {
        if (part == null) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(part);
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
