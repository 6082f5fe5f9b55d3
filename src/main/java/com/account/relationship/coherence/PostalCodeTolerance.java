package com.account.relationship.coherence;

/**
 * How a missing postal code affects an otherwise matching state and country.
 */
public enum PostalCodeTolerance {
    /** Match when the postal code is absent on one or both sides. */
    AT_LEAST_ONE_SIDE_MISSING,
    /** Match only when exactly one side lacks a postal code. */
    EXACTLY_ONE_SIDE_MISSING,
    /** Postal codes must be present on both sides and equal. */
    STRICT;

    /**
     * Decides the postal part of a match when at least one side has no postal code.
     */
    public boolean tolerates(boolean customerHasPostal, boolean parentHasPostal) {
        return switch (this) {
            case AT_LEAST_ONE_SIDE_MISSING -> !customerHasPostal || !parentHasPostal;
            case EXACTLY_ONE_SIDE_MISSING -> customerHasPostal != parentHasPostal;
            case STRICT -> false;
        };
    }
}
