package com.account.relationship.core.model;

/**
 * How far the downstream reasoning step should rely on a field.
 */
public enum TrustLevel {
    /** The record's own fields. */
    TRUSTED,
    /** Third-party enrichment copies; could be inaccurate. */
    SEMI_RELIABLE,
    /** Flags derived by this engine. */
    COMPUTED
}
