package com.account.relationship.core.model;

import java.util.Objects;

/**
 * Outcome of the bad-domain gate.
 *
 * @param bad         true when the email or website resolves to a disallowed domain
 * @param explanation which field and root domain matched, or why nothing did
 */
public record BadDomainFlag(boolean bad, String explanation) {

    public static final String CLEAN_EXPLANATION = "no bad domain detected";

    public BadDomainFlag {
        Objects.requireNonNull(explanation, "explanation is required");
        if (explanation.isBlank()) {
            throw new IllegalArgumentException("explanation must not be blank");
        }
    }

    public static BadDomainFlag clean() {
        return new BadDomainFlag(false, CLEAN_EXPLANATION);
    }

    public static BadDomainFlag bad(String explanation) {
        return new BadDomainFlag(true, explanation);
    }
}
