package com.account.relationship.domain;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of disallowed root domains (consumer webmail, disposable and test domains,
 * placeholders). Built once at startup and shared by every evaluation.
 */
public final class BadDomainList {

    private final Set<String> domains;
    private final String source;

    private BadDomainList(Set<String> domains, String source) {
        this.domains = domains;
        this.source = source;
    }

    public static BadDomainList of(Collection<String> domains) {
        return of(domains, "inline");
    }

    public static BadDomainList of(Collection<String> domains, String source) {
        Set<String> normalized = domains.stream()
                .filter(d -> d != null && !d.isBlank())
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        return new BadDomainList(normalized, source);
    }

    public boolean contains(String domain) {
        return domain != null && domains.contains(domain);
    }

    public Set<String> domains() {
        return domains;
    }

    public int size() {
        return domains.size();
    }

    public boolean isEmpty() {
        return domains.isEmpty();
    }

    /**
     * Where the list was loaded from, for logging.
     */
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return "BadDomainList{size=" + domains.size() + ", source='" + source + "'}";
    }
}
