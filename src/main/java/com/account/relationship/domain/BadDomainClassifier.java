package com.account.relationship.domain;

import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.core.model.BadDomainFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The bad-domain gate. Checks a record's email and then its website against the
 * disallow-list and stops at the first hit.
 *
 * <p>A domain matches a listed root when it is equal to it, is a subdomain of it
 * ({@code test.ringcentral.com} matches {@code ringcentral.com}), or is the listed domain
 * followed by at most four stray alphanumerics ({@code yahoo.comxyz}).</p>
 */
public class BadDomainClassifier {
    private static final Logger log = LoggerFactory.getLogger(BadDomainClassifier.class);

    static final String EMAIL_FIELD = "ContactMostFrequentEmail";
    static final String WEBSITE_FIELD = "Website";
    private static final Pattern STRAY_TAIL = Pattern.compile("^[a-z0-9]{1,4}$");

    private final BadDomainList badDomains;
    private final DomainNormalizer normalizer;

    public BadDomainClassifier(BadDomainList badDomains) {
        this(badDomains, new DomainNormalizer());
    }

    public BadDomainClassifier(BadDomainList badDomains, DomainNormalizer normalizer) {
        this.badDomains = Objects.requireNonNull(badDomains, "badDomains is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    /**
     * Classifies a record. The email is checked before the website.
     */
    public BadDomainFlag classify(AccountRecord record) {
        Optional<BadDomainFlag> emailHit = check(EMAIL_FIELD, "Email", normalizer.fromEmail(record.getEmail()));
        if (emailHit.isPresent()) {
            return emailHit.get();
        }
        Optional<BadDomainFlag> websiteHit = check(WEBSITE_FIELD, "Website", normalizer.fromUrl(record.getWebsite()));
        return websiteHit.orElseGet(BadDomainFlag::clean);
    }

    /**
     * Returns the listed root domain a normalized domain falls under, if any.
     */
    public Optional<String> matchListedDomain(String domain) {
        if (domain == null || domain.isEmpty()) {
            return Optional.empty();
        }
        if (badDomains.contains(domain)) {
            return Optional.of(domain);
        }

        int dot = domain.indexOf('.');
        while (dot >= 0) {
            String parent = domain.substring(dot + 1);
            if (parent.indexOf('.') < 0) {
                break;
            }
            if (badDomains.contains(parent)) {
                return Optional.of(parent);
            }
            dot = domain.indexOf('.', dot + 1);
        }

        String best = null;
        for (String listed : badDomains.domains()) {
            if (domain.length() > listed.length() && domain.startsWith(listed)
                    && STRAY_TAIL.matcher(domain.substring(listed.length())).matches()
                    && (best == null || listed.length() > best.length())) {
                best = listed;
            }
        }
        return Optional.ofNullable(best);
    }

    public BadDomainList getBadDomains() {
        return badDomains;
    }

    private Optional<BadDomainFlag> check(String field, String kind, Optional<String> domain) {
        if (domain.isEmpty()) {
            return Optional.empty();
        }
        String normalized = domain.get();
        return matchListedDomain(normalized).map(root -> {
            log.debug("bad-domain.hit field={} domain={} root={}", field, normalized, root);
            String subject = normalized.equals(root)
                    ? kind + " domain '" + root + "'"
                    : kind + " domain '" + normalized + "' (root '" + root + "')";
            return BadDomainFlag.bad(subject + " from " + field + " matches bad domain list");
        });
    }
}
