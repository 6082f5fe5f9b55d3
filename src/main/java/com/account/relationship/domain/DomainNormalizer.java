package com.account.relationship.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts a canonical domain from a URL or an email address.
 *
 * <p>The result is lowercase, without scheme, user-info, port, path, query or
 * {@code www.} prefix. Subdomains are kept; use {@link #rootDomain(String)} for the
 * registrable part.</p>
 *
 * <p>A final label that is not a known suffix but starts with one followed by at most
 * four alphanumerics is truncated to that suffix ({@code gmail.comno} becomes
 * {@code gmail.com}). This is a list-driven heuristic and can mis-correct legitimate
 * domains whose suffix is missing from {@link PublicSuffixes}.</p>
 */
public class DomainNormalizer {
    private static final Logger log = LoggerFactory.getLogger(DomainNormalizer.class);

    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.-]*://");
    private static final Pattern PORT = Pattern.compile(":\\d*$");
    private static final Pattern HOST = Pattern.compile(
            "^[a-z0-9](?:[a-z0-9-]*[a-z0-9])?(?:\\.[a-z0-9](?:[a-z0-9-]*[a-z0-9])?)+$");
    private static final Pattern MALFORMED_TAIL = Pattern.compile("^[a-z0-9]{1,4}$");
    private static final String WWW = "www.";

    /**
     * Normalizes either an email address or a URL.
     * Values containing {@code @} and no scheme are treated as email addresses.
     */
    public Optional<String> normalize(String urlOrEmail) {
        if (urlOrEmail == null || urlOrEmail.isBlank()) {
            return Optional.empty();
        }
        String value = urlOrEmail.trim().toLowerCase(Locale.ROOT);
        if (!value.contains("://") && value.indexOf('@') >= 0) {
            return fromEmail(value);
        }
        return fromUrl(value);
    }

    /**
     * Takes the part after the last {@code @} of an email address.
     */
    public Optional<String> fromEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        String value = email.trim().toLowerCase(Locale.ROOT);
        int at = value.lastIndexOf('@');
        if (at < 0 || at == value.length() - 1) {
            log.debug("Cannot extract domain from email '{}'", email);
            return Optional.empty();
        }
        return cleanHost(value.substring(at + 1));
    }

    /**
     * Extracts the host of a URL, with or without scheme.
     */
    public Optional<String> fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String value = SCHEME.matcher(url.trim().toLowerCase(Locale.ROOT)).replaceFirst("");
        int end = value.length();
        for (char stop : new char[]{'/', '?', '#'}) {
            int idx = value.indexOf(stop);
            if (idx >= 0 && idx < end) {
                end = idx;
            }
        }
        String authority = value.substring(0, end);
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        authority = PORT.matcher(authority).replaceFirst("");
        return cleanHost(authority);
    }

    /**
     * Returns the registrable domain: the last two labels, or three when the last two
     * form a known multi-label suffix such as {@code co.uk}.
     */
    public String rootDomain(String domain) {
        String[] labels = domain.split("\\.");
        if (labels.length <= 2) {
            return domain;
        }
        int keep = PublicSuffixes.isMultiLabel(lastLabels(labels, 2)) ? 3 : 2;
        return lastLabels(labels, Math.min(keep, labels.length));
    }

    /**
     * Returns the name-like tokens of a domain, i.e. the labels before the public suffix,
     * split on hyphens. {@code west.acme-tools.com} gives {@code [west, acme, tools]}.
     */
    public List<String> domainTokens(String domain) {
        String[] labels = domain.split("\\.");
        int suffixLabels = 1;
        if (labels.length > 2 && PublicSuffixes.isMultiLabel(lastLabels(labels, 2))) {
            suffixLabels = 2;
        }
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < labels.length - suffixLabels; i++) {
            for (String part : labels[i].split("-")) {
                if (!part.isEmpty()) {
                    tokens.add(part);
                }
            }
        }
        return tokens;
    }

    private Optional<String> cleanHost(String rawHost) {
        String host = rawHost.trim();
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        while (host.startsWith(WWW) && host.indexOf('.', WWW.length()) > 0) {
            host = host.substring(WWW.length());
        }
        if (!HOST.matcher(host).matches()) {
            log.debug("Rejecting malformed host '{}'", rawHost);
            return Optional.empty();
        }
        return Optional.of(repairSuffix(host));
    }

    private String repairSuffix(String host) {
        int lastDot = host.lastIndexOf('.');
        String last = host.substring(lastDot + 1);
        if (PublicSuffixes.isTopLevel(last)) {
            return host;
        }
        String known = PublicSuffixes.longestTopLevelPrefix(last);
        if (known == null || known.length() == last.length()) {
            return host;
        }
        String tail = last.substring(known.length());
        if (!MALFORMED_TAIL.matcher(tail).matches()) {
            return host;
        }
        String repaired = host.substring(0, lastDot + 1) + known;
        log.debug("Repaired malformed suffix '{}' -> '{}'", host, repaired);
        return repaired;
    }

    private static String lastLabels(String[] labels, int count) {
        return String.join(".", Arrays.copyOfRange(labels, labels.length - count, labels.length));
    }
}
