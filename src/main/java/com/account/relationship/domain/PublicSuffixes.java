package com.account.relationship.domain;

import java.util.Set;

/**
 * Known public suffixes used to find the registrable part of a domain and to repair
 * malformed top-level labels.
 *
 * <p>This is a curated subset, not the full Public Suffix List. Unknown suffixes are
 * left untouched by normalization.</p>
 */
public final class PublicSuffixes {

    private static final Set<String> TOP_LEVEL = Set.of(
            // generic
            "com", "net", "org", "edu", "gov", "mil", "int", "info", "biz", "name", "pro",
            "coop", "aero", "museum", "mobi", "jobs", "travel", "tel", "asia",
            "io", "ai", "co", "app", "dev", "tech", "online", "site", "store", "shop",
            "xyz", "cloud", "digital", "agency", "company", "solutions", "services",
            "global", "group", "health", "law", "media", "network", "systems", "world",
            // country codes
            "us", "uk", "ca", "au", "nz", "de", "fr", "es", "it", "nl", "be", "ch", "at",
            "se", "no", "dk", "fi", "ie", "pt", "pl", "cz", "ru", "ua", "tr", "gr", "il",
            "in", "cn", "jp", "kr", "sg", "hk", "tw", "my", "ph", "id", "th", "vn",
            "br", "mx", "ar", "cl", "pe", "za", "ng", "ke", "eg", "ae", "sa", "tv", "me", "ly"
    );

    private static final Set<String> MULTI_LABEL = Set.of(
            "co.uk", "org.uk", "ac.uk", "gov.uk", "ltd.uk", "plc.uk",
            "com.au", "net.au", "org.au", "edu.au", "gov.au",
            "co.nz", "org.nz", "co.jp", "ne.jp", "or.jp", "co.kr", "co.in", "co.za",
            "com.br", "com.mx", "com.ar", "com.cn", "com.sg", "com.hk", "com.tw",
            "com.tr", "com.my", "com.ph", "co.il", "com.eg", "com.sa"
    );

    private PublicSuffixes() {
        // Utility class
    }

    public static boolean isTopLevel(String label) {
        return TOP_LEVEL.contains(label);
    }

    public static boolean isMultiLabel(String suffix) {
        return MULTI_LABEL.contains(suffix);
    }

    /**
     * Returns the longest known top-level label that {@code label} starts with, or {@code null}.
     */
    public static String longestTopLevelPrefix(String label) {
        String best = null;
        for (String tld : TOP_LEVEL) {
            if (label.startsWith(tld) && (best == null || tld.length() > best.length())) {
                best = tld;
            }
        }
        return best;
    }
}
