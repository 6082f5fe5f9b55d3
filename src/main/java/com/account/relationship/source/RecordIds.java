package com.account.relationship.source;

import java.util.regex.Pattern;

/**
 * Record identifier handling. Ids come in a case-sensitive 15-character form and a
 * case-insensitive 18-character form whose last three characters encode the capitalization
 * of the first fifteen.
 */
public final class RecordIds {

    public static final String DEFAULT_PREFIX = "001";

    private static final String CHECKSUM_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ012345";
    private static final Pattern ALPHANUMERIC = Pattern.compile("^[A-Za-z0-9]+$");

    private RecordIds() {
        // Utility class
    }

    public static boolean isValid(String id) {
        return isValid(id, DEFAULT_PREFIX);
    }

    /**
     * True for a 15- or 18-character alphanumeric id starting with the given key prefix.
     * A null or empty prefix accepts any prefix.
     */
    public static boolean isValid(String id, String prefix) {
        if (id == null) {
            return false;
        }
        String trimmed = id.trim();
        if (trimmed.length() != 15 && trimmed.length() != 18) {
            return false;
        }
        if (!ALPHANUMERIC.matcher(trimmed).matches()) {
            return false;
        }
        return prefix == null || prefix.isEmpty() || trimmed.startsWith(prefix);
    }

    /**
     * Describes why {@link #isValid(String, String)} rejected an id.
     */
    public static String invalidReason(String id, String prefix) {
        if (id == null || id.isBlank()) {
            return "id is empty";
        }
        String trimmed = id.trim();
        if (trimmed.length() != 15 && trimmed.length() != 18) {
            return "id must be 15 or 18 characters long, got " + trimmed.length();
        }
        if (!ALPHANUMERIC.matcher(trimmed).matches()) {
            return "id must be alphanumeric";
        }
        if (prefix != null && !prefix.isEmpty() && !trimmed.startsWith(prefix)) {
            return "id must start with '" + prefix + "'";
        }
        return "id is valid";
    }

    /**
     * Converts a 15-character id to its 18-character form. Other lengths are returned trimmed
     * and otherwise unchanged.
     */
    public static String to18(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        if (trimmed.length() != 15) {
            return trimmed;
        }
        StringBuilder suffix = new StringBuilder(3);
        for (int chunk = 0; chunk < 3; chunk++) {
            int bits = 0;
            for (int i = 0; i < 5; i++) {
                char c = trimmed.charAt(chunk * 5 + i);
                if (c >= 'A' && c <= 'Z') {
                    bits |= 1 << i;
                }
            }
            suffix.append(CHECKSUM_ALPHABET.charAt(bits));
        }
        return trimmed + suffix;
    }

    /**
     * The case-sensitive 15-character form, which is what two ids are compared on. For an
     * 18-character id the capitalization is restored from its suffix, so an 18-character id in
     * any case yields the same result.
     */
    public static String to15(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        if (trimmed.length() != 18) {
            return trimmed;
        }
        StringBuilder base = new StringBuilder(15);
        for (int chunk = 0; chunk < 3; chunk++) {
            int bits = CHECKSUM_ALPHABET.indexOf(Character.toUpperCase(trimmed.charAt(15 + chunk)));
            if (bits < 0) {
                return trimmed.substring(0, 15);
            }
            for (int i = 0; i < 5; i++) {
                char c = trimmed.charAt(chunk * 5 + i);
                boolean upper = (bits & (1 << i)) != 0;
                base.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            }
        }
        return base.toString();
    }

    /**
     * True when both ids are non-blank and denote the same record across the 15/18 forms.
     */
    public static boolean sameRecord(String id1, String id2) {
        if (id1 == null || id2 == null || id1.isBlank() || id2.isBlank()) {
            return false;
        }
        return to15(id1).equals(to15(id2));
    }
}
