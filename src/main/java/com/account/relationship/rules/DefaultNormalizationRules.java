package com.account.relationship.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for company and person names as they appear on account records.
 */
public final class DefaultNormalizationRules {

    private static final String LEGAL_SUFFIXES = String.join("|",
            "Inc", "Incorporated", "Corp", "Corporation", "Co", "Company",
            "Ltd", "Limited", "LLC", "L\\.L\\.C", "LLP", "L\\.L\\.P", "LP", "PLC", "P\\.L\\.C",
            "GmbH", "AG", "S\\.?A", "N\\.?V", "B\\.?V", "Pty", "Pte", "SARL", "S\\.?r\\.?l",
            "Group", "Holdings", "Enterprises");

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getCompanyRules());
        rules.addAll(getCommonRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Legal-entity suffixes and the leading article. Suffixes are stripped repeatedly, so
     * "Acme Holdings, Inc." loses both. A name made only of a suffix word is kept.
     */
    public static List<NormalizationRule> getCompanyRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("company-legal-suffix")
                        .pattern("[,\\s]+(?:" + LEGAL_SUFFIXES + ")\\.?\\s*$")
                        .replacement("")
                        .priority(10)
                        .repeatable(true)
                        .build(),

                NormalizationRule.builder()
                        .name("company-the")
                        .pattern("^The\\s+")
                        .replacement("")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Punctuation and connector rules that apply to every name.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-and")
                        .pattern("\\s+and\\s+")
                        .replacement(" ")
                        .priority(50)
                        .build(),

                NormalizationRule.builder()
                        .name("common-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" ")
                        .priority(50)
                        .build(),

                // McDonald's -> mcdonalds
                NormalizationRule.builder()
                        .name("common-apostrophe")
                        .pattern("['\u2019]")
                        .replacement("")
                        .priority(90)
                        .build(),

                NormalizationRule.builder()
                        .name("common-special-chars")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }
}
