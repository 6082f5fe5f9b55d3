package com.account.relationship.similarity;

import com.account.relationship.domain.DomainNormalizer;
import com.account.relationship.rules.DefaultNormalizationRules;
import com.account.relationship.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Fuzzy scorer for company names and website domains.
 *
 * <p>Names are normalized first (lowercase, punctuation and legal suffixes removed, whitespace
 * collapsed). The score is the maximum of the full-string {@link IndelRatioSimilarity} and the
 * {@link TokenSetSimilarity}, scaled to [0, 100]. All comparisons are symmetric.</p>
 */
public class NameSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(NameSimilarityScorer.class);

    private final NormalizationEngine normalizationEngine;
    private final DomainNormalizer domainNormalizer;
    private final IndelRatioSimilarity ratio;
    private final TokenSetSimilarity tokenSet;

    public NameSimilarityScorer() {
        this(DefaultNormalizationRules.createDefaultEngine(), new DomainNormalizer());
    }

    public NameSimilarityScorer(NormalizationEngine normalizationEngine, DomainNormalizer domainNormalizer) {
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
        this.domainNormalizer = Objects.requireNonNull(domainNormalizer, "domainNormalizer is required");
        this.ratio = new IndelRatioSimilarity();
        this.tokenSet = new TokenSetSimilarity(ratio);
    }

    /**
     * Compares two free-text names.
     */
    public SimilarityScore compareNames(String name1, String name2) {
        if (isBlank(name1) || isBlank(name2)) {
            return SimilarityScore.insufficient("a name is missing");
        }
        String normalized1 = normalizationEngine.normalize(name1);
        String normalized2 = normalizationEngine.normalize(name2);
        if (normalized1.isEmpty() || normalized2.isEmpty()) {
            return SimilarityScore.insufficient("a name is empty after normalization");
        }

        double similarity = bestOf(normalized1, normalized2);
        log.debug("Name similarity '{}' vs '{}' = {}", normalized1, normalized2, similarity);
        return SimilarityScore.of(similarity, "'" + normalized1 + "' vs '" + normalized2 + "'");
    }

    /**
     * Compares a name with a normalized website domain.
     * The domain is reduced to its name-like labels, so "Acme West" matches {@code west.acme.com}
     * and "Carlos Reyes" matches {@code carlosreyes.zumba.com}.
     */
    public SimilarityScore compareNameToDomain(String name, String domain) {
        if (isBlank(name)) {
            return SimilarityScore.insufficient("a name is missing");
        }
        if (isBlank(domain)) {
            return SimilarityScore.insufficient("a domain is missing");
        }
        String normalizedName = normalizationEngine.normalize(name);
        if (normalizedName.isEmpty()) {
            return SimilarityScore.insufficient("name '" + name + "' is empty after normalization");
        }
        List<String> tokens = domainNormalizer.domainTokens(domain);
        if (tokens.isEmpty()) {
            return SimilarityScore.insufficient("domain '" + domain + "' has no name-like labels");
        }

        String domainText = String.join(" ", tokens);
        String compactName = normalizedName.replace(" ", "");
        double similarity = bestOf(normalizedName, domainText);
        similarity = Math.max(similarity, ratio.compute(compactName, String.join("", tokens)));
        for (String token : tokens) {
            similarity = Math.max(similarity, ratio.compute(compactName, token));
        }

        log.debug("Name/domain similarity '{}' vs '{}' = {}", normalizedName, domain, similarity);
        return SimilarityScore.of(similarity, "'" + normalizedName + "' vs domain '" + domain + "'");
    }

    /**
     * Compares two normalized domains. Domains sharing a registrable root score 100.
     */
    public SimilarityScore compareDomains(String domain1, String domain2) {
        if (isBlank(domain1) || isBlank(domain2)) {
            return SimilarityScore.insufficient("a domain is missing");
        }
        String root1 = domainNormalizer.rootDomain(domain1);
        String root2 = domainNormalizer.rootDomain(domain2);
        if (root1.equals(root2)) {
            return SimilarityScore.of(1.0, "shared root domain '" + root1 + "'");
        }

        List<String> tokens1 = domainNormalizer.domainTokens(root1);
        List<String> tokens2 = domainNormalizer.domainTokens(root2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return SimilarityScore.insufficient("no name-like labels in '" + root1 + "' or '" + root2 + "'");
        }
        double similarity = Math.max(
                bestOf(String.join(" ", tokens1), String.join(" ", tokens2)),
                ratio.compute(String.join("", tokens1), String.join("", tokens2)));
        return SimilarityScore.of(similarity, "'" + root1 + "' vs '" + root2 + "'");
    }

    /**
     * Raw 0-100 score of two names, 0 when either is missing.
     */
    public int score(String name1, String name2) {
        return compareNames(name1, name2).score();
    }

    public String normalize(String name) {
        return normalizationEngine.normalize(name);
    }

    private double bestOf(String s1, String s2) {
        return Math.max(ratio.compute(s1, s2), tokenSet.compute(s1, s2));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
