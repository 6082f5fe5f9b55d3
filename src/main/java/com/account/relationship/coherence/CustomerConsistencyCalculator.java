package com.account.relationship.coherence;

import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.core.model.ScoredFlag;
import com.account.relationship.domain.DomainNormalizer;
import com.account.relationship.similarity.NameSimilarityScorer;
import com.account.relationship.similarity.SimilarityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores how well a record's name agrees with its own website.
 *
 * <p>Candidate pairs, in order: Name vs Website, Name vs Enrichment Website,
 * Enrichment Company Name vs Website, Enrichment Company Name vs Enrichment Website.
 * The best score among pairs where both values exist wins.</p>
 */
public class CustomerConsistencyCalculator {
    private static final Logger log = LoggerFactory.getLogger(CustomerConsistencyCalculator.class);

    public static final String NO_WEBSITE_EXPLANATION = "no website data available";

    static final List<FieldPair> CANDIDATES = FieldPair.crossProduct(
            List.of(new FieldPair.Field("Name", AccountRecord::getName),
                    new FieldPair.Field("Enrichment Company Name", AccountRecord::getEnrichmentCompanyName)),
            List.of(new FieldPair.Field("Website", AccountRecord::getWebsite),
                    new FieldPair.Field("Enrichment Website", AccountRecord::getEnrichmentWebsite)));

    private final NameSimilarityScorer scorer;
    private final DomainNormalizer domainNormalizer;

    public CustomerConsistencyCalculator(NameSimilarityScorer scorer, DomainNormalizer domainNormalizer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.domainNormalizer = Objects.requireNonNull(domainNormalizer, "domainNormalizer is required");
    }

    public ScoredFlag calculate(AccountRecord record) {
        if (!record.hasAnyWebsite()) {
            return ScoredFlag.zero(NO_WEBSITE_EXPLANATION);
        }

        List<PairScore> scores = new ArrayList<>();
        for (FieldPair pair : CANDIDATES) {
            String name = pair.left().apply(record);
            String website = pair.right().apply(record);
            if (name == null || website == null) {
                continue;
            }
            Optional<String> domain = domainNormalizer.fromUrl(website);
            SimilarityScore similarity = domain
                    .map(d -> scorer.compareNameToDomain(name, d))
                    .orElseGet(() -> SimilarityScore.insufficient(
                            "could not extract a domain from '" + website + "'"));
            scores.add(new PairScore(pair.label(), similarity));
        }

        if (scores.isEmpty()) {
            return ScoredFlag.zero("insufficient data: no company name available to compare with the website");
        }

        PairScore best = PairScore.best(scores).orElseThrow();
        if (!PairScore.anySufficient(scores)) {
            return ScoredFlag.zero(best.label() + ": " + best.similarity().explanation());
        }

        String explanation = "Best match " + best.describe();
        if (scores.size() > 1) {
            explanation += "; also compared " + PairScore.describeOthers(scores, best);
        }
        log.debug("customer-consistency record={} score={} pair='{}'", record.getId(), best.score(), best.label());
        return ScoredFlag.clamped(best.score(), explanation);
    }
}
