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
 * Scores how well a customer's metadata lines up with its parent's.
 *
 * <p>The best of up to four name pairings and the best of up to four website pairings are
 * averaged with equal weight and rounded half up. When only one category has a usable pairing,
 * its score is used alone.</p>
 */
public class ShellCoherenceCalculator {
    private static final Logger log = LoggerFactory.getLogger(ShellCoherenceCalculator.class);

    public static final String INSUFFICIENT_EXPLANATION = "insufficient data for shell coherence comparison";

    static final List<FieldPair> NAME_PAIRS = FieldPair.crossProduct(
            List.of(new FieldPair.Field("Customer Name", AccountRecord::getName),
                    new FieldPair.Field("Customer Enrichment Company Name", AccountRecord::getEnrichmentCompanyName)),
            List.of(new FieldPair.Field("Parent Name", AccountRecord::getName),
                    new FieldPair.Field("Parent Enrichment Company Name", AccountRecord::getEnrichmentCompanyName)));

    static final List<FieldPair> WEBSITE_PAIRS = FieldPair.crossProduct(
            List.of(new FieldPair.Field("Customer Website", AccountRecord::getWebsite),
                    new FieldPair.Field("Customer Enrichment Website", AccountRecord::getEnrichmentWebsite)),
            List.of(new FieldPair.Field("Parent Website", AccountRecord::getWebsite),
                    new FieldPair.Field("Parent Enrichment Website", AccountRecord::getEnrichmentWebsite)));

    private final NameSimilarityScorer scorer;
    private final DomainNormalizer domainNormalizer;

    public ShellCoherenceCalculator(NameSimilarityScorer scorer, DomainNormalizer domainNormalizer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.domainNormalizer = Objects.requireNonNull(domainNormalizer, "domainNormalizer is required");
    }

    public ScoredFlag calculate(AccountRecord customer, AccountRecord parent) {
        Objects.requireNonNull(customer, "customer is required");
        Objects.requireNonNull(parent, "parent is required");

        List<PairScore> nameScores = new ArrayList<>();
        for (FieldPair pair : NAME_PAIRS) {
            String customerName = pair.left().apply(customer);
            String parentName = pair.right().apply(parent);
            if (customerName != null && parentName != null) {
                nameScores.add(new PairScore(pair.label(), scorer.compareNames(customerName, parentName)));
            }
        }

        List<PairScore> websiteScores = new ArrayList<>();
        for (FieldPair pair : WEBSITE_PAIRS) {
            String customerWebsite = pair.left().apply(customer);
            String parentWebsite = pair.right().apply(parent);
            if (customerWebsite != null && parentWebsite != null) {
                websiteScores.add(new PairScore(pair.label(), compareWebsites(customerWebsite, parentWebsite)));
            }
        }

        Optional<PairScore> bestName = usableBest(nameScores);
        Optional<PairScore> bestWebsite = usableBest(websiteScores);

        if (bestName.isEmpty() && bestWebsite.isEmpty()) {
            return ScoredFlag.zero(INSUFFICIENT_EXPLANATION);
        }
        if (bestWebsite.isEmpty()) {
            PairScore name = bestName.get();
            return ScoredFlag.clamped(name.score(),
                    "Name match " + name.describe() + "; no comparable website pair");
        }
        if (bestName.isEmpty()) {
            PairScore website = bestWebsite.get();
            return ScoredFlag.clamped(website.score(),
                    "Website match " + website.describe() + "; no comparable name pair");
        }

        PairScore name = bestName.get();
        PairScore website = bestWebsite.get();
        int combined = (int) Math.round((name.score() + website.score()) / 2.0);
        log.debug("shell-coherence customer={} parent={} name={} website={} combined={}",
                customer.getId(), parent.getId(), name.score(), website.score(), combined);
        return ScoredFlag.clamped(combined,
                "Name match " + name.describe()
                        + "; Website match " + website.describe()
                        + "; combined score " + combined);
    }

    private SimilarityScore compareWebsites(String customerWebsite, String parentWebsite) {
        Optional<String> customerDomain = domainNormalizer.fromUrl(customerWebsite);
        Optional<String> parentDomain = domainNormalizer.fromUrl(parentWebsite);
        if (customerDomain.isEmpty()) {
            return SimilarityScore.insufficient("could not extract a domain from '" + customerWebsite + "'");
        }
        if (parentDomain.isEmpty()) {
            return SimilarityScore.insufficient("could not extract a domain from '" + parentWebsite + "'");
        }
        return scorer.compareDomains(customerDomain.get(), parentDomain.get());
    }

    private static Optional<PairScore> usableBest(List<PairScore> scores) {
        if (!PairScore.anySufficient(scores)) {
            return Optional.empty();
        }
        return PairScore.best(scores);
    }
}
