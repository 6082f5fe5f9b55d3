package com.account.relationship.api;

import com.account.relationship.coherence.AddressConsistencyCalculator;
import com.account.relationship.coherence.CustomerConsistencyCalculator;
import com.account.relationship.coherence.ShellCoherenceCalculator;
import com.account.relationship.config.EvaluationOptions;
import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.core.model.RelationshipFlags;
import com.account.relationship.domain.BadDomainClassifier;
import com.account.relationship.domain.BadDomainList;
import com.account.relationship.domain.BadDomainListLoader;
import com.account.relationship.domain.DomainNormalizer;
import com.account.relationship.metrics.MetricsService;
import com.account.relationship.metrics.NoOpMetricsService;
import com.account.relationship.rules.DefaultNormalizationRules;
import com.account.relationship.rules.NormalizationEngine;
import com.account.relationship.similarity.NameSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point that wires the flag pipeline together.
 *
 * <p>The bad-domain list is loaded once when the engine is built and never reloaded.
 * Usage:</p>
 * <pre>
 * try (RelationshipFlagEngine engine = RelationshipFlagEngine.builder()
 *         .options(EvaluationOptions.builder().maxConcurrency(4).build())
 *         .build()) {
 *     RelationshipFlags flags = engine.evaluate(record, parent);
 * }
 * </pre>
 */
public class RelationshipFlagEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelationshipFlagEngine.class);

    private final EvaluationOptions options;
    private final BadDomainList badDomainList;
    private final RelationshipFlagEvaluator evaluator;
    private final BatchFlagEvaluator batchEvaluator;

    private RelationshipFlagEngine(Builder builder, BadDomainList badDomainList) {
        this.options = builder.options;
        this.badDomainList = badDomainList;

        DomainNormalizer domainNormalizer = new DomainNormalizer();
        NameSimilarityScorer scorer = new NameSimilarityScorer(builder.normalizationEngine, domainNormalizer);
        this.evaluator = new RelationshipFlagEvaluator(
                new BadDomainClassifier(badDomainList, domainNormalizer),
                new CustomerConsistencyCalculator(scorer, domainNormalizer),
                new ShellCoherenceCalculator(scorer, domainNormalizer),
                new AddressConsistencyCalculator(options.getPostalCodeTolerance()),
                builder.metricsService);
        this.batchEvaluator = new BatchFlagEvaluator(evaluator, options, builder.metricsService);

        log.info("engine.started badDomains={} source={} options={}",
                badDomainList.size(), badDomainList.source(), options);
    }

    public RelationshipFlags evaluate(AccountRecord record) {
        return evaluator.evaluate(record, null);
    }

    public RelationshipFlags evaluate(AccountRecord record, AccountRecord parent) {
        return evaluator.evaluate(record, parent);
    }

    public EvaluationResult evaluate(EvaluationRequest request) {
        return evaluator.evaluate(request);
    }

    /**
     * Evaluates a batch concurrently; results follow the order of {@code requests}.
     */
    public List<EvaluationResult> evaluateBatch(List<EvaluationRequest> requests) {
        return batchEvaluator.evaluateAll(requests);
    }

    public EvaluationOptions getOptions() {
        return options;
    }

    public BadDomainList getBadDomainList() {
        return badDomainList;
    }

    public RelationshipFlagEvaluator getEvaluator() {
        return evaluator;
    }

    @Override
    public void close() {
        batchEvaluator.close();
        log.info("engine.closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EvaluationOptions options = EvaluationOptions.defaults();
        private BadDomainList badDomainList;
        private BadDomainListLoader loader = new BadDomainListLoader();
        private NormalizationEngine normalizationEngine = DefaultNormalizationRules.createDefaultEngine();
        private MetricsService metricsService = NoOpMetricsService.INSTANCE;

        public Builder options(EvaluationOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Uses the given list instead of loading one from {@link EvaluationOptions#getBadDomainListLocation()}.
         */
        public Builder badDomainList(BadDomainList badDomainList) {
            this.badDomainList = badDomainList;
            return this;
        }

        public Builder loader(BadDomainListLoader loader) {
            this.loader = loader;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Builds the engine, loading the bad-domain list unless one was supplied.
         *
         * @throws com.account.relationship.config.ConfigurationException if the list cannot be loaded
         */
        public RelationshipFlagEngine build() {
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
            Objects.requireNonNull(metricsService, "metricsService is required");
            BadDomainList list = badDomainList;
            if (list == null) {
                Objects.requireNonNull(loader, "loader is required");
                list = loader.load(options.getBadDomainListLocation());
            }
            return new RelationshipFlagEngine(this, list);
        }
    }
}
