package com.account.relationship.cdi;

import com.account.relationship.api.RelationshipFlagEngine;
import com.account.relationship.coherence.PostalCodeTolerance;
import com.account.relationship.config.ConfigurationException;
import com.account.relationship.config.EvaluationOptions;
import com.account.relationship.domain.BadDomainListLoader;
import com.account.relationship.metrics.MetricsService;
import com.account.relationship.metrics.MicrometerMetricsService;
import com.account.relationship.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.Metrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * CDI producer that wires the flag engine from MicroProfile Config properties.
 *
 * <p>The bad-domain list is loaded while the engine bean is produced. A missing or empty list
 * fails startup with a {@link ConfigurationException}.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * account-relationship:
 *   bad-domains:
 *     location: classpath:bad_domains.csv
 *   batch:
 *     max-concurrency: 8
 *     timeout-seconds: 60
 *   address:
 *     postal-code-tolerance: AT_LEAST_ONE_SIDE_MISSING
 *   record-id:
 *     prefix: "001"
 *   metrics:
 *     enabled: false
 * </pre>
 */
@ApplicationScoped
public class FlagEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(FlagEngineProducer.class);

    @Inject
    @ConfigProperty(name = "account-relationship.bad-domains.location", defaultValue = BadDomainListLoader.DEFAULT_LOCATION)
    String badDomainsLocation;

    @Inject
    @ConfigProperty(name = "account-relationship.batch.max-concurrency", defaultValue = "8")
    int maxConcurrency;

    @Inject
    @ConfigProperty(name = "account-relationship.batch.timeout-seconds", defaultValue = "60")
    long batchTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "account-relationship.address.postal-code-tolerance", defaultValue = "AT_LEAST_ONE_SIDE_MISSING")
    String postalCodeTolerance;

    @Inject
    @ConfigProperty(name = "account-relationship.record-id.prefix", defaultValue = "001")
    String recordIdPrefix;

    @Inject
    @ConfigProperty(name = "account-relationship.metrics.enabled", defaultValue = "false")
    boolean metricsEnabled;

    @Produces
    @ApplicationScoped
    public EvaluationOptions evaluationOptions() {
        return EvaluationOptions.builder()
                .badDomainListLocation(badDomainsLocation)
                .maxConcurrency(maxConcurrency)
                .batchTimeout(Duration.ofSeconds(batchTimeoutSeconds))
                .postalCodeTolerance(parseTolerance(postalCodeTolerance))
                .recordIdPrefix(recordIdPrefix)
                .build();
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (metricsEnabled) {
            log.info("Metrics enabled on the global Micrometer registry");
            return new MicrometerMetricsService(Metrics.globalRegistry);
        }
        return NoOpMetricsService.INSTANCE;
    }

    @Produces
    @ApplicationScoped
    public RelationshipFlagEngine relationshipFlagEngine(EvaluationOptions options, MetricsService metricsService) {
        log.info("Producing RelationshipFlagEngine: badDomains={} maxConcurrency={}",
                options.getBadDomainListLocation(), options.getMaxConcurrency());
        return RelationshipFlagEngine.builder()
                .options(options)
                .metricsService(metricsService)
                .build();
    }

    public void closeEngine(@Disposes RelationshipFlagEngine engine) {
        log.info("Closing RelationshipFlagEngine");
        engine.close();
    }

    static PostalCodeTolerance parseTolerance(String value) {
        try {
            return PostalCodeTolerance.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown postal code tolerance '" + value + "'", e);
        }
    }
}
