package com.account.relationship.cdi;

import com.account.relationship.api.RelationshipFlagEngine;
import com.account.relationship.coherence.PostalCodeTolerance;
import com.account.relationship.config.ConfigurationException;
import com.account.relationship.config.EvaluationOptions;
import com.account.relationship.metrics.MicrometerMetricsService;
import com.account.relationship.metrics.NoOpMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FlagEngineProducerTest {

    private FlagEngineProducer producer;

    @BeforeEach
    void setUp() {
        producer = new FlagEngineProducer();
        producer.badDomainsLocation = "classpath:test_bad_domains.csv";
        producer.maxConcurrency = 3;
        producer.batchTimeoutSeconds = 15;
        producer.postalCodeTolerance = "strict";
        producer.recordIdPrefix = "001";
        producer.metricsEnabled = false;
    }

    @Test
    @DisplayName("Options are built from the configured properties")
    void options() {
        EvaluationOptions options = producer.evaluationOptions();

        assertEquals("classpath:test_bad_domains.csv", options.getBadDomainListLocation());
        assertEquals(3, options.getMaxConcurrency());
        assertEquals(Duration.ofSeconds(15), options.getBatchTimeout());
        assertEquals(PostalCodeTolerance.STRICT, options.getPostalCodeTolerance());
    }

    @ParameterizedTest
    @CsvSource({
            "AT_LEAST_ONE_SIDE_MISSING, AT_LEAST_ONE_SIDE_MISSING",
            "exactly-one-side-missing, EXACTLY_ONE_SIDE_MISSING",
            "' strict ', STRICT"
    })
    @DisplayName("Tolerance names are case and separator insensitive")
    void parseTolerance(String value, PostalCodeTolerance expected) {
        assertEquals(expected, FlagEngineProducer.parseTolerance(value));
    }

    @Test
    @DisplayName("An unknown tolerance fails startup")
    void unknownTolerance() {
        assertThrows(ConfigurationException.class, () -> FlagEngineProducer.parseTolerance("lenient"));
    }

    @Test
    @DisplayName("Metrics are no-op unless enabled")
    void metrics() {
        assertSame(NoOpMetricsService.INSTANCE, producer.metricsService());

        producer.metricsEnabled = true;
        assertInstanceOf(MicrometerMetricsService.class, producer.metricsService());
    }

    @Test
    @DisplayName("The engine loads the configured list and is closed on disposal")
    void engine() {
        RelationshipFlagEngine engine = producer.relationshipFlagEngine(
                producer.evaluationOptions(), NoOpMetricsService.INSTANCE);

        assertEquals(5, engine.getBadDomainList().size());
        assertEquals(PostalCodeTolerance.STRICT, engine.getOptions().getPostalCodeTolerance());
        producer.closeEngine(engine);
    }

    @Test
    @DisplayName("A missing list fails engine production")
    void missingList() {
        producer.badDomainsLocation = "classpath:nowhere.csv";

        assertThrows(ConfigurationException.class,
                () -> producer.relationshipFlagEngine(producer.evaluationOptions(), NoOpMetricsService.INSTANCE));
    }
}
