package com.account.relationship.metrics;

import com.account.relationship.core.model.EvaluationStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code relationship.evaluation.duration}: Timer (tag: stage)</li>
 *   <li>{@code relationship.bad_domain}: Counter</li>
 *   <li>{@code relationship.flag.degraded}: Counter (tag: flag)</li>
 *   <li>{@code relationship.customer_consistency.score}: DistributionSummary</li>
 *   <li>{@code relationship.shell_coherence.score}: DistributionSummary</li>
 *   <li>{@code relationship.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<EvaluationStage, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary consistencySummary;
    private final DistributionSummary coherenceSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter badDomainCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.consistencySummary = DistributionSummary.builder("relationship.customer_consistency.score")
                .description("Distribution of customer consistency scores")
                .register(registry);
        this.coherenceSummary = DistributionSummary.builder("relationship.shell_coherence.score")
                .description("Distribution of customer-to-shell coherence scores")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("relationship.batch.size")
                .description("Number of records per batch evaluation")
                .register(registry);
        this.badDomainCounter = Counter.builder("relationship.bad_domain")
                .description("Records stopped by the bad-domain gate")
                .register(registry);
    }

    @Override
    public void recordEvaluationDuration(EvaluationStage terminalStage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(terminalStage, stage ->
                Timer.builder("relationship.evaluation.duration")
                        .description("Duration of single-record flag evaluation")
                        .tag("stage", stage.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementBadDomainHit() {
        badDomainCounter.increment();
    }

    @Override
    public void incrementDegradedFlag(String flag) {
        counter("degraded:" + flag, "relationship.flag.degraded", "flag", flag,
                "Flags replaced by a degraded value after a failure").increment();
    }

    @Override
    public void recordCustomerConsistencyScore(int score) {
        consistencySummary.record(score);
    }

    @Override
    public void recordShellCoherenceScore(int score) {
        coherenceSummary.record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    private Counter counter(String key, String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
