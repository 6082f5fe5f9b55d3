package com.account.relationship.metrics;

import com.account.relationship.core.model.EvaluationStage;

import java.time.Duration;

/**
 * Discards every measurement.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordEvaluationDuration(EvaluationStage terminalStage, Duration duration) {
    }

    @Override
    public void incrementBadDomainHit() {
    }

    @Override
    public void incrementDegradedFlag(String flag) {
    }

    @Override
    public void recordCustomerConsistencyScore(int score) {
    }

    @Override
    public void recordShellCoherenceScore(int score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
