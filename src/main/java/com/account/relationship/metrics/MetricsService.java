package com.account.relationship.metrics;

import com.account.relationship.core.model.EvaluationStage;

import java.time.Duration;

/**
 * Records flag-evaluation metrics. {@link NoOpMetricsService} is the default, so the engine
 * runs without a metrics backend.
 */
public interface MetricsService {

    void recordEvaluationDuration(EvaluationStage terminalStage, Duration duration);

    void incrementBadDomainHit();

    /**
     * A flag was replaced by a degraded value after its computation failed.
     */
    void incrementDegradedFlag(String flag);

    void recordCustomerConsistencyScore(int score);

    void recordShellCoherenceScore(int score);

    void recordBatchSize(int size);
}
