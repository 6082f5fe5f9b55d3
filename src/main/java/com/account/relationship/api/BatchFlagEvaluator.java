package com.account.relationship.api;

import com.account.relationship.config.EvaluationOptions;
import com.account.relationship.core.model.RelationshipFlags;
import com.account.relationship.logging.LogContext;
import com.account.relationship.metrics.MetricsService;
import com.account.relationship.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates many records concurrently on a fixed-size worker pool.
 *
 * <p>Each record is evaluated independently. Results are collected from the per-record futures
 * in submission order, so the output list lines up with the input list. A record whose
 * evaluation throws yields {@link RelationshipFlagEvaluator#failedEvaluation degraded flags}
 * rather than failing the batch; only the batch deadline fails the whole call.</p>
 */
public class BatchFlagEvaluator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchFlagEvaluator.class);

    private final RelationshipFlagEvaluator evaluator;
    private final EvaluationOptions options;
    private final MetricsService metricsService;
    private final ExecutorService executor;

    public BatchFlagEvaluator(RelationshipFlagEvaluator evaluator, EvaluationOptions options) {
        this(evaluator, options, NoOpMetricsService.INSTANCE);
    }

    public BatchFlagEvaluator(RelationshipFlagEvaluator evaluator, EvaluationOptions options,
                              MetricsService metricsService) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.executor = Executors.newFixedThreadPool(options.getMaxConcurrency(), new WorkerThreadFactory());
    }

    /**
     * Evaluates all requests and waits for the results, bounded by the configured batch timeout.
     *
     * @throws BatchEvaluationException if the deadline expires or the calling thread is interrupted
     */
    public List<EvaluationResult> evaluateAll(List<EvaluationRequest> requests) {
        String batchId = LogContext.generateCorrelationId();
        try (LogContext ignored = LogContext.forBatch(batchId)) {
            long timeoutMs = options.getBatchTimeout().toMillis();
            log.info("batch.started batchId={} size={} maxConcurrency={}",
                    batchId, requests.size(), options.getMaxConcurrency());
            List<CompletableFuture<EvaluationResult>> futures = submitEach(batchId, requests);
            CompletableFuture<List<EvaluationResult>> batch = collect(futures);
            try {
                List<EvaluationResult> results = batch.get(timeoutMs, TimeUnit.MILLISECONDS);
                log.info("batch.completed batchId={} size={}", batchId, results.size());
                return results;
            } catch (TimeoutException e) {
                futures.forEach(f -> f.cancel(true));
                log.warn("batch.timeout batchId={} timeoutMs={}", batchId, timeoutMs);
                throw new BatchEvaluationException(
                        "Batch of " + requests.size() + " records did not complete within " + timeoutMs + " ms", e);
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new BatchEvaluationException("Batch evaluation interrupted", e);
            } catch (ExecutionException e) {
                throw new BatchEvaluationException("Batch evaluation failed", e.getCause());
            }
        }
    }

    /**
     * Asynchronous variant of {@link #evaluateAll}. The returned future completes exceptionally
     * with a {@link java.util.concurrent.TimeoutException} when the batch timeout expires.
     */
    public CompletableFuture<List<EvaluationResult>> evaluateAllAsync(List<EvaluationRequest> requests) {
        String batchId = LogContext.generateCorrelationId();
        return collect(submitEach(batchId, requests))
                .orTimeout(options.getBatchTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private List<CompletableFuture<EvaluationResult>> submitEach(String batchId, List<EvaluationRequest> requests) {
        Objects.requireNonNull(requests, "requests is required");
        metricsService.recordBatchSize(requests.size());
        return requests.stream()
                .map(request -> CompletableFuture.supplyAsync(() -> evaluateSafely(batchId, request), executor))
                .toList();
    }

    private static CompletableFuture<List<EvaluationResult>> collect(List<CompletableFuture<EvaluationResult>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    private EvaluationResult evaluateSafely(String batchId, EvaluationRequest request) {
        try (LogContext ignored = LogContext.forBatch(batchId)) {
            try {
                return evaluator.evaluate(request);
            } catch (RuntimeException e) {
                log.warn("batch.record-failed batchId={} recordId={} error={}",
                        batchId, request.record().getId(), e.getMessage(), e);
                metricsService.incrementDegradedFlag("evaluation");
                RelationshipFlags degraded = RelationshipFlagEvaluator.failedEvaluation(request.record(), e);
                return new EvaluationResult(request.record(), request.parent(), degraded);
            }
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "flag-evaluator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
