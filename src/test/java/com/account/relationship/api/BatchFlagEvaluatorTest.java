package com.account.relationship.api;

import com.account.relationship.config.EvaluationOptions;
import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.core.model.EvaluationStage;
import com.account.relationship.core.model.RelationshipFlags;
import com.account.relationship.metrics.MetricsService;
import com.account.relationship.metrics.NoOpMetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchFlagEvaluatorTest {

    @Mock
    private RelationshipFlagEvaluator mockEvaluator;

    @Mock
    private MetricsService metrics;

    private BatchFlagEvaluator batch;

    @AfterEach
    void tearDown() {
        if (batch != null) {
            batch.close();
        }
    }

    private static AccountRecord record(int n) {
        return AccountRecord.builder()
                .id(String.format("001%012d", n))
                .name("Company " + n)
                .website("company" + n + ".com")
                .email(n % 3 == 0 ? "owner" + n + "@gmail.com" : null)
                .build();
    }

    @Test
    @DisplayName("Results follow the order of the requests")
    void preservesOrder() {
        batch = new BatchFlagEvaluator(RelationshipFlagEvaluatorTest.realEvaluator(NoOpMetricsService.INSTANCE),
                EvaluationOptions.builder().maxConcurrency(4).build(), metrics);
        List<EvaluationRequest> requests = new ArrayList<>();
        for (int i = 1; i <= 50; i++) {
            requests.add(EvaluationRequest.of(record(i)));
        }

        List<EvaluationResult> results = batch.evaluateAll(requests);

        assertEquals(50, results.size());
        for (int i = 0; i < 50; i++) {
            assertEquals(requests.get(i).record().getId(), results.get(i).recordId());
            boolean expectBad = (i + 1) % 3 == 0;
            assertEquals(expectBad, results.get(i).flags().isTerminatedByBadDomain());
        }
        verify(metrics).recordBatchSize(50);
    }

    @Test
    @DisplayName("An empty batch returns an empty list")
    void emptyBatch() {
        batch = new BatchFlagEvaluator(mockEvaluator, EvaluationOptions.defaults());

        assertTrue(batch.evaluateAll(List.of()).isEmpty());
        verifyNoInteractions(mockEvaluator);
    }

    @Test
    @DisplayName("A failing record degrades without failing the batch")
    void failingRecordDegrades() {
        AccountRecord ok = record(1);
        AccountRecord broken = AccountRecord.builder()
                .id("001000000000002")
                .parentId("001000000000009")
                .build();
        RelationshipFlags okFlags = RelationshipFlagEvaluatorTest.realEvaluator(NoOpMetricsService.INSTANCE)
                .evaluate(ok, null);
        when(mockEvaluator.evaluate(any(EvaluationRequest.class))).thenAnswer(invocation -> {
            EvaluationRequest request = invocation.getArgument(0);
            if (request.record() == broken) {
                throw new IllegalStateException("corrupt record");
            }
            return new EvaluationResult(request.record(), null, okFlags);
        });
        batch = new BatchFlagEvaluator(mockEvaluator, EvaluationOptions.defaults(), metrics);

        List<EvaluationResult> results = batch.evaluateAll(
                List.of(EvaluationRequest.of(ok), EvaluationRequest.of(broken)));

        assertSame(okFlags, results.get(0).flags());
        RelationshipFlags degraded = results.get(1).flags();
        assertEquals(EvaluationStage.FLAGS_COMPLETE, degraded.getStage());
        assertEquals("evaluation failed: corrupt record", degraded.getBadDomain().explanation());
        assertEquals(true, degraded.hasShell().orElseThrow());
        assertEquals(0, degraded.getCustomerShellCoherence().orElseThrow().score());
        verify(metrics).incrementDegradedFlag("evaluation");
    }

    @Test
    @DisplayName("An expired deadline fails the batch")
    void timeout() {
        when(mockEvaluator.evaluate(any(EvaluationRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(1000);
            return null;
        });
        batch = new BatchFlagEvaluator(mockEvaluator,
                EvaluationOptions.builder().maxConcurrency(1).batchTimeout(Duration.ofMillis(100)).build());

        BatchEvaluationException e = assertThrows(BatchEvaluationException.class,
                () -> batch.evaluateAll(List.of(EvaluationRequest.of(record(1)))));

        assertInstanceOf(TimeoutException.class, e.getCause());
    }

    @Test
    @DisplayName("The async variant completes with ordered results")
    void async() throws Exception {
        batch = new BatchFlagEvaluator(RelationshipFlagEvaluatorTest.realEvaluator(NoOpMetricsService.INSTANCE),
                EvaluationOptions.builder().maxConcurrency(2).build());

        List<EvaluationResult> results = batch.evaluateAllAsync(
                List.of(EvaluationRequest.of(record(1)), EvaluationRequest.of(record(2))))
                .get(10, TimeUnit.SECONDS);

        assertEquals("001000000000001", results.get(0).recordId());
        assertEquals("001000000000002", results.get(1).recordId());
    }

    @Test
    @DisplayName("The async variant times out")
    void asyncTimeout() {
        when(mockEvaluator.evaluate(any(EvaluationRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(1000);
            return null;
        });
        batch = new BatchFlagEvaluator(mockEvaluator,
                EvaluationOptions.builder().maxConcurrency(1).batchTimeout(Duration.ofMillis(100)).build());

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> batch.evaluateAllAsync(List.of(EvaluationRequest.of(record(1)))).get(10, TimeUnit.SECONDS));

        assertInstanceOf(TimeoutException.class, e.getCause());
    }
}
