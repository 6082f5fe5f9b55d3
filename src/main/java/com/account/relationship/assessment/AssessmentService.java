package com.account.relationship.assessment;

import com.account.relationship.api.EvaluationRequest;
import com.account.relationship.api.EvaluationResult;
import com.account.relationship.api.RelationshipFlagEngine;
import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.logging.LogContext;
import com.account.relationship.source.ParentResolver;
import com.account.relationship.source.RecordIds;
import com.account.relationship.source.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the full assessment flow for a list of requested ids: validate the ids, fetch the records
 * in one batch, resolve their parents, evaluate the flags, build the payloads and, for records
 * that passed the bad-domain gate, ask the {@link ConfidenceScorer} for a verdict.
 */
public class AssessmentService {
    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    private final RecordSource recordSource;
    private final ParentResolver parentResolver;
    private final RelationshipFlagEngine engine;
    private final ConfidenceScorer scorer;
    private final String idPrefix;

    public AssessmentService(RecordSource recordSource, RelationshipFlagEngine engine, ConfidenceScorer scorer) {
        this(recordSource, engine, scorer, engine.getOptions().getRecordIdPrefix());
    }

    public AssessmentService(RecordSource recordSource, RelationshipFlagEngine engine,
                             ConfidenceScorer scorer, String idPrefix) {
        this.recordSource = Objects.requireNonNull(recordSource, "recordSource is required");
        this.parentResolver = new ParentResolver(recordSource);
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.idPrefix = Objects.requireNonNull(idPrefix, "idPrefix is required");
    }

    public AssessmentBatchResult assess(List<String> requestedIds) {
        Objects.requireNonNull(requestedIds, "requestedIds is required");
        try (LogContext ignored = LogContext.forAssessment(LogContext.generateCorrelationId())) {
            List<AssessmentBatchResult.InvalidId> invalid = new ArrayList<>();
            Set<String> validIds = new LinkedHashSet<>();
            for (String id : requestedIds) {
                if (RecordIds.isValid(id, idPrefix)) {
                    validIds.add(RecordIds.to18(id));
                } else {
                    invalid.add(new AssessmentBatchResult.InvalidId(id, RecordIds.invalidReason(id, idPrefix)));
                }
            }

            Map<String, AccountRecord> found = validIds.isEmpty() ? Map.of() : recordSource.findAllById(validIds);
            List<AccountRecord> records = new ArrayList<>();
            List<String> notFound = new ArrayList<>();
            for (String id : validIds) {
                AccountRecord record = found.get(id);
                if (record != null) {
                    records.add(record);
                } else {
                    notFound.add(id);
                }
            }
            log.info("assessment.started requested={} valid={} invalid={} notFound={}",
                    requestedIds.size(), validIds.size(), invalid.size(), notFound.size());

            List<EvaluationRequest> requests = parentResolver.resolveAll(records);
            List<EvaluationResult> results = engine.evaluateBatch(requests);

            List<RecordAssessment> assessments = new ArrayList<>(results.size());
            for (EvaluationResult result : results) {
                AssessmentPayload payload = AssessmentPayloadBuilder.from(result);
                ConfidenceAssessment confidence = result.flags().isTerminatedByBadDomain() ? null : score(payload);
                assessments.add(new RecordAssessment(result, payload, confidence));
            }

            log.info("assessment.completed assessed={} scorer={}", assessments.size(), scorer.getProviderName());
            return new AssessmentBatchResult(assessments, invalid, notFound);
        }
    }

    private ConfidenceAssessment score(AssessmentPayload payload) {
        if (!scorer.isAvailable()) {
            return ConfidenceAssessment.unavailable(
                    "AI scoring unavailable - " + scorer.getProviderName() + " scorer is not available");
        }
        try {
            return scorer.score(payload);
        } catch (RuntimeException e) {
            log.warn("assessment.scorer-failed recordId={} scorer={} error={}",
                    payload.getRecordId(), scorer.getProviderName(), e.getMessage(), e);
            return ConfidenceAssessment.failed("Error calling confidence scorer: " + e.getMessage(), null);
        }
    }
}
