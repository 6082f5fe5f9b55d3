package com.account.relationship.api;

import com.account.relationship.coherence.AddressConsistencyCalculator;
import com.account.relationship.coherence.CustomerConsistencyCalculator;
import com.account.relationship.coherence.ShellCoherenceCalculator;
import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.core.model.AddressConsistencyFlag;
import com.account.relationship.core.model.BadDomainFlag;
import com.account.relationship.core.model.EvaluationStage;
import com.account.relationship.core.model.RelationshipFlags;
import com.account.relationship.core.model.ScoredFlag;
import com.account.relationship.domain.BadDomainClassifier;
import com.account.relationship.logging.LogContext;
import com.account.relationship.metrics.MetricsService;
import com.account.relationship.metrics.NoOpMetricsService;
import com.account.relationship.source.RecordIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Computes the {@link RelationshipFlags} of a single record.
 *
 * <p>Flags are computed in a fixed order: bad domain, has shell, customer consistency, then
 * (only with a shell) shell coherence and address consistency. A bad domain stops evaluation.
 * A failing sub-computation never aborts the evaluation; its flag is replaced by a zero score
 * or an inconsistent address whose explanation describes the failure.</p>
 *
 * <p>Instances are stateless and may be shared across threads.</p>
 */
public class RelationshipFlagEvaluator {
    private static final Logger log = LoggerFactory.getLogger(RelationshipFlagEvaluator.class);

    static final String UNRESOLVED_PARENT = "parent record could not be resolved";

    private final BadDomainClassifier badDomainClassifier;
    private final CustomerConsistencyCalculator consistencyCalculator;
    private final ShellCoherenceCalculator coherenceCalculator;
    private final AddressConsistencyCalculator addressCalculator;
    private final MetricsService metricsService;

    public RelationshipFlagEvaluator(BadDomainClassifier badDomainClassifier,
                                     CustomerConsistencyCalculator consistencyCalculator,
                                     ShellCoherenceCalculator coherenceCalculator,
                                     AddressConsistencyCalculator addressCalculator) {
        this(badDomainClassifier, consistencyCalculator, coherenceCalculator, addressCalculator,
                NoOpMetricsService.INSTANCE);
    }

    public RelationshipFlagEvaluator(BadDomainClassifier badDomainClassifier,
                                     CustomerConsistencyCalculator consistencyCalculator,
                                     ShellCoherenceCalculator coherenceCalculator,
                                     AddressConsistencyCalculator addressCalculator,
                                     MetricsService metricsService) {
        this.badDomainClassifier = Objects.requireNonNull(badDomainClassifier, "badDomainClassifier is required");
        this.consistencyCalculator = Objects.requireNonNull(consistencyCalculator, "consistencyCalculator is required");
        this.coherenceCalculator = Objects.requireNonNull(coherenceCalculator, "coherenceCalculator is required");
        this.addressCalculator = Objects.requireNonNull(addressCalculator, "addressCalculator is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    public EvaluationResult evaluate(EvaluationRequest request) {
        Objects.requireNonNull(request, "request is required");
        return new EvaluationResult(request.record(), request.parent(),
                evaluate(request.record(), request.parent()));
    }

    /**
     * Evaluates a record against its resolved parent.
     *
     * @param record the record to evaluate
     * @param parent the resolved parent, or {@code null} when there is none or it could not be resolved
     */
    public RelationshipFlags evaluate(AccountRecord record, AccountRecord parent) {
        Objects.requireNonNull(record, "record is required");
        long start = System.nanoTime();

        try (LogContext ignored = LogContext.forEvaluation(record.getId())) {
            EvaluationStage stage = EvaluationStage.PENDING;

            BadDomainFlag badDomain = checkBadDomain(record);
            stage = advance(stage, EvaluationStage.BAD_DOMAIN_CHECKED);

            RelationshipFlags flags;
            if (badDomain.bad()) {
                stage = advance(stage, EvaluationStage.TERMINATED);
                metricsService.incrementBadDomainHit();
                log.info("flags.terminated recordId={} reason=\"{}\"", record.getId(), badDomain.explanation());
                flags = RelationshipFlags.badDomain(badDomain);
            } else {
                boolean shell = hasShell(record);
                stage = advance(stage, EvaluationStage.SHELL_CHECKED);

                ScoredFlag consistency = guarded("customer_consistency",
                        () -> consistencyCalculator.calculate(record),
                        ScoredFlag::zero);
                metricsService.recordCustomerConsistencyScore(consistency.score());

                if (!shell) {
                    flags = RelationshipFlags.withoutShell(badDomain, consistency);
                } else if (parent == null) {
                    log.warn("flags.parent-unresolved recordId={} parentId={}", record.getId(), record.getParentId());
                    metricsService.incrementDegradedFlag("customer_shell_coherence");
                    metricsService.incrementDegradedFlag("address_consistency");
                    flags = RelationshipFlags.withShell(badDomain, consistency,
                            ScoredFlag.zero(UNRESOLVED_PARENT),
                            AddressConsistencyFlag.failed(UNRESOLVED_PARENT));
                } else {
                    ScoredFlag coherence = guarded("customer_shell_coherence",
                            () -> coherenceCalculator.calculate(record, parent),
                            ScoredFlag::zero);
                    metricsService.recordShellCoherenceScore(coherence.score());
                    AddressConsistencyFlag address = guarded("address_consistency",
                            () -> addressCalculator.calculate(record, parent),
                            AddressConsistencyFlag::failed);
                    flags = RelationshipFlags.withShell(badDomain, consistency, coherence, address);
                }
                stage = advance(stage, EvaluationStage.FLAGS_COMPLETE);
            }

            metricsService.recordEvaluationDuration(stage, Duration.ofNanos(System.nanoTime() - start));
            log.debug("flags.evaluated recordId={} stage={} hasShell={}",
                    record.getId(), stage, flags.hasShell().orElse(null));
            return flags;
        }
    }

    /**
     * True when the record links to a parent other than itself. A 15-character id and its
     * 18-character form denote the same record.
     */
    public static boolean hasShell(AccountRecord record) {
        String parentId = record.getParentId();
        if (parentId == null || parentId.isBlank()) {
            return false;
        }
        return !RecordIds.sameRecord(record.getId(), parentId);
    }

    /**
     * Flags for a record whose evaluation failed outright. Every flag that would have been
     * computed for the record is present and explains the failure.
     */
    public static RelationshipFlags failedEvaluation(AccountRecord record, Throwable cause) {
        String explanation = "evaluation failed: " + describe(cause);
        BadDomainFlag badDomain = new BadDomainFlag(false, explanation);
        ScoredFlag consistency = ScoredFlag.zero(explanation);
        if (!hasShell(record)) {
            return RelationshipFlags.withoutShell(badDomain, consistency);
        }
        return RelationshipFlags.withShell(badDomain, consistency,
                ScoredFlag.zero(explanation), AddressConsistencyFlag.failed(explanation));
    }

    private BadDomainFlag checkBadDomain(AccountRecord record) {
        try {
            return badDomainClassifier.classify(record);
        } catch (RuntimeException e) {
            log.warn("flags.degraded recordId={} flag=bad_domain error={}", record.getId(), describe(e), e);
            metricsService.incrementDegradedFlag("bad_domain");
            return new BadDomainFlag(false, "bad domain check failed: " + describe(e));
        }
    }

    private <T> T guarded(String flag, Supplier<T> computation, Function<String, T> fallback) {
        try {
            return computation.get();
        } catch (RuntimeException e) {
            log.warn("flags.degraded flag={} error={}", flag, describe(e), e);
            metricsService.incrementDegradedFlag(flag);
            return fallback.apply(flag.replace('_', ' ') + " computation failed: " + describe(e));
        }
    }

    private static EvaluationStage advance(EvaluationStage current, EvaluationStage next) {
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal evaluation transition " + current + " -> " + next);
        }
        return next;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
