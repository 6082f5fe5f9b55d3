package com.account.relationship.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-record evaluation lifecycle.
 *
 * <pre>
 * PENDING -> BAD_DOMAIN_CHECKED -> TERMINATED
 *                               -> SHELL_CHECKED -> FLAGS_COMPLETE
 * </pre>
 */
public enum EvaluationStage {
    PENDING,
    BAD_DOMAIN_CHECKED,
    TERMINATED,
    SHELL_CHECKED,
    FLAGS_COMPLETE;

    public boolean canTransitionTo(EvaluationStage next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == TERMINATED || this == FLAGS_COMPLETE;
    }

    private Set<EvaluationStage> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(BAD_DOMAIN_CHECKED);
            case BAD_DOMAIN_CHECKED -> EnumSet.of(TERMINATED, SHELL_CHECKED);
            case SHELL_CHECKED -> EnumSet.of(FLAGS_COMPLETE);
            case TERMINATED, FLAGS_COMPLETE -> EnumSet.noneOf(EvaluationStage.class);
        };
    }
}
