package com.account.relationship.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationStageTest {

    @ParameterizedTest(name = "{0} -> {1}: {2}")
    @CsvSource({
            "PENDING, BAD_DOMAIN_CHECKED, true",
            "PENDING, SHELL_CHECKED, false",
            "BAD_DOMAIN_CHECKED, TERMINATED, true",
            "BAD_DOMAIN_CHECKED, SHELL_CHECKED, true",
            "BAD_DOMAIN_CHECKED, FLAGS_COMPLETE, false",
            "SHELL_CHECKED, FLAGS_COMPLETE, true",
            "SHELL_CHECKED, TERMINATED, false",
            "TERMINATED, SHELL_CHECKED, false",
            "FLAGS_COMPLETE, PENDING, false"
    })
    @DisplayName("Only the lifecycle transitions are allowed")
    void transitions(EvaluationStage from, EvaluationStage to, boolean allowed) {
        assertEquals(allowed, from.canTransitionTo(to));
    }

    @Test
    @DisplayName("TERMINATED and FLAGS_COMPLETE are terminal")
    void terminal() {
        assertTrue(EvaluationStage.TERMINATED.isTerminal());
        assertTrue(EvaluationStage.FLAGS_COMPLETE.isTerminal());
        assertFalse(EvaluationStage.PENDING.isTerminal());
        assertFalse(EvaluationStage.BAD_DOMAIN_CHECKED.isTerminal());
        assertFalse(EvaluationStage.SHELL_CHECKED.isTerminal());
    }

    @Test
    @DisplayName("No stage transitions to itself")
    void noSelfTransition() {
        for (EvaluationStage stage : EvaluationStage.values()) {
            assertFalse(stage.canTransitionTo(stage), stage.name());
        }
    }
}
