package com.account.relationship.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipFlagsTest {

    private static final ScoredFlag CONSISTENCY = new ScoredFlag(80, "Best match Name vs Website (80)");

    @Test
    @DisplayName("A bad domain carries no other flag")
    void badDomainOnly() {
        RelationshipFlags flags = RelationshipFlags.badDomain(BadDomainFlag.bad("Email domain 'gmail.com'"));

        assertTrue(flags.getBadDomain().bad());
        assertTrue(flags.hasShell().isEmpty());
        assertTrue(flags.getCustomerConsistency().isEmpty());
        assertTrue(flags.getCustomerShellCoherence().isEmpty());
        assertTrue(flags.getAddressConsistency().isEmpty());
        assertEquals(EvaluationStage.TERMINATED, flags.getStage());
        assertTrue(flags.isTerminatedByBadDomain());
    }

    @Test
    @DisplayName("badDomain requires a set flag")
    void badDomainRequiresBad() {
        assertThrows(IllegalArgumentException.class, () -> RelationshipFlags.badDomain(BadDomainFlag.clean()));
    }

    @Test
    @DisplayName("Without a shell only consistency is present")
    void withoutShell() {
        RelationshipFlags flags = RelationshipFlags.withoutShell(BadDomainFlag.clean(), CONSISTENCY);

        assertEquals(false, flags.hasShell().orElseThrow());
        assertEquals(CONSISTENCY, flags.getCustomerConsistency().orElseThrow());
        assertTrue(flags.getCustomerShellCoherence().isEmpty());
        assertTrue(flags.getAddressConsistency().isEmpty());
        assertEquals(EvaluationStage.FLAGS_COMPLETE, flags.getStage());
        assertFalse(flags.isTerminatedByBadDomain());
    }

    @Test
    @DisplayName("With a shell every flag is present")
    void withShell() {
        RelationshipFlags flags = RelationshipFlags.withShell(BadDomainFlag.clean(), CONSISTENCY,
                new ScoredFlag(90, "combined score 90"), AddressConsistencyFlag.noComparableData());

        assertEquals(true, flags.hasShell().orElseThrow());
        assertEquals(90, flags.getCustomerShellCoherence().orElseThrow().score());
        assertFalse(flags.getAddressConsistency().orElseThrow().consistent());
    }

    @Test
    @DisplayName("A bad domain cannot be combined with other flags")
    void badDomainCannotContinue() {
        BadDomainFlag bad = BadDomainFlag.bad("Website domain 'yahoo.com'");

        assertThrows(IllegalArgumentException.class, () -> RelationshipFlags.withoutShell(bad, CONSISTENCY));
        assertThrows(IllegalArgumentException.class, () -> RelationshipFlags.withShell(bad, CONSISTENCY,
                CONSISTENCY, AddressConsistencyFlag.noComparableData()));
    }

    @Test
    @DisplayName("Shell flags are required when a shell exists")
    void shellFlagsRequired() {
        assertThrows(NullPointerException.class, () -> RelationshipFlags.withShell(BadDomainFlag.clean(),
                CONSISTENCY, null, AddressConsistencyFlag.noComparableData()));
    }

    @Nested
    @DisplayName("Flag values")
    class FlagValues {

        @ParameterizedTest
        @CsvSource({"-1", "101"})
        @DisplayName("Scores outside 0-100 are rejected")
        void scoreRange(int score) {
            assertThrows(IllegalArgumentException.class, () -> new ScoredFlag(score, "x"));
        }

        @Test
        @DisplayName("clamped keeps scores in range")
        void clamped() {
            assertEquals(100, ScoredFlag.clamped(130, "x").score());
            assertEquals(0, ScoredFlag.clamped(-4, "x").score());
        }

        @Test
        @DisplayName("Explanations must not be blank")
        void blankExplanation() {
            assertThrows(IllegalArgumentException.class, () -> new ScoredFlag(10, " "));
            assertThrows(IllegalArgumentException.class, () -> new BadDomainFlag(false, ""));
            assertThrows(NullPointerException.class, () -> new AddressConsistencyFlag(true, null, null));
        }

        @Test
        @DisplayName("A clean domain flag explains itself")
        void cleanFlag() {
            assertFalse(BadDomainFlag.clean().bad());
            assertEquals("no bad domain detected", BadDomainFlag.clean().explanation());
        }
    }
}
