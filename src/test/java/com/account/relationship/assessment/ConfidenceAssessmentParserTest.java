package com.account.relationship.assessment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceAssessmentParserTest {

    private final ConfidenceAssessmentParser parser = new ConfidenceAssessmentParser();

    @Nested
    @DisplayName("Usable replies")
    class Usable {

        @Test
        @DisplayName("Strict JSON is parsed")
        void strictJson() {
            String reply = "{\"confidence_score\": 85, \"explanation_bullets\": [\"Names match\", \"Shared domain\"]}";

            ConfidenceAssessment assessment = parser.parse(reply);

            assertTrue(assessment.success());
            assertEquals(85, assessment.confidenceScore());
            assertEquals(List.of("Names match", "Shared domain"), assessment.explanationBullets());
            assertNull(assessment.error());
            assertEquals(reply, assessment.rawResponse());
        }

        @Test
        @DisplayName("JSON inside a code fence is recovered")
        void fenced() {
            String reply = "```json\n{\"confidence_score\": 40, \"explanation_bullets\": [\"Weak link\"]}\n```";

            ConfidenceAssessment assessment = parser.parse(reply);

            assertTrue(assessment.success());
            assertEquals(40, assessment.confidenceScore());
        }

        @Test
        @DisplayName("JSON wrapped in prose is recovered, braces in strings included")
        void prose() {
            String reply = "Here is my assessment: {\"confidence_score\": 70, "
                    + "\"explanation_bullets\": [\"Website {acme} matches\"]} Hope this helps.";

            ConfidenceAssessment assessment = parser.parse(reply);

            assertTrue(assessment.success());
            assertEquals(List.of("Website {acme} matches"), assessment.explanationBullets());
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "150 | 100",
                "-20 | 0",
                "72.6 | 73",
                "'\"64\"' | 64"
        })
        @DisplayName("Scores are rounded and clamped")
        void clamping(String raw, int expected) {
            ConfidenceAssessment assessment = parser.parse(
                    "{\"confidence_score\": " + raw + ", \"explanation_bullets\": []}");

            assertTrue(assessment.success());
            assertEquals(expected, assessment.confidenceScore());
        }

        @Test
        @DisplayName("Blank bullets are dropped")
        void blankBullets() {
            ConfidenceAssessment assessment = parser.parse(
                    "{\"confidence_score\": 50, \"explanation_bullets\": [\" \", \"Kept \"]}");

            assertEquals(List.of("Kept"), assessment.explanationBullets());
        }
    }

    @Nested
    @DisplayName("Unusable replies")
    class Unusable {

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Empty replies fail")
        void empty(String reply) {
            ConfidenceAssessment assessment = parser.parse(reply);

            assertFalse(assessment.success());
            assertEquals("Empty response from confidence scorer", assessment.error());
            assertEquals(0, assessment.confidenceScore());
        }

        @Test
        @DisplayName("Text without JSON fails")
        void noJson() {
            ConfidenceAssessment assessment = parser.parse("I cannot assess this record.");

            assertFalse(assessment.success());
            assertEquals("Failed to parse scorer response as JSON", assessment.error());
            assertTrue(assessment.explanationBullets().get(0).endsWith("Failed to parse scorer response as JSON"));
        }

        @Test
        @DisplayName("A JSON array fails")
        void notAnObject() {
            assertFalse(parser.parse("[1, 2, 3]").success());
        }

        @Test
        @DisplayName("A missing score fails")
        void missingScore() {
            ConfidenceAssessment assessment = parser.parse("{\"explanation_bullets\": [\"x\"]}");

            assertFalse(assessment.success());
            assertEquals("Scorer response has no confidence_score", assessment.error());
        }

        @Test
        @DisplayName("A non-numeric score fails")
        void nonNumericScore() {
            ConfidenceAssessment assessment = parser.parse(
                    "{\"confidence_score\": \"high\", \"explanation_bullets\": []}");

            assertFalse(assessment.success());
            assertEquals("confidence_score is not a number: high", assessment.error());
        }

        @Test
        @DisplayName("Missing bullets fail")
        void missingBullets() {
            ConfidenceAssessment assessment = parser.parse("{\"confidence_score\": 50}");

            assertFalse(assessment.success());
            assertEquals("Scorer response has no explanation_bullets array", assessment.error());
        }
    }

    @Test
    @DisplayName("The first balanced object is extracted")
    void firstJsonObject() {
        assertEquals("{\"a\": {\"b\": 1}}", ConfidenceAssessmentParser.firstJsonObject("x {\"a\": {\"b\": 1}} y {}").orElseThrow());
        assertTrue(ConfidenceAssessmentParser.firstJsonObject("no braces").isEmpty());
        assertTrue(ConfidenceAssessmentParser.firstJsonObject("{ unbalanced").isEmpty());
    }

    @Test
    @DisplayName("Assessment scores must be in range")
    void scoreRange() {
        assertThrows(IllegalArgumentException.class, () -> ConfidenceAssessment.of(101, List.of(), null));
    }
}
