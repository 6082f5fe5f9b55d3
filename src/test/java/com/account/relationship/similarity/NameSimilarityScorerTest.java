package com.account.relationship.similarity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class NameSimilarityScorerTest {

    private NameSimilarityScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new NameSimilarityScorer();
    }

    @Nested
    @DisplayName("Names")
    class Names {

        @Test
        @DisplayName("Legal suffixes and case should not matter")
        void suffixesIgnored() {
            SimilarityScore score = scorer.compareNames("Acme Corp", "ACME Corporation");

            assertEquals(100, score.score());
            assertTrue(score.sufficient());
            assertEquals("'acme' vs 'acme'", score.explanation());
        }

        @Test
        @DisplayName("Connectors should not matter")
        void connectors() {
            assertEquals(100, scorer.score("Procter & Gamble", "Procter and Gamble"));
        }

        @Test
        @DisplayName("Extra words on one side should still score high")
        void extraWords() {
            assertEquals(100, scorer.score("Acme West LLC", "Acme Corporation"));
        }

        @Test
        @DisplayName("Unrelated names should score low")
        void unrelated() {
            assertTrue(scorer.score("Globex", "Initech") < 50);
        }

        @ParameterizedTest
        @DisplayName("A name compared with itself scores 100")
        @ValueSource(strings = {"Acme", "North Star Logistics Inc.", "McDonald's"})
        void reflexive(String name) {
            assertEquals(100, scorer.score(name, name));
        }

        @ParameterizedTest
        @DisplayName("Scores should be symmetric")
        @CsvSource({
                "Acme West LLC,Acme Corporation",
                "Globex,Initech",
                "North Star Freight,Star North Logistics",
                "Carlos Reyes,Reyes Carlos Fitness"
        })
        void symmetric(String a, String b) {
            assertEquals(scorer.score(a, b), scorer.score(b, a));
        }

        @Test
        @DisplayName("Missing names are insufficient")
        void missing() {
            SimilarityScore score = scorer.compareNames(null, "Acme");

            assertEquals(0, score.score());
            assertFalse(score.sufficient());
            assertTrue(score.explanation().startsWith("insufficient data"));
            assertEquals(0, scorer.score("  ", "Acme"));
        }

        @Test
        @DisplayName("A name with no letters or digits is insufficient")
        void emptyAfterNormalization() {
            SimilarityScore score = scorer.compareNames("!!!", "Acme");

            assertFalse(score.sufficient());
            assertEquals("insufficient data: a name is empty after normalization", score.explanation());
        }
    }

    @Nested
    @DisplayName("Name vs domain")
    class NameToDomain {

        @Test
        @DisplayName("A concatenated personal name should match its subdomain")
        void concatenatedSubdomain() {
            assertEquals(100, scorer.compareNameToDomain("Carlos Reyes", "carlosreyes.zumba.com").score());
        }

        @Test
        @DisplayName("Domain labels should match in any order")
        void labelOrder() {
            SimilarityScore score = scorer.compareNameToDomain("Acme West LLC", "west.acme.com");

            assertEquals(100, score.score());
            assertEquals("'acme west' vs domain 'west.acme.com'", score.explanation());
        }

        @Test
        @DisplayName("Hyphenated domains should split into tokens")
        void hyphenated() {
            assertEquals(100, scorer.compareNameToDomain("Acme Tools", "acme-tools.com").score());
        }

        @Test
        @DisplayName("An unrelated domain should score low")
        void unrelated() {
            assertTrue(scorer.compareNameToDomain("Globex", "initech.com").score() < 50);
        }

        @Test
        @DisplayName("A bare suffix has no labels to compare")
        void bareSuffix() {
            SimilarityScore score = scorer.compareNameToDomain("Acme", "com");

            assertFalse(score.sufficient());
            assertEquals(0, score.score());
        }
    }

    @Nested
    @DisplayName("Domains")
    class Domains {

        @Test
        @DisplayName("A shared root domain scores 100")
        void sharedRoot() {
            SimilarityScore score = scorer.compareDomains("west.acme.com", "acme.com");

            assertEquals(100, score.score());
            assertEquals("shared root domain 'acme.com'", score.explanation());
        }

        @Test
        @DisplayName("The same name under different suffixes scores 100")
        void differentSuffix() {
            SimilarityScore score = scorer.compareDomains("acme.co.uk", "acme.com");

            assertEquals(100, score.score());
            assertEquals("'acme.co.uk' vs 'acme.com'", score.explanation());
        }

        @Test
        @DisplayName("Unrelated domains score low")
        void unrelated() {
            assertTrue(scorer.compareDomains("acme.com", "globex.com").score() < 50);
        }

        @Test
        @DisplayName("Domain comparison is symmetric")
        void symmetric() {
            assertEquals(scorer.compareDomains("acme-tools.com", "acmetools.io").score(),
                    scorer.compareDomains("acmetools.io", "acme-tools.com").score());
        }

        @Test
        @DisplayName("A missing domain is insufficient")
        void missing() {
            assertFalse(scorer.compareDomains(null, "acme.com").sufficient());
        }
    }
}
