package com.account.relationship.coherence;

import com.account.relationship.core.model.AccountRecord;
import com.account.relationship.core.model.ScoredFlag;
import com.account.relationship.domain.DomainNormalizer;
import com.account.relationship.similarity.NameSimilarityScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CustomerConsistencyCalculatorTest {

    private CustomerConsistencyCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new CustomerConsistencyCalculator(new NameSimilarityScorer(), new DomainNormalizer());
    }

    @Test
    @DisplayName("No website on either field scores zero")
    void noWebsite() {
        AccountRecord record = AccountRecord.builder().id("001A").name("Acme Corp").build();

        ScoredFlag flag = calculator.calculate(record);

        assertEquals(0, flag.score());
        assertEquals(CustomerConsistencyCalculator.NO_WEBSITE_EXPLANATION, flag.explanation());
    }

    @Test
    @DisplayName("Matching name and website score 100")
    void matchingWebsite() {
        AccountRecord record = AccountRecord.builder()
                .id("001A")
                .name("Acme Corp")
                .website("https://www.acme.com/about")
                .build();

        ScoredFlag flag = calculator.calculate(record);

        assertEquals(100, flag.score());
        assertTrue(flag.explanation().startsWith("Best match Name vs Website (100)"));
    }

    @Test
    @DisplayName("The best of the candidate pairs wins")
    void bestPairWins() {
        AccountRecord record = AccountRecord.builder()
                .id("001A")
                .name("Globex")
                .website("initech.com")
                .enrichmentWebsite("globex.io")
                .build();

        ScoredFlag flag = calculator.calculate(record);

        assertEquals(100, flag.score());
        assertTrue(flag.explanation().startsWith("Best match Name vs Enrichment Website (100)"));
        assertTrue(flag.explanation().contains("also compared Name vs Website ("));
    }

    @Test
    @DisplayName("The enrichment company name is used when the name is missing")
    void enrichmentName() {
        AccountRecord record = AccountRecord.builder()
                .id("001A")
                .enrichmentCompanyName("Acme Tools Inc")
                .website("acme-tools.com")
                .build();

        ScoredFlag flag = calculator.calculate(record);

        assertEquals(100, flag.score());
        assertTrue(flag.explanation().contains("Enrichment Company Name vs Website"));
    }

    @Test
    @DisplayName("A website with no name to compare is insufficient")
    void noName() {
        AccountRecord record = AccountRecord.builder().id("001A").website("acme.com").build();

        ScoredFlag flag = calculator.calculate(record);

        assertEquals(0, flag.score());
        assertTrue(flag.explanation().startsWith("insufficient data"));
    }

    @Test
    @DisplayName("An unparseable website is insufficient")
    void unparseableWebsite() {
        AccountRecord record = AccountRecord.builder().id("001A").name("Acme").website("not a url").build();

        ScoredFlag flag = calculator.calculate(record);

        assertEquals(0, flag.score());
        assertEquals("Name vs Website: insufficient data: could not extract a domain from 'not a url'",
                flag.explanation());
    }
}
