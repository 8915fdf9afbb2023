package com.ledgermatch.dedup.similarity;

import com.ledgermatch.dedup.normalize.MerchantNormalizer;
import com.ledgermatch.domain.TransactionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityScorerTest {

    private final SimilarityScorer scorer = new SimilarityScorer(new MerchantNormalizer());

    @Test
    @DisplayName("equal strings score 1, one empty side scores 0")
    void bounds() {
        assertThat(scorer.combined("TARGET", "target")).isEqualTo(1.0);
        assertThat(scorer.combined("TARGET", "")).isZero();
        assertThat(scorer.combined(null, "TARGET")).isZero();
    }

    @Test
    @DisplayName("short merchant contained in a longer one scores as strong containment")
    void containmentWins() {
        assertThat(scorer.combined("CHIPOTLE", "CHIPOTLE MEXICAN GRILL"))
                .isCloseTo(SimilarityScorer.STRONG_CONTAINMENT_SCORE, within(1e-9));
    }

    @Test
    @DisplayName("containment of short tokens is scaled by length ratio")
    void weakContainment() {
        assertThat(SimilarityScorer.containment("abcd", "abcdef")).isCloseTo(0.9, within(1e-9));
        assertThat(SimilarityScorer.containment("abc", "abcdef")).isZero();
        assertThat(SimilarityScorer.containment("shell", "target")).isZero();
    }

    @Test
    @DisplayName("word overlap is divided by the larger word count")
    void wordOverlap() {
        assertThat(SimilarityScorer.wordOverlap("blue bottle", "blue bottle coffee oakland"))
                .isCloseTo(0.5, within(1e-9));
        assertThat(SimilarityScorer.wordOverlap("blue bottle coffee oakland", "blue bottle"))
                .isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("word overlap counts each side against the other and keeps the lower count")
    void wordOverlapBothDirections() {
        assertThat(SimilarityScorer.wordOverlap("qqqq aaaa aaab", "aaaa qqqq zzzz"))
                .isCloseTo(2.0 / 3, within(1e-9));
        assertThat(SimilarityScorer.wordOverlap("aaaa qqqq zzzz", "qqqq aaaa aaab"))
                .isCloseTo(2.0 / 3, within(1e-9));
        assertThat(scorer.combined("qqqq aaaa aaab", "aaaa qqqq zzzz"))
                .isEqualTo(scorer.combined("aaaa qqqq zzzz", "qqqq aaaa aaab"))
                .isLessThan(0.88);
    }

    @Test
    @DisplayName("distinct merchants score low")
    void distinctMerchants() {
        assertThat(scorer.combined("STARBUCKS", "DUNKIN DONUTS")).isLessThan(0.75);
    }

    @Test
    @DisplayName("merchant label on the incoming side can carry the best score")
    void incomingLabelScored() {
        TransactionRecord incoming = record("XYZ PAYMENT 5566", "Target");
        TransactionRecord known = record("TARGET 00012345", null);

        FieldScore best = scorer.bestAcrossFields(incoming, known);

        assertThat(best.score()).isEqualTo(1.0);
        assertThat(best.field()).isEqualTo(MatchField.INCOMING_LABEL);
    }

    @Test
    @DisplayName("field pairs list description first and only existing labels")
    void fieldPairs() {
        TransactionRecord incoming = record("AplPay CHIPOTLE 1249GAINESVILLE VA", null);
        TransactionRecord known = record("CHIPOTLE 1249", "Chipotle Mexican Grill");

        assertThat(scorer.fieldPairs(incoming, known))
                .extracting(SimilarityScorer.FieldPair::field)
                .containsExactly(MatchField.DESCRIPTION, MatchField.KNOWN_LABEL);
        assertThat(scorer.fieldPairs(incoming, known).get(1).knownMerchant()).isEqualTo("CHIPOTLE MEXICAN GRILL");
    }

    private static TransactionRecord record(String description, String merchantName) {
        return TransactionRecord.builder()
                .description(description)
                .merchantName(merchantName)
                .amount(new BigDecimal("-12.50"))
                .date(LocalDate.of(2025, 1, 10))
                .build();
    }
}
