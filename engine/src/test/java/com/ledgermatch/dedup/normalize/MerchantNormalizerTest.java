package com.ledgermatch.dedup.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MerchantNormalizerTest {

    private final MerchantNormalizer normalizer = new MerchantNormalizer();

    @ParameterizedTest
    @CsvSource({
            "'AplPay CHIPOTLE 1249GAINESVILLE VA', CHIPOTLE",
            "'Chipotle Mexican Grill', CHIPOTLE MEXICAN GRILL",
            "'SQ *COFFEESHOP', COFFEESHOP",
            "'TST* ROCKWOOD GAINESVILLE', ROCKWOOD GAINESVILLE",
            "'PAYPAL *SPOTIFY', SPOTIFY",
            "'Amazon.com', AMAZON",
            "'COSTCO WHSE #1234', COSTCO WHSE",
            "'STARBUCKS CARD XXXX1234', STARBUCKS",
            "'ACME CORP', ACME",
            "'one two three four five', ONE TWO THREE FOUR"
    })
    @DisplayName("strips processor, location and reference noise")
    void normalizesDescriptions(String raw, String expected) {
        assertThat(normalizer.normalize(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("prefixes and suffixes only match whole words")
    void wholeWordAffixes() {
        assertThat(normalizer.normalize("POSTMATES")).isEqualTo("POSTMATES");
        assertThat(normalizer.normalize("COSTCO")).isEqualTo("COSTCO");
        assertThat(normalizer.normalize("ACHILLES BOOTS")).isEqualTo("ACHILLES BOOTS");
    }

    @Test
    @DisplayName("never strips a description down to nothing")
    void neverEmpty() {
        assertThat(normalizer.normalize("POS")).isEqualTo("POS");
        assertThat(normalizer.normalize("12345")).isEqualTo("12345");
    }

    @Test
    @DisplayName("null and blank input give empty string")
    void nullAndBlank() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("   ")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "AplPay CHIPOTLE 1249GAINESVILLE VA",
            "RAISING CANES 0724 MANASSAS VA",
            "DD *DOORDASH BURRITOBARN",
            "UBER *EATS PENDING",
            "NETFLIX.COM 866-579-7172 CA",
            "WALMART SUPERCENTER STORE 1234 BENTONVILLE AR 72712",
            "Online Payment - Thank You",
            "ACH DEBIT CITY OF AUSTIN UTIL WEB",
            "Trader Joe's #552"
    })
    @DisplayName("normalizing a normalized value is a no-op")
    void idempotent(String raw) {
        String once = normalizer.normalize(raw);
        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("meaningful tokens skip stop words and short words")
    void meaningfulTokens() {
        assertThat(normalizer.meaningfulTokens("The Coffee Shop")).containsExactly("coffee", "shop");
        assertThat(normalizer.meaningfulTokens("Trader Joe's #552")).containsExactly("trader", "joes");
        assertThat(normalizer.meaningfulTokens(null)).isEmpty();
    }

    @Test
    @DisplayName("token overlap counts exact and contained tokens")
    void significantOverlap() {
        assertThat(normalizer.hasSignificantTokenOverlap("McDonald's 1234", "MCDONALDS")).isTrue();
        assertThat(normalizer.hasSignificantTokenOverlap("BLUE BOTTLE COFFEE OAKLAND", "Blue Bottle Cafe")).isTrue();
        assertThat(normalizer.hasSignificantTokenOverlap("STARBUCKS", "DUNKIN DONUTS")).isFalse();
        assertThat(normalizer.hasSignificantTokenOverlap("", "DUNKIN DONUTS")).isFalse();
    }
}
