package com.ledgermatch.domain;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Categorical confidence reported by the semantic verifier.
 * LOW is never accepted as a match.
 */
public enum VerifierConfidence {
    HIGH(0.95),
    MEDIUM(0.85),
    LOW(Double.NaN);

    private final double score;

    VerifierConfidence(double score) {
        this.score = score;
    }

    /**
     * Numeric confidence for an accepted verdict; empty for LOW.
     */
    public OptionalDouble score() {
        return this == LOW ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    /**
     * Lenient parse of "high" / "medium" / "low"; anything else is LOW.
     */
    public static VerifierConfidence parse(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOW;
        }
    }
}
