package com.ledgermatch.domain;

/**
 * Per-incoming-record decision. {@code matched} is null for UNIQUE.
 * Unique confidence tells how sure the engine is that the record is new: 1.0 when no
 * candidate shared its date window and amount, lower when candidates existed but no tier accepted one.
 */
public record MatchResult(
        TransactionRecord incoming,
        MatchOutcome outcome,
        TransactionRecord matched,
        double confidence,
        MatchTier tier
) {

    public static final double UNIQUE_NO_CANDIDATES = 1.0;
    public static final double UNIQUE_DETERMINISTIC_ONLY = 0.7;
    public static final double UNIQUE_AFTER_VERIFIER = 0.6;

    public static MatchResult duplicate(TransactionRecord incoming, TransactionRecord matched,
                                        double confidence, MatchTier tier) {
        return new MatchResult(incoming, MatchOutcome.DUPLICATE, matched, clamp(confidence), tier);
    }

    public static MatchResult unique(TransactionRecord incoming, double confidence) {
        return new MatchResult(incoming, MatchOutcome.UNIQUE, null, clamp(confidence), MatchTier.NONE);
    }

    public boolean isDuplicate() {
        return outcome == MatchOutcome.DUPLICATE;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
