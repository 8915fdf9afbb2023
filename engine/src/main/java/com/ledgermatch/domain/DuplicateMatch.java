package com.ledgermatch.domain;

/**
 * An incoming record recognised as a copy of a known record.
 */
public record DuplicateMatch(
        TransactionRecord incoming,
        TransactionRecord matchedKnown,
        double confidence,
        MatchTier tier
) {

    public static DuplicateMatch from(MatchResult result) {
        return new DuplicateMatch(result.incoming(), result.matched(), result.confidence(), result.tier());
    }
}
