package com.ledgermatch.domain;

import java.util.List;

/**
 * Tier-1-only view of a batch for split client/server flows: definite matches, pairs that need
 * semantic verification, and records with no candidate at all.
 */
public record Tier1Analysis(
        List<DuplicateMatch> definiteMatches,
        List<UncertainPair> uncertainPairs,
        List<TransactionRecord> unique,
        RunStatistics statistics
) {

    public Tier1Analysis {
        definiteMatches = List.copyOf(definiteMatches);
        uncertainPairs = List.copyOf(uncertainPairs);
        unique = List.copyOf(unique);
    }
}
