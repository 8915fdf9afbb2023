package com.ledgermatch.domain;

/**
 * Incoming record and one candidate that Tier 1 could not confirm; input for the semantic verifier.
 */
public record UncertainPair(
        TransactionRecord incoming,
        TransactionRecord candidate,
        double tier1Score
) {
}
