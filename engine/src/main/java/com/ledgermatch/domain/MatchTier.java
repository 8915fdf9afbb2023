package com.ledgermatch.domain;

/**
 * Pipeline stage that decided a record.
 */
public enum MatchTier {
    /** Tier 1: merchant normalization + string similarity, in process. */
    DETERMINISTIC,
    /** Tier 2: external semantic verifier. */
    SEMANTIC,
    /** No match; record is unique. */
    NONE
}
