package com.ledgermatch.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Counters for one dedup run. For a finished run tier1Matches + tier2Matches == duplicates and
 * unique + duplicates == total. A Tier-1 analysis leaves records with uncertain pairs out of both
 * unique and duplicates.
 */
@Getter
@Builder
@ToString
public class RunStatistics {

    private final int total;
    private final int unique;
    private final int duplicates;
    private final int tier1Matches;
    private final int tier2Matches;
    /** Pairs queued for (or submitted to) the semantic verifier. */
    private final int uncertainPairs;
    private final int verifierBatches;
    private final int failedVerifierBatches;
    /** Batches not issued because the caller deadline passed. */
    private final int skippedVerifierBatches;
    /** True when Tier 2 had work but was unavailable, disabled, failed or cut short. */
    private final boolean degraded;
    private final long elapsedMs;
}
