package com.ledgermatch.domain;

import java.util.List;

/**
 * Output shared by the deterministic-only and full pipeline entry points.
 * {@code results} holds one entry per incoming record, in input order.
 */
public record DedupResult(
        List<TransactionRecord> unique,
        List<DuplicateMatch> duplicates,
        List<MatchResult> results,
        RunStatistics statistics
) {

    public DedupResult {
        unique = List.copyOf(unique);
        duplicates = List.copyOf(duplicates);
        results = List.copyOf(results);
    }
}
