package com.ledgermatch.dedup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.ledgermatch.verifier.BatchOutcome;
import com.ledgermatch.verifier.VerificationPair;
import com.ledgermatch.verifier.VerificationVerdict;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Verdicts of one run, keyed by the verified pair. Unbounded: a verdict must stay until the run has
 * resolved its records, and the cache is dropped with the run.
 */
final class VerdictCache {

    private final Cache<VerificationPair, VerificationVerdict> cache;

    private VerdictCache(int expectedPairs) {
        this.cache = Caffeine.newBuilder()
                .initialCapacity(Math.max(16, expectedPairs))
                .recordStats()
                .build();
    }

    static VerdictCache forPairs(List<VerificationPair> pairs) {
        return new VerdictCache(pairs.size());
    }

    /**
     * Distinct pairs without a verdict yet, in first-seen order.
     */
    List<VerificationPair> missing(List<VerificationPair> pairs) {
        Set<VerificationPair> distinct = new LinkedHashSet<>();
        for (VerificationPair pair : pairs) {
            if (cache.getIfPresent(pair) == null) {
                distinct.add(pair);
            }
        }
        return new ArrayList<>(distinct);
    }

    void putAll(List<BatchOutcome> outcomes) {
        for (BatchOutcome outcome : outcomes) {
            if (!outcome.isSucceeded()) {
                continue;
            }
            for (int i = 0; i < outcome.getPairs().size(); i++) {
                cache.put(outcome.getPairs().get(i), outcome.getVerdicts().get(i));
            }
        }
    }

    Optional<VerificationVerdict> get(VerificationPair pair) {
        return Optional.ofNullable(cache.getIfPresent(pair));
    }

    CacheStats stats() {
        return cache.stats();
    }
}
