package com.ledgermatch.dedup;

import com.ledgermatch.dedup.index.CandidateIndex;
import com.ledgermatch.domain.DedupResult;
import com.ledgermatch.domain.DuplicateMatch;
import com.ledgermatch.domain.MatchResult;
import com.ledgermatch.domain.MatchTier;
import com.ledgermatch.domain.RunStatistics;
import com.ledgermatch.domain.TransactionRecord;
import com.ledgermatch.verifier.BatchOutcome;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of a single run: the candidate index, one result slot per incoming record and counters.
 * Confined to the thread executing the run.
 */
final class DedupRun {

    @Getter
    private final CandidateIndex index;
    private final MatchResult[] results;
    private final long startNanos = System.nanoTime();

    private int uncertainPairs;
    private int verifierBatches;
    private int failedVerifierBatches;
    private int skippedVerifierBatches;
    private boolean degraded;

    DedupRun(CandidateIndex index, int incomingCount) {
        this.index = index;
        this.results = new MatchResult[incomingCount];
    }

    void set(int position, MatchResult result) {
        results[position] = result;
    }

    void addUncertainPairs(int count) {
        uncertainPairs += count;
    }

    void markDegraded() {
        degraded = true;
    }

    void recordBatches(List<BatchOutcome> outcomes) {
        for (BatchOutcome outcome : outcomes) {
            switch (outcome.getStatus()) {
                case SUCCEEDED -> verifierBatches++;
                case FAILED -> {
                    verifierBatches++;
                    failedVerifierBatches++;
                    degraded = true;
                }
                case SKIPPED -> {
                    skippedVerifierBatches++;
                    degraded = true;
                }
            }
        }
    }

    DedupResult finish() {
        List<TransactionRecord> unique = new ArrayList<>();
        List<DuplicateMatch> duplicates = new ArrayList<>();
        List<MatchResult> ordered = new ArrayList<>(results.length);
        int tier1 = 0;
        int tier2 = 0;
        for (MatchResult result : results) {
            if (result == null) {
                throw new IllegalStateException("Run finished with an unclassified record");
            }
            ordered.add(result);
            if (result.isDuplicate()) {
                duplicates.add(DuplicateMatch.from(result));
                if (result.tier() == MatchTier.SEMANTIC) {
                    tier2++;
                } else {
                    tier1++;
                }
            } else {
                unique.add(result.incoming());
            }
        }
        RunStatistics statistics = RunStatistics.builder()
                .total(results.length)
                .unique(unique.size())
                .duplicates(duplicates.size())
                .tier1Matches(tier1)
                .tier2Matches(tier2)
                .uncertainPairs(uncertainPairs)
                .verifierBatches(verifierBatches)
                .failedVerifierBatches(failedVerifierBatches)
                .skippedVerifierBatches(skippedVerifierBatches)
                .degraded(degraded)
                .elapsedMs(elapsedMs())
                .build();
        return new DedupResult(unique, duplicates, ordered, statistics);
    }

    long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
