package com.ledgermatch.dedup;

import com.ledgermatch.config.AsyncConfig;
import com.ledgermatch.dedup.config.DedupProperties;
import com.ledgermatch.dedup.index.CandidateIndex;
import com.ledgermatch.dedup.matcher.Tier1Matcher;
import com.ledgermatch.dedup.matcher.Tier1Matcher.MatchedCandidate;
import com.ledgermatch.domain.DedupResult;
import com.ledgermatch.domain.DuplicateMatch;
import com.ledgermatch.domain.MatchResult;
import com.ledgermatch.domain.MatchTier;
import com.ledgermatch.domain.RunStatistics;
import com.ledgermatch.domain.Tier1Analysis;
import com.ledgermatch.domain.TransactionRecord;
import com.ledgermatch.domain.UncertainPair;
import com.ledgermatch.verifier.BatchOutcome;
import com.ledgermatch.verifier.VerificationPair;
import com.ledgermatch.verifier.VerificationVerdict;
import com.ledgermatch.verifier.VerifierBatchExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry points of the dedup engine. Every run indexes the known set, runs Tier 1 per incoming record and,
 * in the full pipeline, sends the records Tier 1 could not settle to the semantic verifier in batches.
 * A Tier-1 match is never revisited by Tier 2.
 * <p>
 * Runs share no mutable state; the index and verdict cache belong to the run.
 */
@Service
@Slf4j
public class DedupOrchestrator {

    private final Tier1Matcher tier1Matcher;
    private final VerifierBatchExecutor verifierBatchExecutor;
    private final DedupProperties dedupProperties;
    private final Executor dedupExecutor;

    public DedupOrchestrator(Tier1Matcher tier1Matcher,
                             VerifierBatchExecutor verifierBatchExecutor,
                             DedupProperties dedupProperties,
                             @Qualifier(AsyncConfig.DEDUP_EXECUTOR) Executor dedupExecutor) {
        this.tier1Matcher = tier1Matcher;
        this.verifierBatchExecutor = verifierBatchExecutor;
        this.dedupProperties = dedupProperties;
        this.dedupExecutor = dedupExecutor;
    }

    /**
     * Tier 1 only, on the calling thread. Records with candidates but no Tier-1 match are unique
     * with the reduced {@link MatchResult#UNIQUE_DETERMINISTIC_ONLY} confidence.
     */
    public DedupResult findDuplicatesDeterministic(Collection<TransactionRecord> incoming,
                                                   Collection<TransactionRecord> known) {
        return run(incoming, known, DedupOptions.deterministicOnly());
    }

    /**
     * Full pipeline on the dedup executor. Verifier failures never fail the future; they leave the affected
     * records unique and set {@link RunStatistics#isDegraded()}.
     */
    public CompletableFuture<DedupResult> findDuplicates(Collection<TransactionRecord> incoming,
                                                         Collection<TransactionRecord> known,
                                                         DedupOptions options) {
        DedupOptions effective = options == null ? DedupOptions.defaults() : options;
        return CompletableFuture.supplyAsync(() -> run(incoming, known, effective), dedupExecutor);
    }

    /**
     * Tier 1 without verification, for callers that verify the uncertain pairs elsewhere
     * (see {@link #resolveUncertainPairs}).
     */
    public Tier1Analysis analyzeTier1(Collection<TransactionRecord> incoming, Collection<TransactionRecord> known) {
        long start = System.nanoTime();
        List<TransactionRecord> records = nonNull(incoming);
        CandidateIndex index = buildIndex(known);

        List<DuplicateMatch> definite = new ArrayList<>();
        List<UncertainPair> uncertain = new ArrayList<>();
        List<TransactionRecord> unique = new ArrayList<>();
        for (TransactionRecord record : records) {
            List<TransactionRecord> candidates = index.lookup(record);
            if (candidates.isEmpty()) {
                unique.add(record);
                continue;
            }
            Optional<MatchedCandidate> match = tier1Matcher.findFirstMatch(record, candidates);
            if (match.isPresent()) {
                definite.add(DuplicateMatch.from(tier1Result(record, match.get())));
            } else {
                uncertain.addAll(uncertainPairs(record, candidates));
            }
        }
        RunStatistics statistics = RunStatistics.builder()
                .total(records.size())
                .unique(unique.size())
                .duplicates(definite.size())
                .tier1Matches(definite.size())
                .uncertainPairs(uncertain.size())
                .elapsedMs((System.nanoTime() - start) / 1_000_000)
                .build();
        log.info("Tier-1 analysis: {} incoming, {} definite, {} uncertain pairs, {} without candidates",
                records.size(), definite.size(), uncertain.size(), unique.size());
        return new Tier1Analysis(definite, uncertain, unique, statistics);
    }

    /**
     * Verifies pairs produced by {@link #analyzeTier1} and decides each incoming record they mention: the
     * first accepted pair of a record makes it a duplicate. Pairs are grouped by incoming record (identity)
     * in first-seen order and capped per record like the full pipeline.
     */
    public DedupResult resolveUncertainPairs(Collection<UncertainPair> pairs, DedupOptions options) {
        DedupOptions effective = options == null ? DedupOptions.defaults() : options;
        int cap = Math.max(1, dedupProperties.getMaxCandidatesPerRecord());
        Map<TransactionRecord, List<UncertainPair>> byIncoming = new IdentityHashMap<>();
        List<TransactionRecord> order = new ArrayList<>();
        for (UncertainPair pair : nonNull(pairs)) {
            if (pair.incoming() == null || pair.candidate() == null) {
                continue;
            }
            List<UncertainPair> forRecord = byIncoming.computeIfAbsent(pair.incoming(), r -> {
                order.add(r);
                return new ArrayList<>();
            });
            if (forRecord.size() < cap) {
                forRecord.add(pair);
            }
        }
        // pairs arrive already matched; no index
        DedupRun run = new DedupRun(null, order.size());
        Map<Integer, List<UncertainPair>> pending = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            pending.put(i, byIncoming.get(order.get(i)));
        }
        settlePending(run, pending, effective);
        DedupResult result = run.finish();
        logSummary("Uncertain-pair resolution", result.statistics());
        return result;
    }

    private DedupResult run(Collection<TransactionRecord> incoming, Collection<TransactionRecord> known,
                            DedupOptions options) {
        List<TransactionRecord> records = nonNull(incoming);
        DedupRun run = new DedupRun(buildIndex(known), records.size());
        boolean escalate = options.useVerifier() && verifierBatchExecutor.isVerifierAvailable();
        if (options.useVerifier() && !escalate) {
            log.debug("Semantic verifier unavailable; running Tier 1 only");
        }

        Map<Integer, List<UncertainPair>> pending = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            TransactionRecord record = records.get(i);
            List<TransactionRecord> candidates = run.getIndex().lookup(record);
            if (candidates.isEmpty()) {
                run.set(i, MatchResult.unique(record, MatchResult.UNIQUE_NO_CANDIDATES));
            } else {
                Optional<MatchedCandidate> match = tier1Matcher.findFirstMatch(record, candidates);
                if (match.isPresent()) {
                    run.set(i, tier1Result(record, match.get()));
                    log.debug("Tier-1 duplicate: {} -> {}", record, match.get().candidate());
                } else if (escalate) {
                    pending.put(i, uncertainPairs(record, candidates));
                } else {
                    run.set(i, MatchResult.unique(record, MatchResult.UNIQUE_DETERMINISTIC_ONLY));
                    run.markDegraded();
                }
            }
            options.reportProgress(i + 1, records.size());
        }

        if (!pending.isEmpty()) {
            settlePending(run, pending, options);
        }
        DedupResult result = run.finish();
        logSummary(escalate ? "Dedup run" : "Deterministic dedup run", result.statistics());
        return result;
    }

    /**
     * Tier 2 for records keyed by result position. Without a usable verifier every record becomes unique with
     * the reduced confidence marker.
     */
    private void settlePending(DedupRun run, Map<Integer, List<UncertainPair>> pending, DedupOptions options) {
        int pairCount = pending.values().stream().mapToInt(List::size).sum();
        run.addUncertainPairs(pairCount);
        if (!options.useVerifier() || !verifierBatchExecutor.isVerifierAvailable()) {
            pending.forEach((position, pairs) -> run.set(position,
                    MatchResult.unique(pairs.get(0).incoming(), MatchResult.UNIQUE_DETERMINISTIC_ONLY)));
            if (!pending.isEmpty()) {
                run.markDegraded();
            }
            return;
        }

        List<VerificationPair> queue = new ArrayList<>(pairCount);
        pending.values().forEach(pairs -> pairs.forEach(p -> queue.add(VerificationPair.of(p))));
        VerdictCache verdicts = VerdictCache.forPairs(queue);
        List<VerificationPair> toSubmit = verdicts.missing(queue);
        log.debug("Submitting {} distinct pairs ({} queued) for {} records", toSubmit.size(), queue.size(),
                pending.size());

        List<BatchOutcome> outcomes = verifierBatchExecutor.execute(toSubmit, options.deadline());
        run.recordBatches(outcomes);
        verdicts.putAll(outcomes);

        pending.forEach((position, pairs) -> run.set(position, decide(pairs, verdicts)));
        log.debug("Verdict cache: {}", verdicts.stats());
    }

    /**
     * Walks a record's pairs in submission order: accepted wins, rejected moves on, a pair without a verdict
     * (failed or skipped batch) ends the walk.
     */
    private static MatchResult decide(List<UncertainPair> pairs, VerdictCache verdicts) {
        TransactionRecord incoming = pairs.get(0).incoming();
        for (UncertainPair pair : pairs) {
            Optional<VerificationVerdict> verdict = verdicts.get(VerificationPair.of(pair));
            if (verdict.isEmpty()) {
                break;
            }
            if (verdict.get().isAccepted()) {
                double confidence = verdict.get().matchConfidence().orElse(0.0);
                log.debug("Tier-2 duplicate: {} -> {} ({})", incoming, pair.candidate(), verdict.get().confidence());
                return MatchResult.duplicate(incoming, pair.candidate(), confidence, MatchTier.SEMANTIC);
            }
        }
        return MatchResult.unique(incoming, MatchResult.UNIQUE_AFTER_VERIFIER);
    }

    private List<UncertainPair> uncertainPairs(TransactionRecord record, List<TransactionRecord> candidates) {
        return candidates.stream()
                .limit(Math.max(1, dedupProperties.getMaxCandidatesPerRecord()))
                .map(c -> new UncertainPair(record, c, tier1Matcher.match(record, c).score()))
                .toList();
    }

    private static MatchResult tier1Result(TransactionRecord record, MatchedCandidate match) {
        return MatchResult.duplicate(record, match.candidate(), match.match().score(), MatchTier.DETERMINISTIC);
    }

    private CandidateIndex buildIndex(Collection<TransactionRecord> known) {
        return CandidateIndex.build(nonNull(known), dedupProperties.getDateWindowDays(),
                dedupProperties.getAmountScale());
    }

    private static <T> List<T> nonNull(Collection<T> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream().filter(Objects::nonNull).toList();
    }

    private static void logSummary(String label, RunStatistics s) {
        log.info("{}: {} records, {} unique, {} duplicates (tier1={}, tier2={}), {} uncertain pairs, "
                        + "{} verifier batches ({} failed, {} skipped), degraded={}, {} ms",
                label, s.getTotal(), s.getUnique(), s.getDuplicates(), s.getTier1Matches(), s.getTier2Matches(),
                s.getUncertainPairs(), s.getVerifierBatches(), s.getFailedVerifierBatches(),
                s.getSkippedVerifierBatches(), s.isDegraded(), s.getElapsedMs());
    }
}
