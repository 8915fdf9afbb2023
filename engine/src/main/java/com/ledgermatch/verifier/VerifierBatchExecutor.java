package com.ledgermatch.verifier;

import com.ledgermatch.common.Batches;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Submits pairs to the {@link SemanticVerifier} in sequential batches of at most
 * {@link SemanticVerifier#maxPairsPerRequest()} pairs. A failing batch is logged and recorded; the next batch
 * still runs. The deadline is checked before each batch, never during one.
 */
@Component
@Slf4j
public class VerifierBatchExecutor {

    private final SemanticVerifier verifier;
    private final Clock clock;

    @Autowired
    public VerifierBatchExecutor(SemanticVerifier verifier) {
        this(verifier, Clock.systemUTC());
    }

    VerifierBatchExecutor(SemanticVerifier verifier, Clock clock) {
        this.verifier = verifier;
        this.clock = clock;
    }

    public boolean isVerifierAvailable() {
        return verifier.isAvailable();
    }

    /**
     * @param pairs    pairs in submission order
     * @param deadline no batch is started at or after this instant; null for no deadline
     * @return one outcome per batch, in submission order
     */
    public List<BatchOutcome> execute(List<VerificationPair> pairs, Instant deadline) {
        if (pairs == null || pairs.isEmpty()) {
            return List.of();
        }
        List<List<VerificationPair>> batches = Batches.chunk(pairs, verifier.maxPairsPerRequest());
        List<BatchOutcome> outcomes = new ArrayList<>(batches.size());
        for (int i = 0; i < batches.size(); i++) {
            List<VerificationPair> batch = batches.get(i);
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                log.info("Deadline {} reached; skipping verifier batch {}/{} ({} pairs)",
                        deadline, i + 1, batches.size(), batch.size());
                outcomes.add(BatchOutcome.skipped(i, batch));
                continue;
            }
            outcomes.add(runBatch(i, batches.size(), batch));
        }
        return outcomes;
    }

    private BatchOutcome runBatch(int index, int total, List<VerificationPair> batch) {
        try {
            List<VerificationVerdict> verdicts = verifier.verify(batch);
            if (verdicts == null || verdicts.size() != batch.size()) {
                throw new VerifierException("Expected " + batch.size() + " verdicts, got "
                        + (verdicts == null ? "none" : verdicts.size()));
            }
            log.debug("Verifier batch {}/{} done ({} pairs)", index + 1, total, batch.size());
            return BatchOutcome.succeeded(index, batch, verdicts);
        } catch (RuntimeException e) {
            log.warn("Verifier batch {}/{} failed ({} pairs): {}", index + 1, total, batch.size(), e.getMessage());
            return BatchOutcome.failed(index, batch, e);
        }
    }
}
