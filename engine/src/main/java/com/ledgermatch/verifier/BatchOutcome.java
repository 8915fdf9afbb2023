package com.ledgermatch.verifier;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Result of one verifier request: verdicts on success, the cause on failure, or nothing when the batch was
 * never sent because the caller deadline had passed.
 */
@Getter
public class BatchOutcome {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    private final int batchIndex;
    private final Status status;
    private final List<VerificationPair> pairs;
    private final List<VerificationVerdict> verdicts;
    private final RuntimeException error;

    private BatchOutcome(int batchIndex, Status status, List<VerificationPair> pairs,
                         List<VerificationVerdict> verdicts, RuntimeException error) {
        this.batchIndex = batchIndex;
        this.status = status;
        this.pairs = List.copyOf(pairs);
        this.verdicts = List.copyOf(verdicts);
        this.error = error;
    }

    public static BatchOutcome succeeded(int batchIndex, List<VerificationPair> pairs,
                                         List<VerificationVerdict> verdicts) {
        if (verdicts.size() != pairs.size()) {
            throw new IllegalArgumentException("expected " + pairs.size() + " verdicts, got " + verdicts.size());
        }
        return new BatchOutcome(batchIndex, Status.SUCCEEDED, pairs, verdicts, null);
    }

    public static BatchOutcome failed(int batchIndex, List<VerificationPair> pairs, RuntimeException error) {
        return new BatchOutcome(batchIndex, Status.FAILED, pairs, List.of(), error);
    }

    public static BatchOutcome skipped(int batchIndex, List<VerificationPair> pairs) {
        return new BatchOutcome(batchIndex, Status.SKIPPED, pairs, List.of(), null);
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public Optional<RuntimeException> getError() {
        return Optional.ofNullable(error);
    }
}
