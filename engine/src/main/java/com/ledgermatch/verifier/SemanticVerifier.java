package com.ledgermatch.verifier;

import java.util.List;

/**
 * External semantic comparison of transaction descriptions (Tier 2).
 * Implementations are called with at most {@link #maxPairsPerRequest()} pairs per call.
 */
public interface SemanticVerifier {

    /**
     * Capability check, not a health check: false when the verifier is not configured or switched off.
     */
    boolean isAvailable();

    /**
     * Largest number of pairs one {@link #verify} call accepts.
     */
    int maxPairsPerRequest();

    /**
     * Verify pairs in one request.
     *
     * @return one verdict per pair, same order
     * @throws VerifierException on transport or response errors
     */
    List<VerificationVerdict> verify(List<VerificationPair> pairs);
}
