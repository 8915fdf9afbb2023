package com.ledgermatch.verifier;

import java.util.List;

/**
 * Stand-in when no verifier is configured. The pipeline checks {@link #isAvailable()} and never calls verify.
 */
public class DisabledSemanticVerifier implements SemanticVerifier {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public int maxPairsPerRequest() {
        return 1;
    }

    @Override
    public List<VerificationVerdict> verify(List<VerificationPair> pairs) {
        throw new VerifierException("Semantic verifier is not configured");
    }
}
