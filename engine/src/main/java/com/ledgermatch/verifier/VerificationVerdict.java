package com.ledgermatch.verifier;

import com.ledgermatch.domain.VerifierConfidence;

import java.util.OptionalDouble;

/**
 * Verifier answer for one pair. Accepted only when same merchant with MEDIUM or HIGH confidence.
 */
public record VerificationVerdict(boolean sameMerchant, VerifierConfidence confidence) {

    private static final VerificationVerdict REJECTED = new VerificationVerdict(false, VerifierConfidence.LOW);

    public VerificationVerdict {
        if (confidence == null) {
            confidence = VerifierConfidence.LOW;
        }
    }

    public static VerificationVerdict rejected() {
        return REJECTED;
    }

    public boolean isAccepted() {
        return sameMerchant && confidence != VerifierConfidence.LOW;
    }

    /**
     * Match confidence for an accepted verdict (HIGH 0.95, MEDIUM 0.85); empty otherwise.
     */
    public OptionalDouble matchConfidence() {
        return isAccepted() ? confidence.score() : OptionalDouble.empty();
    }
}
