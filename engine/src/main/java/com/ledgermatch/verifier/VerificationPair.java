package com.ledgermatch.verifier;

import com.ledgermatch.domain.UncertainPair;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * What the semantic verifier sees of one uncertain pair. Equal pairs within a run are verified once.
 *
 * @param amount absolute amount at two decimals, or null when unknown
 */
public record VerificationPair(
        String incomingDescription,
        String candidateDescription,
        BigDecimal amount,
        LocalDate date
) {

    public static VerificationPair of(UncertainPair pair) {
        BigDecimal amount = pair.incoming().getAmount();
        return new VerificationPair(
                pair.incoming().descriptionOrEmpty(),
                pair.candidate().descriptionOrEmpty(),
                amount == null ? null : amount.abs().setScale(2, RoundingMode.HALF_UP),
                pair.incoming().getDate());
    }
}
