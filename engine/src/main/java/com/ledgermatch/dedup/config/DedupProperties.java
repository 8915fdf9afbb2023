package com.ledgermatch.dedup.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Matching thresholds and candidate-window settings. Documented in application.yml under ledgermatch.dedup.
 */
@ConfigurationProperties(prefix = "ledgermatch.dedup")
@NoArgsConstructor
@Getter
@Setter
public class DedupProperties {

    /** Combined merchant similarity at or above which Tier 1 declares a duplicate. */
    private double tier1Threshold = 0.88;

    /**
     * Looser Jaro-Winkler bar used only when the raw descriptions also share a majority of meaningful tokens.
     */
    private double tokenOverlapMinSimilarity = 0.75;

    /** Symmetric date window in days probed around the incoming record's date. */
    private int dateWindowDays = 2;

    /** Decimal places of the absolute amount in index keys. */
    private int amountScale = 2;

    /** Candidates per incoming record escalated to the semantic verifier. */
    private int maxCandidatesPerRecord = 5;
}
