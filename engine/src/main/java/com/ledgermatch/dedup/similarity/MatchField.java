package com.ledgermatch.dedup.similarity;

/**
 * Which pair of fields produced a similarity score.
 */
public enum MatchField {
    /** incoming description vs known description */
    DESCRIPTION,
    /** incoming merchant label vs known description */
    INCOMING_LABEL,
    /** incoming description vs known merchant label */
    KNOWN_LABEL
}
