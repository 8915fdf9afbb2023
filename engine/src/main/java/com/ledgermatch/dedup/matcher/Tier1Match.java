package com.ledgermatch.dedup.matcher;

import com.ledgermatch.dedup.similarity.MatchField;

/**
 * Tier-1 verdict for one (incoming, candidate) pair. {@code score} is the best similarity seen even when
 * there is no match.
 */
public record Tier1Match(boolean isMatch, double score, MatchField field) {

    public static Tier1Match noMatch(double score, MatchField field) {
        return new Tier1Match(false, score, field);
    }
}
