package com.ledgermatch.dedup.similarity;

/**
 * Best cross-field similarity and the field combination it came from.
 */
public record FieldScore(double score, MatchField field) {

    public static FieldScore none() {
        return new FieldScore(0.0, MatchField.DESCRIPTION);
    }
}
