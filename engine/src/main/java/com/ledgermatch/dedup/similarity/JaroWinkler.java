package com.ledgermatch.dedup.similarity;

import org.apache.commons.text.similarity.JaroWinklerSimilarity;

import java.util.Locale;

/**
 * Jaro-Winkler similarity in [0, 1]. Case-insensitive, surrounding whitespace ignored, symmetric.
 * Rewards a shared prefix (up to 4 characters), which suits truncated merchant names.
 */
public final class JaroWinkler {

    private static final JaroWinklerSimilarity SIMILARITY = new JaroWinklerSimilarity();

    private JaroWinkler() {
    }

    public static double similarity(String s1, String s2) {
        String a = s1 == null ? "" : s1.strip().toLowerCase(Locale.ROOT);
        String b = s2 == null ? "" : s2.strip().toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        // matching of equal-length inputs depends on argument order
        return a.compareTo(b) <= 0 ? SIMILARITY.apply(a, b) : SIMILARITY.apply(b, a);
    }
}
