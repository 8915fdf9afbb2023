package com.ledgermatch.dedup.similarity;

import com.ledgermatch.dedup.normalize.MerchantNormalizer;
import com.ledgermatch.domain.TransactionRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Merchant similarity in [0, 1]: the best of Jaro-Winkler, containment and fuzzy word overlap.
 * Inputs are expected to be normalized merchant tokens.
 */
@Component
@RequiredArgsConstructor
public class SimilarityScorer {

    static final double STRONG_CONTAINMENT_SCORE = 0.92;
    private static final int MIN_CONTAINMENT_LENGTH = 4;
    private static final int STRONG_CONTAINMENT_LENGTH = 5;
    private static final int MIN_WORD_LENGTH = 3;
    private static final double WORD_MATCH_THRESHOLD = 0.85;
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final MerchantNormalizer merchantNormalizer;

    /**
     * Combined score of two merchant strings.
     */
    public double combined(String s1, String s2) {
        String a = s1 == null ? "" : s1.strip().toLowerCase(Locale.ROOT);
        String b = s2 == null ? "" : s2.strip().toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        double best = Math.max(JaroWinkler.similarity(a, b), containment(a, b));
        best = Math.max(best, wordOverlap(a, b));
        return Math.min(1.0, best);
    }

    /**
     * Best combined score over description/description, incoming label/known description and
     * incoming description/known label. Labels are normalized the same way descriptions are.
     */
    public FieldScore bestAcrossFields(TransactionRecord incoming, TransactionRecord known) {
        FieldScore best = FieldScore.none();
        for (FieldPair pair : fieldPairs(incoming, known)) {
            double score = combined(pair.incomingMerchant(), pair.knownMerchant());
            if (score > best.score()) {
                best = new FieldScore(score, pair.field());
            }
        }
        return best;
    }

    /**
     * Field combinations that exist for this pair, description/description first.
     * Raw texts are kept alongside the normalized merchants for token-overlap checks.
     */
    public List<FieldPair> fieldPairs(TransactionRecord incoming, TransactionRecord known) {
        String incomingMerchant = merchantNormalizer.normalize(incoming.getDescription());
        String knownMerchant = merchantNormalizer.normalize(known.getDescription());
        List<FieldPair> pairs = new ArrayList<>(3);
        pairs.add(new FieldPair(MatchField.DESCRIPTION,
                incoming.descriptionOrEmpty(), known.descriptionOrEmpty(), incomingMerchant, knownMerchant));
        if (incoming.hasMerchantName()) {
            pairs.add(new FieldPair(MatchField.INCOMING_LABEL,
                    incoming.getMerchantName(), known.descriptionOrEmpty(),
                    merchantNormalizer.normalize(incoming.getMerchantName()), knownMerchant));
        }
        if (known.hasMerchantName()) {
            pairs.add(new FieldPair(MatchField.KNOWN_LABEL,
                    incoming.descriptionOrEmpty(), known.getMerchantName(),
                    incomingMerchant, merchantNormalizer.normalize(known.getMerchantName())));
        }
        return pairs;
    }

    static double containment(String a, String b) {
        String norm1 = NON_ALNUM.matcher(a).replaceAll("");
        String norm2 = NON_ALNUM.matcher(b).replaceAll("");
        if (norm1.length() < MIN_CONTAINMENT_LENGTH || norm2.length() < MIN_CONTAINMENT_LENGTH) {
            return 0.0;
        }
        if (!norm1.contains(norm2) && !norm2.contains(norm1)) {
            return 0.0;
        }
        int shorter = Math.min(norm1.length(), norm2.length());
        if (shorter >= STRONG_CONTAINMENT_LENGTH) {
            return STRONG_CONTAINMENT_SCORE;
        }
        double ratio = (double) shorter / Math.max(norm1.length(), norm2.length());
        return 0.7 + ratio * 0.3;
    }

    /**
     * Share of words with a fuzzy counterpart on the other side, over the larger word count. Counted in
     * both directions and the lower count kept, which keeps the score symmetric.
     */
    static double wordOverlap(String a, String b) {
        List<String> words1 = words(a);
        List<String> words2 = words(b);
        if (words1.isEmpty() || words2.isEmpty()) {
            return 0.0;
        }
        int matching = Math.min(wordsWithCounterpart(words1, words2), wordsWithCounterpart(words2, words1));
        return (double) matching / Math.max(words1.size(), words2.size());
    }

    private static int wordsWithCounterpart(List<String> from, List<String> to) {
        int matching = 0;
        for (String w1 : from) {
            for (String w2 : to) {
                if (JaroWinkler.similarity(w1, w2) >= WORD_MATCH_THRESHOLD) {
                    matching++;
                    break;
                }
            }
        }
        return matching;
    }

    private static List<String> words(String s) {
        List<String> out = new ArrayList<>();
        for (String w : WHITESPACE.split(s)) {
            if (w.length() >= MIN_WORD_LENGTH) {
                out.add(w);
            }
        }
        return out;
    }

    /**
     * One field combination of an (incoming, known) pair.
     */
    public record FieldPair(MatchField field, String incomingRaw, String knownRaw,
                            String incomingMerchant, String knownMerchant) {
    }
}
