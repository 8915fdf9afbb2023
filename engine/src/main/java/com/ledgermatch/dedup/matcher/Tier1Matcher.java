package com.ledgermatch.dedup.matcher;

import com.ledgermatch.dedup.config.DedupProperties;
import com.ledgermatch.dedup.index.AmountKey;
import com.ledgermatch.dedup.normalize.MerchantNormalizer;
import com.ledgermatch.dedup.similarity.FieldScore;
import com.ledgermatch.dedup.similarity.JaroWinkler;
import com.ledgermatch.dedup.similarity.MatchField;
import com.ledgermatch.dedup.similarity.SimilarityScorer;
import com.ledgermatch.dedup.similarity.SimilarityScorer.FieldPair;
import com.ledgermatch.domain.TransactionRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Deterministic, in-process matching.
 * <ol>
 *   <li>Primary: the best combined similarity over the field combinations is &gt;= tier1Threshold; that
 *       best score is the confidence.</li>
 *   <li>Secondary: raw descriptions share a majority of meaningful tokens AND the normalized merchants
 *       reach tokenOverlapMinSimilarity. Covers merchant extraction stripping a distinctive token.</li>
 * </ol>
 * A pair whose absolute amounts differ at the configured scale never matches.
 */
@Component
@RequiredArgsConstructor
public class Tier1Matcher {

    private final SimilarityScorer similarityScorer;
    private final MerchantNormalizer merchantNormalizer;
    private final DedupProperties dedupProperties;

    public Tier1Match match(TransactionRecord incoming, TransactionRecord candidate) {
        if (!AmountKey.sameAbsoluteAmount(incoming.getAmount(), candidate.getAmount(),
                dedupProperties.getAmountScale())) {
            return Tier1Match.noMatch(0.0, MatchField.DESCRIPTION);
        }
        FieldScore best = similarityScorer.bestAcrossFields(incoming, candidate);
        if (best.score() >= dedupProperties.getTier1Threshold()) {
            return new Tier1Match(true, best.score(), best.field());
        }

        for (FieldPair pair : similarityScorer.fieldPairs(incoming, candidate)) {
            if (!merchantNormalizer.hasSignificantTokenOverlap(pair.incomingRaw(), pair.knownRaw())) {
                continue;
            }
            double raw = JaroWinkler.similarity(pair.incomingMerchant(), pair.knownMerchant());
            if (raw >= dedupProperties.getTokenOverlapMinSimilarity()) {
                return new Tier1Match(true, Math.max(best.score(), raw), pair.field());
            }
        }
        return Tier1Match.noMatch(best.score(), best.field());
    }

    /**
     * First candidate, in the given order, that Tier 1 accepts. No re-ranking by score.
     */
    public Optional<MatchedCandidate> findFirstMatch(TransactionRecord incoming, List<TransactionRecord> candidates) {
        for (TransactionRecord candidate : candidates) {
            Tier1Match result = match(incoming, candidate);
            if (result.isMatch()) {
                return Optional.of(new MatchedCandidate(candidate, result));
            }
        }
        return Optional.empty();
    }

    public record MatchedCandidate(TransactionRecord candidate, Tier1Match match) {
    }
}
