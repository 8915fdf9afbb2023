package com.ledgermatch.dedup.index;

import com.ledgermatch.domain.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup of known records by (date, absolute amount). Built once per run and discarded with it.
 * <p>
 * Each known record is filed under its primary date and every alternate date (authorized, posted), so a
 * record from a feed using another date convention still lands in a probed bucket. Lookups probe every day
 * in {@code [date - windowDays, date + windowDays]}; the amount must match exactly at {@code amountScale}.
 * Results come earliest probed day first, known-set order within a day, and contain each record once.
 */
@Slf4j
public final class CandidateIndex {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE; // YYYY-MM-DD

    private final Map<String, List<TransactionRecord>> buckets = new LinkedHashMap<>();
    private final int windowDays;
    private final int amountScale;
    private int indexedRecords;
    private int skippedRecords;

    private CandidateIndex(int windowDays, int amountScale) {
        if (windowDays < 0) {
            throw new IllegalArgumentException("windowDays must not be negative");
        }
        if (amountScale < 0) {
            throw new IllegalArgumentException("amountScale must not be negative");
        }
        this.windowDays = windowDays;
        this.amountScale = amountScale;
    }

    public static CandidateIndex build(Collection<TransactionRecord> known, int windowDays, int amountScale) {
        CandidateIndex index = new CandidateIndex(windowDays, amountScale);
        if (known != null) {
            for (TransactionRecord record : known) {
                index.add(record);
            }
        }
        log.debug("Candidate index built: {} records in {} buckets, {} skipped (missing date or amount)",
                index.indexedRecords, index.buckets.size(), index.skippedRecords);
        return index;
    }

    public static CandidateIndex build(Collection<TransactionRecord> known) {
        return build(known, 2, AmountKey.DEFAULT_SCALE);
    }

    /**
     * Known records within the date window of {@code incoming} with the same absolute amount.
     * Empty when {@code incoming} has no date or amount.
     */
    public List<TransactionRecord> lookup(TransactionRecord incoming) {
        if (incoming == null || !incoming.hasAmountAndDate()) {
            return List.of();
        }
        String amount = AmountKey.of(incoming.getAmount(), amountScale);
        List<TransactionRecord> candidates = new ArrayList<>();
        Set<TransactionRecord> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int offset = -windowDays; offset <= windowDays; offset++) {
            List<TransactionRecord> bucket = buckets.get(key(incoming.getDate().plusDays(offset), amount));
            if (bucket == null) {
                continue;
            }
            for (TransactionRecord match : bucket) {
                if (seen.add(match)) {
                    candidates.add(match);
                }
            }
        }
        return candidates;
    }

    public int size() {
        return indexedRecords;
    }

    public int getWindowDays() {
        return windowDays;
    }

    public int getAmountScale() {
        return amountScale;
    }

    private void add(TransactionRecord record) {
        if (record == null || !record.hasAmountAndDate()) {
            skippedRecords++;
            return;
        }
        String amount = AmountKey.of(record.getAmount(), amountScale);
        addToBucket(key(record.getDate(), amount), record);
        for (LocalDate alternate : record.alternateDates()) {
            addToBucket(key(alternate, amount), record);
        }
        indexedRecords++;
    }

    private void addToBucket(String key, TransactionRecord record) {
        List<TransactionRecord> bucket = buckets.computeIfAbsent(key, k -> new ArrayList<>());
        for (TransactionRecord existing : bucket) {
            if (existing == record) {
                return;
            }
        }
        bucket.add(record);
    }

    private static String key(LocalDate date, String amount) {
        return date.format(DATE_FORMAT) + "|" + amount;
    }
}
