package com.ledgermatch.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One transaction as seen by the dedup engine. Known-side records (already stored) carry an id;
 * incoming records (CSV import or bank-feed sync) usually do not.
 * Never persisted; identity is reference identity, so two records with equal fields stay distinct.
 */
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Getter
@Setter
public class TransactionRecord {

    private String id;
    private String description;
    /** Signed amount; only the absolute value takes part in matching. */
    private BigDecimal amount;
    private LocalDate date;
    /** Bank-feed authorization date (usually the purchase date a CSV statement shows). */
    private LocalDate authorizedDate;
    /** Bank-feed settlement date. */
    private LocalDate postedDate;
    /** Cleaner merchant label supplied by a bank feed, e.g. "Chipotle Mexican Grill". */
    private String merchantName;

    /**
     * Records missing a date or an amount cannot be indexed as candidates.
     */
    public boolean hasAmountAndDate() {
        return amount != null && date != null;
    }

    public boolean hasMerchantName() {
        return merchantName != null && !merchantName.isBlank();
    }

    /**
     * Alternate dates other than the primary one, authorized first. Posted date equal to the primary is skipped.
     */
    public List<LocalDate> alternateDates() {
        List<LocalDate> out = new ArrayList<>(2);
        if (authorizedDate != null) {
            out.add(authorizedDate);
        }
        if (postedDate != null && !postedDate.equals(date) && !postedDate.equals(authorizedDate)) {
            out.add(postedDate);
        }
        return out;
    }

    public String descriptionOrEmpty() {
        return description == null ? "" : description;
    }

    @Override
    public String toString() {
        return "TransactionRecord{id=" + id + ", description='" + description + "', amount=" + amount
                + ", date=" + date + "}";
    }
}
