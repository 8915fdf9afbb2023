package com.ledgermatch.dedup.index;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-precision absolute amount used in index keys, so -22.77, 22.770 and 22.77 share one bucket.
 */
public final class AmountKey {

    public static final int DEFAULT_SCALE = 2;

    private AmountKey() {
    }

    public static String of(BigDecimal amount, int scale) {
        return amount.abs().setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * True when the absolute amounts are equal once rounded to {@code scale} places.
     */
    public static boolean sameAbsoluteAmount(BigDecimal a, BigDecimal b, int scale) {
        if (a == null || b == null) {
            return false;
        }
        return of(a, scale).equals(of(b, scale));
    }
}
