package com.wayq.geo;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Decimals {
    private static final int SCALE = 5;

    private Decimals() {
    }

    /**
     * Formats {@code value} with at most five decimals and no trailing zeros, e.g. {@code 100}, {@code -37.8}.
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("not a finite number: " + value);
        }
        BigDecimal rounded = new BigDecimal(value).setScale(SCALE, RoundingMode.HALF_EVEN);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }
}
