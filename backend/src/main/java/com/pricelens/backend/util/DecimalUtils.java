package com.pricelens.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class DecimalUtils {

    private DecimalUtils() {
    }

    /**
     * Rounds the exact binary value half-even, so 0.125 stays 0.12 and 2.675 becomes 2.67.
     */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double round2(double value) {
        return round(value, 2);
    }

    public static double percentChange(double oldValue, double newValue) {
        if (oldValue == 0) {
            return 0.0;
        }
        return ((newValue - oldValue) / oldValue) * 100.0;
    }
}
