package com.findex.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders GuardDuty severity with exactly one fractional digit, rounding half up
 * on the decimal value the service sent (4.25 becomes 4.3, 4.24 becomes 4.2).
 */
public final class SeverityFormat {

    public static final int SCALE = 1;

    private SeverityFormat() {
    }

    public static String format(double severity) {
        if (!Double.isFinite(severity)) {
            throw new IllegalArgumentException("Severity must be a finite number: " + severity);
        }
        return BigDecimal.valueOf(severity).setScale(SCALE, RoundingMode.HALF_UP).toPlainString();
    }
}
