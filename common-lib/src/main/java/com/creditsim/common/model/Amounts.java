package com.creditsim.common.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money helpers. All amounts and limits live at cent precision and are
 * truncated, never rounded up.
 */
public final class Amounts {

    public static final int        SCALE = 2;
    public static final BigDecimal CENT  = new BigDecimal("0.01");

    private Amounts() {}

    public static BigDecimal truncate(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal truncate(double value) {
        return truncate(BigDecimal.valueOf(value));
    }

    /** Lenient parse of a scenario value (number or string); {@code null} when unparseable. */
    public static BigDecimal parse(Object raw) {
        if (raw == null) return null;
        if (raw instanceof BigDecimal bd) return bd;
        if (raw instanceof Number n) return new BigDecimal(n.toString());
        try {
            return new BigDecimal(raw.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
