package com.acme.labinsight.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

public final class FormatUtil {
    private FormatUtil() {}

    /** Fixed decimals, rounding the exact binary value half-up. */
    public static String fixed(double v, int decimals) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return String.valueOf(v);
        return new BigDecimal(v).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
    }

    /** Shortest plain rendering: 14.0 -> "14", 4.70 -> "4.7". */
    public static String plain(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return String.valueOf(v);
        if (v == 0) return "0";
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    public static String plain(Object raw) {
        if (raw == null) return "null";
        if (raw instanceof Double || raw instanceof Float) return plain(((Number) raw).doubleValue());
        if (raw instanceof BigDecimal bd) return plain(bd.doubleValue());
        return raw.toString();
    }

    /** Fraction of 1 shown as a whole percentage: 0.6 -> "60%". */
    public static String percent(double fraction) {
        return fixed(fraction * 100, 0) + "%";
    }

    public static String capitalize(String s) {
        if (s == null || s.isEmpty()) return s;
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }
}
