package com.acme.labinsight.util;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw value decoding shared by the panel normalizers. Nothing here throws:
 * absent or unreadable input falls back to the caller's default.
 */
public final class NormalizeUtil {
    private NormalizeUtil() {}

    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    /** First key holding a non-blank value, or null. */
    public static Object firstPresent(Map<String, Object> values, String... keys) {
        if (values == null) return null;
        for (String k : keys) {
            Object v = values.get(k);
            if (v == null) continue;
            if (v instanceof String s && s.isBlank()) continue;
            return v;
        }
        return null;
    }

    /** Leading numeric prefix of the raw value, so "12.5 g/dL" reads as 12.5. */
    public static OptionalDouble parseLeading(Object raw) {
        if (raw == null) return OptionalDouble.empty();
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
        Matcher m = LEADING_NUMBER.matcher(raw.toString());
        if (!m.find()) return OptionalDouble.empty();
        try {
            double d = Double.parseDouble(m.group(1));
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    public static double number(Map<String, Object> values, double def, String... keys) {
        return parseLeading(firstPresent(values, keys)).orElse(def);
    }

    /** Lower-cased, trimmed text of the first present key, or the default. */
    public static String text(Map<String, Object> values, String def, String... keys) {
        Object raw = firstPresent(values, keys);
        String s = (raw == null) ? def : raw.toString();
        return s.trim().toLowerCase(Locale.ROOT);
    }

    /** Maps text onto a closed vocabulary; anything else becomes the fallback. */
    public static String vocabulary(String text, Set<String> vocab, String fallback) {
        if (text == null) return fallback;
        String t = text.trim().toLowerCase(Locale.ROOT);
        return vocab.contains(t) ? t : fallback;
    }

    public static boolean mentions(Object raw, String sentinel) {
        return raw instanceof String s && s.toLowerCase(Locale.ROOT).contains(sentinel);
    }
}
