package com.lynkvertx.primecee.util;

import java.util.regex.Pattern;

/**
 * Lenient number parsing for values that arrive from JSON columns or user
 * input: numbers, or strings such as {@code "1 250,5"}.
 * <p>
 * Every method returns {@code null} for "absent"; none of them throws.
 */
public final class NumericCoercion {

    // Regular, narrow no-break and no-break spaces all show up as thousands separators
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u202F]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private NumericCoercion() {
    }

    public static Double toNumber(Object value) {
        if (value instanceof Number) {
            double numeric = ((Number) value).doubleValue();
            return Double.isFinite(numeric) ? numeric : null;
        }
        if (value instanceof String) {
            return parse((String) value);
        }
        return null;
    }

    public static Double toPositiveNumber(Object value) {
        Double numeric = toNumber(value);
        return numeric != null && numeric > 0 ? numeric : null;
    }

    public static Double toNonNegativeNumber(Object value) {
        Double numeric = toNumber(value);
        return numeric != null && numeric >= 0 ? numeric : null;
    }

    private static Double parse(String raw) {
        String sanitized = WHITESPACE.matcher(raw).replaceAll("").replaceFirst(",", ".");
        if (!DECIMAL.matcher(sanitized).matches()) {
            return null;
        }
        double parsed = Double.parseDouble(sanitized);
        return Double.isFinite(parsed) ? parsed : null;
    }
}
