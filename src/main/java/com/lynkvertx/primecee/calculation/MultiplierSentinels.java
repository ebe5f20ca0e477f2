package com.lynkvertx.primecee.calculation;

import java.util.Locale;

/**
 * Backward-compatibility markers of older product configurations.
 */
public final class MultiplierSentinels {

    /** primeMultiplierParam value meaning "the multiplier is the line quantity" */
    public static final String LEGACY_QUANTITY_KEY = "__quantity__";

    /** Older spelling of {@link #LEGACY_QUANTITY_KEY} still found in catalog records */
    public static final String LEGACY_QUANTITY_ALIAS = "quantity";

    /** Formula variableKey meaning "use the line's raw quantity" */
    public static final String FORMULA_QUANTITY_KEY = "__quantity__";

    private MultiplierSentinels() {
    }

    public static boolean isLegacyQuantityMultiplier(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String trimmed = value.trim();
        return LEGACY_QUANTITY_KEY.equals(trimmed)
            || LEGACY_QUANTITY_ALIAS.equals(trimmed.toLowerCase(Locale.ROOT));
    }

    public static boolean isFormulaQuantityKey(String value) {
        return value != null && FORMULA_QUANTITY_KEY.equals(value.trim());
    }
}
