package com.lynkvertx.primecee.calculation;

import java.util.Arrays;
import java.util.Optional;

/**
 * Valorisation formula templates offered in the product editor.
 * Expressions use the variables bound by {@link CeeFormulaEvaluator}.
 */
public enum CeeFormulaTemplate {

    /** (kWh cumac × bonification × coefficient) / 1000, no expression */
    STANDARD("standard", "Formule standard", null, false),

    LIGHTING_LED("lighting-led", "Éclairage LED (BONUS_DOM × LED_WATT)",
        "KWH_CUMAC * BONUS_DOM * LED_WATT / MWH_DIVISOR", false),

    /** Free-text expression written by the user */
    CUSTOM("custom", "Formule personnalisée", null, true);

    private final String id;
    private final String label;
    private final String expression;
    private final boolean custom;

    CeeFormulaTemplate(String id, String label, String expression, boolean custom) {
        this.id = id;
        this.label = label;
        this.expression = expression;
        this.custom = custom;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getExpression() {
        return expression;
    }

    public boolean isCustom() {
        return custom;
    }

    public static Optional<CeeFormulaTemplate> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(template -> template.id.equals(id.trim()))
            .findFirst();
    }
}
