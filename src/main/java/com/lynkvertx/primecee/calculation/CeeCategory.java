package com.lynkvertx.primecee.calculation;

import java.util.Arrays;
import java.util.Optional;

/**
 * CEE operation categories a product can be configured with
 */
public enum CeeCategory {

    ISOLATION("isolation", "Isolation"),
    HEATING("heating", "Chauffage"),
    LIGHTING("lighting", "Éclairage"),
    VENTILATION("ventilation", "Ventilation"),
    OTHER("other", "Autre");

    private final String value;
    private final String label;

    CeeCategory(String value, String label) {
        this.value = value;
        this.label = label;
    }

    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<CeeCategory> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
            .filter(category -> category.value.equals(trimmed))
            .findFirst();
    }
}
