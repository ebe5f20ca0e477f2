package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.dto.ParamsSchemaField;
import com.lynkvertx.primecee.util.KeyNormalizer;
import com.lynkvertx.primecee.util.NumericCoercion;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Table-driven search of numeric values in a line's dynamic params.
 * Candidate keys are tried in order; the first positive value wins.
 */
final class DynamicParamLookup {

    private DynamicParamLookup() {
    }

    /**
     * Find a positive number whose schema field name or label matches one of the targets.
     * Schema-described entries are searched first, then the raw dynamic param keys
     * (products without a schema still store values under their field names).
     */
    static Double findPositive(List<ParamsSchemaField> schema, Map<String, Object> params, List<String> targets) {
        if (params == null || params.isEmpty()) {
            return null;
        }
        List<String> cleanTargets = targets.stream()
            .filter(Objects::nonNull)
            .filter(target -> !KeyNormalizer.normalizeLabel(target).isEmpty())
            .collect(Collectors.toList());
        if (cleanTargets.isEmpty()) {
            return null;
        }

        for (ParamsSchemaField field : schema != null ? schema : Collections.<ParamsSchemaField>emptyList()) {
            if (field == null || field.getName() == null || !params.containsKey(field.getName())) {
                continue;
            }
            if (matchesAny(field.getName(), cleanTargets) || matchesAny(field.getLabel(), cleanTargets)) {
                Double value = NumericCoercion.toPositiveNumber(params.get(field.getName()));
                if (value != null) {
                    return value;
                }
            }
        }

        for (Map.Entry<String, Object> entry : params.entrySet()) {
            if (matchesAny(entry.getKey(), cleanTargets)) {
                Double value = NumericCoercion.toPositiveNumber(entry.getValue());
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    /**
     * Find a positive number stored under one of the keys, compared without case,
     * whitespace, underscores or hyphens ({@code led_watt}, {@code ledWatt}, {@code LED WATT}).
     */
    static Double findPositiveByKey(Map<String, Object> params, List<String> keys) {
        if (params == null || params.isEmpty()) {
            return null;
        }
        for (String key : keys) {
            String wanted = compact(key);
            for (Map.Entry<String, Object> entry : params.entrySet()) {
                if (compact(entry.getKey()).equals(wanted)) {
                    Double value = NumericCoercion.toPositiveNumber(entry.getValue());
                    if (value != null) {
                        return value;
                    }
                }
            }
        }
        return null;
    }

    private static boolean matchesAny(String candidate, List<String> targets) {
        return targets.stream().anyMatch(target -> KeyNormalizer.labelMatches(candidate, target));
    }

    private static String compact(String key) {
        return key == null ? "" : key.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
    }
}
