package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.dto.ValorisationFormulaConfigDTO;
import com.lynkvertx.primecee.util.KeyNormalizer;
import com.lynkvertx.primecee.util.NumericCoercion;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the formula multiplier configuration out of the loosely-typed JSON
 * stored with a product (default params, or the legacy cee_config.defaults block).
 */
@Component
public class ValorisationFormulaNormalizer {

    static final String LUMINAIRE_KEY = "nombre_luminaire";

    private static final List<String> CANDIDATE_KEYS =
        Arrays.asList("valorisation_formula", "valorisationFormula", "valorisation");

    private static final Set<String> LED_COUNT_SYNONYMS = Set.of(
        "nombre_led", "nombre_luminaire", "nombre_leds", "nombre_de_led", "nombre_de_luminaire");

    // Older editors stored the literal LED count under any of these
    private static final List<String> LED_COUNT_VALUE_KEYS = Arrays.asList(
        "variableValue", "variable_value", "nombre_led", "nombreLed", "Nombre Led",
        "nombre_luminaire", "nombreLuminaire");

    /**
     * First valid formula found in the default params, then in the legacy
     * cee_config defaults.
     *
     * @return the normalized formula, or null when none is configured
     */
    public ValorisationFormulaConfigDTO fromProductParams(Map<String, Object> defaultParams,
                                                          Map<String, Object> ceeDefaults) {
        for (Map<String, Object> source : Arrays.asList(defaultParams, ceeDefaults)) {
            if (source == null) {
                continue;
            }
            for (String key : CANDIDATE_KEYS) {
                ValorisationFormulaConfigDTO normalized = normalize(source.get(key));
                if (normalized != null) {
                    return normalized;
                }
            }
        }
        return null;
    }

    /**
     * @param raw a JSON object as parsed by Jackson
     * @return the normalized formula, or null when {@code raw} has no variable key
     */
    public ValorisationFormulaConfigDTO normalize(Object raw) {
        if (!(raw instanceof Map)) {
            return null;
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> values = (Map<String, Object>) raw;

        Object rawKeyValue = values.get("variableKey");
        String rawKey = rawKeyValue instanceof String ? ((String) rawKeyValue).trim() : "";
        if (rawKey.isEmpty()) {
            return null;
        }
        boolean ledCount = LED_COUNT_SYNONYMS.contains(KeyNormalizer.slug(rawKey));
        String variableKey = ledCount ? LUMINAIRE_KEY : rawKey;

        Object rawLabel = values.get("variableLabel");
        String label = rawLabel instanceof String && !((String) rawLabel).isBlank() ? (String) rawLabel : null;

        Object rawCoefficient = values.get("coefficient");
        Double coefficient = rawCoefficient instanceof Number
            ? NumericCoercion.toPositiveNumber(rawCoefficient)
            : null;

        Double variableValue = null;
        if (ledCount) {
            variableValue = 0d;
            for (String key : LED_COUNT_VALUE_KEYS) {
                Double candidate = NumericCoercion.toPositiveNumber(values.get(key));
                if (candidate != null) {
                    variableValue = candidate;
                    break;
                }
            }
        } else if (values.containsKey("variableValue")) {
            variableValue = NumericCoercion.toPositiveNumber(values.get("variableValue"));
        }

        return ValorisationFormulaConfigDTO.builder()
            .variableKey(variableKey)
            .variableLabel(label)
            .coefficient(coefficient)
            .variableValue(variableValue)
            .build();
    }
}
