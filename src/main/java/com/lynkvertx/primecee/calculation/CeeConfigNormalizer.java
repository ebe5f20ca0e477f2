package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.dto.CeeConfigDTO;
import com.lynkvertx.primecee.util.NumericCoercion;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Normalizes the {@code cee_config} JSON of a catalog product.
 * <p>
 * Accepts camelCase and snake_case keys, and the legacy
 * {@code defaults.multiplier.{key,coefficient}} / {@code defaults.led_watt_constant} shapes.
 */
@Component
@RequiredArgsConstructor
public class CeeConfigNormalizer {

    private final CategoryMultiplierDefaults categoryDefaults;

    public CeeConfigDTO normalize(Map<String, Object> raw) {
        if (raw == null) {
            return defaultConfig();
        }
        Map<String, Object> legacyDefaults = asMap(raw.get("defaults"));
        Map<String, Object> legacyMultiplier = legacyDefaults != null ? asMap(legacyDefaults.get("multiplier")) : null;

        // Unknown categories are left unset so the catalog category applies
        String category = CeeCategory.fromValue(firstString(raw, "category", "category_key"))
            .map(CeeCategory::getValue)
            .orElse(null);

        CeeFormulaTemplate template = CeeFormulaTemplate.fromId(firstString(raw, "formulaTemplate", "formula_template"))
            .orElse(CeeFormulaTemplate.STANDARD);

        String expression;
        if (template.isCustom()) {
            String rawExpression = firstString(raw, "formulaExpression", "formula_expression");
            expression = rawExpression != null && !rawExpression.isBlank() ? rawExpression.trim() : null;
        } else {
            expression = template.getExpression();
        }

        String multiplierParam = categoryDefaults.resolveKey(
            firstString(raw, "primeMultiplierParam", "prime_multiplier_param"), category);
        if (multiplierParam == null && legacyMultiplier != null) {
            Object legacyKey = legacyMultiplier.get("key");
            multiplierParam = categoryDefaults.resolveKey(legacyKey instanceof String ? (String) legacyKey : null, category);
        }
        if (multiplierParam == null) {
            multiplierParam = defaultMultiplierKey(category);
        }

        Object rawCoefficient = firstPresent(raw, "primeMultiplierCoefficient", "prime_multiplier_coefficient");
        if (rawCoefficient == null && legacyMultiplier != null) {
            rawCoefficient = legacyMultiplier.get("coefficient");
        }

        Double ledWatt = NumericCoercion.toPositiveNumber(firstPresent(raw, "ledWattConstant", "led_watt_constant"));
        if (ledWatt == null && legacyDefaults != null) {
            ledWatt = NumericCoercion.toPositiveNumber(legacyDefaults.get("led_watt_constant"));
        }

        return CeeConfigDTO.builder()
            .category(category)
            .formulaTemplate(template.getId())
            .formulaExpression(expression)
            .primeMultiplierParam(multiplierParam)
            .primeMultiplierCoefficient(NumericCoercion.toPositiveNumber(rawCoefficient))
            .ledWattConstant(CeeCategory.LIGHTING.getValue().equals(category) ? ledWatt : null)
            .build();
    }

    /**
     * The legacy {@code cee_config.defaults} block, where older products kept their formula.
     */
    public Map<String, Object> legacyDefaults(Map<String, Object> raw) {
        return raw != null ? asMap(raw.get("defaults")) : null;
    }

    private CeeConfigDTO defaultConfig() {
        return CeeConfigDTO.builder()
            .formulaTemplate(CeeFormulaTemplate.STANDARD.getId())
            .primeMultiplierParam(MultiplierSentinels.LEGACY_QUANTITY_KEY)
            .build();
    }

    private String defaultMultiplierKey(String category) {
        String key = categoryDefaults.defaultKey(category);
        return key != null ? key : MultiplierSentinels.LEGACY_QUANTITY_KEY;
    }

    private static Object firstPresent(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            if (raw.get(key) != null) {
                return raw.get(key);
            }
        }
        return null;
    }

    private static String firstString(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            if (raw.get(key) instanceof String) {
                return (String) raw.get(key);
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }
}
