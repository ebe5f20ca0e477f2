package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.calculation.MultiplierResolution.Source;
import com.lynkvertx.primecee.dto.CatalogProductDTO;
import com.lynkvertx.primecee.dto.CeeConfigDTO;
import com.lynkvertx.primecee.dto.ParamsSchemaField;
import com.lynkvertx.primecee.dto.ProjectProductLineDTO;
import com.lynkvertx.primecee.dto.ValorisationFormulaConfigDTO;
import com.lynkvertx.primecee.util.KeyNormalizer;
import com.lynkvertx.primecee.util.NumericCoercion;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Multiplier Resolver
 *
 * Determines the single quantity (surface, LED count, raw quantity...) that drives
 * the valorisation of a product line. Product configuration went through three
 * generations, all still present in the catalog, and they are tried in this fixed order:
 *
 * 1. Schema-driven field from {@code ceeConfig.primeMultiplierParam} (× coefficient)
 * 2. Formula config ({@code valorisationFormula}) when no real schema field applies
 * 3. The line's raw quantity
 *
 * Changing this order changes which historical product records compute correctly.
 */
@Component
@RequiredArgsConstructor
public class MultiplierResolver {

    static final String QUANTITY_LABEL = "Quantité";
    static final String UNNAMED_MULTIPLIER_LABEL = "Multiplicateur";

    private final CategoryMultiplierDefaults categoryDefaults;
    private final ValorisationFormulaNormalizer formulaNormalizer;

    public MultiplierResolution resolve(CatalogProductDTO product, ProjectProductLineDTO line) {
        CeeConfigDTO ceeConfig = product.getCeeConfig() != null ? product.getCeeConfig() : new CeeConfigDTO();
        Map<String, Object> dynamicParams = line.getDynamicParams();

        // === Tier 1: schema-driven multiplier ===
        String category = effectiveCategory(product);
        String multiplierParam = categoryDefaults.resolveKey(ceeConfig.getPrimeMultiplierParam(), category);
        String defaultKey = categoryDefaults.defaultKey(category);
        String effectiveKey = MultiplierSentinels.LEGACY_QUANTITY_KEY.equals(multiplierParam) && defaultKey != null
            ? defaultKey
            : multiplierParam;

        if (effectiveKey != null && !MultiplierSentinels.LEGACY_QUANTITY_KEY.equals(effectiveKey)) {
            String schemaLabel = schemaFieldLabel(product.getParamsSchema(), effectiveKey);
            Double coefficient = NumericCoercion.toPositiveNumber(ceeConfig.getPrimeMultiplierCoefficient());
            double appliedCoefficient = coefficient != null ? coefficient : 1;

            List<String> targets = new ArrayList<>();
            targets.add(effectiveKey);
            if (schemaLabel != null) {
                targets.add(schemaLabel);
            }
            Double fieldValue = DynamicParamLookup.findPositive(product.getParamsSchema(), dynamicParams, targets);
            String labelBase = schemaLabel != null ? schemaLabel : fallbackLabel(effectiveKey, defaultKey, category);

            if (fieldValue != null) {
                return MultiplierResolution.builder()
                    .value(fieldValue * appliedCoefficient)
                    .label(withCoefficient(labelBase, appliedCoefficient))
                    .source(Source.SCHEMA_FIELD)
                    .build();
            }
            return MultiplierResolution.builder()
                .label(withCoefficient(labelBase, appliedCoefficient))
                .missingDynamicParams(true)
                .source(Source.SCHEMA_FIELD)
                .build();
        }

        // === Tier 2: formula-configured multiplier ===
        ValorisationFormulaConfigDTO formula = product.getValorisationFormula() != null
            ? product.getValorisationFormula()
            : formulaNormalizer.fromProductParams(product.getDefaultParams(), null);
        if (formula != null && formula.getVariableKey() != null) {
            return resolveFromFormula(formula, product, line);
        }

        // === Tier 3: bare quantity ===
        Double quantity = NumericCoercion.toPositiveNumber(line.getQuantity());
        if (quantity != null) {
            return MultiplierResolution.builder()
                .value(quantity)
                .label(QUANTITY_LABEL)
                .source(Source.QUANTITY)
                .build();
        }
        return MultiplierResolution.none();
    }

    private MultiplierResolution resolveFromFormula(ValorisationFormulaConfigDTO formula,
                                                    CatalogProductDTO product,
                                                    ProjectProductLineDTO line) {
        // zero or negative coefficients count as 1 so a resolved multiplier is never negative
        Double rawCoefficient = NumericCoercion.toPositiveNumber(formula.getCoefficient());
        double coefficient = rawCoefficient != null ? rawCoefficient : 1;
        String baseLabel = formula.getVariableLabel() != null ? formula.getVariableLabel() : formula.getVariableKey();
        String label = withCoefficient(baseLabel, coefficient);

        if (MultiplierSentinels.isFormulaQuantityKey(formula.getVariableKey())) {
            Double quantity = NumericCoercion.toPositiveNumber(line.getQuantity());
            String quantityLabel = formula.getVariableLabel() != null || coefficient != 1 ? label : QUANTITY_LABEL;
            return MultiplierResolution.builder()
                .value(quantity != null ? quantity * coefficient : null)
                .label(quantityLabel)
                .missingDynamicParams(quantity == null)
                .source(Source.FORMULA)
                .build();
        }

        List<String> targets = new ArrayList<>();
        targets.add(formula.getVariableKey());
        if (formula.getVariableLabel() != null) {
            targets.add(formula.getVariableLabel());
        }
        Double fieldValue = DynamicParamLookup.findPositive(product.getParamsSchema(), line.getDynamicParams(), targets);
        if (fieldValue == null) {
            fieldValue = NumericCoercion.toPositiveNumber(formula.getVariableValue());
        }

        return MultiplierResolution.builder()
            .value(fieldValue != null ? fieldValue * coefficient : null)
            .label(label)
            .missingDynamicParams(fieldValue == null)
            .source(Source.FORMULA)
            .build();
    }

    private String fallbackLabel(String key, String defaultKey, String category) {
        String defaultLabel = key.equals(defaultKey) ? categoryDefaults.defaultLabel(category) : null;
        return defaultLabel != null ? defaultLabel : key;
    }

    /**
     * The CEE config category wins over the catalog category.
     */
    static String effectiveCategory(CatalogProductDTO product) {
        CeeConfigDTO ceeConfig = product.getCeeConfig();
        if (ceeConfig != null && ceeConfig.getCategory() != null && !ceeConfig.getCategory().isBlank()) {
            return ceeConfig.getCategory();
        }
        return product.getCategory();
    }

    /**
     * Label of the schema field whose name matches the key; falls back to the field name.
     */
    static String schemaFieldLabel(List<ParamsSchemaField> schema, String key) {
        String normalizedKey = KeyNormalizer.normalizeKey(key);
        if (schema == null || normalizedKey.isEmpty()) {
            return null;
        }
        for (ParamsSchemaField field : schema) {
            if (field == null || !KeyNormalizer.normalizeKey(field.getName()).equals(normalizedKey)) {
                continue;
            }
            if (field.getLabel() != null && !field.getLabel().isBlank()) {
                return field.getLabel();
            }
            if (field.getName() != null && !field.getName().isBlank()) {
                return field.getName();
            }
        }
        return null;
    }

    /**
     * "Surface isolée" with coefficient 2 → "Surface isolée × 2".
     */
    static String withCoefficient(String label, double coefficient) {
        String trimmed = label != null && !label.isBlank() ? label.trim() : null;
        if (coefficient == 1) {
            return trimmed;
        }
        return (trimmed != null ? trimmed : UNNAMED_MULTIPLIER_LABEL) + " × " + formatCoefficient(coefficient);
    }

    static String formatCoefficient(double coefficient) {
        if (!Double.isFinite(coefficient)) {
            return "1";
        }
        if (coefficient == Math.rint(coefficient)) {
            return String.valueOf((long) coefficient);
        }
        String formatted = String.format(Locale.ROOT, "%.2f", coefficient);
        return formatted.endsWith(".00") ? formatted.substring(0, formatted.length() - 3) : formatted;
    }
}
