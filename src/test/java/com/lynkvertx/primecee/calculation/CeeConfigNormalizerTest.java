package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.dto.CeeConfigDTO;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CeeConfigNormalizerTest {

    private final CeeConfigNormalizer normalizer =
        new CeeConfigNormalizer(new CategoryMultiplierDefaults(CeeTestFixtures.config()));

    @Test
    void snakeCaseLightingConfig() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("category", "lighting");
        raw.put("formula_template", "lighting-led");
        raw.put("prime_multiplier_param", " nombre_led ");
        raw.put("prime_multiplier_coefficient", "2");
        raw.put("led_watt_constant", 20);

        CeeConfigDTO config = normalizer.normalize(raw);

        assertThat(config.getCategory()).isEqualTo("lighting");
        assertThat(config.getFormulaTemplate()).isEqualTo("lighting-led");
        assertThat(config.getFormulaExpression()).isEqualTo("KWH_CUMAC * BONUS_DOM * LED_WATT / MWH_DIVISOR");
        assertThat(config.getPrimeMultiplierParam()).isEqualTo("nombre_led");
        assertThat(config.getPrimeMultiplierCoefficient()).isEqualTo(2d);
        assertThat(config.getLedWattConstant()).isEqualTo(20d);
    }

    @Test
    void legacyDefaultsBlock() {
        Map<String, Object> raw = Map.of(
            "category", "isolation",
            "defaults", Map.of(
                "multiplier", Map.of("key", "quantity", "coefficient", 1.5),
                "led_watt_constant", 30));

        CeeConfigDTO config = normalizer.normalize(raw);

        assertThat(config.getPrimeMultiplierParam()).isEqualTo("surface_isolee");
        assertThat(config.getPrimeMultiplierCoefficient()).isEqualTo(1.5);
        // LED wattage only applies to lighting products
        assertThat(config.getLedWattConstant()).isNull();
    }

    @Test
    void customTemplateKeepsTrimmedExpression() {
        Map<String, Object> raw = Map.of(
            "category", "garden",
            "formulaTemplate", "custom",
            "formulaExpression", "  KWH_CUMAC / 2 ");

        CeeConfigDTO config = normalizer.normalize(raw);

        assertThat(config.getCategory()).isNull();
        assertThat(config.getFormulaTemplate()).isEqualTo("custom");
        assertThat(config.getFormulaExpression()).isEqualTo("KWH_CUMAC / 2");
        assertThat(config.getPrimeMultiplierParam()).isEqualTo(MultiplierSentinels.LEGACY_QUANTITY_KEY);
    }

    @Test
    void missingOrUnknownValuesFallBackToStandard() {
        CeeConfigDTO empty = normalizer.normalize(null);
        CeeConfigDTO unknownTemplate = normalizer.normalize(Map.of(
            "formulaTemplate", "fancy",
            "formulaExpression", "KWH_CUMAC",
            "primeMultiplierCoefficient", -1));

        assertThat(empty.getFormulaTemplate()).isEqualTo("standard");
        assertThat(empty.getPrimeMultiplierParam()).isEqualTo(MultiplierSentinels.LEGACY_QUANTITY_KEY);
        assertThat(unknownTemplate.getFormulaTemplate()).isEqualTo("standard");
        assertThat(unknownTemplate.getFormulaExpression()).isNull();
        assertThat(unknownTemplate.getPrimeMultiplierCoefficient()).isNull();
    }

    @Test
    void legacyDefaultsAreExposedForFormulaLookup() {
        Map<String, Object> defaults = Map.of("valorisation", Map.of("variableKey", "surface"));

        assertThat(normalizer.legacyDefaults(Map.of("defaults", defaults))).isEqualTo(defaults);
        assertThat(normalizer.legacyDefaults(Map.of("defaults", "none"))).isNull();
        assertThat(normalizer.legacyDefaults(null)).isNull();
    }
}
