package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.config.CeeCalculationConfig;
import com.lynkvertx.primecee.dto.PrimeCeeResultDTO;
import com.lynkvertx.primecee.dto.PrimeCeeResultDTO.LightingValorisation;
import com.lynkvertx.primecee.util.KeyNormalizer;
import com.lynkvertx.primecee.util.NumericCoercion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Valorisation Calculator
 *
 * Converts a product line into MWh cumac and euros:
 *
 * 1. Per-unit MWh = kWh cumac × bonification × coefficient / MWH divisor
 *    (replaced by the product's formula expression when it yields a positive value)
 * 2. Total MWh = per-unit MWh × multiplier
 * 3. EUR figures = MWh figures × delegate price (EUR/MWh)
 * 4. Lighting products: per-LED figures follow the product formula when it applies,
 *    otherwise the generic per-unit MWh scaled by the LED wattage ratio
 *
 * No rounding is applied; figures are rounded only for display.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValorisationCalculator {

    static final List<String> LED_WATT_KEYS = Arrays.asList("led_watt", "ledWatt", "LED_WATT");
    static final List<String> BONUS_DOM_KEYS = Arrays.asList("bonus_dom", "bonusDom", "BONUS_DOM");

    private final CeeCalculationConfig config;
    private final CeeFormulaEvaluator formulaEvaluator;

    public PrimeCeeResultDTO calculate(ValorisationInput input) {
        return calculate(input, new ArrayList<>());
    }

    /**
     * @param input line inputs
     * @param steps receives a trace of each calculation step
     * @return the valorisation, or null when the line cannot be valorised
     */
    public PrimeCeeResultDTO calculate(ValorisationInput input, List<String> steps) {
        double multiplier = input.getMultiplier();
        if (!Double.isFinite(multiplier) || multiplier <= 0) {
            steps.add("Valorisation skipped: no positive multiplier");
            return null;
        }

        double price = resolveDelegatePrice(input.getDelegatePriceEurPerMwh());
        boolean lighting = isLighting(input.getCategory());
        Double kwhCumac = NumericCoercion.toPositiveNumber(input.getKwhCumac());

        if (kwhCumac == null) {
            if (!lighting) {
                steps.add("Valorisation skipped: kWh cumac missing");
                return null;
            }
            steps.add("Lighting product without kWh cumac base: figures set to 0");
            return missingLightingBase(input, multiplier, price);
        }

        double divisor = config.getMwhDivisor();
        double bonification = input.getBonification();
        double coefficient = input.getCoefficient();

        // === Step 1: per-unit MWh ===
        double perUnitMwh = kwhCumac * bonification * coefficient / divisor;
        steps.add(String.format("Step 1: Per-unit MWh = %.2f × %.2f × %.2f / %.0f = %.4f",
            kwhCumac, bonification, coefficient, divisor, perUnitMwh));

        Double formulaLedWatt = null;
        if (input.getFormulaExpression() != null && !input.getFormulaExpression().isBlank()) {
            Map<String, Double> variables = formulaVariables(input, kwhCumac, divisor);
            Double evaluated = formulaEvaluator.evaluate(input.getFormulaExpression(), variables);
            if (evaluated != null) {
                perUnitMwh = evaluated;
                formulaLedWatt = variables.get(CeeFormulaEvaluator.LED_WATT);
                steps.add(String.format("Step 1a: Formula '%s' overrides per-unit MWh = %.4f",
                    input.getFormulaExpression().trim(), perUnitMwh));
            } else {
                steps.add(String.format("Step 1a: Formula '%s' ignored, generic per-unit MWh kept",
                    input.getFormulaExpression().trim()));
            }
        }

        // === Step 2-3: totals ===
        double totalMwh = perUnitMwh * multiplier;
        double perUnitEur = perUnitMwh * price;
        double totalEur = totalMwh * price;
        if (!allFinite(perUnitMwh, totalMwh, perUnitEur, totalEur)) {
            log.warn("Non-finite valorisation figures (kWh cumac={}, multiplier={}, price={}), line skipped",
                kwhCumac, multiplier, price);
            steps.add("Valorisation skipped: non-finite figures");
            return null;
        }
        steps.add(String.format("Step 2: Total MWh = %.4f × %.2f = %.4f", perUnitMwh, multiplier, totalMwh));
        steps.add(String.format("Step 3: Total EUR = %.4f × %.2f €/MWh = %.2f", totalMwh, price, totalEur));

        PrimeCeeResultDTO result = PrimeCeeResultDTO.builder()
            .kwhCumac(kwhCumac)
            .bonification(bonification)
            .coefficient(coefficient)
            .multiplier(multiplier)
            .delegatePrice(price)
            .valorisationPerUnitMwh(perUnitMwh)
            .valorisationPerUnitEur(perUnitEur)
            .valorisationTotalMwh(totalMwh)
            .valorisationTotalEur(totalEur)
            .totalPrime(totalEur)
            .build();

        // === Step 4: lighting ===
        if (lighting) {
            LightingValorisation lightingValorisation =
                calculateLighting(input, perUnitMwh, formulaLedWatt, multiplier, price, steps);
            result.setLighting(lightingValorisation);
            if (lightingValorisation.getTotalEur() != null) {
                result.setTotalPrime(lightingValorisation.getTotalEur());
            }
        }

        log.debug("Valorisation: kWh={}, bonif={}, coef={}, multiplier={}, price={} → {} MWh, {} EUR, prime {}",
            kwhCumac, bonification, coefficient, multiplier, price, totalMwh, totalEur, result.getTotalPrime());
        return result;
    }

    /**
     * @param formulaLedWatt LED wattage the product formula was evaluated with, null when no formula applied
     */
    private LightingValorisation calculateLighting(ValorisationInput input, double perUnitMwh, Double formulaLedWatt,
                                                   double multiplier, double price, List<String> steps) {
        Double ledWatt;
        double perLedMwh;
        if (formulaLedWatt != null) {
            // the formula already carries LED_WATT
            ledWatt = formulaLedWatt;
            perLedMwh = perUnitMwh;
            steps.add(String.format("Step 4: Lighting per LED = formula per-unit MWh = %.4f", perLedMwh));
        } else {
            ledWatt = resolveLedWatt(input);
            Double defaultLedWatt = NumericCoercion.toPositiveNumber(config.getLighting().getDefaultLedWatt());
            if (ledWatt == null || defaultLedWatt == null) {
                log.warn("Lighting valorisation skipped: no LED wattage reference configured");
                steps.add("Step 4: Lighting figures unavailable (no LED wattage reference)");
                return LightingValorisation.builder().ledWatt(ledWatt).build();
            }
            double ratio = ledWatt / defaultLedWatt;
            perLedMwh = perUnitMwh * ratio;
            steps.add(String.format("Step 4: Lighting ratio = %.0fW / %.0fW = %.4f, per LED = %.4f MWh",
                ledWatt, defaultLedWatt, ratio, perLedMwh));
        }

        double perLedEur = perLedMwh * price;
        double totalMwh = perLedMwh * multiplier;
        double totalEur = totalMwh * price;
        if (!allFinite(perLedMwh, perLedEur, totalMwh, totalEur)) {
            steps.add("Step 4: Lighting figures unavailable (non-finite)");
            return LightingValorisation.builder().ledWatt(ledWatt).build();
        }

        steps.add(String.format("Step 4: Lighting total = %.4f MWh / %.2f EUR", totalMwh, totalEur));
        return LightingValorisation.builder()
            .perLedMwh(perLedMwh)
            .perLedEur(perLedEur)
            .totalMwh(totalMwh)
            .totalEur(totalEur)
            .ledWatt(ledWatt)
            .build();
    }

    private PrimeCeeResultDTO missingLightingBase(ValorisationInput input, double multiplier, double price) {
        return PrimeCeeResultDTO.builder()
            .bonification(input.getBonification())
            .coefficient(input.getCoefficient())
            .multiplier(multiplier)
            .delegatePrice(price)
            .lighting(LightingValorisation.builder()
                .perLedMwh(0d)
                .perLedEur(0d)
                .totalMwh(0d)
                .totalEur(0d)
                .missingBase(true)
                .ledWatt(resolveLedWatt(input))
                .build())
            .build();
    }

    private Map<String, Double> formulaVariables(ValorisationInput input, double kwhCumac, double divisor) {
        Double bonusDom = DynamicParamLookup.findPositiveByKey(input.getDynamicParams(), BONUS_DOM_KEYS);
        Double ledWatt = NumericCoercion.toPositiveNumber(input.getLedWattConstant());
        if (ledWatt == null) {
            ledWatt = DynamicParamLookup.findPositiveByKey(input.getDynamicParams(), LED_WATT_KEYS);
        }

        Map<String, Double> variables = new LinkedHashMap<>();
        variables.put(CeeFormulaEvaluator.KWH_CUMAC, kwhCumac);
        variables.put(CeeFormulaEvaluator.BONIFICATION, input.getBonification());
        variables.put(CeeFormulaEvaluator.BONUS_DOM, bonusDom != null ? bonusDom : input.getBonification());
        variables.put(CeeFormulaEvaluator.COEFFICIENT, input.getCoefficient());
        variables.put(CeeFormulaEvaluator.LED_WATT, ledWatt != null ? ledWatt : 1d);
        variables.put(CeeFormulaEvaluator.MWH_DIVISOR, divisor);
        return variables;
    }

    /**
     * Product constant, then the line's led_watt param, then the category reference wattage.
     */
    private Double resolveLedWatt(ValorisationInput input) {
        Double constant = NumericCoercion.toPositiveNumber(input.getLedWattConstant());
        if (constant != null) {
            return constant;
        }
        Double dynamic = DynamicParamLookup.findPositiveByKey(input.getDynamicParams(), LED_WATT_KEYS);
        if (dynamic != null) {
            return dynamic;
        }
        return NumericCoercion.toPositiveNumber(config.getLighting().getDefaultLedWatt());
    }

    boolean isLighting(String category) {
        String lightingCategory = KeyNormalizer.normalizeKey(config.getLighting().getCategory());
        return !lightingCategory.isEmpty() && KeyNormalizer.normalizeKey(category).equals(lightingCategory);
    }

    private static double resolveDelegatePrice(Double price) {
        Double rate = NumericCoercion.toNonNegativeNumber(price);
        return rate != null ? rate : 0;
    }

    private static boolean allFinite(double... values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}
