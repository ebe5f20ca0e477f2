package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.dto.PrimeCeeResultDTO;
import com.lynkvertx.primecee.dto.PrimeCeeResultDTO.LightingValorisation;
import com.lynkvertx.primecee.dto.ProjectCeeTotalsDTO;
import com.lynkvertx.primecee.dto.ProjectProductCeeEntryDTO.DisplayValues;
import com.lynkvertx.primecee.dto.ProjectProductCeeEntryDTO.Warnings;
import org.springframework.stereotype.Component;

import java.text.NumberFormat;
import java.util.Locale;

/**
 * French (fr-FR) rendering of valorisation figures and warnings.
 * Rounding happens here only; the calculation figures are kept exact.
 */
@Component
public class ValorisationDisplayFormatter {

    public static final String REASON_MISSING_DYNAMIC_PARAMS = "Paramètres dynamiques manquants";
    public static final String REASON_MISSING_KWH = "Aucune valeur kWh pour ce bâtiment";
    public static final String REASON_MISSING_LIGHTING_BASE = "kWh cumac manquant pour cette typologie";
    public static final String REASON_NOT_COMPUTED = "Prime non calculée";
    public static final String NOT_COMPUTED = "Non calculée";

    private static final Locale FRENCH = Locale.FRANCE;

    public String formatCurrency(double value) {
        NumberFormat format = NumberFormat.getCurrencyInstance(FRENCH);
        format.setMinimumFractionDigits(2);
        format.setMaximumFractionDigits(2);
        return format.format(value);
    }

    public String formatDecimal(double value) {
        NumberFormat format = NumberFormat.getNumberInstance(FRENCH);
        format.setMinimumFractionDigits(0);
        format.setMaximumFractionDigits(2);
        return format.format(value);
    }

    /**
     * Why a line shows no (or a zero) prime; null when nothing is wrong.
     */
    public String reason(PrimeCeeResultDTO result, Warnings warnings) {
        if (result != null) {
            return warnings.isMissingLightingBase() ? REASON_MISSING_LIGHTING_BASE : null;
        }
        if (warnings.isMissingDynamicParams()) {
            return REASON_MISSING_DYNAMIC_PARAMS;
        }
        if (warnings.isMissingKwh()) {
            return warnings.isMissingLightingBase() ? REASON_MISSING_LIGHTING_BASE : REASON_MISSING_KWH;
        }
        return REASON_NOT_COMPUTED;
    }

    public DisplayValues displayValues(PrimeCeeResultDTO result, String multiplierLabel, Double multiplierValue,
                                       String reason) {
        DisplayValues.DisplayValuesBuilder display = DisplayValues.builder()
            .multiplier(multiplierValue != null ? formatDecimal(multiplierValue) : null);

        if (result == null) {
            return display
                .valorisationPerUnit(NOT_COMPUTED)
                .valorisationTotal(NOT_COMPUTED)
                .valorisationTotalMwh(reason)
                .prime(REASON_NOT_COMPUTED)
                .build();
        }

        LightingValorisation lighting = result.getLighting();
        String unitLabel = multiplierLabel != null && !multiplierLabel.isBlank() ? multiplierLabel : "unité";
        String perUnit;
        String perUnitMwh;
        if (lighting != null && lighting.getPerLedEur() != null) {
            perUnit = formatCurrency(lighting.getPerLedEur()) + " / " + unitLabel;
            perUnitMwh = formatDecimal(lighting.getPerLedMwh()) + " MWh";
        } else {
            perUnit = formatCurrency(result.getValorisationPerUnitEur()) + " / " + unitLabel;
            perUnitMwh = formatDecimal(result.getValorisationPerUnitMwh()) + " MWh";
        }

        String totalMwh;
        if (lighting != null && lighting.getTotalMwh() != null) {
            totalMwh = String.format("%s MWh × %s = %s MWh", formatDecimal(lighting.getPerLedMwh()),
                formatDecimal(result.getMultiplier()), formatDecimal(lighting.getTotalMwh()));
        } else {
            totalMwh = String.format("%s MWh × %s = %s MWh", formatDecimal(result.getValorisationPerUnitMwh()),
                formatDecimal(result.getMultiplier()), formatDecimal(result.getValorisationTotalMwh()));
        }

        return display
            .valorisationPerUnit(perUnit)
            .valorisationPerUnitMwh(perUnitMwh)
            .valorisationTotal(formatCurrency(result.getValorisationTotalEur()))
            .valorisationTotalMwh(totalMwh)
            .prime("Prime calculée : " + formatCurrency(result.getTotalPrime()))
            .build();
    }

    /**
     * "1 234,50 € (24,69 MWh)", or "Non calculée" when no line produced a result.
     */
    public String totalsLine(ProjectCeeTotalsDTO totals, boolean hasComputedTotals) {
        if (!hasComputedTotals) {
            return NOT_COMPUTED;
        }
        return formatCurrency(totals.getTotalValorisationEur())
            + " (" + formatDecimal(totals.getTotalValorisationMwh()) + " MWh)";
    }
}
