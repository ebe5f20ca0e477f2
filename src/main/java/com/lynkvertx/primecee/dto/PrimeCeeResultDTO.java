package com.lynkvertx.primecee.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Valorisation of one product line. Recomputed on every request, never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PrimeCeeResultDTO {

    /** kWh cumac reference used for the line (null when missing, lighting only) */
    private Double kwhCumac;

    private double bonification;

    private double coefficient;

    /** Resolved multiplier (surface, LED count, quantity...) */
    private double multiplier;

    /** Delegate rate actually applied, 0 when none is configured */
    private double delegatePrice;

    private double valorisationPerUnitMwh;

    private double valorisationPerUnitEur;

    private double valorisationTotalMwh;

    private double valorisationTotalEur;

    /** Subsidy amount the line can claim */
    private double totalPrime;

    /** Per-LED figures, lighting category only */
    private LightingValorisation lighting;

    /**
     * Per-LED valorisation of a lighting product.
     * Figures are null when the LED wattage ratio cannot be derived.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LightingValorisation {

        @JsonProperty("per_led_mwh")
        private Double perLedMwh;

        @JsonProperty("per_led_eur")
        private Double perLedEur;

        @JsonProperty("total_mwh")
        private Double totalMwh;

        @JsonProperty("total_eur")
        private Double totalEur;

        /** kWh cumac base missing for the building typology */
        @JsonProperty("missing_base")
        private boolean missingBase;

        @JsonProperty("led_watt")
        private Double ledWatt;
    }
}
