package com.lynkvertx.primecee.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Valorisation outcome of one displayed project line, with its warnings
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectProductCeeEntryDTO {

    private Long projectProductId;

    private Long productId;

    private String productCode;

    private String productName;

    private String multiplierLabel;

    private Double multiplierValue;

    /** Null when the line could not be valorised; see warnings and reason */
    private PrimeCeeResultDTO result;

    private Warnings warnings;

    /** Human-readable reason when no prime (or a zero one) could be computed */
    private String reason;

    private DisplayValues display;

    /** Debug trace of each calculation step */
    private List<String> calculationSteps;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Warnings {
        private boolean missingDynamicParams;
        private boolean missingKwh;
        /** Lighting product whose kWh cumac base is missing for the typology */
        private boolean missingLightingBase;
    }

    /**
     * Pre-formatted (fr-FR) strings for the presentation layer
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DisplayValues {
        private String multiplier;
        private String valorisationPerUnit;
        private String valorisationPerUnitMwh;
        private String valorisationTotal;
        private String valorisationTotalMwh;
        private String prime;
    }
}
