package com.lynkvertx.primecee.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-product CEE pricing-rule configuration
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CeeConfigDTO {

    /** CEE category override (isolation, heating, lighting, ventilation, other) */
    private String category;

    /** Formula template id: standard, lighting-led or custom */
    private String formulaTemplate;

    /** Valorisation expression; when present it overrides the per-unit MWh figure */
    private String formulaExpression;

    /** Dynamic param supplying the multiplier, or the legacy quantity sentinel */
    private String primeMultiplierParam;

    /** Applied to the resolved multiplier field value (default 1) */
    private Double primeMultiplierCoefficient;

    /** LED wattage used by the lighting valorisation instead of the category default */
    private Double ledWattConstant;
}
