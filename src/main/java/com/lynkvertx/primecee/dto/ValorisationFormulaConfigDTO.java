package com.lynkvertx.primecee.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Formula-driven multiplier configuration, stored in a product's default params
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValorisationFormulaConfigDTO {

    /** Dynamic param key, or "__quantity__" to use the line's raw quantity */
    private String variableKey;

    private String variableLabel;

    /** Literal fallback when the dynamic param is missing */
    private Double variableValue;

    private Double coefficient;
}
