package com.lynkvertx.primecee.calculation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Inputs of the valorisation of one product line
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValorisationInput {

    /** Null for a lighting product whose base is missing for the building type */
    private Double kwhCumac;

    private double bonification;

    private double coefficient;

    private double multiplier;

    private Double quantity;

    /** Null or negative is treated as 0 */
    private Double delegatePriceEurPerMwh;

    private Map<String, Object> dynamicParams;

    private String formulaExpression;

    private Double ledWattConstant;

    /** Effective CEE category of the product */
    private String category;
}
