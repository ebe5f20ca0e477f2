package com.lynkvertx.primecee.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Project-level CEE totals
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectCeeTotalsDTO {

    private double totalValorisationMwh;

    private double totalValorisationEur;

    private double totalPrime;
}
