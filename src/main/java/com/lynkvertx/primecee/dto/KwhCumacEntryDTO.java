package com.lynkvertx.primecee.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * kWh cumac reference value of a product for one building type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KwhCumacEntryDTO {

    private String buildingType;

    private Double kwhCumac;
}
