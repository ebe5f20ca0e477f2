package com.lynkvertx.primecee.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of the Prime CEE valorisation of a whole project
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectValorisationResultDTO {

    private Long projectId;

    private String buildingType;

    private double bonification;

    /** One entry per displayed line (helper products excluded) */
    private List<ProjectProductCeeEntryDTO> entries;

    private ProjectCeeTotalsDTO totals;

    /** True when at least one line produced a result */
    private boolean hasComputedTotals;

    /** e.g. "1 234,50 € (24,69 MWh)" or "Non calculée" */
    private String totalsDisplay;
}
