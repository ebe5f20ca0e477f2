package com.lynkvertx.primecee.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything the valorisation engine needs for one project.
 * Built from the collaborator tables, or posted as-is to the stateless endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectValorisationSnapshotDTO {

    private Long projectId;

    private String buildingType;

    /** Delegate purchase rate in EUR/MWh (null when no delegate is assigned) */
    private Double delegatePriceEurPerMwh;

    /** Organization bonification factor (null or non-positive falls back to the default) */
    private Double primeBonification;

    @Valid
    @NotNull(message = "Product lines are required")
    @Builder.Default
    private List<ProjectProductLineDTO> lines = new ArrayList<>();

    @Valid
    @NotNull(message = "Catalog products are required")
    @Builder.Default
    private List<CatalogProductDTO> products = new ArrayList<>();
}
