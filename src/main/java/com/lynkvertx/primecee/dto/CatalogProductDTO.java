package com.lynkvertx.primecee.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of a catalog product, as consumed by the valorisation engine
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogProductDTO {

    @NotNull(message = "Product id is required")
    private Long id;

    private String code;

    private String name;

    private String category;

    private List<ParamsSchemaField> paramsSchema;

    private Map<String, Object> defaultParams;

    private CeeConfigDTO ceeConfig;

    /** Formula multiplier config; when null it is looked up in defaultParams */
    private ValorisationFormulaConfigDTO valorisationFormula;

    private List<KwhCumacEntryDTO> kwhCumacValues;
}
