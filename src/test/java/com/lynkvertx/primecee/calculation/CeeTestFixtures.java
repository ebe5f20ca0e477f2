package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.config.CeeCalculationConfig;
import com.lynkvertx.primecee.dto.CatalogProductDTO;
import com.lynkvertx.primecee.dto.CeeConfigDTO;
import com.lynkvertx.primecee.dto.KwhCumacEntryDTO;
import com.lynkvertx.primecee.dto.ParamsSchemaField;
import com.lynkvertx.primecee.dto.ProjectProductLineDTO;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine wiring and catalog samples shared by the calculation tests
 */
final class CeeTestFixtures {

    static final String HOUSE = "Maison individuelle";

    private CeeTestFixtures() {
    }

    static CeeCalculationConfig config() {
        CeeCalculationConfig config = new CeeCalculationConfig();
        config.getLighting().setDefaultLedWatt(250d);
        return config;
    }

    static PrimeCeeValorisationEngine engine(CeeCalculationConfig config) {
        CategoryMultiplierDefaults defaults = new CategoryMultiplierDefaults(config);
        return new PrimeCeeValorisationEngine(
            config,
            new MultiplierResolver(defaults, new ValorisationFormulaNormalizer()),
            new KwhCumacLookup(),
            new ValorisationCalculator(config, new CeeFormulaEvaluator()),
            new ProjectCeeAggregator(),
            new ValorisationDisplayFormatter());
    }

    static CatalogProductDTO insulationProduct(long id, String code, double kwhCumac) {
        List<ParamsSchemaField> schema = new ArrayList<>();
        schema.add(ParamsSchemaField.builder().name("surface_isolee").label("Surface isolée").unit("m²").build());
        return CatalogProductDTO.builder()
            .id(id)
            .code(code)
            .name("Isolation combles " + code)
            .category("isolation")
            .paramsSchema(schema)
            .ceeConfig(CeeConfigDTO.builder()
                .category("isolation")
                .formulaTemplate("standard")
                .primeMultiplierParam("surface_isolee")
                .build())
            .kwhCumacValues(kwh(HOUSE, kwhCumac))
            .build();
    }

    static CatalogProductDTO lightingProduct(long id, String code, Double kwhCumac) {
        List<ParamsSchemaField> schema = new ArrayList<>();
        schema.add(ParamsSchemaField.builder().name("nombre_led").label("Nombre de LED").build());
        return CatalogProductDTO.builder()
            .id(id)
            .code(code)
            .name("Éclairage LED " + code)
            .category("lighting")
            .paramsSchema(schema)
            .ceeConfig(CeeConfigDTO.builder()
                .category("lighting")
                .formulaTemplate("standard")
                .primeMultiplierParam("nombre_led")
                .build())
            .kwhCumacValues(kwhCumac != null ? kwh(HOUSE, kwhCumac) : new ArrayList<>())
            .build();
    }

    static List<KwhCumacEntryDTO> kwh(String buildingType, double value) {
        List<KwhCumacEntryDTO> entries = new ArrayList<>();
        entries.add(KwhCumacEntryDTO.builder().buildingType(buildingType).kwhCumac(value).build());
        return entries;
    }

    static ProjectProductLineDTO line(long id, long productId, Object quantity, Object... params) {
        Map<String, Object> dynamicParams = new LinkedHashMap<>();
        for (int i = 0; i + 1 < params.length; i += 2) {
            dynamicParams.put((String) params[i], params[i + 1]);
        }
        return ProjectProductLineDTO.builder()
            .id(id)
            .productId(productId)
            .quantity(quantity)
            .dynamicParams(dynamicParams)
            .build();
    }
}
