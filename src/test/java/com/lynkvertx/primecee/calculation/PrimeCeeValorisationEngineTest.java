package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.dto.CatalogProductDTO;
import com.lynkvertx.primecee.dto.PrimeCeeResultDTO;
import com.lynkvertx.primecee.dto.ProjectProductCeeEntryDTO;
import com.lynkvertx.primecee.dto.ProjectValorisationResultDTO;
import com.lynkvertx.primecee.dto.ProjectValorisationSnapshotDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PrimeCeeValorisationEngineTest {

    private PrimeCeeValorisationEngine engine;

    @BeforeEach
    void setUp() {
        engine = CeeTestFixtures.engine(CeeTestFixtures.config());
    }

    private ProjectValorisationSnapshotDTO snapshot() {
        return ProjectValorisationSnapshotDTO.builder()
            .projectId(7L)
            .buildingType(CeeTestFixtures.HOUSE)
            .delegatePriceEurPerMwh(5d)
            .products(Arrays.asList(
                CeeTestFixtures.insulationProduct(1, "BAR-EN-101", 250),
                CeeTestFixtures.insulationProduct(2, "eco-frais-dossier", 1000),
                CeeTestFixtures.lightingProduct(3, "BAR-EQ-111", null)))
            .lines(Arrays.asList(
                CeeTestFixtures.line(100, 1, 1, "surface_isolee", 40),
                CeeTestFixtures.line(101, 2, 1, "surface_isolee", 40),
                CeeTestFixtures.line(102, 3, 10, "nombre_led", 10),
                CeeTestFixtures.line(103, 1, 1),
                CeeTestFixtures.line(104, 99, 2)))
            .build();
    }

    @Test
    void valorisesLinesAndAggregatesTotals() {
        ProjectValorisationResultDTO result = engine.evaluate(snapshot());

        assertThat(result.getBonification()).isEqualTo(2d);
        assertThat(result.getEntries()).extracting(ProjectProductCeeEntryDTO::getProjectProductId)
            .containsExactly(100L, 102L, 103L, 104L);

        ProjectProductCeeEntryDTO insulation = result.getEntries().get(0);
        assertThat(insulation.getResult().getValorisationPerUnitMwh()).isCloseTo(0.5, within(1e-9));
        assertThat(insulation.getResult().getValorisationTotalMwh()).isCloseTo(20, within(1e-9));
        assertThat(insulation.getResult().getTotalPrime()).isCloseTo(100, within(1e-9));
        assertThat(insulation.getMultiplierLabel()).isEqualTo("Surface isolée");
        assertThat(insulation.getReason()).isNull();
        assertThat(insulation.getCalculationSteps()).isNotEmpty();

        assertThat(result.getTotals().getTotalPrime()).isCloseTo(100, within(1e-9));
        assertThat(result.getTotals().getTotalValorisationMwh()).isCloseTo(20, within(1e-9));
        assertThat(result.isHasComputedTotals()).isTrue();
        assertThat(result.getTotalsDisplay().replaceAll("[\\u00A0\\u202F]", " ")).isEqualTo("100,00 € (20 MWh)");
    }

    @Test
    void helperProductsAreExcludedEverywhere() {
        ProjectValorisationResultDTO result = engine.evaluate(snapshot());

        assertThat(result.getEntries()).extracting(ProjectProductCeeEntryDTO::getProductCode)
            .doesNotContain("eco-frais-dossier");
        // the helper line would have added 1000 × 2 / 1000 × 40 × 5 = 400 EUR
        assertThat(result.getTotals().getTotalPrime()).isCloseTo(100, within(1e-9));
    }

    @Test
    void lightingWithoutBaseIsFlaggedButStillReturned() {
        ProjectProductCeeEntryDTO lighting = engine.evaluate(snapshot()).getEntries().get(1);

        assertThat(lighting.getResult()).isNotNull();
        assertThat(lighting.getResult().getLighting().isMissingBase()).isTrue();
        assertThat(lighting.getResult().getTotalPrime()).isZero();
        assertThat(lighting.getWarnings().isMissingKwh()).isTrue();
        assertThat(lighting.getWarnings().isMissingLightingBase()).isTrue();
        assertThat(lighting.getReason()).isEqualTo("kWh cumac manquant pour cette typologie");
        assertThat(lighting.getMultiplierValue()).isEqualTo(10d);
    }

    @Test
    void lightingLedProductPrimeMatchesItsValorisation() {
        Map<String, Object> rawConfig = new LinkedHashMap<>();
        rawConfig.put("category", "lighting");
        rawConfig.put("formulaTemplate", "lighting-led");
        rawConfig.put("ledWattConstant", 30);
        CatalogProductDTO product = CeeTestFixtures.lightingProduct(4, "BAR-EQ-112", 250d);
        product.setCeeConfig(new CeeConfigNormalizer(new CategoryMultiplierDefaults(CeeTestFixtures.config()))
            .normalize(rawConfig));

        ProjectValorisationSnapshotDTO snapshot = snapshot();
        snapshot.setProducts(Arrays.asList(product));
        snapshot.setLines(Arrays.asList(CeeTestFixtures.line(200, 4, 1, "nombre_led", 10)));

        ProjectValorisationResultDTO result = engine.evaluate(snapshot);
        PrimeCeeResultDTO lighting = result.getEntries().get(0).getResult();

        // 250 × 2 × 30 / 1000 = 15 MWh per LED, × 10 LED × 5 EUR/MWh
        assertThat(lighting.getLighting().getPerLedMwh()).isCloseTo(15, within(1e-9));
        assertThat(lighting.getLighting().getTotalEur()).isCloseTo(750, within(1e-9));
        assertThat(lighting.getValorisationTotalEur()).isCloseTo(750, within(1e-9));
        assertThat(lighting.getTotalPrime()).isCloseTo(750, within(1e-9));
        assertThat(result.getTotals().getTotalPrime())
            .isCloseTo(result.getTotals().getTotalValorisationEur(), within(1e-9));
    }

    @Test
    void missingDynamicParamAndUnknownProduct() {
        ProjectValorisationResultDTO result = engine.evaluate(snapshot());
        ProjectProductCeeEntryDTO missingSurface = result.getEntries().get(2);
        ProjectProductCeeEntryDTO unknownProduct = result.getEntries().get(3);

        assertThat(missingSurface.getResult()).isNull();
        assertThat(missingSurface.getWarnings().isMissingDynamicParams()).isTrue();
        assertThat(missingSurface.getReason()).isEqualTo("Paramètres dynamiques manquants");

        assertThat(unknownProduct.getResult()).isNull();
        assertThat(unknownProduct.getMultiplierValue()).isNull();
        assertThat(unknownProduct.getReason()).isEqualTo("Prime non calculée");
    }

    @Test
    void missingKwhForBuildingType() {
        ProjectValorisationSnapshotDTO snapshot = snapshot();
        snapshot.setBuildingType("Appartement");

        ProjectValorisationResultDTO result = engine.evaluate(snapshot);
        ProjectProductCeeEntryDTO insulation = result.getEntries().get(0);

        assertThat(insulation.getResult()).isNull();
        assertThat(insulation.getWarnings().isMissingKwh()).isTrue();
        assertThat(insulation.getReason()).isEqualTo("Aucune valeur kWh pour ce bâtiment");
        assertThat(result.getTotals().getTotalPrime()).isZero();
    }

    @Test
    void organizationBonificationOverridesDefault() {
        ProjectValorisationSnapshotDTO snapshot = snapshot();
        snapshot.setPrimeBonification(3d);

        ProjectValorisationResultDTO result = engine.evaluate(snapshot);

        assertThat(result.getBonification()).isEqualTo(3d);
        assertThat(result.getEntries().get(0).getResult().getValorisationPerUnitMwh()).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void nothingComputed() {
        ProjectValorisationSnapshotDTO snapshot = snapshot();
        snapshot.setLines(Arrays.asList(CeeTestFixtures.line(103, 1, 1)));

        ProjectValorisationResultDTO result = engine.evaluate(snapshot);

        assertThat(result.isHasComputedTotals()).isFalse();
        assertThat(result.getTotalsDisplay()).isEqualTo("Non calculée");
        assertThat(result.getTotals().getTotalPrime()).isZero();
    }

    @Test
    void sameSnapshotGivesSameResult() {
        assertThat(engine.evaluate(snapshot())).isEqualTo(engine.evaluate(snapshot()));
    }
}
