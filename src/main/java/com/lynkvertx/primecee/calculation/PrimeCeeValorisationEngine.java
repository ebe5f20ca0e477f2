package com.lynkvertx.primecee.calculation;

import com.lynkvertx.primecee.config.CeeCalculationConfig;
import com.lynkvertx.primecee.dto.CatalogProductDTO;
import com.lynkvertx.primecee.dto.PrimeCeeResultDTO;
import com.lynkvertx.primecee.dto.ProjectCeeTotalsDTO;
import com.lynkvertx.primecee.dto.ProjectProductCeeEntryDTO;
import com.lynkvertx.primecee.dto.ProjectProductCeeEntryDTO.Warnings;
import com.lynkvertx.primecee.dto.ProjectProductLineDTO;
import com.lynkvertx.primecee.dto.ProjectValorisationResultDTO;
import com.lynkvertx.primecee.dto.ProjectValorisationSnapshotDTO;
import com.lynkvertx.primecee.util.NumericCoercion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Prime CEE Valorisation Engine
 *
 * Valorises every line of a project snapshot and aggregates the totals:
 *
 * 1. Drop helper products (code prefix, ECO by default) once, upstream
 * 2. Per line: resolve the multiplier and the kWh cumac independently
 * 3. Valorise when the multiplier is positive and the kWh cumac is known
 *    (lighting products are valorised even without kWh cumac, with zero figures)
 * 4. Sum the results into project totals
 *
 * Pure and stateless: the same snapshot always yields the same result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PrimeCeeValorisationEngine {

    private final CeeCalculationConfig config;
    private final MultiplierResolver multiplierResolver;
    private final KwhCumacLookup kwhCumacLookup;
    private final ValorisationCalculator calculator;
    private final ProjectCeeAggregator aggregator;
    private final ValorisationDisplayFormatter formatter;

    public ProjectValorisationResultDTO evaluate(ProjectValorisationSnapshotDTO snapshot) {
        Double organizationBonification = NumericCoercion.toPositiveNumber(snapshot.getPrimeBonification());
        double bonification = organizationBonification != null ? organizationBonification : config.getDefaultBonification();

        Map<Long, CatalogProductDTO> products = new LinkedHashMap<>();
        if (snapshot.getProducts() != null) {
            snapshot.getProducts().stream()
                .filter(Objects::nonNull)
                .filter(product -> product.getId() != null)
                .forEach(product -> products.putIfAbsent(product.getId(), product));
        }

        // === Step 1: helper product filter ===
        List<ProjectProductLineDTO> lines = snapshot.getLines() == null ? new ArrayList<>() : snapshot.getLines().stream()
            .filter(Objects::nonNull)
            .filter(line -> !isHelperProduct(products.get(line.getProductId())))
            .collect(Collectors.toList());

        // === Step 2-3: per-line valorisation ===
        List<ProjectProductCeeEntryDTO> entries = lines.stream()
            .map(line -> evaluateLine(line, products.get(line.getProductId()), snapshot, bonification))
            .collect(Collectors.toList());

        // === Step 4: totals ===
        List<PrimeCeeResultDTO> results = entries.stream()
            .map(ProjectProductCeeEntryDTO::getResult)
            .collect(Collectors.toList());
        ProjectCeeTotalsDTO totals = aggregator.computeProjectCeeTotals(results);
        boolean hasComputedTotals = results.stream().anyMatch(Objects::nonNull);

        log.info("CEE valorisation of project {}: {} line(s), {} valorised, total prime {} EUR",
            snapshot.getProjectId(), entries.size(), results.stream().filter(Objects::nonNull).count(),
            totals.getTotalPrime());

        return ProjectValorisationResultDTO.builder()
            .projectId(snapshot.getProjectId())
            .buildingType(snapshot.getBuildingType())
            .bonification(bonification)
            .entries(entries)
            .totals(totals)
            .hasComputedTotals(hasComputedTotals)
            .totalsDisplay(formatter.totalsLine(totals, hasComputedTotals))
            .build();
    }

    private ProjectProductCeeEntryDTO evaluateLine(ProjectProductLineDTO line, CatalogProductDTO product,
                                                   ProjectValorisationSnapshotDTO snapshot, double bonification) {
        List<String> steps = new ArrayList<>();

        if (product == null) {
            log.warn("Project line {} references unknown product {}", line.getId(), line.getProductId());
            steps.add("Product " + line.getProductId() + " not found in catalog");
            Warnings warnings = Warnings.builder().build();
            String reason = formatter.reason(null, warnings);
            return ProjectProductCeeEntryDTO.builder()
                .projectProductId(line.getId())
                .productId(line.getProductId())
                .warnings(warnings)
                .reason(reason)
                .display(formatter.displayValues(null, null, null, reason))
                .calculationSteps(steps)
                .build();
        }

        MultiplierResolution multiplier = multiplierResolver.resolve(product, line);
        steps.add(String.format("Multiplier: %s = %s (%s)",
            multiplier.getLabel(), multiplier.getValue(), multiplier.getSource()));

        String category = MultiplierResolver.effectiveCategory(product);
        boolean lighting = calculator.isLighting(category);
        Double kwhCumac = kwhCumacLookup.find(product.getKwhCumacValues(), snapshot.getBuildingType());
        boolean missingKwh = kwhCumac == null;
        steps.add(missingKwh
            ? "kWh cumac: missing for building type '" + snapshot.getBuildingType() + "'"
            : "kWh cumac: " + kwhCumac + " for building type '" + snapshot.getBuildingType() + "'");

        PrimeCeeResultDTO result = null;
        if (multiplier.isResolved() && (!missingKwh || lighting)) {
            ValorisationInput input = ValorisationInput.builder()
                .kwhCumac(kwhCumac)
                .bonification(bonification)
                .coefficient(1)
                .multiplier(multiplier.getValue())
                .quantity(NumericCoercion.toNumber(line.getQuantity()))
                .delegatePriceEurPerMwh(snapshot.getDelegatePriceEurPerMwh())
                .dynamicParams(line.getDynamicParams())
                .formulaExpression(product.getCeeConfig() != null ? product.getCeeConfig().getFormulaExpression() : null)
                .ledWattConstant(product.getCeeConfig() != null ? product.getCeeConfig().getLedWattConstant() : null)
                .category(category)
                .build();
            result = calculator.calculate(input, steps);
        }

        Warnings warnings = Warnings.builder()
            .missingDynamicParams(multiplier.isMissingDynamicParams())
            .missingKwh(missingKwh)
            .missingLightingBase(lighting && missingKwh)
            .build();
        String reason = formatter.reason(result, warnings);

        if (log.isDebugEnabled()) {
            log.debug("Line {} ({}): {}", line.getId(), product.getCode(), String.join(" | ", steps));
        }

        return ProjectProductCeeEntryDTO.builder()
            .projectProductId(line.getId())
            .productId(product.getId())
            .productCode(product.getCode())
            .productName(product.getName())
            .multiplierLabel(multiplier.getLabel())
            .multiplierValue(multiplier.getValue())
            .result(result)
            .warnings(warnings)
            .reason(reason)
            .display(formatter.displayValues(result, multiplier.getLabel(), multiplier.getValue(), reason))
            .calculationSteps(steps)
            .build();
    }

    boolean isHelperProduct(CatalogProductDTO product) {
        String prefix = config.getHelperCodePrefix();
        if (product == null || product.getCode() == null || prefix == null || prefix.isBlank()) {
            return false;
        }
        return product.getCode().trim().toUpperCase(Locale.ROOT).startsWith(prefix.trim().toUpperCase(Locale.ROOT));
    }
}
