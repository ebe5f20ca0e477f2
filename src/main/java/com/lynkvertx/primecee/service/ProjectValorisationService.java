package com.lynkvertx.primecee.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lynkvertx.primecee.calculation.CeeConfigNormalizer;
import com.lynkvertx.primecee.calculation.PrimeCeeValorisationEngine;
import com.lynkvertx.primecee.calculation.ValorisationFormulaNormalizer;
import com.lynkvertx.primecee.dto.CatalogProductDTO;
import com.lynkvertx.primecee.dto.KwhCumacEntryDTO;
import com.lynkvertx.primecee.dto.ParamsSchemaField;
import com.lynkvertx.primecee.dto.ProjectProductLineDTO;
import com.lynkvertx.primecee.dto.ProjectValorisationResultDTO;
import com.lynkvertx.primecee.dto.ProjectValorisationSnapshotDTO;
import com.lynkvertx.primecee.entity.Delegate;
import com.lynkvertx.primecee.entity.OrganizationPrimeSettings;
import com.lynkvertx.primecee.entity.ProductCatalog;
import com.lynkvertx.primecee.entity.ProductKwhCumac;
import com.lynkvertx.primecee.entity.Project;
import com.lynkvertx.primecee.entity.ProjectProduct;
import com.lynkvertx.primecee.repository.DelegateRepository;
import com.lynkvertx.primecee.repository.OrganizationPrimeSettingsRepository;
import com.lynkvertx.primecee.repository.ProductCatalogRepository;
import com.lynkvertx.primecee.repository.ProductKwhCumacRepository;
import com.lynkvertx.primecee.repository.ProjectProductRepository;
import com.lynkvertx.primecee.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Project Valorisation Service
 *
 * Loads the read-only snapshot of a project (lines, catalog products, kWh cumac
 * references, delegate rate, organization bonification) and hands it to the
 * valorisation engine. JSON columns that cannot be parsed are treated as empty.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectValorisationService {

    private final ProjectRepository projectRepository;
    private final ProjectProductRepository projectProductRepository;
    private final ProductCatalogRepository productCatalogRepository;
    private final ProductKwhCumacRepository kwhCumacRepository;
    private final DelegateRepository delegateRepository;
    private final OrganizationPrimeSettingsRepository primeSettingsRepository;
    private final PrimeCeeValorisationEngine engine;
    private final CeeConfigNormalizer ceeConfigNormalizer;
    private final ValorisationFormulaNormalizer formulaNormalizer;
    private final ObjectMapper objectMapper;

    /**
     * Valorise a stored project.
     *
     * @param projectId The project to valorise
     * @return Per-line valorisation and project totals
     */
    @Transactional(readOnly = true)
    public ProjectValorisationResultDTO calculateForProject(Long projectId) {
        Project project = projectRepository.findById(projectId)
            .orElseThrow(() -> new EntityNotFoundException("Project not found with id: " + projectId));

        return engine.evaluate(loadSnapshot(project));
    }

    /**
     * Valorise a snapshot supplied by the caller (no database access).
     */
    public ProjectValorisationResultDTO evaluate(ProjectValorisationSnapshotDTO snapshot) {
        return engine.evaluate(snapshot);
    }

    ProjectValorisationSnapshotDTO loadSnapshot(Project project) {
        List<ProjectProduct> lines = projectProductRepository.findByProjectIdOrderByIdAsc(project.getId());
        Set<Long> productIds = lines.stream()
            .map(ProjectProduct::getProductId)
            .filter(Objects::nonNull)
            .collect(Collectors.toCollection(LinkedHashSet::new));

        List<CatalogProductDTO> products = new ArrayList<>();
        if (!productIds.isEmpty()) {
            Map<Long, List<KwhCumacEntryDTO>> kwhByProduct = kwhCumacRepository.findByProductIdInOrderByIdAsc(productIds)
                .stream()
                .collect(Collectors.groupingBy(ProductKwhCumac::getProductId, LinkedHashMap::new,
                    Collectors.mapping(this::toKwhCumacEntry, Collectors.toList())));

            productCatalogRepository.findByIdIn(productIds).forEach(product ->
                products.add(toCatalogProduct(product, kwhByProduct.getOrDefault(product.getId(), new ArrayList<>()))));
        }

        Double delegatePrice = Optional.ofNullable(project.getDelegateId())
            .flatMap(delegateRepository::findById)
            .map(Delegate::getPriceEurPerMwh)
            .map(BigDecimal::doubleValue)
            .orElse(null);

        Double bonification = Optional.ofNullable(project.getOrganizationId())
            .flatMap(primeSettingsRepository::findByOrganizationId)
            .map(OrganizationPrimeSettings::getPrimeBonification)
            .map(BigDecimal::doubleValue)
            .orElse(null);

        log.debug("Loaded snapshot of project {}: {} line(s), {} product(s), delegate price={}, bonification={}",
            project.getId(), lines.size(), products.size(), delegatePrice, bonification);

        return ProjectValorisationSnapshotDTO.builder()
            .projectId(project.getId())
            .buildingType(project.getBuildingType())
            .delegatePriceEurPerMwh(delegatePrice)
            .primeBonification(bonification)
            .lines(lines.stream().map(this::toLine).collect(Collectors.toList()))
            .products(products)
            .build();
    }

    private CatalogProductDTO toCatalogProduct(ProductCatalog entity, List<KwhCumacEntryDTO> kwhCumacValues) {
        Map<String, Object> defaultParams = parseObject(entity.getDefaultParams(), "default_params", entity.getId());
        Map<String, Object> rawCeeConfig = parseObject(entity.getCeeConfig(), "cee_config", entity.getId());

        return CatalogProductDTO.builder()
            .id(entity.getId())
            .code(entity.getCode())
            .name(entity.getName())
            .category(entity.getCategory())
            .paramsSchema(parseSchema(entity.getParamsSchema(), entity.getId()))
            .defaultParams(defaultParams)
            .ceeConfig(ceeConfigNormalizer.normalize(rawCeeConfig))
            .valorisationFormula(formulaNormalizer.fromProductParams(defaultParams,
                ceeConfigNormalizer.legacyDefaults(rawCeeConfig)))
            .kwhCumacValues(kwhCumacValues)
            .build();
    }

    private ProjectProductLineDTO toLine(ProjectProduct entity) {
        return ProjectProductLineDTO.builder()
            .id(entity.getId())
            .productId(entity.getProductId())
            .quantity(entity.getQuantity())
            .dynamicParams(parseObject(entity.getDynamicParams(), "dynamic_params", entity.getId()))
            .build();
    }

    private KwhCumacEntryDTO toKwhCumacEntry(ProductKwhCumac entity) {
        return KwhCumacEntryDTO.builder()
            .buildingType(entity.getBuildingType())
            .kwhCumac(entity.getKwhCumac() != null ? entity.getKwhCumac().doubleValue() : null)
            .build();
    }

    /**
     * The schema is stored either as an array of fields or as {@code {"fields": [...]}}.
     */
    List<ParamsSchemaField> parseSchema(String json, Long productId) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode fields = root.isArray() ? root : root.path("fields");
            if (!fields.isArray()) {
                return new ArrayList<>();
            }
            List<ParamsSchemaField> schema = new ArrayList<>();
            for (JsonNode field : fields) {
                if (!field.isObject() || !field.path("name").isTextual()) {
                    continue;
                }
                schema.add(ParamsSchemaField.builder()
                    .name(field.path("name").asText())
                    .label(field.path("label").isTextual() ? field.path("label").asText() : null)
                    .unit(field.path("unit").isTextual() ? field.path("unit").asText() : null)
                    .build());
            }
            return schema;
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse params_schema of product {}: {}", productId, e.getMessage());
            return new ArrayList<>();
        }
    }

    Map<String, Object> parseObject(String json, String column, Long id) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse {} of record {}: {}", column, id, e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
