package com.lynkvertx.primecee.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import javax.persistence.*;
import java.time.LocalDateTime;

/**
 * Catalog product entity
 * Product definition with its dynamic params schema and CEE pricing rules (JSON columns)
 */
@Entity
@Table(name = "product_catalog")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductCatalog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String code;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 100)
    private String category;

    @Column(name = "organization_id")
    private Long organizationId;

    @Column(name = "params_schema", columnDefinition = "JSON")
    private String paramsSchema;

    @Column(name = "default_params", columnDefinition = "JSON")
    private String defaultParams;

    @Column(name = "cee_config", columnDefinition = "JSON")
    private String ceeConfig;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
