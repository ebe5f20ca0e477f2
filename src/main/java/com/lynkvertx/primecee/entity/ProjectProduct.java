package com.lynkvertx.primecee.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.math.BigDecimal;

/**
 * Product line of a project, with the values entered for the product's dynamic params
 */
@Entity
@Table(name = "project_products")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectProduct {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(precision = 12, scale = 2)
    private BigDecimal quantity;

    @Column(name = "dynamic_params", columnDefinition = "JSON")
    private String dynamicParams;
}
