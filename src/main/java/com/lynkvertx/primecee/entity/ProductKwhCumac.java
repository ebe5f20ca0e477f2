package com.lynkvertx.primecee.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.math.BigDecimal;

/**
 * kWh cumac reference of a product for one building type
 */
@Entity
@Table(name = "product_kwh_cumac")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductKwhCumac {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "building_type", nullable = false, length = 100)
    private String buildingType;

    @Column(name = "kwh_cumac", precision = 14, scale = 4)
    private BigDecimal kwhCumac;
}
