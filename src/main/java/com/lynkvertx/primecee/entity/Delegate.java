package com.lynkvertx.primecee.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.math.BigDecimal;

/**
 * CEE delegate (obligated party) buying the energy savings of a project
 */
@Entity
@Table(name = "delegates")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Delegate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    /** Purchase rate in EUR per MWh cumac */
    @Column(name = "price_eur_per_mwh", precision = 10, scale = 2)
    private BigDecimal priceEurPerMwh;
}
