package com.lynkvertx.primecee.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import javax.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Per-organization Prime CEE settings
 */
@Entity
@Table(name = "organization_prime_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationPrimeSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "prime_bonification", precision = 6, scale = 2)
    private BigDecimal primeBonification;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
