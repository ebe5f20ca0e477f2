package com.lynkvertx.primecee.repository;

import com.lynkvertx.primecee.entity.OrganizationPrimeSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Organization Prime Settings Repository
 */
@Repository
public interface OrganizationPrimeSettingsRepository extends JpaRepository<OrganizationPrimeSettings, Long> {

    Optional<OrganizationPrimeSettings> findByOrganizationId(Long organizationId);
}
