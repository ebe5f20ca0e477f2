package com.lynkvertx.primecee.repository;

import com.lynkvertx.primecee.entity.Delegate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Delegate Repository
 */
@Repository
public interface DelegateRepository extends JpaRepository<Delegate, Long> {
}
