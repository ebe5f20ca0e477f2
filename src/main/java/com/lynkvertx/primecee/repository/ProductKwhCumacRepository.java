package com.lynkvertx.primecee.repository;

import com.lynkvertx.primecee.entity.ProductKwhCumac;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * kWh Cumac Reference Repository
 */
@Repository
public interface ProductKwhCumacRepository extends JpaRepository<ProductKwhCumac, Long> {

    List<ProductKwhCumac> findByProductIdInOrderByIdAsc(Collection<Long> productIds);
}
