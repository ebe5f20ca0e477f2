package com.lynkvertx.primecee.repository;

import com.lynkvertx.primecee.entity.ProductCatalog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Catalog Product Repository
 */
@Repository
public interface ProductCatalogRepository extends JpaRepository<ProductCatalog, Long> {

    /**
     * Find the catalog products referenced by a set of project lines
     */
    List<ProductCatalog> findByIdIn(Collection<Long> ids);
}
