package com.lynkvertx.primecee.repository;

import com.lynkvertx.primecee.entity.ProjectProduct;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Project Product Line Repository
 */
@Repository
public interface ProjectProductRepository extends JpaRepository<ProjectProduct, Long> {

    /**
     * Find the lines of a project in insertion order
     */
    List<ProjectProduct> findByProjectIdOrderByIdAsc(Long projectId);
}
