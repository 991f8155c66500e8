package com.kpi.drivertree.repository;

import com.kpi.drivertree.entity.DriverTreeCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DriverTreeCategoryRepository extends JpaRepository<DriverTreeCategory, Long> {

    /**
     * Find categories for a tree type and KPI, in insertion order
     */
    List<DriverTreeCategory> findByTreeTypeAndKpiOrderByIdAsc(String treeType, String kpi);

    /**
     * All categories ordered for grouping by industry class and industry
     */
    List<DriverTreeCategory> findAllByOrderByIdAsc();
}
