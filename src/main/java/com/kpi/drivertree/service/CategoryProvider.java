package com.kpi.drivertree.service;

import com.kpi.drivertree.exception.CategoryNotFoundException;

import java.util.List;
import java.util.Map;

/**
 * Source of formula templates by industry and KPI.
 */
public interface CategoryProvider {

    /**
     * @throws CategoryNotFoundException if no template matches
     */
    List<String> getFormulas(String treeType, String kpi);

    /**
     * @return industry class -> industry -> tree types
     */
    Map<String, Map<String, List<String>>> getCategories();
}
