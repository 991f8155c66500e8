package com.kpi.drivertree.service;

import com.kpi.drivertree.entity.DriverTreeCategory;
import com.kpi.drivertree.exception.CategoryNotFoundException;
import com.kpi.drivertree.repository.DriverTreeCategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CategoryProvider} backed by the category table
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DriverTreeCategoryService implements CategoryProvider {

    private final DriverTreeCategoryRepository categoryRepository;

    @Override
    @Transactional(readOnly = true)
    public List<String> getFormulas(String treeType, String kpi) {
        List<DriverTreeCategory> categories = categoryRepository.findByTreeTypeAndKpiOrderByIdAsc(treeType, kpi);
        if (categories.isEmpty()) {
            log.warn("No formulas for tree type '{}' and KPI '{}'", treeType, kpi);
            throw new CategoryNotFoundException(treeType, kpi);
        }

        List<String> formulas = new ArrayList<>(categories.get(0).getFormulas());
        log.info("Found {} formulas for tree type '{}' and KPI '{}'", formulas.size(), treeType, kpi);
        return formulas;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Map<String, List<String>>> getCategories() {
        List<DriverTreeCategory> categories = categoryRepository.findAllByOrderByIdAsc();

        Map<String, Map<String, List<String>>> result = new LinkedHashMap<>();
        for (DriverTreeCategory category : categories) {
            List<String> treeTypes = result
                    .computeIfAbsent(category.getIndustryClass(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(category.getIndustry(), k -> new ArrayList<>());
            if (!treeTypes.contains(category.getTreeType())) {
                treeTypes.add(category.getTreeType());
            }
        }

        log.info("Retrieved {} categories", categories.size());
        return result;
    }
}
