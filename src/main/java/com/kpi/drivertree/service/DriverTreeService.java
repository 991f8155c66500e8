package com.kpi.drivertree.service;

import com.kpi.drivertree.dto.DecompositionView;
import com.kpi.drivertree.entity.DriverTree;
import com.kpi.drivertree.exception.DriverTreeException;
import com.kpi.drivertree.exception.TreeNotFoundException;
import com.kpi.drivertree.repository.DriverTreeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for generating driver trees from formulas.
 * <p>
 * A batch is one transaction: node creation, decomposition creation and coordinate updates
 * commit together, and any failure (including the transaction timeout) rolls all of them back.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DriverTreeService {

    private final TreeBuilder treeBuilder;
    private final LayoutEngine layoutEngine;
    private final CategoryProvider categoryProvider;
    private final DriverTreeRepository treeRepository;

    /**
     * Generate laid-out decompositions for a batch of formulas
     * @param formulas e.g. ["profit = revenue - cost", "revenue = quantity * price"]
     * @return decompositions keyed by root label; a root defined twice maps to its last formula
     */
    @Transactional
    public Map<String, DecompositionView> generateTrees(List<String> formulas) {
        log.info("Generating driver trees from {} formulas", formulas == null ? 0 : formulas.size());

        try {
            TreeBuildResult result = treeBuilder.build(formulas);
            layoutEngine.layout(result.getLayoutRoots(), result.getForest(), result.getRegistry().nodes());

            Map<String, DecompositionView> views = new LinkedHashMap<>();
            for (Map.Entry<String, DriverTree> entry : result.getForest().entrySet()) {
                views.put(entry.getKey(), DecompositionView.from(entry.getValue()));
            }

            log.info("Generated {} driver trees from {} decompositions",
                    views.size(), result.getDecompositions().size());
            return views;
        } catch (DriverTreeException e) {
            log.error("Driver tree generation rejected ({}) at formula #{}: {}",
                    e.getKind(), e.getFormulaIndex(), e.getMessage());
            throw e;
        }
    }

    /**
     * Generate decompositions from the template registered for a tree type and KPI
     */
    @Transactional
    public Map<String, DecompositionView> generateTreesForCategory(String treeType, String kpi) {
        List<String> formulas = categoryProvider.getFormulas(treeType, kpi);
        return generateTrees(formulas);
    }

    /**
     * Get a stored decomposition
     */
    @Transactional(readOnly = true)
    public DecompositionView getTree(Long id) {
        DriverTree tree = treeRepository.findById(id)
                .orElseThrow(() -> new TreeNotFoundException(id));
        return DecompositionView.from(tree);
    }
}
