package com.kpi.drivertree.store;

import com.kpi.drivertree.entity.DriverTree;
import com.kpi.drivertree.entity.DriverTreeNode;
import com.kpi.drivertree.entity.FormulaOperator;

import java.util.List;

/**
 * Persistence gateway for decomposition records.
 */
public interface DecompositionStore {

    /**
     * @param operator null for a bare alias
     */
    DriverTree create(DriverTreeNode root, FormulaOperator operator, List<DriverTreeNode> children);
}
