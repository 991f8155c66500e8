package com.kpi.drivertree.service;

import com.kpi.drivertree.entity.DriverTree;
import com.kpi.drivertree.entity.DriverTreeNode;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Output of one tree building run, before layout.
 */
@Data
@Builder
public class TreeBuildResult {

    /**
     * Decompositions keyed by root label, in first-seen order. A repeated root keeps the last formula.
     */
    private final Map<String, DriverTree> forest;

    /**
     * Every decomposition created, one per formula, in input order.
     */
    private final List<DriverTree> decompositions;

    /**
     * Entry points for the layout pass: top-level roots first, then the remaining roots.
     */
    private final List<DriverTreeNode> layoutRoots;

    private final NodeRegistry registry;
}
