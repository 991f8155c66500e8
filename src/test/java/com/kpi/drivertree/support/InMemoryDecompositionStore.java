package com.kpi.drivertree.support;

import com.kpi.drivertree.entity.DriverTree;
import com.kpi.drivertree.entity.DriverTreeNode;
import com.kpi.drivertree.entity.FormulaOperator;
import com.kpi.drivertree.store.DecompositionStore;

import java.util.ArrayList;
import java.util.List;

public class InMemoryDecompositionStore implements DecompositionStore {

    private final List<DriverTree> trees = new ArrayList<>();
    private long nextId = 1;

    @Override
    public DriverTree create(DriverTreeNode root, FormulaOperator operator, List<DriverTreeNode> children) {
        DriverTree tree = DriverTree.builder()
                .id(nextId++)
                .rootNode(root)
                .operator(operator)
                .children(new ArrayList<>(children))
                .build();
        trees.add(tree);
        return tree;
    }

    public List<DriverTree> getTrees() {
        return trees;
    }
}
