package com.kpi.drivertree.store;

import com.kpi.drivertree.entity.DriverTree;
import com.kpi.drivertree.entity.DriverTreeNode;
import com.kpi.drivertree.entity.FormulaOperator;
import com.kpi.drivertree.repository.DriverTreeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaDecompositionStore implements DecompositionStore {

    private final DriverTreeRepository treeRepository;

    @Override
    public DriverTree create(DriverTreeNode root, FormulaOperator operator, List<DriverTreeNode> children) {
        DriverTree tree = DriverTree.builder()
                .rootNode(root)
                .operator(operator)
                .children(new ArrayList<>(children))
                .build();
        return treeRepository.save(tree);
    }
}
