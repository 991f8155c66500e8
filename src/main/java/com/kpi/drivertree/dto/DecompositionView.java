package com.kpi.drivertree.dto;

import com.kpi.drivertree.entity.DriverTree;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One decomposition as handed to the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecompositionView {

    private Long id;

    private NodeView root;

    /**
     * Operator symbol ("+", "-", "*", "/", "%"), null for a bare alias
     */
    private String operator;

    /**
     * Children in formula order
     */
    private List<NodeView> children;

    public static DecompositionView from(DriverTree tree) {
        return DecompositionView.builder()
                .id(tree.getId())
                .root(NodeView.from(tree.getRootNode()))
                .operator(tree.getOperator() == null ? null : tree.getOperator().symbolString())
                .children(tree.getChildren().stream().map(NodeView::from).toList())
                .build();
    }
}
