package com.kpi.drivertree.dto;

import com.kpi.drivertree.entity.DriverTreeNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A node as handed to the caller: identity, label and layout coordinates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeView {
    private Long id;
    private String label;
    private Integer x;
    private Integer y;

    public static NodeView from(DriverTreeNode node) {
        return NodeView.builder()
                .id(node.getId())
                .label(node.getLabel())
                .x(node.getX())
                .y(node.getY())
                .build();
    }
}
