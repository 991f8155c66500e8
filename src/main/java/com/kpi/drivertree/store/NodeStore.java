package com.kpi.drivertree.store;

import com.kpi.drivertree.entity.DriverTreeNode;
import com.kpi.drivertree.exception.NodeLabelConflictException;

import java.util.Optional;

/**
 * Persistence gateway behind the node registry.
 */
public interface NodeStore {

    Optional<DriverTreeNode> findByLabel(String label);

    /**
     * Creates a node with the label and no coordinates.
     * @throws NodeLabelConflictException if another writer already stored the label
     */
    DriverTreeNode create(String label);

    void updateCoordinates(Long nodeId, int x, int y);
}
