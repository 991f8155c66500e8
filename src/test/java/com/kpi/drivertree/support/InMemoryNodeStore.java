package com.kpi.drivertree.support;

import com.kpi.drivertree.entity.DriverTreeNode;
import com.kpi.drivertree.exception.NodeLabelConflictException;
import com.kpi.drivertree.store.NodeStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed node store for unit tests. Records every call so tests can assert on store traffic.
 */
public class InMemoryNodeStore implements NodeStore {

    private final Map<String, DriverTreeNode> nodesByLabel = new LinkedHashMap<>();
    private final List<String> createdLabels = new ArrayList<>();
    private final List<String> lookups = new ArrayList<>();
    private long nextId = 1;

    @Override
    public Optional<DriverTreeNode> findByLabel(String label) {
        lookups.add(label);
        return Optional.ofNullable(nodesByLabel.get(label));
    }

    @Override
    public DriverTreeNode create(String label) {
        if (nodesByLabel.containsKey(label)) {
            throw new NodeLabelConflictException(label);
        }
        DriverTreeNode node = DriverTreeNode.builder()
                .id(nextId++)
                .label(label)
                .build();
        nodesByLabel.put(label, node);
        createdLabels.add(label);
        return node;
    }

    @Override
    public void updateCoordinates(Long nodeId, int x, int y) {
        DriverTreeNode node = nodesByLabel.values().stream()
                .filter(n -> n.getId().equals(nodeId))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown node " + nodeId));
        node.setX(x);
        node.setY(y);
    }

    /**
     * Stores a node as if another batch had created it earlier.
     */
    public DriverTreeNode preload(String label, Integer x, Integer y) {
        DriverTreeNode node = DriverTreeNode.builder()
                .id(nextId++)
                .label(label)
                .x(x)
                .y(y)
                .build();
        nodesByLabel.put(label, node);
        return node;
    }

    public int size() {
        return nodesByLabel.size();
    }

    public List<String> getCreatedLabels() {
        return createdLabels;
    }

    public List<String> getLookups() {
        return lookups;
    }

    public DriverTreeNode get(String label) {
        return nodesByLabel.get(label);
    }
}
