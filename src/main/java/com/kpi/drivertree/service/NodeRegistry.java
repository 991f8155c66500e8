package com.kpi.drivertree.service;

import com.kpi.drivertree.entity.DriverTreeNode;
import com.kpi.drivertree.exception.FormulaValidationException;
import com.kpi.drivertree.exception.NodeLabelConflictException;
import com.kpi.drivertree.exception.TreeConsistencyException;
import com.kpi.drivertree.store.NodeStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Label-deduplicating node lookup for a single generation batch.
 * <p>
 * Not a Spring bean: one instance is created per batch, owned by the request processing it
 * and dropped when the batch ends. Each label resolves to exactly one node for the lifetime
 * of the registry, either adopted from the store or created on first sight.
 */
@Slf4j
public class NodeRegistry {

    private final NodeStore nodeStore;
    private final Map<String, DriverTreeNode> nodesByLabel = new LinkedHashMap<>();
    private int createdCount;
    private int adoptedCount;

    public NodeRegistry(NodeStore nodeStore) {
        this.nodeStore = nodeStore;
    }

    /**
     * Returns the node for a label, creating it in the store the first time the label is seen.
     * @throws FormulaValidationException if the label is blank
     * @throws TreeConsistencyException if a lost creation race cannot be resolved by a fresh lookup
     */
    public DriverTreeNode findOrCreate(String label) {
        if (label == null || label.trim().isEmpty()) {
            throw new FormulaValidationException("Node label must not be empty");
        }

        DriverTreeNode cached = nodesByLabel.get(label);
        if (cached != null) {
            return cached;
        }

        DriverTreeNode node;
        Optional<DriverTreeNode> existing = nodeStore.findByLabel(label);
        if (existing.isPresent()) {
            node = existing.get();
            adoptedCount++;
            log.debug("Adopted stored node '{}' (ID: {})", label, node.getId());
        } else {
            node = createOrAdoptWinner(label);
        }

        nodesByLabel.put(label, node);
        return node;
    }

    private DriverTreeNode createOrAdoptWinner(String label) {
        try {
            DriverTreeNode created = nodeStore.create(label);
            createdCount++;
            return created;
        } catch (NodeLabelConflictException e) {
            log.warn("Node '{}' was created by a concurrent writer, retrying lookup", label);
            DriverTreeNode winner = nodeStore.findByLabel(label)
                    .orElseThrow(() -> new TreeConsistencyException(
                            "Node '" + label + "' reported as taken but not found on retry"));
            adoptedCount++;
            return winner;
        }
    }

    /**
     * Nodes in the order their labels were first requested.
     */
    public List<DriverTreeNode> nodes() {
        return new ArrayList<>(nodesByLabel.values());
    }

    public int size() {
        return nodesByLabel.size();
    }

    public int createdCount() {
        return createdCount;
    }

    public int adoptedCount() {
        return adoptedCount;
    }
}
