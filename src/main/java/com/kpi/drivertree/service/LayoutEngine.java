package com.kpi.drivertree.service;

import com.kpi.drivertree.entity.DriverTree;
import com.kpi.drivertree.entity.DriverTreeNode;
import com.kpi.drivertree.exception.TreeConsistencyException;
import com.kpi.drivertree.store.NodeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns display coordinates to a forest of decompositions.
 * <p>
 * Pre-order depth-first walk: x is the depth below the root the walk started from and y is a
 * sequence number shared by every root of the batch. Nodes that already carry coordinates,
 * from this pass or an earlier batch, are skipped together with their subtrees, which makes
 * the pass idempotent and lets incremental batches keep existing positions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LayoutEngine {

    private final NodeStore nodeStore;

    /**
     * Lays out every root in order, starting the sequence at zero.
     * @param roots entry points, visited in the given order
     * @param forest decompositions keyed by root label
     * @param batchNodes every node of the batch; bounds the recursion depth
     * @return the next unused sequence value
     * @throws TreeConsistencyException if a child is not part of the batch or the depth bound is exceeded
     */
    public int layout(List<DriverTreeNode> roots, Map<String, DriverTree> forest,
                      Collection<DriverTreeNode> batchNodes) {
        Set<Long> knownIds = new HashSet<>();
        for (DriverTreeNode node : batchNodes) {
            knownIds.add(node.getId());
        }
        LayoutContext context = new LayoutContext(forest, knownIds, batchNodes.size());

        int counter = 0;
        for (DriverTreeNode root : roots) {
            counter = layoutNode(root, 0, counter, context);
        }

        log.info("Laid out {} nodes from {} roots", counter, roots.size());
        return counter;
    }

    /**
     * Lays out one node and its decomposition children.
     * @return the sequence value following the last node assigned in this subtree
     */
    int layoutNode(DriverTreeNode node, int depth, int counter, LayoutContext context) {
        if (depth > context.depthCeiling) {
            throw new TreeConsistencyException(String.format(
                    "Layout depth %d exceeds %d at node '%s', the forest contains a cycle",
                    depth, context.depthCeiling, node.getLabel()));
        }
        if (node.isLaidOut()) {
            return counter;
        }

        node.setX(depth);
        node.setY(counter);
        nodeStore.updateCoordinates(node.getId(), depth, counter);
        log.debug("Node '{}' -> ({}, {})", node.getLabel(), depth, counter);
        int next = counter + 1;

        DriverTree decomposition = context.forest.get(node.getLabel());
        if (decomposition == null) {
            return next;
        }

        for (DriverTreeNode child : decomposition.getChildren()) {
            if (child.getId() == null || !context.knownIds.contains(child.getId())) {
                throw new TreeConsistencyException(String.format(
                        "Decomposition of '%s' references node '%s' outside the batch",
                        node.getLabel(), child.getLabel()));
            }
            next = layoutNode(child, depth + 1, next, context);
        }
        return next;
    }

    static final class LayoutContext {
        private final Map<String, DriverTree> forest;
        private final Set<Long> knownIds;
        private final int depthCeiling;

        LayoutContext(Map<String, DriverTree> forest, Set<Long> knownIds, int depthCeiling) {
            this.forest = forest;
            this.knownIds = knownIds;
            this.depthCeiling = depthCeiling;
        }
    }
}
