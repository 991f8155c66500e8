package com.kpi.drivertree.store;

import com.kpi.drivertree.entity.DriverTreeNode;
import com.kpi.drivertree.exception.NodeLabelConflictException;
import com.kpi.drivertree.exception.TreeConsistencyException;
import com.kpi.drivertree.repository.DriverTreeNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * {@link NodeStore} over the node repository.
 * Creation is an insert that skips taken labels, so a label held by another writer (committed or
 * still in flight) is reported as a conflict without invalidating the surrounding transaction.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JpaNodeStore implements NodeStore {

    private final DriverTreeNodeRepository nodeRepository;

    @Override
    public Optional<DriverTreeNode> findByLabel(String label) {
        return nodeRepository.findByLabel(label);
    }

    @Override
    public DriverTreeNode create(String label) {
        int inserted = nodeRepository.insertIfAbsent(label, LocalDateTime.now());
        if (inserted == 0) {
            throw new NodeLabelConflictException(label);
        }
        DriverTreeNode node = nodeRepository.findByLabel(label)
                .orElseThrow(() -> new TreeConsistencyException("Inserted node is not readable: " + label));
        log.debug("Created node '{}' (ID: {})", label, node.getId());
        return node;
    }

    @Override
    public void updateCoordinates(Long nodeId, int x, int y) {
        DriverTreeNode node = nodeRepository.findById(nodeId)
                .orElseThrow(() -> new TreeConsistencyException("Node not found for coordinate update: " + nodeId));
        node.setX(x);
        node.setY(y);
        nodeRepository.save(node);
    }
}
