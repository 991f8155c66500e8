package com.kpi.drivertree.repository;

import com.kpi.drivertree.entity.DriverTreeNode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface DriverTreeNodeRepository extends JpaRepository<DriverTreeNode, Long> {

    /**
     * Find node by its label
     */
    Optional<DriverTreeNode> findByLabel(String label);

    /**
     * Insert a node for the label unless one is already stored.
     * Returns 0 when another writer holds the label; if that writer has not committed yet the
     * insert waits for it. No constraint violation is raised either way.
     */
    @Modifying
    @Query(value = "INSERT INTO driver_tree_nodes (label, created_date) VALUES (:label, :createdDate) " +
           "ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(@Param("label") String label, @Param("createdDate") LocalDateTime createdDate);
}
