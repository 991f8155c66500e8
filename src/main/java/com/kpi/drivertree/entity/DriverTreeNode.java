package com.kpi.drivertree.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One factor of a decomposition, e.g. "revenue".
 * The label is unique across storage; x and y stay null until the layout pass reaches the node.
 */
@Entity
@Table(name = "driver_tree_nodes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverTreeNode {

    public static final int MAX_LABEL_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = MAX_LABEL_LENGTH)
    private String label;

    private Integer x; // depth from the root that first reached this node

    private Integer y; // pre-order sequence within the layout pass

    @Column(nullable = false)
    private LocalDateTime createdDate;

    private LocalDateTime updatedDate;

    public boolean isLaidOut() {
        return x != null && y != null;
    }

    @PrePersist
    protected void onCreate() {
        createdDate = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedDate = LocalDateTime.now();
    }
}
