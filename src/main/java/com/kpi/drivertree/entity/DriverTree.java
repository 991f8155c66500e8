package com.kpi.drivertree.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * The result of one formula: a root node joined to its ordered children by a single operator.
 * A bare alias ("a = b") has a single child and no operator.
 */
@Entity
@Table(name = "driver_trees")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverTree {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "root_node_id", nullable = false)
    private DriverTreeNode rootNode;

    @Column(length = 10)
    private FormulaOperator operator;

    @ManyToMany
    @JoinTable(
            name = "driver_tree_children",
            joinColumns = @JoinColumn(name = "driver_tree_id"),
            inverseJoinColumns = @JoinColumn(name = "child_node_id"))
    @OrderColumn(name = "child_order")
    @ToString.Exclude
    @Builder.Default
    private List<DriverTreeNode> children = new ArrayList<>();

    @Column(nullable = false)
    private LocalDateTime createdDate;

    @PrePersist
    protected void onCreate() {
        createdDate = LocalDateTime.now();
    }
}
