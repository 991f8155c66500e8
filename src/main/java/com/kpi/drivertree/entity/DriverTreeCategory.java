package com.kpi.drivertree.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Formula template for an industry and KPI, e.g. manufacturing / gross profit.
 */
@Entity
@Table(name = "driver_tree_categories")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverTreeCategory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String industryClass;

    @Column(nullable = false, length = 100)
    private String industry;

    @Column(nullable = false, length = 100)
    private String treeType;

    @Column(nullable = false, length = 100)
    private String kpi;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "driver_tree_category_formulas", joinColumns = @JoinColumn(name = "category_id"))
    @OrderColumn(name = "formula_order")
    @Column(name = "formula", nullable = false, length = 500)
    @Builder.Default
    private List<String> formulas = new ArrayList<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @Column(nullable = false)
    private LocalDateTime createdDate;

    @PrePersist
    protected void onCreate() {
        createdDate = LocalDateTime.now();
    }
}
