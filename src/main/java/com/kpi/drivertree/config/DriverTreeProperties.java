package com.kpi.drivertree.config;

import com.kpi.drivertree.entity.DriverTreeNode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "driver-tree")
public class DriverTreeProperties {
    /**
     * Longest accepted label; values above the label column width are capped to it.
     */
    private int maxLabelLength = DriverTreeNode.MAX_LABEL_LENGTH;
    private int generationTimeoutSeconds = 30;
    private String seedResource = "seed/driver_tree_categories.json";
}
