package com.kpi.drivertree.init;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpi.drivertree.config.DriverTreeProperties;
import com.kpi.drivertree.entity.DriverTreeCategory;
import com.kpi.drivertree.repository.DriverTreeCategoryRepository;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds the category table with formula templates
 * Only runs in 'dev' profile
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class CategorySeeder implements CommandLineRunner {

    private final DriverTreeCategoryRepository categoryRepository;
    private final ObjectMapper objectMapper;
    private final DriverTreeProperties properties;

    @Override
    public void run(String... args) {
        if (categoryRepository.count() > 0) {
            log.info("Categories already present, skipping seeding");
            return;
        }

        log.info("Seeding driver tree categories from {}", properties.getSeedResource());

        List<CategorySeed> seeds = readSeeds();
        List<DriverTreeCategory> categories = new ArrayList<>(seeds.size());
        for (CategorySeed seed : seeds) {
            categories.add(DriverTreeCategory.builder()
                    .industryClass(seed.getIndustryClass())
                    .industry(seed.getIndustry())
                    .treeType(seed.getTreeType())
                    .kpi(seed.getKpi())
                    .formulas(new ArrayList<>(seed.getFormulas()))
                    .metadata(new HashMap<>(seed.getMetadata()))
                    .build());
        }

        categoryRepository.saveAll(categories);
        log.info("Seeded {} categories", categories.size());
    }

    private List<CategorySeed> readSeeds() {
        ClassPathResource resource = new ClassPathResource(properties.getSeedResource());
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<CategorySeed>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read category seed " + properties.getSeedResource(), e);
        }
    }

    @Data
    static class CategorySeed {
        private String industryClass;
        private String industry;
        private String treeType;
        private String kpi;
        private List<String> formulas = new ArrayList<>();
        private Map<String, Object> metadata = new HashMap<>();
    }
}
