package com.kpi.drivertree.service;

import com.kpi.drivertree.entity.DriverTreeCategory;
import com.kpi.drivertree.exception.CategoryNotFoundException;
import com.kpi.drivertree.repository.DriverTreeCategoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(DriverTreeCategoryService.class)
class DriverTreeCategoryServiceTest {

    @Autowired
    private DriverTreeCategoryService categoryService;

    @Autowired
    private DriverTreeCategoryRepository categoryRepository;

    @BeforeEach
    void setUp() {
        categoryRepository.save(category("Manufacturing", "Automotive", "volume_x_rate", "gross profit",
                "gross profit = revenue - cost of sales", "revenue = units * unit price"));
        categoryRepository.save(category("Manufacturing", "Automotive", "volume_x_rate", "operating profit",
                "operating profit = gross profit - expenses"));
        categoryRepository.save(category("Manufacturing", "Electronics", "volume_x_rate", "gross profit",
                "gross profit = revenue - cost of sales"));
        categoryRepository.save(category("Services", "Hotels", "rooms_x_occupancy", "revenue",
                "revenue = rooms sold * average daily rate"));
    }

    @Test
    void testGetFormulasKeepsOrder() {
        List<String> formulas = categoryService.getFormulas("volume_x_rate", "gross profit");

        assertEquals(List.of("gross profit = revenue - cost of sales", "revenue = units * unit price"), formulas);
    }

    @Test
    void testGetFormulasUnknownTemplate() {
        assertThrows(CategoryNotFoundException.class,
                () -> categoryService.getFormulas("volume_x_rate", "net profit"));
    }

    @Test
    void testGetCategoriesGroupsByIndustryClassAndIndustry() {
        Map<String, Map<String, List<String>>> categories = categoryService.getCategories();

        assertEquals(List.of("Manufacturing", "Services"), new ArrayList<>(categories.keySet()));
        assertEquals(List.of("Automotive", "Electronics"),
                new ArrayList<>(categories.get("Manufacturing").keySet()));
        // two KPIs share one tree type, which is listed once
        assertEquals(List.of("volume_x_rate"), categories.get("Manufacturing").get("Automotive"));
        assertEquals(List.of("rooms_x_occupancy"), categories.get("Services").get("Hotels"));
    }

    @Test
    void testMetadataRoundTrips() {
        DriverTreeCategory saved = categoryRepository.save(DriverTreeCategory.builder()
                .industryClass("Retail")
                .industry("Grocery")
                .treeType("basket_x_visits")
                .kpi("revenue")
                .formulas(new ArrayList<>(List.of("revenue = basket size * visits")))
                .metadata(Map.of("unit", "JPY", "weeks", 52))
                .build());
        categoryRepository.flush();

        DriverTreeCategory loaded = categoryRepository.findById(saved.getId()).orElseThrow();
        assertEquals("JPY", loaded.getMetadata().get("unit"));
    }

    private static DriverTreeCategory category(String industryClass, String industry, String treeType,
                                               String kpi, String... formulas) {
        return DriverTreeCategory.builder()
                .industryClass(industryClass)
                .industry(industry)
                .treeType(treeType)
                .kpi(kpi)
                .formulas(new ArrayList<>(List.of(formulas)))
                .build();
    }
}
