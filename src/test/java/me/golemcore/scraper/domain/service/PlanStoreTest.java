package me.golemcore.scraper.domain.service;

import me.golemcore.scraper.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.scraper.domain.exception.RegistryIOException;
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.ScrapingSelector;
import me.golemcore.scraper.domain.model.action.NavigateAction;
import me.golemcore.scraper.infrastructure.config.AutoConfiguration;
import me.golemcore.scraper.infrastructure.config.ScraperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanStoreTest {

    @TempDir
    Path tempDir;

    private PlanStore planStore;

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        planStore = new PlanStore(storage, new PlanCodec(AutoConfiguration.objectMapper()), properties);
    }

    @Test
    void shouldSavePlanUnderDomainDirectory() {
        Plan plan = plan();

        String path = planStore.save(plan);

        assertEquals(plan.getRelativePath(), path);
        assertTrue(path.startsWith("shop.example.com/shop_v1.0_"));
        assertTrue(Files.exists(tempDir.resolve("scraping_plans").resolve(path)));
        assertTrue(planStore.exists(path));
    }

    @Test
    void shouldLoadSavedPlan() {
        Plan plan = plan();
        String path = planStore.save(plan);

        Plan loaded = planStore.load(path);

        assertEquals(plan.getUrl(), loaded.getUrl());
        assertEquals(plan.getSteps(), loaded.getSteps());
        assertEquals(plan.getSelectors(), loaded.getSelectors());
        assertEquals(plan.getFingerprint(), loaded.getFingerprint());
    }

    @Test
    void shouldFailForMissingPlanFile() {
        RegistryIOException error = assertThrows(RegistryIOException.class,
                () -> planStore.load("nowhere.com/none.json"));
        assertTrue(error.getMessage().startsWith("Plan file not found"));
    }

    @Test
    void shouldFailForCorruptPlanFile() throws Exception {
        Path file = tempDir.resolve("scraping_plans").resolve("broken.json");
        Files.writeString(file, "{\"steps\": [");

        assertThrows(RegistryIOException.class, () -> planStore.load("broken.json"));
    }

    @Test
    void shouldDeletePlanFile() {
        String path = planStore.save(plan());

        planStore.delete(path);

        assertFalse(planStore.exists(path));
    }

    private static Plan plan() {
        return Plan.builder()
                .url("https://shop.example.com/")
                .name("shop")
                .objective("Collect product titles")
                .steps(List.of(NavigateAction.builder().url("https://shop.example.com/").build()))
                .selectors(List.of(ScrapingSelector.builder().name("titles").selector("h2").multiple(true).build()))
                .build();
    }
}
