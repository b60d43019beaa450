package me.golemcore.scraper.tools;

import me.golemcore.scraper.domain.exception.PlanValidationException;
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.PlanSaveResult;
import me.golemcore.scraper.domain.model.PlanSummary;
import me.golemcore.scraper.domain.model.ToolFailureKind;
import me.golemcore.scraper.domain.model.ToolResult;
import me.golemcore.scraper.domain.service.PlanCodec;
import me.golemcore.scraper.domain.service.ScrapingToolkit;
import me.golemcore.scraper.infrastructure.config.AutoConfiguration;
import me.golemcore.scraper.infrastructure.config.ScraperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScrapingPlanToolTest {

    private static final String URL = "https://shop.example.com/products";

    private ScrapingToolkit toolkit;
    private ScrapingPlanTool tool;

    @BeforeEach
    void setUp() {
        toolkit = mock(ScrapingToolkit.class);
        tool = new ScrapingPlanTool(toolkit, new PlanCodec(AutoConfiguration.objectMapper()), new ScraperProperties());
    }

    @Test
    void shouldRejectUnknownOperation() {
        ToolResult result = tool.execute(Map.of("operation", "export")).join();

        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
        assertTrue(result.getError().startsWith("Unknown operation: export"));
    }

    // ===== list =====

    @Test
    void shouldListPlans() {
        when(toolkit.planList("shop.example.com", null)).thenReturn(List.of(PlanSummary.builder()
                .name("products").version("1.0").url(URL).useCount(3).build()));

        ToolResult result = tool.execute(Map.of("operation", "list", "domain", "shop.example.com")).join();

        assertTrue(result.isSuccess());
        assertEquals("Saved plans (1):\n- products v1.0 " + URL + " (used 3x)", result.getOutput());
    }

    @Test
    void shouldReportEmptyList() {
        when(toolkit.planList(null, null)).thenReturn(List.of());

        ToolResult result = tool.execute(Map.of("operation", "list")).join();

        assertEquals("No saved plans", result.getOutput());
    }

    // ===== load / delete =====

    @Test
    void shouldLoadPlanAsJson() {
        when(toolkit.planLoad(URL)).thenReturn(Optional.of(Plan.builder().url(URL).name("products").build()));

        ToolResult result = tool.execute(Map.of("operation", "load", "url", URL)).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("\"name\""));
        assertTrue(result.getOutput().contains("\"products\""));
    }

    @Test
    void shouldFailLoadWithoutKeyOrPlan() {
        when(toolkit.planLoad("ghost")).thenReturn(Optional.empty());

        assertEquals(ToolFailureKind.INVALID_INPUT,
                tool.execute(Map.of("operation", "load")).join().getFailureKind());
        assertEquals("No saved plan for ghost",
                tool.execute(Map.of("operation", "load", "name", "ghost")).join().getError());
    }

    @Test
    void shouldDeletePlanAndFileByDefault() {
        when(toolkit.planDelete("products", true)).thenReturn(true);

        ToolResult result = tool.execute(Map.of("operation", "delete", "name", "products")).join();

        assertTrue(result.isSuccess());
        verify(toolkit).planDelete("products", true);
    }

    @Test
    void shouldReportDeleteOfUnknownPlan() {
        when(toolkit.planDelete("ghost", false)).thenReturn(false);

        ToolResult result = tool.execute(Map.of("operation", "delete", "name", "ghost", "delete_file", false)).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
    }

    // ===== save / create =====

    @Test
    void shouldSaveInlinePlan() {
        when(toolkit.planSave(any(Plan.class), eq(true))).thenReturn(PlanSaveResult.builder()
                .success(true)
                .message("Plan saved and registered successfully.")
                .name("products")
                .path("shop.example.com/products_v1.0_abc.json")
                .build());

        ToolResult result = tool.execute(Map.of("operation", "save", "overwrite", true,
                "plan", Map.of("url", URL, "name", "products"))).join();

        assertTrue(result.isSuccess());
        assertEquals("Plan saved and registered successfully. (shop.example.com/products_v1.0_abc.json)",
                result.getOutput());
    }

    @Test
    void shouldReportRefusedSave() {
        when(toolkit.planSave(any(Plan.class), eq(false)))
                .thenReturn(PlanSaveResult.failure("Plan already exists. Use overwrite=true to replace it."));

        ToolResult result = tool.execute(Map.of("operation", "save", "plan", Map.of("url", URL))).join();

        assertFalse(result.isSuccess());
        assertEquals(Boolean.FALSE, ((Map<?, ?>) result.getData()).get("saved"));
    }

    @Test
    void shouldRequirePlanForSave() {
        ToolResult result = tool.execute(Map.of("operation", "save")).join();

        assertEquals("plan is required", result.getError());
    }

    @Test
    void shouldCreatePlanWithoutSaving() {
        Plan plan = Plan.builder().url(URL).objective("Collect names").build();
        when(toolkit.planCreate(eq(URL), eq("Collect names"), isNull(), eq(false)))
                .thenReturn(CompletableFuture.completedFuture(plan));

        ToolResult result = tool.execute(Map.of("operation", "create", "url", URL,
                "objective", "Collect names")).join();

        assertTrue(result.isSuccess());
        verify(toolkit, never()).planSave(any(), anyBoolean());
    }

    @Test
    void shouldCreateAndSavePlan() {
        Plan plan = Plan.builder().url(URL).objective("Collect names").build();
        when(toolkit.planCreate(eq(URL), eq("Collect names"), isNull(), eq(true)))
                .thenReturn(CompletableFuture.completedFuture(plan));
        when(toolkit.planSave(plan, false)).thenReturn(PlanSaveResult.builder()
                .success(true).message("Plan saved and registered successfully.").path("p.json").build());

        ToolResult result = tool.execute(Map.of("operation", "create", "url", URL,
                "objective", "Collect names", "save", true, "force_regenerate", true)).join();

        assertTrue(result.isSuccess());
        verify(toolkit).planSave(plan, false);
    }

    @Test
    void shouldRequireObjectiveForCreate() {
        ToolResult result = tool.execute(Map.of("operation", "create", "url", URL)).join();

        assertEquals("objective is required", result.getError());
    }

    @Test
    void shouldMapGenerationFailureToInvalidInput() {
        when(toolkit.planCreate(eq(URL), eq("Collect names"), isNull(), eq(false)))
                .thenReturn(CompletableFuture.failedFuture(
                        new PlanValidationException("Plan response has no 'steps' array", "{}")));

        ToolResult result = tool.execute(Map.of("operation", "create", "url", URL,
                "objective", "Collect names")).join();

        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
    }
}
