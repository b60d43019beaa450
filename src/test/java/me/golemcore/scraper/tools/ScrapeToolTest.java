package me.golemcore.scraper.tools;

import me.golemcore.scraper.domain.exception.ConfigurationException;
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.ScrapeRequest;
import me.golemcore.scraper.domain.model.ScrapingResult;
import me.golemcore.scraper.domain.model.StepError;
import me.golemcore.scraper.domain.model.ToolFailureKind;
import me.golemcore.scraper.domain.model.ToolResult;
import me.golemcore.scraper.domain.model.action.ClickAction;
import me.golemcore.scraper.domain.model.action.NavigateAction;
import me.golemcore.scraper.domain.service.PlanCodec;
import me.golemcore.scraper.domain.service.ScrapingToolkit;
import me.golemcore.scraper.infrastructure.config.AutoConfiguration;
import me.golemcore.scraper.infrastructure.config.ScraperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScrapeToolTest {

    private static final String URL = "https://shop.example.com/products";

    private ScrapingToolkit toolkit;
    private ScraperProperties properties;
    private ScrapeTool tool;

    @BeforeEach
    void setUp() {
        toolkit = mock(ScrapingToolkit.class);
        properties = new ScraperProperties();
        tool = new ScrapeTool(toolkit, new PlanCodec(AutoConfiguration.objectMapper()), properties);
    }

    // ===== definition =====

    @Test
    void shouldDescribeParameters() {
        assertEquals("scrape", tool.getToolName());
        assertEquals("tool", tool.getComponentType());
        Map<String, Object> schema = tool.getDefinition().getInputSchema();
        assertEquals(List.of("url"), schema.get("required"));
        assertTrue(((Map<?, ?>) schema.get("properties")).containsKey("steps"));
    }

    @Test
    void shouldFollowToolsEnabledFlag() {
        assertTrue(tool.isEnabled());

        properties.getTools().setEnabled(false);

        assertFalse(tool.isEnabled());
    }

    // ===== input validation =====

    @Test
    void shouldRejectMissingUrl() {
        ToolResult result = tool.execute(Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
        verify(toolkit, never()).scrape(any());
    }

    @Test
    void shouldRejectNonHttpSchemes() {
        ToolResult result = tool.execute(Map.of("url", "file:///etc/passwd")).join();

        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
        assertEquals("Only http and https URLs are allowed", result.getError());
    }

    @Test
    void shouldAddHttpsToBareHost() {
        when(toolkit.scrape(any())).thenReturn(CompletableFuture.completedFuture(success("https://example.com")));

        tool.execute(Map.of("url", "example.com")).join();

        ArgumentCaptor<ScrapeRequest> request = ArgumentCaptor.forClass(ScrapeRequest.class);
        verify(toolkit).scrape(request.capture());
        assertEquals("https://example.com", request.getValue().getUrl());
    }

    @Test
    void shouldRejectUnknownSavedPlanName() {
        when(toolkit.planLoad("missing")).thenReturn(Optional.empty());

        ToolResult result = tool.execute(Map.of("url", URL, "plan_name", "missing")).join();

        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
        assertTrue(result.getError().contains("missing"));
    }

    @Test
    void shouldRejectUnknownStepAction() {
        ToolResult result = tool.execute(Map.of("url", URL,
                "steps", List.of(Map.of("action", "teleport")))).join();

        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
    }

    // ===== request building =====

    @Test
    void shouldPassRawStepsAndSelectors() {
        when(toolkit.scrape(any())).thenReturn(CompletableFuture.completedFuture(success(URL)));
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("url", URL);
        parameters.put("steps", List.of(
                Map.of("action", "navigate", "url", URL),
                Map.of("action", "click", "selector", "#more")));
        parameters.put("selectors", List.of(Map.of("name", "titles", "selector", "h2", "multiple", true)));
        parameters.put("config", Map.of("driver_type", "playwright"));

        tool.execute(parameters).join();

        ArgumentCaptor<ScrapeRequest> captor = ArgumentCaptor.forClass(ScrapeRequest.class);
        verify(toolkit).scrape(captor.capture());
        ScrapeRequest request = captor.getValue();
        assertInstanceOf(NavigateAction.class, request.getSteps().get(0));
        assertEquals("#more", ((ClickAction) request.getSteps().get(1)).getSelector());
        assertTrue(request.getSelectors().get(0).isMultiple());
        assertEquals(Map.of("driver_type", "playwright"), request.getConfigOverrides());
        assertNull(request.getPlan());
    }

    @Test
    void shouldFillInlinePlanUrl() {
        when(toolkit.scrape(any())).thenReturn(CompletableFuture.completedFuture(success(URL)));

        tool.execute(Map.of("url", URL, "plan", Map.of("name", "inline",
                "steps", List.of(Map.of("action", "scroll", "direction", "down"))))).join();

        ArgumentCaptor<ScrapeRequest> captor = ArgumentCaptor.forClass(ScrapeRequest.class);
        verify(toolkit).scrape(captor.capture());
        Plan plan = captor.getValue().getPlan();
        assertEquals(URL, plan.getUrl());
        assertEquals("inline", plan.getName());
    }

    @Test
    void shouldUseSavedPlanByName() {
        Plan saved = Plan.builder().url(URL).name("products").build();
        when(toolkit.planLoad("products")).thenReturn(Optional.of(saved));
        when(toolkit.scrape(any())).thenReturn(CompletableFuture.completedFuture(success(URL)));

        tool.execute(Map.of("url", URL, "plan_name", "products", "save_plan", "true")).join();

        ArgumentCaptor<ScrapeRequest> captor = ArgumentCaptor.forClass(ScrapeRequest.class);
        verify(toolkit).scrape(captor.capture());
        assertSame(saved, captor.getValue().getPlan());
        assertTrue(captor.getValue().isSavePlan());
    }

    // ===== results =====

    @Test
    void shouldReportExtractedData() {
        ScrapingResult scraped = success(URL);
        scraped.getExtractedData().put("titles", List.of("Lamp", "Chair"));
        scraped.getStepErrors().add(StepError.builder().stepIndex(1).action("click").error("not found").build());
        when(toolkit.scrape(any())).thenReturn(CompletableFuture.completedFuture(scraped));

        ToolResult result = tool.execute(Map.of("url", URL)).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Scraped " + URL + " (2/2 steps, 1 failed)"));
        assertTrue(result.getOutput().contains("Lamp"));
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals(Map.of("titles", List.of("Lamp", "Chair")), data.get("extracted_data"));
        assertEquals(1, ((List<?>) data.get("step_errors")).size());
        assertEquals(Boolean.TRUE, data.get("success"));
    }

    @Test
    void shouldTruncatePageSourceWithoutSelectors() {
        ScrapingResult scraped = success(URL);
        scraped.setContent("x".repeat(3000));
        when(toolkit.scrape(any())).thenReturn(CompletableFuture.completedFuture(scraped));

        ToolResult result = tool.execute(Map.of("url", URL)).join();

        assertTrue(result.getOutput().contains("Page source:"));
        assertTrue(result.getOutput().endsWith("... (truncated)"));
    }

    @Test
    void shouldReportAbortedScrapeAsExecutionFailure() {
        ScrapingResult scraped = success(URL);
        scraped.setSuccess(false);
        scraped.setAborted(true);
        scraped.setErrorMessage("Critical step 0 (navigate) failed");
        when(toolkit.scrape(any())).thenReturn(CompletableFuture.completedFuture(scraped));

        ToolResult result = tool.execute(Map.of("url", URL)).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Scrape failed: Critical step 0 (navigate) failed", result.getError());
        assertEquals(Boolean.TRUE, ((Map<?, ?>) result.getData()).get("aborted"));
    }

    @Test
    void shouldMapConfigurationErrorsToInvalidInput() {
        when(toolkit.scrape(any())).thenReturn(CompletableFuture.failedFuture(
                new CompletionException(new ConfigurationException("Unknown driver type 'x'"))));

        ToolResult result = tool.execute(Map.of("url", URL)).join();

        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
        assertEquals("Unknown driver type 'x'", result.getError());
    }

    @Test
    void shouldMapRuntimeErrorsToExecutionFailure() {
        when(toolkit.scrape(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("crashed")));

        ToolResult result = tool.execute(new HashMap<>(Map.of("url", URL))).join();

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Failed to scrape: crashed", result.getError());
    }

    private static ScrapingResult success(String url) {
        return ScrapingResult.builder()
                .url(url)
                .success(true)
                .totalSteps(2)
                .executedSteps(2)
                .content("<html></html>")
                .build();
    }
}
