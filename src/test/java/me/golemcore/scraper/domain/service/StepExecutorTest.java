package me.golemcore.scraper.domain.service;

import me.golemcore.scraper.domain.model.BrowserCookie;
import me.golemcore.scraper.domain.model.DriverConfig;
import me.golemcore.scraper.domain.model.ExecutionInput;
import me.golemcore.scraper.domain.model.ScrapingResult;
import me.golemcore.scraper.domain.model.ScrapingSelector;
import me.golemcore.scraper.domain.model.StepError;
import me.golemcore.scraper.domain.model.action.BrowserAction;
import me.golemcore.scraper.domain.model.action.ClickAction;
import me.golemcore.scraper.domain.model.action.EvaluateAction;
import me.golemcore.scraper.domain.model.action.FillAction;
import me.golemcore.scraper.domain.model.action.GetCookiesAction;
import me.golemcore.scraper.domain.model.action.LegacyAction;
import me.golemcore.scraper.domain.model.action.NavigateAction;
import me.golemcore.scraper.domain.model.action.PressKeyAction;
import me.golemcore.scraper.domain.model.action.ScreenshotAction;
import me.golemcore.scraper.domain.model.action.ScrollAction;
import me.golemcore.scraper.domain.model.action.SelectAction;
import me.golemcore.scraper.domain.model.action.WaitAction;
import me.golemcore.scraper.port.outbound.BrowserDriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StepExecutorTest {

    private static final String URL = "https://example.com/shop/";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String PAGE = "<html><body><h1>Catalog</h1><p class=\"price\">42</p></body></html>";

    @TempDir
    Path tempDir;

    private BrowserDriver driver;
    private StepExecutor stepExecutor;
    private DriverConfig config;

    @BeforeEach
    void setUp() {
        driver = mock(BrowserDriver.class);
        stepExecutor = new StepExecutor(Clock.fixed(NOW, ZoneOffset.UTC), Runnable::run, new SelectorExtractor(),
                tempDir);
        config = DriverConfig.builder()
                .defaultTimeout(Duration.ofSeconds(2))
                .delayBetweenActions(Duration.ZERO)
                .overlayHousekeeping(false)
                .build();

        when(driver.navigate(anyString(), any(Duration.class))).thenReturn(CompletableFuture.completedFuture(null));
        when(driver.getPageSource()).thenReturn(CompletableFuture.completedFuture(PAGE));
        when(driver.currentUrl()).thenReturn(CompletableFuture.completedFuture(URL));
    }

    // ===== failure policy =====

    @Test
    void shouldRecordNonCriticalFailureAndContinue() {
        when(driver.executeScript(anyString()))
                .thenReturn(CompletableFuture.completedFuture(false))
                .thenReturn(CompletableFuture.completedFuture(true));

        ScrapingResult result = run(
                NavigateAction.builder().url(URL).build(),
                ScrollAction.builder().direction("down").build(),
                ScrollAction.builder().direction("bottom").build());

        assertTrue(result.isSuccess());
        assertFalse(result.isAborted());
        assertEquals(3, result.getTotalSteps());
        assertEquals(3, result.getExecutedSteps());
        assertEquals(1, result.getStepErrors().size());
        StepError error = result.getStepErrors().get(0);
        assertEquals(1, error.getStepIndex());
        assertEquals("scroll", error.getAction());
        assertEquals("step returned false", error.getError());
        assertEquals("1 step(s) failed", result.getErrorMessage());
        assertEquals(PAGE, result.getContent());
    }

    @Test
    void shouldAbortOnCriticalFailure() {
        when(driver.navigate(anyString(), any(Duration.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("net::ERR_NAME_NOT_RESOLVED")));

        ScrapingResult result = run(
                NavigateAction.builder().url(URL).build(),
                ClickAction.builder().selector("#next").build());

        assertFalse(result.isSuccess());
        assertTrue(result.isAborted());
        assertEquals(1, result.getExecutedSteps());
        assertEquals(1, result.getStepErrors().size());
        assertTrue(result.getErrorMessage().startsWith("Critical step 0 (navigate) failed"));
        assertTrue(result.getErrorMessage().contains("net::ERR_NAME_NOT_RESOLVED"));
        assertNull(result.getContent());
        verify(driver, never()).click(anyString(), any(Duration.class));
        verify(driver, never()).getPageSource();
    }

    @Test
    void shouldRecordExceptionFromStep() {
        when(driver.click(anyString(), any(Duration.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("Element not found: #gone")));

        ScrapingResult result = run(ClickAction.builder().selector("#gone").build());

        assertTrue(result.isSuccess());
        assertEquals("Element not found: #gone", result.getStepErrors().get(0).getError());
    }

    @Test
    void shouldSkipLegacyActions() {
        ScrapingResult result = run(
                LegacyAction.builder().action("loop").build(),
                NavigateAction.builder().url(URL).build());

        assertTrue(result.isSuccess());
        assertTrue(result.getStepErrors().isEmpty());
        assertEquals(2, result.getExecutedSteps());
    }

    @Test
    void shouldReportUnreadablePageSource() {
        when(driver.getPageSource()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("gone")));

        ScrapingResult result = run(NavigateAction.builder().url(URL).build());

        assertFalse(result.isSuccess());
        assertFalse(result.isAborted());
        assertEquals("Failed to read page source: gone", result.getErrorMessage());
    }

    // ===== extraction =====

    @Test
    void shouldExtractSelectorsFromFinalPage() {
        ExecutionInput input = ExecutionInput.builder()
                .url(URL)
                .planName("shop")
                .steps(List.of(NavigateAction.builder().url(URL).build()))
                .selectors(List.of(
                        ScrapingSelector.builder().name("heading").selector("h1").build(),
                        ScrapingSelector.builder().name("price").selector(".price").build()))
                .build();

        ScrapingResult result = stepExecutor.execute(driver, input, config).join();

        assertEquals("Catalog", result.getExtractedData().get("heading"));
        assertEquals("42", result.getExtractedData().get("price"));
        assertEquals("shop", result.getPlanName());
        assertEquals(NOW, result.getStartedAt());
        assertEquals(NOW, result.getFinishedAt());
    }

    @Test
    void shouldFallBackToInputUrlWhenCurrentUrlUnavailable() {
        when(driver.currentUrl()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("closed")));

        ScrapingResult result = run(NavigateAction.builder().url(URL).build());

        assertEquals(URL, result.getUrl());
        assertTrue(result.isSuccess());
    }

    // ===== individual actions =====

    @Test
    void shouldResolveRelativeAndMissingNavigateTargets() {
        run(NavigateAction.builder().url("/about").build(), NavigateAction.builder().build());

        verify(driver).navigate(eq("https://example.com/about"), any(Duration.class));
        verify(driver).navigate(eq(URL), any(Duration.class));
    }

    @Test
    void shouldAppendWhenFillDoesNotClear() {
        when(driver.getInputValue("#q", Duration.ofSeconds(2)))
                .thenReturn(CompletableFuture.completedFuture("lamp"));
        when(driver.fill(anyString(), anyString(), any(Duration.class)))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(driver.pressKey("Enter")).thenReturn(CompletableFuture.completedFuture(null));

        ScrapingResult result = run(FillAction.builder()
                .selector("#q")
                .value(" shade")
                .clearFirst(false)
                .pressEnter(true)
                .build());

        assertTrue(result.getStepErrors().isEmpty());
        verify(driver).fill("#q", "lamp shade", Duration.ofSeconds(2));
        verify(driver).pressKey("Enter");
    }

    @Test
    void shouldWaitForUrlCondition() {
        ScrapingResult result = run(WaitAction.builder()
                .conditionType(WaitAction.URL_CONTAINS)
                .condition("/shop")
                .build());

        assertTrue(result.getStepErrors().isEmpty());
    }

    @Test
    void shouldFailWaitWhenConditionNeverHolds() {
        ScrapingResult result = run(WaitAction.builder()
                .conditionType(WaitAction.URL_CONTAINS)
                .condition("/checkout")
                .timeout(1)
                .build());

        assertEquals(1, result.getStepErrors().size());
        assertEquals("wait", result.getStepErrors().get(0).getAction());
    }

    @Test
    void shouldRecordEvaluationResults() {
        when(driver.executeScript(anyString())).thenReturn(CompletableFuture.completedFuture(42L));

        ScrapingResult result = run(EvaluateAction.builder()
                .script("return document.querySelectorAll('a').length;")
                .returnValue(true)
                .build());

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> evaluations = (List<Map<String, Object>>) result.getMetadata()
                .get(ScrapingResult.META_EVALUATIONS);
        assertEquals(1, evaluations.size());
        assertEquals(0, evaluations.get(0).get("step_index"));
        assertEquals(42L, evaluations.get(0).get("result"));
    }

    @Test
    void shouldSaveScreenshotToDefaultDirectory() {
        when(driver.screenshot(any(Path.class), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(new byte[0]));

        ScrapingResult result = run(ScreenshotAction.builder().build());

        Path expected = tempDir.resolve("screenshot_" + NOW.toEpochMilli() + ".png");
        verify(driver).screenshot(expected, true);
        assertEquals(List.of(expected.toString()), result.getMetadata().get(ScrapingResult.META_SCREENSHOTS));
    }

    @Test
    void shouldFilterCookiesByNameAndDomain() {
        when(driver.getCookies()).thenReturn(CompletableFuture.completedFuture(List.of(
                BrowserCookie.builder().name("sid").value("1").domain(".example.com").build(),
                BrowserCookie.builder().name("theme").value("dark").domain("example.com").build(),
                BrowserCookie.builder().name("sid").value("2").domain("tracker.org").build())));

        ScrapingResult result = run(GetCookiesAction.builder()
                .names(List.of("sid"))
                .domain("example.com")
                .build());

        @SuppressWarnings("unchecked")
        List<BrowserCookie> cookies = (List<BrowserCookie>) result.getMetadata().get(ScrapingResult.META_COOKIES);
        assertEquals(1, cookies.size());
        assertEquals("1", cookies.get(0).getValue());
    }

    @Test
    void shouldPressKeyChordWhenNotSequential() {
        when(driver.pressKey(anyString())).thenReturn(CompletableFuture.completedFuture(null));

        run(PressKeyAction.builder().keys(List.of("Control", "a")).sequential(false).build());

        verify(driver).pressKey("Control+a");
    }

    @Test
    void shouldSelectByValueThroughDriver() {
        when(driver.selectOption(anyString(), anyString(), any(Duration.class)))
                .thenReturn(CompletableFuture.completedFuture(null));

        ScrapingResult result = run(SelectAction.builder().selector("#size").value("xl").build());

        assertTrue(result.getStepErrors().isEmpty());
        verify(driver).selectOption("#size", "xl", Duration.ofSeconds(2));
    }

    @Test
    void shouldRequireSelectorForClick() {
        ScrapingResult result = run(ClickAction.builder().build());

        assertEquals("click requires selector", result.getStepErrors().get(0).getError());
    }

    // ===== pacing =====

    @Test
    void shouldPauseBetweenStepsButNotAfterLast() {
        List<Duration> pauses = new ArrayList<>();
        StepExecutor pacedExecutor = new StepExecutor(Clock.fixed(NOW, ZoneOffset.UTC), Runnable::run,
                new SelectorExtractor(), tempDir) {
            @Override
            void sleep(Duration duration) {
                pauses.add(duration);
            }
        };
        DriverConfig pacedConfig = config.toBuilder().delayBetweenActions(Duration.ofMillis(250)).build();
        when(driver.executeScript(anyString())).thenReturn(CompletableFuture.completedFuture(true));
        ExecutionInput input = ExecutionInput.builder()
                .url(URL)
                .steps(List.of(
                        NavigateAction.builder().url(URL).build(),
                        ScrollAction.builder().direction("down").build(),
                        ScrollAction.builder().direction("bottom").build()))
                .build();

        ScrapingResult result = pacedExecutor.execute(driver, input, pacedConfig).join();

        assertTrue(result.isSuccess());
        assertEquals(3, result.getExecutedSteps());
        assertEquals(List.of(Duration.ofMillis(250), Duration.ofMillis(250)), pauses);
    }

    @Test
    void shouldNotPauseForSingleStep() {
        List<Duration> pauses = new ArrayList<>();
        StepExecutor pacedExecutor = new StepExecutor(Clock.fixed(NOW, ZoneOffset.UTC), Runnable::run,
                new SelectorExtractor(), tempDir) {
            @Override
            void sleep(Duration duration) {
                pauses.add(duration);
            }
        };
        DriverConfig pacedConfig = config.toBuilder().delayBetweenActions(Duration.ofMillis(250)).build();
        ExecutionInput input = ExecutionInput.builder()
                .url(URL)
                .steps(List.of(NavigateAction.builder().url(URL).build()))
                .build();

        ScrapingResult result = pacedExecutor.execute(driver, input, pacedConfig).join();

        assertTrue(result.isSuccess());
        assertTrue(pauses.isEmpty());
    }

    // ===== overlay housekeeping =====

    @Test
    void shouldIgnoreOverlayHousekeepingFailures() {
        config = config.toBuilder().overlayHousekeeping(true).build();
        when(driver.executeScript(StepExecutor.OVERLAY_HOUSEKEEPING_SCRIPT))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("detached")));

        ScrapingResult result = run(NavigateAction.builder().url(URL).build());

        assertTrue(result.isSuccess());
        assertTrue(result.getStepErrors().isEmpty());
        verify(driver).executeScript(StepExecutor.OVERLAY_HOUSEKEEPING_SCRIPT);
    }

    private ScrapingResult run(BrowserAction... steps) {
        ExecutionInput input = ExecutionInput.builder()
                .url(URL)
                .steps(List.of(steps))
                .build();
        return stepExecutor.execute(driver, input, config).join();
    }
}
