package me.golemcore.scraper.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.scraper.domain.exception.StepExecutionException;
import me.golemcore.scraper.domain.model.BrowserCookie;
import me.golemcore.scraper.domain.model.DriverConfig;
import me.golemcore.scraper.domain.model.ElementState;
import me.golemcore.scraper.domain.model.ExecutionInput;
import me.golemcore.scraper.domain.model.PageLoadState;
import me.golemcore.scraper.domain.model.ScrapingResult;
import me.golemcore.scraper.domain.model.StepError;
import me.golemcore.scraper.domain.model.action.BackAction;
import me.golemcore.scraper.domain.model.action.BrowserAction;
import me.golemcore.scraper.domain.model.action.ClickAction;
import me.golemcore.scraper.domain.model.action.EvaluateAction;
import me.golemcore.scraper.domain.model.action.FillAction;
import me.golemcore.scraper.domain.model.action.GetCookiesAction;
import me.golemcore.scraper.domain.model.action.LegacyAction;
import me.golemcore.scraper.domain.model.action.NavigateAction;
import me.golemcore.scraper.domain.model.action.PressKeyAction;
import me.golemcore.scraper.domain.model.action.RefreshAction;
import me.golemcore.scraper.domain.model.action.ScreenshotAction;
import me.golemcore.scraper.domain.model.action.ScrollAction;
import me.golemcore.scraper.domain.model.action.SelectAction;
import me.golemcore.scraper.domain.model.action.SetCookiesAction;
import me.golemcore.scraper.domain.model.action.WaitAction;
import me.golemcore.scraper.infrastructure.config.ScraperProperties;
import me.golemcore.scraper.port.outbound.BrowserDriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Runs an ordered list of browser actions against a driver, then applies the
 * content selectors to the resulting page.
 *
 * <p>
 * Failure policy:
 * <ul>
 * <li>navigate and authenticate steps are critical: a failure (exception,
 * timeout or falsy result) stops the page, the result is unsuccessful and
 * marked aborted</li>
 * <li>any other failing step is recorded as a {@link StepError} and execution
 * moves on</li>
 * </ul>
 *
 * <p>
 * The configured inter-step delay elapses between steps, never after the last
 * one. Legacy interactive actions are logged and skipped.
 */
@Service
@Slf4j
public class StepExecutor {

    private static final long GRACE_SECONDS = 5;
    private static final long POLL_INTERVAL_MILLIS = 250;

    static final String OVERLAY_HOUSEKEEPING_SCRIPT = """
            var dismissed = 0;
            var labels = ['accept', 'agree', 'got it', 'allow all', 'ok', 'close', 'dismiss'];
            var containers = document.querySelectorAll(
                '[id*="cookie" i], [class*="cookie" i], [id*="consent" i], [class*="consent" i], '
                + '[class*="modal" i], [class*="popup" i], [role="dialog"]');
            containers.forEach(function (container) {
                container.querySelectorAll('button, a, [role="button"]').forEach(function (button) {
                    var text = (button.innerText || '').trim().toLowerCase();
                    if (text && labels.some(function (label) { return text.indexOf(label) === 0; })) {
                        try { button.click(); dismissed++; } catch (e) { }
                    }
                });
            });
            document.querySelectorAll('body *').forEach(function (el) {
                var style = window.getComputedStyle(el);
                if (style.position === 'fixed' && parseInt(style.zIndex || '0', 10) > 999
                        && el.offsetWidth >= window.innerWidth * 0.8 && el.offsetHeight >= window.innerHeight * 0.8) {
                    el.remove();
                    dismissed++;
                }
            });
            if (document.body) { document.body.style.overflow = 'auto'; }
            return dismissed;
            """;

    private final Clock clock;
    private final Executor executor;
    private final SelectorExtractor selectorExtractor;
    private final Path screenshotDirectory;

    @Autowired
    public StepExecutor(ScraperProperties properties, Clock clock, ExecutorService scraperTaskExecutor,
            SelectorExtractor selectorExtractor) {
        this(clock, scraperTaskExecutor, selectorExtractor,
                properties.resolveWorkspacePath().resolve(properties.getScreenshots().getDirectory()));
    }

    public StepExecutor(Clock clock, Executor executor, SelectorExtractor selectorExtractor,
            Path screenshotDirectory) {
        this.clock = clock;
        this.executor = executor;
        this.selectorExtractor = selectorExtractor;
        this.screenshotDirectory = screenshotDirectory;
    }

    /**
     * Executes the input asynchronously. The returned future always completes
     * normally; step and extraction failures are reported inside the result.
     */
    public CompletableFuture<ScrapingResult> execute(BrowserDriver driver, ExecutionInput input, DriverConfig config) {
        return CompletableFuture.supplyAsync(() -> run(driver, input, config), executor);
    }

    ScrapingResult run(BrowserDriver driver, ExecutionInput input, DriverConfig config) {
        Instant startedAt = clock.instant();
        List<BrowserAction> steps = input.getSteps() != null ? input.getSteps() : List.of();
        List<StepError> stepErrors = new ArrayList<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        boolean aborted = false;
        String abortMessage = null;
        int executed = 0;

        log.debug("[Executor] Running {} step(s) for {}", steps.size(), input.getUrl());
        for (int i = 0; i < steps.size(); i++) {
            BrowserAction step = steps.get(i);
            executed++;
            String error;
            try {
                error = executeStep(driver, step, i, input, config, metadata) ? null : "step returned false";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stepErrors.add(stepError(i, step, "interrupted"));
                aborted = true;
                abortMessage = "Execution interrupted at step " + i;
                break;
            } catch (Exception e) { // NOSONAR - every step failure is recorded, none escapes
                error = describe(e);
            }

            if (error != null) {
                stepErrors.add(stepError(i, step, error));
                if (step.isCritical()) {
                    aborted = true;
                    abortMessage = "Critical step " + i + " (" + step.getAction() + ") failed: " + error;
                    log.warn("[Executor] {} - aborting remaining steps for {}", abortMessage, input.getUrl());
                    break;
                }
                log.warn("[Executor] Step {} ({}) failed: {}", i, step.getAction(), error);
            } else {
                log.debug("[Executor] Step {} ({}) completed", i, step.getAction());
            }

            if (i < steps.size() - 1 && !pause(config.getDelayBetweenActions())) {
                aborted = true;
                abortMessage = "Execution interrupted after step " + i;
                break;
            }
        }

        ScrapingResult.ScrapingResultBuilder result = ScrapingResult.builder()
                .url(input.getUrl())
                .planName(input.getPlanName())
                .stepErrors(stepErrors)
                .aborted(aborted)
                .totalSteps(steps.size())
                .executedSteps(executed)
                .metadata(metadata)
                .startedAt(startedAt);

        if (aborted) {
            return result.success(false)
                    .errorMessage(abortMessage)
                    .finishedAt(clock.instant())
                    .build();
        }

        try {
            String pageSource = await(driver.getPageSource(), config.getDefaultTimeout());
            String pageUrl = currentUrlOr(driver, input.getUrl(), config);
            result.url(pageUrl)
                    .content(pageSource)
                    .extractedData(selectorExtractor.extract(pageSource, pageUrl, input.getSelectors()))
                    .success(true)
                    .errorMessage(stepErrors.isEmpty() ? null : stepErrors.size() + " step(s) failed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.success(false).errorMessage("Interrupted while reading page source");
        } catch (Exception e) { // NOSONAR - reported through the result
            log.warn("[Executor] Failed to read page source for {}: {}", input.getUrl(), describe(e));
            result.success(false).errorMessage("Failed to read page source: " + describe(e));
        }
        return result.finishedAt(clock.instant()).build();
    }

    private boolean executeStep(BrowserDriver driver, BrowserAction step, int index, ExecutionInput input,
            DriverConfig config, Map<String, Object> metadata) throws Exception {
        Duration timeout = step.timeoutOr(config.getDefaultTimeout());

        if (step instanceof NavigateAction navigate) {
            String target = resolveUrl(navigate.getUrl(), input.getUrl());
            if (target == null) {
                throw new StepExecutionException(index, step.getAction(), true, "navigate requires a url", null);
            }
            await(driver.navigate(target, timeout), timeout);
            dismissOverlays(driver, config);
            return true;
        }
        if (step instanceof ClickAction click) {
            return click(driver, click, index, timeout, config);
        }
        if (step instanceof FillAction fill) {
            return fill(driver, fill, index, timeout);
        }
        if (step instanceof WaitAction wait) {
            return waitFor(driver, wait, timeout);
        }
        if (step instanceof ScrollAction scroll) {
            return scroll(driver, scroll, index, timeout);
        }
        if (step instanceof EvaluateAction evaluate) {
            return evaluate(driver, evaluate, index, timeout, metadata);
        }
        if (step instanceof RefreshAction refresh) {
            if (refresh.isHard()) {
                await(driver.executeScript("location.reload(true);"), timeout);
                await(driver.waitForLoadState(PageLoadState.LOAD, timeout), timeout);
            } else {
                await(driver.reload(), timeout);
            }
            dismissOverlays(driver, config);
            return true;
        }
        if (step instanceof BackAction back) {
            for (int i = 0; i < Math.max(1, back.getSteps()); i++) {
                await(driver.goBack(), timeout);
            }
            dismissOverlays(driver, config);
            return true;
        }
        if (step instanceof SelectAction select) {
            return select(driver, select, index, timeout);
        }
        if (step instanceof PressKeyAction pressKey) {
            return pressKeys(driver, pressKey, index, timeout);
        }
        if (step instanceof ScreenshotAction screenshot) {
            return screenshot(driver, screenshot, timeout, metadata);
        }
        if (step instanceof GetCookiesAction getCookies) {
            return readCookies(driver, getCookies, timeout, metadata);
        }
        if (step instanceof SetCookiesAction setCookies) {
            if (setCookies.getCookies() == null || setCookies.getCookies().isEmpty()) {
                throw new StepExecutionException(index, step.getAction(), false, "set_cookies requires cookies", null);
            }
            await(driver.setCookies(setCookies.getCookies()), timeout);
            return true;
        }
        if (step instanceof LegacyAction legacy) {
            log.info("[Executor] Skipping unsupported legacy action '{}' at step {}", legacy.getAction(), index);
            return true;
        }
        log.warn("[Executor] Unknown action type: {}", step.getAction());
        return false;
    }

    private boolean click(BrowserDriver driver, ClickAction click, int index, Duration timeout, DriverConfig config)
            throws Exception {
        String selector = require(click.getSelector(), index, click, "selector");
        String clickType = click.getClickType() != null ? click.getClickType() : "single";
        switch (clickType) {
        case "double" -> dispatchMouseEvent(driver, selector, "dblclick", timeout);
        case "right" -> dispatchMouseEvent(driver, selector, "contextmenu", timeout);
        default -> await(driver.click(selector, timeout), timeout);
        }
        if (!click.isNoWait() && click.getWaitAfterClick() != null && !click.getWaitAfterClick().isBlank()) {
            Duration waitTimeout = Duration.ofSeconds(Math.max(1, click.getWaitTimeout()));
            await(driver.waitForSelector(click.getWaitAfterClick(), waitTimeout, ElementState.VISIBLE), waitTimeout);
        }
        dismissOverlays(driver, config);
        return true;
    }

    private void dispatchMouseEvent(BrowserDriver driver, String selector, String eventType, Duration timeout)
            throws Exception {
        Object dispatched = await(driver.executeScript("var el = " + jsLookup(selector) + ";\n"
                + "if (!el) { return false; }\n"
                + "el.dispatchEvent(new MouseEvent(arguments[0], {bubbles: true, cancelable: true, view: window}));\n"
                + "return true;", eventType), timeout);
        if (!Boolean.TRUE.equals(dispatched)) {
            throw new IllegalStateException("Element not found: " + selector);
        }
    }

    private boolean fill(BrowserDriver driver, FillAction fill, int index, Duration timeout) throws Exception {
        String selector = require(fill.getSelector(), index, fill, "selector");
        String value = fill.getValue() != null ? fill.getValue() : "";
        if (!fill.isClearFirst()) {
            String current = await(driver.getInputValue(selector, timeout), timeout);
            value = (current != null ? current : "") + value;
        }
        await(driver.fill(selector, value, timeout), timeout);
        if (fill.isPressEnter()) {
            await(driver.pressKey("Enter"), timeout);
        }
        return true;
    }

    private boolean waitFor(BrowserDriver driver, WaitAction wait, Duration timeout) throws Exception {
        String condition = wait.getCondition();
        String type = wait.getConditionType();
        if (type == null) {
            type = condition == null || condition.isBlank() ? WaitAction.SIMPLE : WaitAction.SELECTOR;
        }
        switch (type.toLowerCase(Locale.ROOT)) {
        case WaitAction.SELECTOR -> {
            await(driver.waitForSelector(condition, timeout, ElementState.ATTACHED), timeout);
            return true;
        }
        case WaitAction.URL_CONTAINS -> {
            return poll(timeout, () -> {
                String url = awaitQuietly(driver.currentUrl(), timeout);
                return url != null && url.contains(condition);
            });
        }
        case WaitAction.TITLE_CONTAINS -> {
            return poll(timeout, () -> {
                Object title = awaitQuietly(driver.evaluate("document.title"), timeout);
                return title != null && title.toString().contains(condition);
            });
        }
        case WaitAction.CUSTOM -> {
            String script = condition != null && !condition.isBlank() ? condition : wait.getCustomScript();
            if (script == null || script.isBlank()) {
                throw new IllegalArgumentException("custom wait requires a script");
            }
            String body = script.contains("return") ? script : "return (" + script + ");";
            return poll(timeout, () -> isTruthy(awaitQuietly(driver.executeScript(body), timeout)));
        }
        default -> {
            return pause(timeout);
        }
        }
    }

    private boolean scroll(BrowserDriver driver, ScrollAction scroll, int index, Duration timeout)
            throws Exception {
        String direction = scroll.getDirection() != null ? scroll.getDirection().toLowerCase(Locale.ROOT) : "down";
        int amount = scroll.getAmount() != null ? scroll.getAmount() : ScrollAction.DEFAULT_AMOUNT;
        String behavior = scroll.isSmooth() ? "smooth" : "auto";
        String target = scroll.getSelector() != null && !scroll.getSelector().isBlank()
                ? jsLookup(scroll.getSelector())
                : "window";
        String movement = switch (direction) {
        case "down" -> "el.scrollBy({top: " + amount + ", behavior: '" + behavior + "'});";
        case "up" -> "el.scrollBy({top: -" + amount + ", behavior: '" + behavior + "'});";
        case "top" -> "el.scrollTo({top: 0, behavior: '" + behavior + "'});";
        case "bottom" -> "el.scrollTo({top: (el === window ? document.body.scrollHeight : el.scrollHeight), "
                + "behavior: '" + behavior + "'});";
        default -> throw new StepExecutionException(index, scroll.getAction(), false,
                "Unknown scroll direction: " + direction, null);
        };
        Object scrolled = await(driver.executeScript("var el = " + target + ";\n"
                + "if (!el) { return false; }\n" + movement + "\nreturn true;"), timeout);
        return Boolean.TRUE.equals(scrolled);
    }

    private boolean evaluate(BrowserDriver driver, EvaluateAction evaluate, int index, Duration timeout,
            Map<String, Object> metadata) throws Exception {
        String script = evaluate.getScript();
        if ((script == null || script.isBlank()) && evaluate.getScriptFile() != null) {
            try {
                script = Files.readString(Path.of(evaluate.getScriptFile()));
            } catch (IOException e) {
                throw new StepExecutionException(index, evaluate.getAction(), false,
                        "Cannot read script file " + evaluate.getScriptFile() + ": " + e.getMessage(), e);
            }
        }
        if (script == null || script.isBlank()) {
            throw new StepExecutionException(index, evaluate.getAction(), false,
                    "evaluate requires script or script_file", null);
        }
        Object[] args = evaluate.getArgs() != null ? evaluate.getArgs().toArray() : new Object[0];
        Object value = await(driver.executeScript(script, args), timeout);
        if (evaluate.isReturnValue()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("step_index", index);
            entry.put("result", value);
            appendMetadata(metadata, ScrapingResult.META_EVALUATIONS, entry);
        }
        return true;
    }

    private boolean select(BrowserDriver driver, SelectAction select, int index, Duration timeout)
            throws Exception {
        String selector = require(select.getSelector(), index, select, "selector");
        if (select.getValue() != null) {
            await(driver.selectOption(selector, select.getValue(), timeout), timeout);
            return true;
        }
        String matcher;
        Object argument;
        if (select.getText() != null) {
            matcher = "Array.prototype.findIndex.call(el.options, function (o) { return o.text.trim() === wanted; })";
            argument = select.getText();
        } else if (select.getIndex() != null) {
            matcher = "Number(wanted)";
            argument = select.getIndex();
        } else {
            throw new StepExecutionException(index, select.getAction(), false,
                    "select requires value, text or index", null);
        }
        Object selected = await(driver.executeScript("var el = " + jsLookup(selector) + ";\n"
                + "if (!el || !el.options) { return false; }\n"
                + "var wanted = arguments[0];\n"
                + "var idx = " + matcher + ";\n"
                + "if (idx < 0 || idx >= el.options.length) { return false; }\n"
                + "el.selectedIndex = idx;\n"
                + "el.dispatchEvent(new Event('change', {bubbles: true}));\n"
                + "return true;", argument), timeout);
        return Boolean.TRUE.equals(selected);
    }

    private boolean pressKeys(BrowserDriver driver, PressKeyAction pressKey, int index, Duration timeout)
            throws Exception {
        List<String> keys = pressKey.getKeys();
        if (keys == null || keys.isEmpty()) {
            throw new StepExecutionException(index, pressKey.getAction(), false, "press_key requires keys", null);
        }
        if (pressKey.getTarget() != null && !pressKey.getTarget().isBlank()) {
            Object focused = await(driver.executeScript("var el = " + jsLookup(pressKey.getTarget()) + ";\n"
                    + "if (!el) { return false; }\nel.focus();\nreturn true;"), timeout);
            if (!Boolean.TRUE.equals(focused)) {
                throw new IllegalStateException("Element not found: " + pressKey.getTarget());
            }
        }
        if (pressKey.isSequential()) {
            for (String key : keys) {
                await(driver.pressKey(key), timeout);
            }
        } else {
            await(driver.pressKey(String.join("+", keys)), timeout);
        }
        return true;
    }

    private boolean screenshot(BrowserDriver driver, ScreenshotAction screenshot, Duration timeout,
            Map<String, Object> metadata) throws Exception {
        Path directory = screenshot.getOutputPath() != null && !screenshot.getOutputPath().isBlank()
                ? Path.of(screenshot.getOutputPath())
                : screenshotDirectory;
        String filename = screenshot.getFilename() != null && !screenshot.getFilename().isBlank()
                ? screenshot.getFilename()
                : "screenshot_" + clock.millis() + ".png";
        Files.createDirectories(directory);
        Path path = directory.resolve(filename);
        await(driver.screenshot(path, screenshot.isFullPage()), timeout);
        appendMetadata(metadata, ScrapingResult.META_SCREENSHOTS, path.toString());
        return true;
    }

    private boolean readCookies(BrowserDriver driver, GetCookiesAction getCookies, Duration timeout,
            Map<String, Object> metadata) throws Exception {
        List<BrowserCookie> cookies = await(driver.getCookies(), timeout);
        List<BrowserCookie> filtered = cookies.stream()
                .filter(cookie -> getCookies.getNames() == null || getCookies.getNames().isEmpty()
                        || getCookies.getNames().contains(cookie.getName()))
                .filter(cookie -> matchesDomain(cookie.getDomain(), getCookies.getDomain()))
                .toList();
        metadata.put(ScrapingResult.META_COOKIES, filtered);
        return true;
    }

    private void dismissOverlays(BrowserDriver driver, DriverConfig config) {
        if (!config.isOverlayHousekeeping()) {
            return;
        }
        try {
            Object dismissed = await(driver.executeScript(OVERLAY_HOUSEKEEPING_SCRIPT), config.getDefaultTimeout());
            if (dismissed instanceof Number count && count.intValue() > 0) {
                log.debug("[Executor] Dismissed {} overlay element(s)", count);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) { // NOSONAR - housekeeping is best effort
            log.debug("[Executor] Overlay housekeeping failed: {}", describe(e));
        }
    }

    private boolean poll(Duration timeout, BooleanSupplier condition) {
        long deadline = System.nanoTime() + timeout.toNanos();
        do {
            if (condition.getAsBoolean()) {
                return true;
            }
            if (!pause(Duration.ofMillis(POLL_INTERVAL_MILLIS))) {
                return false;
            }
        } while (System.nanoTime() < deadline);
        return condition.getAsBoolean();
    }

    /**
     * Sleeps for the given duration; false when interrupted.
     */
    private boolean pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    void sleep(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }

    private static <T> T await(Future<T> future, Duration timeout) throws Exception {
        try {
            return future.get(timeout.toSeconds() + GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("timed out after " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private static <T> T awaitQuietly(Future<T> future, Duration timeout) {
        try {
            return await(future, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (Exception e) { // NOSONAR - polled conditions retry until the deadline
            return null;
        }
    }

    private String currentUrlOr(BrowserDriver driver, String fallback, DriverConfig config) {
        String current = awaitQuietly(driver.currentUrl(), config.getDefaultTimeout());
        return current != null && !current.isBlank() ? current : fallback;
    }

    private static String resolveUrl(String url, String baseUrl) {
        if (url == null || url.isBlank()) {
            return baseUrl;
        }
        if (baseUrl == null || baseUrl.isBlank() || url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        try {
            return URI.create(baseUrl.trim()).resolve(url.trim()).toString();
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    private static boolean matchesDomain(String cookieDomain, String filter) {
        if (filter == null || filter.isBlank()) {
            return true;
        }
        if (cookieDomain == null) {
            return false;
        }
        String normalizedCookie = cookieDomain.startsWith(".") ? cookieDomain.substring(1) : cookieDomain;
        String normalizedFilter = filter.startsWith(".") ? filter.substring(1) : filter;
        return normalizedCookie.equalsIgnoreCase(normalizedFilter)
                || normalizedCookie.toLowerCase(Locale.ROOT).endsWith("." + normalizedFilter.toLowerCase(Locale.ROOT));
    }

    private static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private static void appendMetadata(Map<String, Object> metadata, String key, Object value) {
        ((List<Object>) metadata.computeIfAbsent(key, k -> new ArrayList<>())).add(value);
    }

    private static String require(String value, int index, BrowserAction step, String field) {
        if (value == null || value.isBlank()) {
            throw new StepExecutionException(index, step.getAction(), step.isCritical(),
                    step.getAction() + " requires " + field, null);
        }
        return value;
    }

    private static StepError stepError(int index, BrowserAction step, String error) {
        return StepError.builder()
                .stepIndex(index)
                .action(step.getAction())
                .error(error)
                .build();
    }

    private static String jsLookup(String selector) {
        String trimmed = selector.trim();
        String literal = "'" + trimmed.replace("\\", "\\\\")
                .replace("'", "\\'")
                .replace("\n", "\\n")
                .replace("\r", "\\r") + "'";
        if (trimmed.startsWith("/") || trimmed.startsWith("./")) {
            return "document.evaluate(" + literal
                    + ", document, null, XPathResult.FIRST_ORDERED_NODE_TYPE, null).singleNodeValue";
        }
        return "document.querySelector(" + literal + ")";
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
