package me.golemcore.scraper.port.outbound;

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

import me.golemcore.scraper.domain.exception.UnsupportedCapabilityException;
import me.golemcore.scraper.domain.model.BrowserCookie;
import me.golemcore.scraper.domain.model.DriverCapability;
import me.golemcore.scraper.domain.model.ElementState;
import me.golemcore.scraper.domain.model.MockResponse;
import me.golemcore.scraper.domain.model.PageLoadState;
import me.golemcore.scraper.domain.model.RequestInterceptor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Port for controlling one browser session, independent of the automation
 * backend.
 *
 * <p>
 * Every operation returns a future completed on the driver's own dispatch
 * thread, so callers never block on a synchronous automation call. Selectors
 * starting with {@code /} or {@code ./} are treated as XPath, anything else as
 * CSS.
 *
 * <p>
 * Extended capabilities (request interception, HAR recording, PDF export,
 * tracing, route mocking) are optional. Check {@link #supports} before calling
 * them; backends that lack one throw {@link UnsupportedCapabilityException}.
 *
 * <p>
 * A driver is created un-started. Call {@link #start()} before any other
 * operation and {@link #quit()} when done. Instances are not safe for
 * concurrent use by independent callers.
 */
public interface BrowserDriver {

    /**
     * Backend name, e.g. "playwright" or "selenium".
     */
    String getDriverName();

    // lifecycle

    CompletableFuture<Void> start();

    CompletableFuture<Void> quit();

    boolean isStarted();

    // navigation

    CompletableFuture<Void> navigate(String url, Duration timeout);

    CompletableFuture<Void> goBack();

    CompletableFuture<Void> goForward();

    CompletableFuture<Void> reload();

    // interaction

    CompletableFuture<Void> click(String selector, Duration timeout);

    /**
     * Clears the field and types {@code value} into it.
     */
    CompletableFuture<Void> fill(String selector, String value, Duration timeout);

    CompletableFuture<Void> selectOption(String selector, String value, Duration timeout);

    CompletableFuture<Void> hover(String selector, Duration timeout);

    /**
     * Presses a key on the focused element. Key names follow the W3C
     * {@code KeyboardEvent.key} values ("Enter", "Tab", "ArrowDown", "a").
     */
    CompletableFuture<Void> pressKey(String key);

    // extraction

    CompletableFuture<String> getPageSource();

    CompletableFuture<String> getText(String selector, Duration timeout);

    CompletableFuture<String> getAttribute(String selector, String attribute, Duration timeout);

    /**
     * Current value of a form field, including text typed since the page
     * loaded. The {@code value} attribute only holds the initial value.
     */
    CompletableFuture<String> getInputValue(String selector, Duration timeout);

    CompletableFuture<List<String>> getAllTexts(String selector, Duration timeout);

    /**
     * Writes a PNG screenshot to {@code path} and returns its bytes.
     */
    CompletableFuture<byte[]> screenshot(Path path, boolean fullPage);

    // waiting

    CompletableFuture<Void> waitForSelector(String selector, Duration timeout, ElementState state);

    CompletableFuture<Void> waitForNavigation(Duration timeout);

    CompletableFuture<Void> waitForLoadState(PageLoadState state, Duration timeout);

    // scripting

    /**
     * Runs a function body with positional {@code arguments} and returns its
     * result.
     */
    CompletableFuture<Object> executeScript(String script, Object... args);

    /**
     * Evaluates a JavaScript expression and returns its value.
     */
    CompletableFuture<Object> evaluate(String expression);

    // state

    CompletableFuture<String> currentUrl();

    CompletableFuture<List<BrowserCookie>> getCookies();

    CompletableFuture<Void> setCookies(List<BrowserCookie> cookies);

    // extended capabilities

    default Set<DriverCapability> getCapabilities() {
        return Set.of();
    }

    default boolean supports(DriverCapability capability) {
        return getCapabilities().contains(capability);
    }

    default CompletableFuture<Void> interceptRequests(RequestInterceptor interceptor) {
        throw new UnsupportedCapabilityException(DriverCapability.INTERCEPT_REQUESTS, getDriverName());
    }

    /**
     * Records network traffic to a HAR file written on {@link #quit()}. Must be
     * called before {@link #start()}.
     */
    default CompletableFuture<Void> recordHar(Path path) {
        throw new UnsupportedCapabilityException(DriverCapability.RECORD_HAR, getDriverName());
    }

    default CompletableFuture<Void> savePdf(Path path) {
        throw new UnsupportedCapabilityException(DriverCapability.SAVE_PDF, getDriverName());
    }

    default CompletableFuture<Void> startTracing(String name, boolean screenshots, boolean snapshots) {
        throw new UnsupportedCapabilityException(DriverCapability.TRACING, getDriverName());
    }

    default CompletableFuture<Void> stopTracing(Path path) {
        throw new UnsupportedCapabilityException(DriverCapability.TRACING, getDriverName());
    }

    default CompletableFuture<Void> mockRoute(String urlPattern, MockResponse response) {
        throw new UnsupportedCapabilityException(DriverCapability.MOCK_ROUTE, getDriverName());
    }
}
