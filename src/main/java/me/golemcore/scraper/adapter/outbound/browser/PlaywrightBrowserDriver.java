package me.golemcore.scraper.adapter.outbound.browser;

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

import me.golemcore.scraper.domain.exception.ConfigurationException;
import me.golemcore.scraper.domain.exception.UnsupportedCapabilityException;
import me.golemcore.scraper.domain.model.BrowserCookie;
import me.golemcore.scraper.domain.model.DriverCapability;
import me.golemcore.scraper.domain.model.DriverConfig;
import me.golemcore.scraper.domain.model.ElementState;
import me.golemcore.scraper.domain.model.InterceptedRequest;
import me.golemcore.scraper.domain.model.MockResponse;
import me.golemcore.scraper.domain.model.PageLoadState;
import me.golemcore.scraper.domain.model.RequestInterceptor;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.Request;
import com.microsoft.playwright.Route;
import com.microsoft.playwright.Tracing;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitForSelectorState;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Playwright implementation of {@link me.golemcore.scraper.port.outbound.BrowserDriver}.
 *
 * <p>
 * One driver owns one Playwright instance, one browser, one context and one
 * page. Browser names are Playwright engines: {@code chromium},
 * {@code firefox}, {@code webkit}, plus {@code msedge} which launches chromium
 * through the Edge channel.
 *
 * <p>
 * Supports every extended capability. HAR recording has to be requested before
 * {@link #start()} because Playwright configures it on context creation; PDF
 * export only works on chromium.
 */
@Slf4j
public class PlaywrightBrowserDriver extends AbstractBrowserDriver {

    public static final String NAME = "playwright";

    private static final String DEFAULT_MOBILE_DEVICE = "iPhone 14";
    private static final Set<String> ENGINES = Set.of("chromium", "msedge", "firefox", "webkit");

    private static final Map<String, MobileDevice> MOBILE_DEVICES = Map.of(
            "iPhone 14", new MobileDevice(390, 664, 3.0,
                    "Mozilla/5.0 (iPhone; CPU iPhone OS 16_0 like Mac OS X) AppleWebKit/605.1.15 "
                            + "(KHTML, like Gecko) Version/16.0 Mobile/15E148 Safari/604.1"),
            "Pixel 7", new MobileDevice(412, 839, 2.625,
                    "Mozilla/5.0 (Linux; Android 14; Pixel 7) AppleWebKit/537.36 "
                            + "(KHTML, like Gecko) Chrome/124.0.0.0 Mobile Safari/537.36"),
            "iPad Pro 11", new MobileDevice(834, 1194, 2.0,
                    "Mozilla/5.0 (iPad; CPU OS 16_0 like Mac OS X) AppleWebKit/605.1.15 "
                            + "(KHTML, like Gecko) Version/16.0 Mobile/15E148 Safari/604.1"));

    private final Supplier<Playwright> playwrightFactory;

    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;
    private Page page;
    private volatile Path harPath;

    public PlaywrightBrowserDriver(DriverConfig config) {
        this(config, () -> createPlaywright(config));
    }

    public PlaywrightBrowserDriver(DriverConfig config, Supplier<Playwright> playwrightFactory) {
        super(config);
        this.playwrightFactory = playwrightFactory;
        if (!ENGINES.contains(config.getBrowser())) {
            throw new ConfigurationException("Unsupported Playwright browser: " + config.getBrowser());
        }
        if (config.isMobile() && !MOBILE_DEVICES.containsKey(mobileDeviceName())) {
            throw new ConfigurationException("Unknown mobile device '" + mobileDeviceName()
                    + "'. Available: " + MOBILE_DEVICES.keySet());
        }
    }

    @Override
    public String getDriverName() {
        return NAME;
    }

    @Override
    public Set<DriverCapability> getCapabilities() {
        Set<DriverCapability> capabilities = EnumSet.of(
                DriverCapability.INTERCEPT_REQUESTS,
                DriverCapability.RECORD_HAR,
                DriverCapability.TRACING,
                DriverCapability.MOCK_ROUTE);
        if (isChromium()) {
            capabilities.add(DriverCapability.SAVE_PDF);
        }
        return capabilities;
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    protected void doStart() {
        this.playwright = playwrightFactory.get();
        BrowserType.LaunchOptions launchOptions = new BrowserType.LaunchOptions()
                .setHeadless(config.isHeadless());
        if ("msedge".equals(config.getBrowser())) {
            launchOptions.setChannel("msedge");
        }
        this.browser = browserType().launch(launchOptions);

        Browser.NewContextOptions contextOptions = new Browser.NewContextOptions();
        if (config.isMobile()) {
            MobileDevice device = MOBILE_DEVICES.get(mobileDeviceName());
            contextOptions.setViewportSize(device.width(), device.height())
                    .setDeviceScaleFactor(device.scaleFactor())
                    .setIsMobile(true)
                    .setHasTouch(true)
                    .setUserAgent(device.userAgent());
        }
        String userAgent = config.getCustomUserAgent();
        if (userAgent != null && !userAgent.isBlank()) {
            contextOptions.setUserAgent(userAgent);
        }
        if (harPath != null) {
            contextOptions.setRecordHarPath(harPath);
        }

        this.context = browser.newContext(contextOptions);
        context.setDefaultTimeout(config.getDefaultTimeout().toMillis());
        if (config.isDisableImages()) {
            context.route("**/*", route -> {
                if ("image".equals(route.request().resourceType())) {
                    route.abort();
                } else {
                    route.resume();
                }
            });
        }
        this.page = context.newPage();
    }

    @Override
    protected void doQuit() {
        // closing the context flushes the HAR file
        closeQuietly(context, "context");
        closeQuietly(browser, "browser");
        closeQuietly(playwright, "playwright");
        page = null;
        context = null;
        browser = null;
        playwright = null;
    }

    @Override
    public CompletableFuture<Void> navigate(String url, Duration timeout) {
        return dispatchVoid(() -> page.navigate(url, new Page.NavigateOptions().setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<Void> goBack() {
        return dispatchVoid(() -> page.goBack());
    }

    @Override
    public CompletableFuture<Void> goForward() {
        return dispatchVoid(() -> page.goForward());
    }

    @Override
    public CompletableFuture<Void> reload() {
        return dispatchVoid(() -> page.reload());
    }

    @Override
    public CompletableFuture<Void> click(String selector, Duration timeout) {
        return dispatchVoid(() -> locate(selector).click(new Locator.ClickOptions().setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<Void> fill(String selector, String value, Duration timeout) {
        return dispatchVoid(() -> locate(selector)
                .fill(value, new Locator.FillOptions().setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<Void> selectOption(String selector, String value, Duration timeout) {
        return dispatchVoid(() -> locate(selector)
                .selectOption(value, new Locator.SelectOptionOptions().setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<Void> hover(String selector, Duration timeout) {
        return dispatchVoid(() -> locate(selector).hover(new Locator.HoverOptions().setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<Void> pressKey(String key) {
        return dispatchVoid(() -> page.keyboard().press(key));
    }

    @Override
    public CompletableFuture<String> getPageSource() {
        return dispatch(() -> page.content());
    }

    @Override
    public CompletableFuture<String> getText(String selector, Duration timeout) {
        return dispatch(() -> locate(selector).innerText(new Locator.InnerTextOptions().setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<String> getAttribute(String selector, String attribute, Duration timeout) {
        return dispatch(() -> locate(selector)
                .getAttribute(attribute, new Locator.GetAttributeOptions().setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<String> getInputValue(String selector, Duration timeout) {
        return dispatch(() -> locate(selector)
                .inputValue(new Locator.InputValueOptions().setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<List<String>> getAllTexts(String selector, Duration timeout) {
        return dispatch(() -> {
            page.waitForSelector(SelectorSupport.forPlaywright(selector), new Page.WaitForSelectorOptions()
                    .setState(WaitForSelectorState.ATTACHED)
                    .setTimeout(millis(timeout)));
            return page.locator(SelectorSupport.forPlaywright(selector)).allInnerTexts();
        });
    }

    @Override
    public CompletableFuture<byte[]> screenshot(Path path, boolean fullPage) {
        return dispatch(() -> page.screenshot(new Page.ScreenshotOptions().setPath(path).setFullPage(fullPage)));
    }

    @Override
    public CompletableFuture<Void> waitForSelector(String selector, Duration timeout, ElementState state) {
        return dispatchVoid(() -> page.waitForSelector(SelectorSupport.forPlaywright(selector),
                new Page.WaitForSelectorOptions()
                        .setState(toSelectorState(state))
                        .setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<Void> waitForNavigation(Duration timeout) {
        return dispatchVoid(() -> page.waitForLoadState(LoadState.LOAD,
                new Page.WaitForLoadStateOptions().setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<Void> waitForLoadState(PageLoadState state, Duration timeout) {
        return dispatchVoid(() -> page.waitForLoadState(toLoadState(state),
                new Page.WaitForLoadStateOptions().setTimeout(millis(timeout))));
    }

    @Override
    public CompletableFuture<Object> executeScript(String script, Object... args) {
        // same calling convention as Selenium: a function body reading `arguments`
        String wrapped = "(args) => (function() {\n" + script + "\n}).apply(null, args)";
        List<Object> arguments = args != null ? Arrays.asList(args) : List.of();
        return dispatch(() -> page.evaluate(wrapped, arguments));
    }

    @Override
    public CompletableFuture<Object> evaluate(String expression) {
        return dispatch(() -> page.evaluate(expression));
    }

    @Override
    public CompletableFuture<String> currentUrl() {
        return dispatch(() -> page.url());
    }

    @Override
    public CompletableFuture<List<BrowserCookie>> getCookies() {
        return dispatch(() -> context.cookies().stream()
                .map(cookie -> BrowserCookie.builder()
                        .name(cookie.name)
                        .value(cookie.value)
                        .domain(cookie.domain)
                        .path(cookie.path)
                        .expires(cookie.expires != null && cookie.expires > 0 ? cookie.expires.longValue() : null)
                        .secure(Boolean.TRUE.equals(cookie.secure))
                        .httpOnly(Boolean.TRUE.equals(cookie.httpOnly))
                        .build())
                .toList());
    }

    @Override
    public CompletableFuture<Void> setCookies(List<BrowserCookie> cookies) {
        return dispatchVoid(() -> context.addCookies(cookies.stream()
                .map(this::toPlaywrightCookie)
                .toList()));
    }

    @Override
    public CompletableFuture<Void> interceptRequests(RequestInterceptor interceptor) {
        return dispatchVoid(() -> context.route("**/*", route -> {
            Request request = route.request();
            RequestInterceptor.InterceptDecision decision = interceptor.intercept(InterceptedRequest.builder()
                    .url(request.url())
                    .method(request.method())
                    .resourceType(request.resourceType())
                    .headers(request.headers())
                    .build());
            if (decision == RequestInterceptor.InterceptDecision.ABORT) {
                route.abort();
            } else {
                route.resume();
            }
        }));
    }

    @Override
    public CompletableFuture<Void> recordHar(Path path) {
        if (isStarted()) {
            throw new IllegalStateException("HAR recording must be configured before the driver is started");
        }
        return dispatchUnstarted(() -> this.harPath = path);
    }

    @Override
    public CompletableFuture<Void> savePdf(Path path) {
        if (!isChromium()) {
            throw new UnsupportedCapabilityException(DriverCapability.SAVE_PDF, NAME,
                    "PDF export requires chromium, current browser is " + config.getBrowser());
        }
        return dispatchVoid(() -> page.pdf(new Page.PdfOptions().setPath(path)));
    }

    @Override
    public CompletableFuture<Void> startTracing(String name, boolean screenshots, boolean snapshots) {
        return dispatchVoid(() -> context.tracing().start(new Tracing.StartOptions()
                .setName(name)
                .setScreenshots(screenshots)
                .setSnapshots(snapshots)));
    }

    @Override
    public CompletableFuture<Void> stopTracing(Path path) {
        return dispatchVoid(() -> context.tracing().stop(new Tracing.StopOptions().setPath(path)));
    }

    @Override
    public CompletableFuture<Void> mockRoute(String urlPattern, MockResponse response) {
        return dispatchVoid(() -> page.route(urlPattern, route -> {
            Route.FulfillOptions options = new Route.FulfillOptions()
                    .setStatus(response.getStatus())
                    .setContentType(response.getContentType());
            if (response.getBody() != null) {
                options.setBody(response.getBody());
            }
            if (response.getHeaders() != null) {
                options.setHeaders(response.getHeaders());
            }
            route.fulfill(options);
        }));
    }

    private Locator locate(String selector) {
        return page.locator(SelectorSupport.forPlaywright(selector)).first();
    }

    private BrowserType browserType() {
        return switch (config.getBrowser()) {
        case "chromium", "msedge" -> playwright.chromium();
        case "firefox" -> playwright.firefox();
        case "webkit" -> playwright.webkit();
        default -> throw new ConfigurationException("Unsupported Playwright browser: " + config.getBrowser());
        };
    }

    private String mobileDeviceName() {
        return config.getMobileDevice() != null ? config.getMobileDevice() : DEFAULT_MOBILE_DEVICE;
    }

    private boolean isChromium() {
        return "chromium".equals(config.getBrowser()) || "msedge".equals(config.getBrowser());
    }

    private Cookie toPlaywrightCookie(BrowserCookie cookie) {
        Cookie result = new Cookie(cookie.getName(), cookie.getValue());
        if (cookie.getDomain() != null) {
            result.setDomain(cookie.getDomain());
            result.setPath(cookie.getPath() != null ? cookie.getPath() : "/");
        } else {
            result.setUrl(page.url());
        }
        if (cookie.getExpires() != null) {
            result.setExpires(cookie.getExpires());
        }
        result.setSecure(cookie.isSecure());
        result.setHttpOnly(cookie.isHttpOnly());
        return result;
    }

    private double millis(Duration timeout) {
        return orDefault(timeout).toMillis();
    }

    private static WaitForSelectorState toSelectorState(ElementState state) {
        if (state == null) {
            return WaitForSelectorState.VISIBLE;
        }
        return switch (state) {
        case ATTACHED -> WaitForSelectorState.ATTACHED;
        case DETACHED -> WaitForSelectorState.DETACHED;
        case VISIBLE -> WaitForSelectorState.VISIBLE;
        case HIDDEN -> WaitForSelectorState.HIDDEN;
        };
    }

    private static LoadState toLoadState(PageLoadState state) {
        if (state == null) {
            return LoadState.LOAD;
        }
        return switch (state) {
        case DOM_CONTENT_LOADED -> LoadState.DOMCONTENTLOADED;
        case LOAD -> LoadState.LOAD;
        case NETWORK_IDLE -> LoadState.NETWORKIDLE;
        };
    }

    private static Playwright createPlaywright(DriverConfig config) {
        if (config.isAutoInstall()) {
            return Playwright.create();
        }
        return Playwright.create(new Playwright.CreateOptions()
                .setEnv(Map.of("PLAYWRIGHT_SKIP_BROWSER_DOWNLOAD", "1")));
    }

    private static void closeQuietly(AutoCloseable resource, String label) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            log.trace("[Driver] Error closing playwright {}: {}", label, e.getMessage());
        }
    }

    private record MobileDevice(int width, int height, double scaleFactor, String userAgent) {
    }
}
