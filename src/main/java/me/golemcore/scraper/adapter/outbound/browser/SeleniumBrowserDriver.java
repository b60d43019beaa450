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
import me.golemcore.scraper.domain.model.BrowserCookie;
import me.golemcore.scraper.domain.model.DriverConfig;
import me.golemcore.scraper.domain.model.ElementState;
import me.golemcore.scraper.domain.model.PageLoadState;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.Cookie;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Keys;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.openqa.selenium.interactions.Actions;
import org.openqa.selenium.safari.SafariDriver;
import org.openqa.selenium.safari.SafariOptions;
import org.openqa.selenium.support.ui.ExpectedCondition;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Selenium 4 implementation of
 * {@link me.golemcore.scraper.port.outbound.BrowserDriver}.
 *
 * <p>
 * Browser names are Selenium targets: {@code chrome}, {@code firefox},
 * {@code edge} and {@code safari}. Driver binaries are resolved by Selenium
 * Manager when {@code autoInstall} is on. Waits use {@link WebDriverWait};
 * load states are approximated with {@code document.readyState} since the
 * WebDriver protocol has no network-idle signal.
 *
 * <p>
 * No extended capabilities are offered.
 */
@Slf4j
public class SeleniumBrowserDriver extends AbstractBrowserDriver {

    public static final String NAME = "selenium";

    private static final Set<String> BROWSERS = Set.of("chrome", "firefox", "edge", "safari");

    private static final Map<String, CharSequence> KEYS = Map.ofEntries(
            Map.entry("enter", Keys.ENTER),
            Map.entry("return", Keys.RETURN),
            Map.entry("tab", Keys.TAB),
            Map.entry("escape", Keys.ESCAPE),
            Map.entry("esc", Keys.ESCAPE),
            Map.entry("backspace", Keys.BACK_SPACE),
            Map.entry("delete", Keys.DELETE),
            Map.entry("space", Keys.SPACE),
            Map.entry("arrowup", Keys.ARROW_UP),
            Map.entry("arrowdown", Keys.ARROW_DOWN),
            Map.entry("arrowleft", Keys.ARROW_LEFT),
            Map.entry("arrowright", Keys.ARROW_RIGHT),
            Map.entry("pageup", Keys.PAGE_UP),
            Map.entry("pagedown", Keys.PAGE_DOWN),
            Map.entry("home", Keys.HOME),
            Map.entry("end", Keys.END),
            Map.entry("shift", Keys.SHIFT),
            Map.entry("control", Keys.CONTROL),
            Map.entry("alt", Keys.ALT),
            Map.entry("meta", Keys.META));

    private final Function<DriverConfig, WebDriver> webDriverFactory;

    private WebDriver webDriver;

    public SeleniumBrowserDriver(DriverConfig config) {
        this(config, SeleniumBrowserDriver::createWebDriver);
    }

    public SeleniumBrowserDriver(DriverConfig config, Function<DriverConfig, WebDriver> webDriverFactory) {
        super(config);
        if (!BROWSERS.contains(config.getBrowser())) {
            throw new ConfigurationException("Unsupported Selenium browser: " + config.getBrowser());
        }
        this.webDriverFactory = webDriverFactory;
    }

    @Override
    public String getDriverName() {
        return NAME;
    }

    @Override
    protected void doStart() {
        this.webDriver = webDriverFactory.apply(config);
        webDriver.manage().timeouts().pageLoadTimeout(config.getDefaultTimeout());
    }

    @Override
    protected void doQuit() {
        if (webDriver == null) {
            return;
        }
        try {
            webDriver.quit();
        } catch (Exception e) {
            log.trace("[Driver] Error quitting selenium session: {}", e.getMessage());
        } finally {
            webDriver = null;
        }
    }

    @Override
    public CompletableFuture<Void> navigate(String url, Duration timeout) {
        return dispatchVoid(() -> {
            webDriver.manage().timeouts().pageLoadTimeout(orDefault(timeout));
            webDriver.get(url);
        });
    }

    @Override
    public CompletableFuture<Void> goBack() {
        return dispatchVoid(() -> webDriver.navigate().back());
    }

    @Override
    public CompletableFuture<Void> goForward() {
        return dispatchVoid(() -> webDriver.navigate().forward());
    }

    @Override
    public CompletableFuture<Void> reload() {
        return dispatchVoid(() -> webDriver.navigate().refresh());
    }

    @Override
    public CompletableFuture<Void> click(String selector, Duration timeout) {
        return dispatchVoid(() -> await(timeout, ExpectedConditions.elementToBeClickable(by(selector))).click());
    }

    @Override
    public CompletableFuture<Void> fill(String selector, String value, Duration timeout) {
        return dispatchVoid(() -> {
            WebElement element = await(timeout, ExpectedConditions.visibilityOfElementLocated(by(selector)));
            element.clear();
            element.sendKeys(value);
        });
    }

    @Override
    public CompletableFuture<Void> selectOption(String selector, String value, Duration timeout) {
        return dispatchVoid(() -> new Select(await(timeout, ExpectedConditions.presenceOfElementLocated(by(selector))))
                .selectByValue(value));
    }

    @Override
    public CompletableFuture<Void> hover(String selector, Duration timeout) {
        return dispatchVoid(() -> {
            WebElement element = await(timeout, ExpectedConditions.visibilityOfElementLocated(by(selector)));
            new Actions(webDriver).moveToElement(element).perform();
        });
    }

    @Override
    public CompletableFuture<Void> pressKey(String key) {
        return dispatchVoid(() -> webDriver.switchTo().activeElement().sendKeys(toKeys(key)));
    }

    @Override
    public CompletableFuture<String> getPageSource() {
        return dispatch(() -> webDriver.getPageSource());
    }

    @Override
    public CompletableFuture<String> getText(String selector, Duration timeout) {
        return dispatch(() -> await(timeout, ExpectedConditions.presenceOfElementLocated(by(selector))).getText());
    }

    @Override
    public CompletableFuture<String> getAttribute(String selector, String attribute, Duration timeout) {
        return dispatch(() -> await(timeout, ExpectedConditions.presenceOfElementLocated(by(selector)))
                .getAttribute(attribute));
    }

    @Override
    public CompletableFuture<String> getInputValue(String selector, Duration timeout) {
        return dispatch(() -> await(timeout, ExpectedConditions.presenceOfElementLocated(by(selector)))
                .getDomProperty("value"));
    }

    @Override
    public CompletableFuture<List<String>> getAllTexts(String selector, Duration timeout) {
        return dispatch(() -> await(timeout, ExpectedConditions.presenceOfAllElementsLocatedBy(by(selector)))
                .stream()
                .map(WebElement::getText)
                .toList());
    }

    @Override
    public CompletableFuture<byte[]> screenshot(Path path, boolean fullPage) {
        return dispatch(() -> {
            byte[] png = fullPage && webDriver instanceof FirefoxDriver firefox
                    ? firefox.getFullPageScreenshotAs(OutputType.BYTES)
                    : ((TakesScreenshot) webDriver).getScreenshotAs(OutputType.BYTES);
            if (path != null) {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(path, png);
            }
            return png;
        });
    }

    @Override
    public CompletableFuture<Void> waitForSelector(String selector, Duration timeout, ElementState state) {
        return dispatchVoid(() -> {
            By by = by(selector);
            ElementState target = state != null ? state : ElementState.VISIBLE;
            switch (target) {
            case ATTACHED -> await(timeout, ExpectedConditions.presenceOfElementLocated(by));
            case VISIBLE -> await(timeout, ExpectedConditions.visibilityOfElementLocated(by));
            case HIDDEN -> await(timeout, ExpectedConditions.invisibilityOfElementLocated(by));
            case DETACHED -> await(timeout, ExpectedConditions.not(ExpectedConditions.presenceOfElementLocated(by)));
            default -> throw new IllegalArgumentException("Unsupported element state: " + target);
            }
        });
    }

    @Override
    public CompletableFuture<Void> waitForNavigation(Duration timeout) {
        return dispatchVoid(() -> awaitReadyState(timeout, "complete"));
    }

    @Override
    public CompletableFuture<Void> waitForLoadState(PageLoadState state, Duration timeout) {
        return dispatchVoid(() -> {
            if (state == PageLoadState.DOM_CONTENT_LOADED) {
                awaitReadyState(timeout, "interactive", "complete");
            } else {
                awaitReadyState(timeout, "complete");
            }
        });
    }

    @Override
    public CompletableFuture<Object> executeScript(String script, Object... args) {
        return dispatch(() -> ((JavascriptExecutor) webDriver).executeScript(script, args));
    }

    @Override
    public CompletableFuture<Object> evaluate(String expression) {
        return dispatch(() -> ((JavascriptExecutor) webDriver).executeScript("return (" + expression + ");"));
    }

    @Override
    public CompletableFuture<String> currentUrl() {
        return dispatch(() -> webDriver.getCurrentUrl());
    }

    @Override
    public CompletableFuture<List<BrowserCookie>> getCookies() {
        return dispatch(() -> webDriver.manage().getCookies().stream()
                .map(cookie -> BrowserCookie.builder()
                        .name(cookie.getName())
                        .value(cookie.getValue())
                        .domain(cookie.getDomain())
                        .path(cookie.getPath())
                        .expires(cookie.getExpiry() != null ? cookie.getExpiry().getTime() / 1000 : null)
                        .secure(cookie.isSecure())
                        .httpOnly(cookie.isHttpOnly())
                        .build())
                .toList());
    }

    @Override
    public CompletableFuture<Void> setCookies(List<BrowserCookie> cookies) {
        return dispatchVoid(() -> {
            for (BrowserCookie cookie : cookies) {
                Cookie.Builder builder = new Cookie.Builder(cookie.getName(), cookie.getValue())
                        .path(cookie.getPath() != null ? cookie.getPath() : "/")
                        .isSecure(cookie.isSecure())
                        .isHttpOnly(cookie.isHttpOnly());
                if (cookie.getDomain() != null) {
                    builder.domain(cookie.getDomain());
                }
                if (cookie.getExpires() != null) {
                    builder.expiresOn(new Date(cookie.getExpires() * 1000));
                }
                webDriver.manage().addCookie(builder.build());
            }
        });
    }

    private <T> T await(Duration timeout, ExpectedCondition<T> condition) {
        return new WebDriverWait(webDriver, orDefault(timeout)).until(condition);
    }

    private void awaitReadyState(Duration timeout, String... acceptedStates) {
        List<String> accepted = List.of(acceptedStates);
        new WebDriverWait(webDriver, orDefault(timeout)).until(driver -> {
            Object readyState = ((JavascriptExecutor) driver).executeScript("return document.readyState");
            return readyState != null && accepted.contains(readyState.toString());
        });
    }

    private static By by(String selector) {
        String trimmed = selector.trim();
        return SelectorSupport.isXpath(trimmed) ? By.xpath(trimmed) : By.cssSelector(trimmed);
    }

    static CharSequence toKeys(String key) {
        if (key == null || key.isEmpty()) {
            return "";
        }
        if (key.contains("+") && key.length() > 1) {
            String[] parts = key.split("\\+");
            CharSequence[] chord = new CharSequence[parts.length];
            for (int i = 0; i < parts.length; i++) {
                chord[i] = toKeys(parts[i]);
            }
            return Keys.chord(chord);
        }
        CharSequence mapped = KEYS.get(key.toLowerCase(Locale.ROOT));
        return mapped != null ? mapped : key;
    }

    static WebDriver createWebDriver(DriverConfig config) {
        String userAgent = config.getCustomUserAgent();
        boolean hasUserAgent = userAgent != null && !userAgent.isBlank();
        if (!config.isAutoInstall()) {
            log.debug("[Driver] Auto-install disabled, expecting a {} driver binary on PATH", config.getBrowser());
        }
        return switch (config.getBrowser()) {
        case "chrome" -> {
            ChromeOptions options = new ChromeOptions();
            options.addArguments("--disable-gpu", "--no-sandbox", "--disable-dev-shm-usage");
            if (config.isHeadless()) {
                options.addArguments("--headless=new");
            }
            if (config.isMobile()) {
                String device = config.getMobileDevice() != null ? config.getMobileDevice() : "iPhone 12 Pro";
                options.setExperimentalOption("mobileEmulation", Map.of("deviceName", device));
            }
            if (hasUserAgent) {
                options.addArguments("--user-agent=" + userAgent);
            }
            if (config.isDisableImages()) {
                options.setExperimentalOption("prefs", Map.of("profile.managed_default_content_settings.images", 2));
            }
            yield new ChromeDriver(options);
        }
        case "edge" -> {
            EdgeOptions options = new EdgeOptions();
            options.addArguments("--disable-gpu", "--no-sandbox");
            if (config.isHeadless()) {
                options.addArguments("--headless=new");
            }
            if (hasUserAgent) {
                options.addArguments("--user-agent=" + userAgent);
            }
            if (config.isDisableImages()) {
                options.setExperimentalOption("prefs", Map.of("profile.managed_default_content_settings.images", 2));
            }
            yield new EdgeDriver(options);
        }
        case "firefox" -> {
            FirefoxOptions options = new FirefoxOptions();
            if (config.isHeadless()) {
                options.addArguments("-headless");
            }
            if (hasUserAgent) {
                options.addPreference("general.useragent.override", userAgent);
            }
            if (config.isDisableImages()) {
                options.addPreference("permissions.default.image", 2);
            }
            yield new FirefoxDriver(options);
        }
        case "safari" -> new SafariDriver(new SafariOptions());
        default -> throw new ConfigurationException("Unsupported Selenium browser: " + config.getBrowser());
        };
    }
}
