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
import me.golemcore.scraper.domain.exception.ScraperException;
import me.golemcore.scraper.domain.model.DriverConfig;
import me.golemcore.scraper.port.outbound.BrowserDriver;
import me.golemcore.scraper.port.outbound.BrowserDriverFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Registry of driver backends keyed by driver-type name.
 *
 * <p>
 * Each backend declares how generic browser names ("chrome", "edge",
 * "safari", ...) translate into its own identifiers. {@link #create} validates
 * both names before constructing anything, so an unknown type or browser fails
 * with a {@link ConfigurationException} and never leaves a half-built driver
 * behind. Drivers are returned un-started.
 *
 * <p>
 * Built-in backends: {@code selenium} and {@code playwright}. Additional ones
 * can be added with {@link #register}.
 */
@Component
@Slf4j
public class DriverRegistry implements BrowserDriverFactory {

    private static final long START_TIMEOUT_SECONDS = 120;
    private static final long RETRY_BACKOFF_MILLIS = 250;

    private static final Map<String, String> SELENIUM_BROWSERS = Map.of(
            "chrome", "chrome",
            "chromium", "chrome",
            "google-chrome", "chrome",
            "undetected", "chrome",
            "firefox", "firefox",
            "edge", "edge",
            "msedge", "edge",
            "safari", "safari");

    private static final Map<String, String> PLAYWRIGHT_BROWSERS = Map.of(
            "chrome", "chromium",
            "chromium", "chromium",
            "google-chrome", "chromium",
            "firefox", "firefox",
            "edge", "msedge",
            "msedge", "msedge",
            "safari", "webkit",
            "webkit", "webkit");

    private final Map<String, Backend> backends = new ConcurrentHashMap<>();

    public DriverRegistry() {
        register(SeleniumBrowserDriver.NAME, SELENIUM_BROWSERS, SeleniumBrowserDriver::new);
        register(PlaywrightBrowserDriver.NAME, PLAYWRIGHT_BROWSERS, PlaywrightBrowserDriver::new);
    }

    /**
     * Registers (or replaces) a backend.
     *
     * @param driverType
     *            name used in {@code DriverConfig.driverType}
     * @param browserNames
     *            generic browser name to backend identifier
     * @param factory
     *            builds an un-started driver from a config whose browser has
     *            already been translated
     */
    public void register(String driverType, Map<String, String> browserNames,
            Function<DriverConfig, BrowserDriver> factory) {
        backends.put(driverType.toLowerCase(Locale.ROOT), new Backend(Map.copyOf(browserNames), factory));
        log.debug("[Driver] Registered backend: {}", driverType);
    }

    public Set<String> getDriverTypes() {
        return new TreeSet<>(backends.keySet());
    }

    @Override
    public BrowserDriver create(DriverConfig config) {
        String driverType = config.getDriverType() != null ? config.getDriverType().toLowerCase(Locale.ROOT) : "";
        Backend backend = backends.get(driverType);
        if (backend == null) {
            throw new ConfigurationException("Unknown driver type '" + config.getDriverType()
                    + "'. Available: " + getDriverTypes());
        }
        String browser = config.getBrowser() != null ? config.getBrowser().toLowerCase(Locale.ROOT) : "";
        String translated = backend.browserNames().get(browser);
        if (translated == null) {
            throw new ConfigurationException("Browser '" + config.getBrowser() + "' is not supported by the "
                    + driverType + " driver. Supported: " + new TreeSet<>(backend.browserNames().keySet()));
        }
        log.debug("[Driver] Creating {} driver for browser {} ({})", driverType, browser, translated);
        return backend.factory().apply(config.toBuilder()
                .driverType(driverType)
                .browser(translated)
                .build());
    }

    @Override
    public BrowserDriver startWithRetry(BrowserDriver driver, DriverConfig config) {
        int attempts = Math.max(1, config.getRetryAttempts());
        Exception lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                driver.start().get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                return driver;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                driver.quit();
                throw new ScraperException("Interrupted while starting " + driver.getDriverName() + " driver", e);
            } catch (ExecutionException | TimeoutException e) {
                lastError = e;
                log.warn("[Driver] Start attempt {}/{} failed for {}: {}", attempt, attempts,
                        driver.getDriverName(), rootMessage(e));
                if (attempt < attempts) {
                    sleepBeforeRetry(attempt);
                }
            }
        }
        driver.quit();
        throw new ScraperException("Failed to start " + driver.getDriverName() + " driver after "
                + attempts + " attempt(s): " + rootMessage(lastError), lastError);
    }

    private static void sleepBeforeRetry(int attempt) {
        try {
            Thread.sleep(RETRY_BACKOFF_MILLIS * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current != null && current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current != null ? current.getMessage() : "unknown error";
    }

    private record Backend(Map<String, String> browserNames, Function<DriverConfig, BrowserDriver> factory) {
    }
}
