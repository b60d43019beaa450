package me.golemcore.scraper.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration properties for the scraper, bound from application.yml under
 * the {@code scraper.*} prefix.
 *
 * <ul>
 * <li>{@link DriverProperties} - defaults for every browser driver</li>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link PlansProperties} - plan cache directory and generation</li>
 * <li>{@link CrawlProperties} - crawl engine defaults</li>
 * <li>{@link ToolsProperties} - agent tool exposure</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "scraper")
@Data
public class ScraperProperties {

    /**
     * Reuse one driver for all calls between start and stop instead of creating
     * one per call.
     */
    private boolean sessionBased = false;

    private DriverProperties driver = new DriverProperties();
    private StorageProperties storage = new StorageProperties();
    private PlansProperties plans = new PlansProperties();
    private CrawlProperties crawl = new CrawlProperties();
    private ScreenshotProperties screenshots = new ScreenshotProperties();
    private ToolsProperties tools = new ToolsProperties();

    /**
     * Absolute workspace root with {@code ${user.home}} expanded.
     */
    public Path resolveWorkspacePath() {
        String basePath = storage.getLocal().getBasePath();
        return Paths.get(basePath.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }

    @Data
    public static class DriverProperties {
        private String type = "selenium";
        private String browser = "chrome";
        private boolean headless = true;
        private boolean mobile = false;
        private String mobileDevice;
        private boolean autoInstall = true;
        private Duration defaultTimeout = Duration.ofSeconds(10);
        private int retryAttempts = 3;
        private Duration delayBetweenActions = Duration.ofSeconds(1);
        private boolean overlayHousekeeping = true;
        private boolean disableImages = false;
        private String customUserAgent;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/scraper";
    }

    @Data
    public static class PlansProperties {
        private String directory = "scraping_plans";
        private boolean snapshotBeforeGenerate = true;
    }

    @Data
    public static class CrawlProperties {
        private String followSelector = "a[href]";
        private boolean allowExternal = false;
        private int concurrency = 1;
        private String strategy = "bfs";
        private int defaultDepth = 1;
    }

    @Data
    public static class ScreenshotProperties {
        private String directory = "screenshots";
    }

    @Data
    public static class ToolsProperties {
        private boolean enabled = true;
    }
}
