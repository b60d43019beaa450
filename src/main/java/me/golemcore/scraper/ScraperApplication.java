package me.golemcore.scraper;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Scraper.
 *
 * <p>
 * GolemCore Scraper is a plan-driven browser automation and crawl engine built
 * with Spring Boot 3.4.2. A plan is an ordered list of browser actions plus
 * content selectors for a target URL; plans are cached on disk by URL
 * fingerprint and reused across runs.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Two backends</b> - Selenium and Playwright behind one driver
 * contract</li>
 * <li><b>Step execution</b> - critical navigate/authenticate steps abort the
 * page, other failures are recorded and skipped</li>
 * <li><b>Plan cache</b> - exact, path-prefix and domain lookup over a JSON
 * index</li>
 * <li><b>Crawling</b> - BFS/DFS traversal with depth, page and concurrency
 * bounds</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Tools              → ScrapeTool, CrawlTool, ScrapingPlanTool
 * Domain Layer       → ScrapingToolkit, StepExecutor, PlanRegistry, CrawlEngine
 * Infrastructure     → Selenium/Playwright drivers, local storage
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code scraper.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScraperApplication.class, args);
    }

}
