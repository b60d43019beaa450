package me.golemcore.scraper.tools;

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

import me.golemcore.scraper.crawl.CrawlResult;
import me.golemcore.scraper.domain.component.ToolComponent;
import me.golemcore.scraper.domain.model.CrawlRequest;
import me.golemcore.scraper.domain.model.ScrapingResult;
import me.golemcore.scraper.domain.model.ToolDefinition;
import me.golemcore.scraper.domain.model.ToolFailureKind;
import me.golemcore.scraper.domain.model.ToolResult;
import me.golemcore.scraper.domain.service.PlanCodec;
import me.golemcore.scraper.domain.service.ScrapingToolkit;
import me.golemcore.scraper.infrastructure.config.ScraperProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool that crawls a site from a start URL, scraping every page with the same
 * plan and following links up to the requested depth.
 */
@Component
@RequiredArgsConstructor
public class CrawlTool implements ToolComponent {

    static final String NAME = "crawl";

    private static final String PARAM_START_URL = "start_url";
    private static final String TYPE = "type";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_INTEGER = "integer";
    private static final String DESCRIPTION = "description";

    private final ScrapingToolkit toolkit;
    private final PlanCodec planCodec;
    private final ScraperProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(PARAM_START_URL, Map.of(TYPE, TYPE_STRING, DESCRIPTION, "Page to start crawling from"));
        schema.put("objective", Map.of(TYPE, TYPE_STRING,
                DESCRIPTION, "What to extract on each page; used to generate a plan when none is cached"));
        schema.put("plan", Map.of(TYPE, "object", DESCRIPTION, "Inline scraping plan used for every page"));
        schema.put("depth", Map.of(TYPE, TYPE_INTEGER, DESCRIPTION, "Link depth to follow; 0 = start page only"));
        schema.put("max_pages", Map.of(TYPE, TYPE_INTEGER, DESCRIPTION, "Maximum pages to scrape"));
        schema.put("follow_selector", Map.of(TYPE, TYPE_STRING,
                DESCRIPTION, "CSS selector of links to follow (default a[href])"));
        schema.put("follow_pattern", Map.of(TYPE, TYPE_STRING,
                DESCRIPTION, "Regex a link URL must contain to be followed"));
        schema.put("strategy", Map.of(TYPE, TYPE_STRING, "enum", List.of("bfs", "dfs"),
                DESCRIPTION, "Traversal order"));
        schema.put("concurrency", Map.of(TYPE, TYPE_INTEGER, DESCRIPTION, "Pages scraped in parallel"));
        schema.put("save_plan", Map.of(TYPE, "boolean", DESCRIPTION, "Save the plan after the crawl"));
        return ToolDefinition.builder()
                .name(NAME)
                .description("Crawl a website starting from a URL, scraping each page with a scraping plan "
                        + "and following links within the same domain.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", schema,
                        "required", List.of(PARAM_START_URL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        CrawlRequest request;
        try {
            String startUrl = ToolArguments.requireHttpUrl(parameters.get(PARAM_START_URL), PARAM_START_URL);
            Map<String, Object> plan = ToolArguments.object(parameters, "plan");
            if (plan != null) {
                plan = new LinkedHashMap<>(plan);
                plan.putIfAbsent("url", startUrl);
            }
            request = CrawlRequest.builder()
                    .startUrl(startUrl)
                    .objective(ToolArguments.string(parameters, "objective"))
                    .plan(plan != null ? planCodec.fromMap(plan) : null)
                    .depth(ToolArguments.integer(parameters, "depth"))
                    .maxPages(ToolArguments.integer(parameters, "max_pages"))
                    .followSelector(ToolArguments.string(parameters, "follow_selector"))
                    .followPattern(ToolArguments.string(parameters, "follow_pattern"))
                    .strategy(ToolArguments.string(parameters, "strategy"))
                    .concurrency(ToolArguments.integer(parameters, "concurrency"))
                    .savePlan(ToolArguments.bool(parameters, "save_plan", false))
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_INPUT, e.getMessage()));
        }
        return toolkit.crawl(request).handle((result, error) -> {
            if (error != null) {
                return ScrapeTool.failure(request.getStartUrl(), error);
            }
            return toToolResult(result);
        });
    }

    @Override
    public boolean isEnabled() {
        return properties.getTools().isEnabled();
    }

    private ToolResult toToolResult(CrawlResult result) {
        List<Map<String, Object>> pages = result.getPages().stream()
                .map(this::page)
                .toList();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("start_url", result.getStartUrl());
        data.put("depth", result.getDepth());
        data.put("total_pages", result.getTotalPages());
        data.put("visited_urls", result.getVisitedUrls());
        data.put("failed_urls", result.getFailedUrls());
        data.put("errors", result.getErrors());
        data.put("elapsed_seconds", result.getElapsedSeconds());
        data.put("plan_used", result.getPlanUsed());
        data.put("pages", pages);

        String output = String.format("Crawled %s: %d page(s) scraped, %d failed, %.1fs (plan: %s)%n%n%s",
                result.getStartUrl(), result.getTotalPages(), result.getFailedUrls().size(),
                result.getElapsedSeconds(), result.getPlanUsed(), planCodec.toPrettyJson(pages));
        return ToolResult.success(output, data);
    }

    private Map<String, Object> page(ScrapingResult result) {
        Map<String, Object> page = new LinkedHashMap<>();
        page.put("url", result.getUrl());
        page.put("success", result.isSuccess());
        page.put("extracted_data", result.getExtractedData());
        return page;
    }
}
