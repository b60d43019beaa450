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

import me.golemcore.scraper.domain.component.ToolComponent;
import me.golemcore.scraper.domain.exception.ConfigurationException;
import me.golemcore.scraper.domain.exception.PlanValidationException;
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.ScrapeRequest;
import me.golemcore.scraper.domain.model.ScrapingResult;
import me.golemcore.scraper.domain.model.ToolDefinition;
import me.golemcore.scraper.domain.model.ToolFailureKind;
import me.golemcore.scraper.domain.model.ToolResult;
import me.golemcore.scraper.domain.service.PlanCodec;
import me.golemcore.scraper.domain.service.ScrapingToolkit;
import me.golemcore.scraper.infrastructure.config.ScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Tool that scrapes a single page.
 *
 * <p>
 * Steps come from, in priority order: raw {@code steps}, an inline
 * {@code plan}, a saved plan named by {@code plan_name}, the plan cache for
 * the URL, or a plan generated from {@code objective}. Only http and https
 * URLs are accepted; a URL without a scheme gets {@code https://}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScrapeTool implements ToolComponent {

    static final String NAME = "scrape";

    private static final String PARAM_URL = "url";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_OBJECT = "object";
    private static final String TYPE_ARRAY = "array";
    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";
    private static final int MAX_CONTENT_PREVIEW = 2000;

    private final ScrapingToolkit toolkit;
    private final PlanCodec planCodec;
    private final ScraperProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Scrape a web page with a browser. Runs a cached, given or generated scraping plan "
                        + "(or raw steps) and returns the data extracted by its selectors.")
                .inputSchema(Map.of(
                        TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_URL, Map.of(TYPE, TYPE_STRING, DESCRIPTION, "Page to scrape"),
                                "objective", Map.of(TYPE, TYPE_STRING,
                                        DESCRIPTION, "What to extract; used to generate a plan when none is cached"),
                                "plan", Map.of(TYPE, TYPE_OBJECT, DESCRIPTION, "Inline scraping plan"),
                                "plan_name", Map.of(TYPE, TYPE_STRING, DESCRIPTION, "Name of a saved plan"),
                                "steps", Map.of(TYPE, TYPE_ARRAY,
                                        DESCRIPTION, "Raw browser actions; bypasses plan resolution"),
                                "selectors", Map.of(TYPE, TYPE_ARRAY,
                                        DESCRIPTION, "Content selectors used with raw steps"),
                                "save_plan", Map.of(TYPE, "boolean",
                                        DESCRIPTION, "Save the plan after a successful scrape"),
                                "config", Map.of(TYPE, TYPE_OBJECT,
                                        DESCRIPTION, "Driver overrides, e.g. {\"driver_type\": \"playwright\"}")),
                        "required", List.of(PARAM_URL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ScrapeRequest request;
        try {
            request = toRequest(parameters);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_INPUT, e.getMessage()));
        }
        return toolkit.scrape(request).handle((result, error) -> {
            if (error != null) {
                return failure(request.getUrl(), error);
            }
            return toToolResult(result);
        });
    }

    @Override
    public boolean isEnabled() {
        return properties.getTools().isEnabled();
    }

    private ScrapeRequest toRequest(Map<String, Object> parameters) {
        String url = ToolArguments.requireHttpUrl(parameters.get(PARAM_URL), PARAM_URL);
        ScrapeRequest.ScrapeRequestBuilder request = ScrapeRequest.builder()
                .url(url)
                .objective(ToolArguments.string(parameters, "objective"))
                .savePlan(ToolArguments.bool(parameters, "save_plan", false))
                .configOverrides(ToolArguments.object(parameters, "config"));

        List<?> steps = ToolArguments.list(parameters, "steps");
        if (steps != null) {
            request.steps(planCodec.stepsFromMaps(steps));
            List<?> selectors = ToolArguments.list(parameters, "selectors");
            if (selectors != null) {
                request.selectors(planCodec.selectorsFromMaps(selectors));
            }
            return request.build();
        }

        Map<String, Object> plan = ToolArguments.object(parameters, "plan");
        if (plan != null) {
            Map<String, Object> values = new LinkedHashMap<>(plan);
            values.putIfAbsent(PARAM_URL, url);
            request.plan(planCodec.fromMap(values));
        } else {
            String planName = ToolArguments.string(parameters, "plan_name");
            if (planName != null) {
                Plan saved = toolkit.planLoad(planName)
                        .orElseThrow(() -> new IllegalArgumentException("No saved plan named '" + planName + "'"));
                request.plan(saved);
            }
        }
        return request.build();
    }

    private ToolResult toToolResult(ScrapingResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(PARAM_URL, result.getUrl());
        data.put("success", result.isSuccess());
        data.put("plan_name", result.getPlanName());
        data.put("extracted_data", result.getExtractedData());
        data.put("step_errors", planCodec.toTree(result.getStepErrors()));
        data.put("aborted", result.isAborted());
        data.put("metadata", planCodec.toTree(result.getMetadata()));

        if (!result.isSuccess()) {
            return ToolResult.builder()
                    .success(false)
                    .error("Scrape failed: " + result.getErrorMessage())
                    .failureKind(ToolFailureKind.EXECUTION_FAILED)
                    .data(data)
                    .build();
        }

        StringBuilder output = new StringBuilder();
        output.append("Scraped ").append(result.getUrl())
                .append(" (").append(result.getExecutedSteps()).append('/').append(result.getTotalSteps())
                .append(" steps");
        if (result.hadFailures()) {
            output.append(", ").append(result.getStepErrors().size()).append(" failed");
        }
        output.append(")\n\n");
        if (result.getExtractedData() != null && !result.getExtractedData().isEmpty()) {
            output.append("Extracted data:\n").append(planCodec.toPrettyJson(result.getExtractedData()));
        } else {
            String content = result.getContent() != null ? result.getContent() : "";
            if (content.length() > MAX_CONTENT_PREVIEW) {
                content = content.substring(0, MAX_CONTENT_PREVIEW) + "\n... (truncated)";
            }
            output.append("Page source:\n").append(content);
        }
        return ToolResult.success(output.toString(), data);
    }

    static ToolResult failure(String url, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof ConfigurationException || cause instanceof PlanValidationException
                || cause instanceof IllegalArgumentException) {
            return ToolResult.failure(ToolFailureKind.INVALID_INPUT, cause.getMessage());
        }
        log.error("[Toolkit] Tool call failed for {}", url, cause);
        return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Failed to scrape: " + cause.getMessage());
    }
}
