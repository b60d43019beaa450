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
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.PlanSaveResult;
import me.golemcore.scraper.domain.model.PlanSummary;
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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for managing saved scraping plans.
 *
 * <p>
 * Operations:
 * <ul>
 * <li>list - registered plans, optionally filtered by domain or tag
 * <li>load - a plan by URL or name
 * <li>delete - unregister a plan and delete its file
 * <li>create - draft a plan for a URL and objective, saving it when asked
 * <li>save - store an inline plan
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class ScrapingPlanTool implements ToolComponent {

    static final String NAME = "scraping_plans";

    private static final String PARAM_OPERATION = "operation";
    private static final String TYPE = "type";
    private static final String TYPE_STRING = "string";
    private static final String DESCRIPTION = "description";

    private final ScrapingToolkit toolkit;
    private final PlanCodec planCodec;
    private final ScraperProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(PARAM_OPERATION, Map.of(TYPE, TYPE_STRING,
                "enum", List.of("list", "load", "delete", "create", "save"),
                DESCRIPTION, "Operation to perform"));
        schema.put("url", Map.of(TYPE, TYPE_STRING, DESCRIPTION, "Target URL (load, create)"));
        schema.put("name", Map.of(TYPE, TYPE_STRING, DESCRIPTION, "Plan name (load, delete)"));
        schema.put("objective", Map.of(TYPE, TYPE_STRING, DESCRIPTION, "What the plan should extract (create)"));
        schema.put("hints", Map.of(TYPE, "object", DESCRIPTION, "Extra guidance for plan generation (create)"));
        schema.put("force_regenerate", Map.of(TYPE, "boolean", DESCRIPTION, "Ignore a cached plan (create)"));
        schema.put("save", Map.of(TYPE, "boolean", DESCRIPTION, "Save the created plan (create)"));
        schema.put("plan", Map.of(TYPE, "object", DESCRIPTION, "Plan to store (save)"));
        schema.put("overwrite", Map.of(TYPE, "boolean", DESCRIPTION, "Replace an existing plan (create, save)"));
        schema.put("domain", Map.of(TYPE, TYPE_STRING, DESCRIPTION, "Domain filter (list)"));
        schema.put("tag", Map.of(TYPE, TYPE_STRING, DESCRIPTION, "Tag filter (list)"));
        schema.put("delete_file", Map.of(TYPE, "boolean", DESCRIPTION, "Also delete the plan file (delete)"));
        return ToolDefinition.builder()
                .name(NAME)
                .description("Manage saved web scraping plans: list, load, delete, create or save.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", schema,
                        "required", List.of(PARAM_OPERATION)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String operation = ToolArguments.string(parameters, PARAM_OPERATION);
        try {
            return switch (operation != null ? operation : "") {
            case "list" -> CompletableFuture.completedFuture(list(parameters));
            case "load" -> CompletableFuture.completedFuture(load(parameters));
            case "delete" -> CompletableFuture.completedFuture(delete(parameters));
            case "save" -> CompletableFuture.completedFuture(save(parameters));
            case "create" -> create(parameters);
            default -> CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_INPUT,
                    "Unknown operation: " + operation + ". Use list, load, delete, create or save"));
            };
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_INPUT, e.getMessage()));
        }
    }

    @Override
    public boolean isEnabled() {
        return properties.getTools().isEnabled();
    }

    private ToolResult list(Map<String, Object> parameters) {
        List<PlanSummary> plans = toolkit.planList(ToolArguments.string(parameters, "domain"),
                ToolArguments.string(parameters, "tag"));
        if (plans.isEmpty()) {
            return ToolResult.success("No saved plans", Map.of("plans", List.of()));
        }
        StringBuilder output = new StringBuilder("Saved plans (").append(plans.size()).append("):\n");
        for (PlanSummary plan : plans) {
            output.append("- ").append(plan.getName())
                    .append(" v").append(plan.getVersion())
                    .append(" ").append(plan.getUrl())
                    .append(" (used ").append(plan.getUseCount()).append("x)\n");
        }
        return ToolResult.success(output.toString().stripTrailing(), Map.of("plans", planCodec.toTree(plans)));
    }

    private ToolResult load(Map<String, Object> parameters) {
        String key = ToolArguments.string(parameters, "url");
        if (key == null) {
            key = ToolArguments.string(parameters, "name");
        }
        if (key == null) {
            return ToolResult.failure(ToolFailureKind.INVALID_INPUT, "url or name is required");
        }
        Optional<Plan> plan = toolkit.planLoad(key);
        if (plan.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "No saved plan for " + key);
        }
        return ToolResult.success(planCodec.toJson(plan.get()), Map.of("plan", planCodec.toTree(plan.get())));
    }

    private ToolResult delete(Map<String, Object> parameters) {
        String name = ToolArguments.string(parameters, "name");
        if (name == null) {
            return ToolResult.failure(ToolFailureKind.INVALID_INPUT, "name is required");
        }
        boolean deleted = toolkit.planDelete(name, ToolArguments.bool(parameters, "delete_file", true));
        if (!deleted) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "No saved plan named '" + name + "'");
        }
        return ToolResult.success("Deleted plan '" + name + "'");
    }

    private ToolResult save(Map<String, Object> parameters) {
        Map<String, Object> values = ToolArguments.object(parameters, "plan");
        if (values == null) {
            return ToolResult.failure(ToolFailureKind.INVALID_INPUT, "plan is required");
        }
        Plan plan = planCodec.fromMap(values);
        return toSaveResult(plan, toolkit.planSave(plan, ToolArguments.bool(parameters, "overwrite", false)));
    }

    private CompletableFuture<ToolResult> create(Map<String, Object> parameters) {
        String url = ToolArguments.requireHttpUrl(parameters.get("url"), "url");
        String objective = ToolArguments.string(parameters, "objective");
        if (objective == null) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_INPUT, "objective is required"));
        }
        boolean save = ToolArguments.bool(parameters, "save", false);
        boolean overwrite = ToolArguments.bool(parameters, "overwrite", false);
        return toolkit.planCreate(url, objective, ToolArguments.object(parameters, "hints"),
                ToolArguments.bool(parameters, "force_regenerate", false))
                .handle((plan, error) -> {
                    if (error != null) {
                        return ScrapeTool.failure(url, error);
                    }
                    if (save) {
                        return toSaveResult(plan, toolkit.planSave(plan, overwrite));
                    }
                    return ToolResult.success(planCodec.toJson(plan), Map.of("plan", planCodec.toTree(plan)));
                });
    }

    private ToolResult toSaveResult(Plan plan, PlanSaveResult saved) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("saved", saved.isSuccess());
        data.put("message", saved.getMessage());
        data.put("name", saved.getName());
        data.put("path", saved.getPath());
        data.put("fingerprint", saved.getFingerprint());
        data.put("plan", planCodec.toTree(plan));
        if (!saved.isSuccess()) {
            return ToolResult.builder()
                    .success(false)
                    .error(saved.getMessage())
                    .failureKind(ToolFailureKind.EXECUTION_FAILED)
                    .data(data)
                    .build();
        }
        return ToolResult.success(saved.getMessage() + " (" + saved.getPath() + ")", data);
    }
}
