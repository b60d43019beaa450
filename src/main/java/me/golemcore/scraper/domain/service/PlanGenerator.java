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

import me.golemcore.scraper.domain.exception.PlanValidationException;
import me.golemcore.scraper.domain.model.PageSnapshot;
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.port.outbound.LlmCompletionPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drafts scraping plans with a language model.
 *
 * <p>
 * The model gets the URL, the objective, the supported action vocabulary and,
 * when available, a {@link PageSnapshot} of the live page. Its answer is
 * tolerated in markdown fences or surrounded by prose: the first balanced JSON
 * object is taken, missing {@code url}/{@code objective} are filled in, and a
 * {@code steps} list is required. Anything else is rejected with a
 * {@link PlanValidationException} carrying an excerpt of the response.
 */
@Service
@Slf4j
public class PlanGenerator {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?\\s*\\n?(.*?)\\n?\\s*```",
            Pattern.DOTALL);

    static final String PROMPT_TEMPLATE = """
            You are a web scraping expert. Produce a scraping plan that achieves the objective below.

            URL: %s
            OBJECTIVE: %s
            HINTS: %s

            PAGE SNAPSHOT:
            %s

            Respond ONLY with one JSON object of this shape (snake_case keys):
            {
              "url": "<target url>",
              "objective": "<objective>",
              "steps": [ {"action": "<action>", ...}, ... ],
              "selectors": [ {"name": "<field>", "selector": "<css or xpath>", "selector_type": "css|xpath|tag",
                              "extract_type": "text|html|attribute", "attribute": "<attr>", "multiple": false} ],
              "follow_selector": "<css selector of links to crawl, optional>",
              "follow_pattern": "<regex URLs must contain, optional>",
              "max_depth": <crawl depth, optional>,
              "tags": ["<tag>"]
            }

            Supported actions and their fields:
            %s

            Rules:
            - Use CSS selectors unless an XPath is clearly more reliable.
            - Prefer data-* attributes and IDs over class names.
            - Start with a navigate step and follow every navigation with a wait step.
            - Keep steps minimal; content is extracted by "selectors" after the steps run.
            """;

    static final List<String> ACTION_VOCABULARY = List.of(
            "navigate: url, timeout",
            "click: selector, click_type (single|double|right), wait_after_click, wait_timeout, no_wait",
            "fill: selector, value, clear_first, press_enter",
            "wait: condition_type (selector|url_contains|title_contains|custom|simple), condition, timeout",
            "scroll: direction (up|down|top|bottom), amount, selector, smooth",
            "evaluate: script, args, return_value",
            "refresh: hard",
            "back: steps",
            "select: selector, value | text | index",
            "press_key: keys, sequential, target",
            "screenshot: full_page, filename",
            "get_cookies: names, domain",
            "set_cookies: cookies [{name, value, domain, path}]");

    private final ObjectProvider<LlmCompletionPort> llmProvider;
    private final PlanCodec planCodec;

    public PlanGenerator(ObjectProvider<LlmCompletionPort> llmProvider, PlanCodec planCodec) {
        this.llmProvider = llmProvider;
        this.planCodec = planCodec;
    }

    public boolean isAvailable() {
        LlmCompletionPort llm = llmProvider.getIfAvailable();
        return llm != null && llm.isAvailable();
    }

    public CompletableFuture<Plan> generate(String url, String objective, PageSnapshot snapshot,
            Map<String, Object> hints) {
        LlmCompletionPort llm = llmProvider.getIfAvailable();
        if (llm == null || !llm.isAvailable()) {
            return CompletableFuture.failedFuture(
                    new PlanValidationException("Plan generation requires a language model, none is available"));
        }
        String prompt = buildPrompt(url, objective, snapshot, hints);
        log.debug("[Toolkit] Requesting plan for {} ({} prompt chars)", url, prompt.length());
        return llm.complete(prompt).thenApply(raw -> {
            log.debug("[Toolkit] Received plan response ({} chars)", raw != null ? raw.length() : 0);
            return parseResponse(raw, url, objective);
        });
    }

    String buildPrompt(String url, String objective, PageSnapshot snapshot, Map<String, Object> hints) {
        return String.format(PROMPT_TEMPLATE,
                url,
                objective,
                formatHints(hints),
                formatSnapshot(snapshot),
                String.join("\n", ACTION_VOCABULARY.stream().map(line -> "- " + line).toList()));
    }

    /**
     * Parses a model response into a plan with {@code source = "llm"}.
     *
     * @throws PlanValidationException
     *             if no valid plan can be read from the response
     */
    public Plan parseResponse(String raw, String url, String objective) {
        if (raw == null || raw.isBlank()) {
            throw new PlanValidationException("Empty response from language model", raw);
        }
        ObjectMapper mapper = planCodec.mapper();
        JsonNode tree;
        try {
            tree = mapper.readTree(extractJsonObject(stripCodeFences(raw)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PlanValidationException("Failed to parse response as JSON: " + e.getMessage(), raw, e);
        }
        if (!(tree instanceof ObjectNode data)) {
            throw new PlanValidationException("Response is not a JSON object", raw);
        }

        if (!data.hasNonNull("url") || data.get("url").asText().isBlank()) {
            data.put("url", url);
        }
        if (!data.hasNonNull("objective")) {
            data.put("objective", objective);
        }
        JsonNode steps = data.get("steps");
        if (steps == null || !steps.isArray()) {
            throw new PlanValidationException("Response is missing the required 'steps' list", raw);
        }

        try {
            Plan plan = mapper.treeToValue(data, Plan.class);
            return plan.toBuilder().source(Plan.SOURCE_LLM).build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PlanValidationException("Response is not a valid plan: " + e.getMessage(), raw, e);
        }
    }

    static String stripCodeFences(String text) {
        Matcher matcher = CODE_FENCE.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return text.trim();
    }

    /**
     * Returns the first balanced {@code {...}} block. Braces inside JSON string
     * literals are ignored.
     */
    static String extractJsonObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            throw new IllegalArgumentException("No JSON object found in response");
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        throw new IllegalArgumentException("Unterminated JSON object in response");
    }

    private String formatHints(Map<String, Object> hints) {
        if (hints == null || hints.isEmpty()) {
            return "None";
        }
        try {
            return planCodec.mapper().writeValueAsString(hints);
        } catch (JsonProcessingException e) {
            return hints.toString();
        }
    }

    private static String formatSnapshot(PageSnapshot snapshot) {
        if (snapshot == null) {
            return "(not available)";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Title: ").append(nullToEmpty(snapshot.getTitle())).append('\n');
        sb.append("Text excerpt: ").append(nullToEmpty(snapshot.getTextExcerpt())).append('\n');
        sb.append("Element hints:\n");
        if (snapshot.getElementHints() != null) {
            snapshot.getElementHints().forEach(hint -> sb.append("  ").append(hint).append('\n'));
        }
        sb.append("Links:\n");
        if (snapshot.getLinks() != null) {
            snapshot.getLinks().forEach(link -> sb.append("  ").append(link).append('\n'));
        }
        return sb.toString().stripTrailing();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
