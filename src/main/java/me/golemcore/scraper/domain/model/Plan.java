package me.golemcore.scraper.domain.model;

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

import me.golemcore.scraper.crawl.UrlNormalizer;
import me.golemcore.scraper.domain.model.action.BrowserAction;
import me.golemcore.scraper.domain.model.action.NavigateAction;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Declarative, versioned scraping plan for a target URL: ordered browser steps,
 * content selectors and optional crawl hints.
 *
 * <p>
 * {@code domain}, {@code normalizedUrl} and {@code fingerprint} are derived
 * from {@code url} on construction; {@code name} defaults to the sanitized
 * domain. Two URLs that differ only in query string or fragment share a
 * fingerprint. Plans are immutable; use {@link #toBuilder()} to derive a
 * modified copy.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Plan {

    public static final String DEFAULT_VERSION = "1.0";
    public static final String SOURCE_MANUAL = "manual";
    public static final String SOURCE_LLM = "llm";

    private static final int FINGERPRINT_LENGTH = 16;

    String url;
    String objective;
    List<BrowserAction> steps;
    List<ScrapingSelector> selectors;
    String followSelector;
    String followPattern;
    Integer maxDepth;
    String version;
    List<String> tags;
    Instant createdAt;
    String source;
    String name;
    String domain;
    String normalizedUrl;
    String fingerprint;

    @Builder(toBuilder = true)
    @Jacksonized
    @SuppressWarnings("java:S107")
    private Plan(String url, String objective, List<BrowserAction> steps, List<ScrapingSelector> selectors,
            String followSelector, String followPattern, Integer maxDepth, String version, List<String> tags,
            Instant createdAt, String source, String name) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Plan url is required");
        }
        if (!UrlNormalizer.isHttp(url)) {
            throw new IllegalArgumentException("Plan url must be http(s): " + url);
        }
        this.url = url.trim();
        this.objective = objective != null ? objective : "";
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.selectors = selectors != null ? List.copyOf(selectors) : List.of();
        this.followSelector = followSelector;
        this.followPattern = followPattern;
        this.maxDepth = maxDepth;
        this.version = version != null && !version.isBlank() ? version : DEFAULT_VERSION;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.source = source != null && !source.isBlank() ? source : SOURCE_MANUAL;
        this.normalizedUrl = UrlNormalizer.normalize(this.url);
        this.domain = UrlNormalizer.authority(this.url);
        this.name = name != null && !name.isBlank() ? name : sanitize(domain);
        this.fingerprint = fingerprintOf(this.url);
    }

    /**
     * First 16 hex characters of SHA-256 over the normalized URL.
     */
    public static String fingerprintOf(String url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(UrlNormalizer.normalize(url).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, FINGERPRINT_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Plan file location relative to the plans directory:
     * {@code {domain}/{name}_v{version}_{fingerprint}.json}.
     */
    @JsonIgnore
    public String getRelativePath() {
        return domain + "/" + name + "_v" + version + "_" + fingerprint + ".json";
    }

    /**
     * Returns a copy aimed at another page of the same site. Navigate steps that
     * target this plan's own URL are redirected to {@code pageUrl}; when the plan
     * has no navigate step at all one is prepended. The plan name is kept.
     */
    public Plan retarget(String pageUrl) {
        if (UrlNormalizer.normalize(pageUrl).equals(normalizedUrl) && hasNavigateStep()) {
            return this;
        }
        List<BrowserAction> rewritten = new ArrayList<>(steps.size() + 1);
        boolean navigates = false;
        for (BrowserAction step : steps) {
            if (step instanceof NavigateAction navigate) {
                navigates = true;
                if (navigate.getUrl() == null
                        || UrlNormalizer.normalize(navigate.getUrl(), url).equals(normalizedUrl)) {
                    rewritten.add(NavigateAction.builder()
                            .url(pageUrl)
                            .description(navigate.getDescription())
                            .timeout(navigate.getTimeout())
                            .build());
                    continue;
                }
            }
            rewritten.add(step);
        }
        if (!navigates) {
            rewritten.add(0, NavigateAction.builder().url(pageUrl).build());
        }
        return toBuilder().url(pageUrl).steps(rewritten).build();
    }

    private boolean hasNavigateStep() {
        return steps.stream().anyMatch(NavigateAction.class::isInstance);
    }

    private static String sanitize(String domain) {
        String sanitized = domain.replaceAll("[^A-Za-z0-9]+", "_").replaceAll("^_+|_+$", "");
        return sanitized.isEmpty() ? "plan" : sanitized;
    }
}
