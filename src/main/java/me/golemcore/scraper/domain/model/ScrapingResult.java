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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running a plan (or ad-hoc steps) against one page.
 *
 * <p>
 * {@code success} is false only when a critical step aborted the page or the
 * final page source could not be read; recoverable step failures are listed in
 * {@link #stepErrors} while {@code success} stays true.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapingResult {

    public static final String META_COOKIES = "cookies";
    public static final String META_SCREENSHOTS = "screenshots";
    public static final String META_EVALUATIONS = "evaluations";

    private String url;
    private String content;
    @Builder.Default
    private Map<String, Object> extractedData = new LinkedHashMap<>();
    @Builder.Default
    private List<StepError> stepErrors = new ArrayList<>();
    private boolean aborted;
    private int totalSteps;
    private int executedSteps;
    private Instant startedAt;
    private Instant finishedAt;

    /**
     * Extra outputs of individual steps (cookies read, screenshot paths, script
     * results).
     */
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String errorMessage;

    /**
     * Name of the plan that produced this result; null for ad-hoc steps.
     */
    private String planName;

    public boolean hadFailures() {
        return !stepErrors.isEmpty();
    }
}
