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

import me.golemcore.scraper.domain.model.action.BrowserAction;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the step executor runs: a plan, or ad-hoc steps and selectors for a URL.
 * {@code url} is also the base for relative navigate targets.
 */
@Value
@Builder
public class ExecutionInput {

    String url;
    @Builder.Default
    List<BrowserAction> steps = List.of();
    @Builder.Default
    List<ScrapingSelector> selectors = List.of();
    String planName;

    public static ExecutionInput of(Plan plan) {
        return ExecutionInput.builder()
                .url(plan.getUrl())
                .steps(plan.getSteps())
                .selectors(plan.getSelectors())
                .planName(plan.getName())
                .build();
    }
}
