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
import java.util.Map;

/**
 * Single-page scrape request. With {@code steps} the request runs ad hoc and no
 * plan is resolved; otherwise the plan comes from {@code plan}, the registry,
 * or generation from {@code objective}.
 */
@Value
@Builder
public class ScrapeRequest {

    String url;
    Plan plan;
    String objective;
    List<BrowserAction> steps;
    List<ScrapingSelector> selectors;
    boolean savePlan;
    Map<String, Object> configOverrides;
}
