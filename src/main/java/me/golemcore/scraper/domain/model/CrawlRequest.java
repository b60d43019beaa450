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

import lombok.Builder;
import lombok.Value;

/**
 * Multi-page crawl request. Null numeric fields fall back to the plan hints and
 * then the configured defaults.
 */
@Value
@Builder
public class CrawlRequest {

    String startUrl;
    Plan plan;
    String objective;
    Integer depth;
    Integer maxPages;
    String followSelector;
    String followPattern;
    Integer concurrency;
    String strategy;
    boolean savePlan;
}
