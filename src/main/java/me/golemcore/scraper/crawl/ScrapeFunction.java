package me.golemcore.scraper.crawl;

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

import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.ScrapingResult;

import java.util.concurrent.CompletableFuture;

/**
 * Scrapes one crawl page. A failed future or a null result marks the page as
 * failed.
 */
@FunctionalInterface
public interface ScrapeFunction {

    CompletableFuture<ScrapingResult> scrape(String url, Plan plan);
}
