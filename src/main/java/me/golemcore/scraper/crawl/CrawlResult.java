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

import me.golemcore.scraper.domain.model.ScrapingResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Summary of a finished crawl. {@code visitedUrls} lists every processed page
 * (done or failed) in processing order; {@code errors} maps failed URLs to
 * their failure message.
 */
@Value
@Builder
public class CrawlResult {

    String startUrl;
    int depth;
    @Builder.Default
    List<ScrapingResult> pages = List.of();
    @Builder.Default
    List<String> visitedUrls = List.of();
    @Builder.Default
    List<String> failedUrls = List.of();
    @Builder.Default
    Map<String, String> errors = Map.of();
    int totalPages;
    double elapsedSeconds;
    String planUsed;
}
