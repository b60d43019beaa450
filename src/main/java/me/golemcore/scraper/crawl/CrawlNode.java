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
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * One page of a crawl.
 *
 * <p>
 * Status moves PENDING to SCRAPING to DONE or FAILED; a node may also fail
 * straight from PENDING. Any other transition throws
 * {@link IllegalStateException}.
 */
@Getter
@ToString(exclude = "result")
public class CrawlNode {

    private final String url;
    private final String normalizedUrl;
    private final int depth;
    private final String parentUrl;

    private CrawlNodeStatus status = CrawlNodeStatus.PENDING;
    private ScrapingResult result;
    private List<String> discoveredLinks = List.of();
    private Instant startedAt;
    private Instant finishedAt;
    private String error;

    public CrawlNode(String url, int depth, String parentUrl) {
        this.url = url;
        this.normalizedUrl = UrlNormalizer.normalize(url);
        this.depth = depth;
        this.parentUrl = parentUrl;
    }

    void markScraping(Instant now) {
        requireStatus(CrawlNodeStatus.SCRAPING, CrawlNodeStatus.PENDING);
        status = CrawlNodeStatus.SCRAPING;
        startedAt = now;
    }

    void markDone(ScrapingResult scrapingResult, Instant now) {
        requireStatus(CrawlNodeStatus.DONE, CrawlNodeStatus.SCRAPING);
        status = CrawlNodeStatus.DONE;
        result = scrapingResult;
        finishedAt = now;
    }

    void markFailed(String message, Instant now) {
        requireStatus(CrawlNodeStatus.FAILED, CrawlNodeStatus.PENDING, CrawlNodeStatus.SCRAPING);
        status = CrawlNodeStatus.FAILED;
        error = message;
        finishedAt = now;
    }

    void setDiscoveredLinks(List<String> links) {
        discoveredLinks = List.copyOf(links);
    }

    private void requireStatus(CrawlNodeStatus target, CrawlNodeStatus... allowed) {
        for (CrawlNodeStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new IllegalStateException("Cannot move crawl node " + url + " from " + status + " to " + target);
    }
}
