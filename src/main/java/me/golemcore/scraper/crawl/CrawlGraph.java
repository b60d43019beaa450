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

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Crawl state: every known node keyed by normalized URL, the frontier of
 * pending nodes, and the done and failed nodes in completion order.
 *
 * <p>
 * A URL counts as visited from the moment it is enqueued, so each normalized
 * URL is scraped at most once. Not thread-safe; the crawl engine confines all
 * mutation to one thread.
 */
public class CrawlGraph {

    private final Clock clock;
    private final Map<String, CrawlNode> nodes = new LinkedHashMap<>();
    private final Set<String> visited = new HashSet<>();
    private final Deque<CrawlNode> frontier = new ArrayDeque<>();
    private final List<CrawlNode> processed = new ArrayList<>();
    private final List<CrawlNode> done = new ArrayList<>();
    private final List<CrawlNode> failed = new ArrayList<>();

    public CrawlGraph() {
        this(Clock.systemUTC());
    }

    public CrawlGraph(Clock clock) {
        this.clock = clock;
    }

    public CrawlNode addRoot(String url) {
        CrawlNode root = new CrawlNode(url, 0, null);
        enqueue(root);
        return root;
    }

    /**
     * Appends the node to the frontier.
     *
     * @return false if its normalized URL was already visited
     */
    public boolean enqueue(CrawlNode node) {
        if (!visited.add(node.getNormalizedUrl())) {
            return false;
        }
        nodes.put(node.getNormalizedUrl(), node);
        frontier.addLast(node);
        return true;
    }

    public CrawlNode pollFirst() {
        return frontier.pollFirst();
    }

    public CrawlNode pollLast() {
        return frontier.pollLast();
    }

    public boolean hasPending() {
        return !frontier.isEmpty();
    }

    public void markScraping(CrawlNode node) {
        node.markScraping(clock.instant());
    }

    public void markDone(CrawlNode node, ScrapingResult result) {
        node.markDone(result, clock.instant());
        processed.add(node);
        done.add(node);
    }

    public void markFailed(CrawlNode node, String error) {
        node.markFailed(error, clock.instant());
        processed.add(node);
        failed.add(node);
    }

    public List<CrawlNode> getDoneNodes() {
        return List.copyOf(done);
    }

    public List<CrawlNode> getFailedNodes() {
        return List.copyOf(failed);
    }

    /**
     * Done and failed nodes in the order they finished.
     */
    public List<CrawlNode> getProcessedNodes() {
        return List.copyOf(processed);
    }

    public int getDoneCount() {
        return done.size();
    }

    public boolean isVisited(String url) {
        return visited.contains(UrlNormalizer.normalize(url));
    }

    public int visitedCount() {
        return visited.size();
    }

    public CrawlNode getNode(String url) {
        return nodes.get(UrlNormalizer.normalize(url));
    }
}
