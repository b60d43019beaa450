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

import me.golemcore.scraper.domain.exception.PageFetchException;
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.ScrapingResult;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Multi-page crawl orchestrator.
 *
 * <p>
 * Pages are scraped through the {@link ScrapeFunction}, traversal order comes
 * from the {@link CrawlStrategy}, and child links from a {@link LinkDiscoverer}
 * scoped to the start URL's domain. The plan's follow hints override the
 * engine defaults.
 *
 * <p>
 * With {@code concurrency == 1} nodes are scraped one at a time. Otherwise the
 * engine takes batches of up to {@code concurrency} nodes, never more than the
 * remaining page budget, starts them together and waits for the whole batch
 * before taking the next one. Batch results are applied to the graph in batch
 * order on the engine thread, so the graph is never mutated concurrently.
 *
 * <p>
 * A page that fails is recorded and the crawl goes on; only the page budget
 * or an empty frontier end a crawl.
 */
@Slf4j
public class CrawlEngine {

    private final ScrapeFunction scrapeFunction;
    private final CrawlStrategy strategy;
    private final String followSelector;
    private final String followPattern;
    private final boolean allowExternal;
    private final int concurrency;
    private final Executor executor;
    private final Clock clock;

    @Builder
    private CrawlEngine(ScrapeFunction scrapeFunction, CrawlStrategy strategy, String followSelector,
            String followPattern, boolean allowExternal, int concurrency, Executor executor, Clock clock) {
        if (scrapeFunction == null) {
            throw new IllegalArgumentException("scrapeFunction is required");
        }
        this.scrapeFunction = scrapeFunction;
        this.strategy = strategy != null ? strategy : new BfsStrategy();
        this.followSelector = followSelector != null ? followSelector : LinkDiscoverer.DEFAULT_FOLLOW_SELECTOR;
        this.followPattern = followPattern;
        this.allowExternal = allowExternal;
        this.concurrency = Math.max(1, concurrency);
        this.executor = executor != null ? executor : ForkJoinPool.commonPool();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Crawls from {@code startUrl}.
     *
     * @param depth
     *            maximum link depth; 0 scrapes only the start page
     * @param maxPages
     *            cap on successfully scraped pages, null for no cap
     */
    public CompletableFuture<CrawlResult> run(String startUrl, Plan plan, int depth, Integer maxPages) {
        String selector = plan != null && plan.getFollowSelector() != null && !plan.getFollowSelector().isBlank()
                ? plan.getFollowSelector()
                : followSelector;
        String pattern = plan != null && plan.getFollowPattern() != null && !plan.getFollowPattern().isBlank()
                ? plan.getFollowPattern()
                : followPattern;
        LinkDiscoverer discoverer = new LinkDiscoverer(selector, pattern, startUrl, allowExternal);
        int maxDepth = Math.max(0, depth);
        return CompletableFuture.supplyAsync(() -> crawl(startUrl, plan, discoverer, maxDepth, maxPages), executor);
    }

    private CrawlResult crawl(String startUrl, Plan plan, LinkDiscoverer discoverer, int maxDepth,
            Integer maxPages) {
        CrawlGraph graph = new CrawlGraph(clock);
        graph.addRoot(startUrl);
        Instant started = clock.instant();
        log.info("[Crawl] Starting crawl url={} depth={} maxPages={} strategy={} concurrency={}",
                startUrl, maxDepth, maxPages, strategy.getName(), concurrency);

        if (concurrency == 1) {
            runSequential(graph, plan, discoverer, maxDepth, maxPages);
        } else {
            runBatched(graph, plan, discoverer, maxDepth, maxPages);
        }

        double elapsed = Duration.between(started, clock.instant()).toMillis() / 1000.0;
        Map<String, String> errors = new LinkedHashMap<>();
        graph.getFailedNodes().forEach(node -> errors.put(node.getUrl(), node.getError()));
        CrawlResult result = CrawlResult.builder()
                .startUrl(startUrl)
                .depth(maxDepth)
                .pages(graph.getDoneNodes().stream()
                        .map(CrawlNode::getResult)
                        .toList())
                .visitedUrls(graph.getProcessedNodes().stream()
                        .map(CrawlNode::getUrl)
                        .toList())
                .failedUrls(graph.getFailedNodes().stream()
                        .map(CrawlNode::getUrl)
                        .toList())
                .errors(errors)
                .totalPages(graph.getDoneCount())
                .elapsedSeconds(elapsed)
                .planUsed(plan != null ? plan.getName() : null)
                .build();
        log.info("[Crawl] Crawl complete pages={} failed={} elapsed={}s",
                result.getTotalPages(), result.getFailedUrls().size(), elapsed);
        return result;
    }

    private void runSequential(CrawlGraph graph, Plan plan, LinkDiscoverer discoverer, int maxDepth,
            Integer maxPages) {
        while (remainingBudget(graph, maxPages) > 0) {
            CrawlNode node = strategy.next(graph);
            if (node == null) {
                return;
            }
            graph.markScraping(node);
            CompletableFuture<ScrapingResult> future = scrapeSafely(node, plan);
            complete(graph, node, await(future, node), discoverer, maxDepth);
        }
        log.info("[Crawl] maxPages={} reached, stopping", maxPages);
    }

    private void runBatched(CrawlGraph graph, Plan plan, LinkDiscoverer discoverer, int maxDepth,
            Integer maxPages) {
        while (true) {
            int budget = Math.min(concurrency, remainingBudget(graph, maxPages));
            if (budget <= 0) {
                log.info("[Crawl] maxPages={} reached, stopping", maxPages);
                return;
            }
            List<CrawlNode> batch = new ArrayList<>(budget);
            while (batch.size() < budget) {
                CrawlNode node = strategy.next(graph);
                if (node == null) {
                    break;
                }
                batch.add(node);
            }
            if (batch.isEmpty()) {
                return;
            }

            List<CompletableFuture<ScrapingResult>> futures = new ArrayList<>(batch.size());
            for (CrawlNode node : batch) {
                graph.markScraping(node);
                futures.add(scrapeSafely(node, plan));
            }
            try {
                CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
            } catch (CompletionException e) { // NOSONAR - individual failures are read per node below
                log.debug("[Crawl] Batch finished with failures: {}", e.getMessage());
            }
            for (int i = 0; i < batch.size(); i++) {
                complete(graph, batch.get(i), await(futures.get(i), batch.get(i)), discoverer, maxDepth);
            }
        }
    }

    private void complete(CrawlGraph graph, CrawlNode node, Outcome outcome, LinkDiscoverer discoverer,
            int maxDepth) {
        if (outcome.error() != null) {
            graph.markFailed(node, outcome.error().getMessage());
            log.warn("[Crawl] Failed url={} error={}", node.getUrl(), outcome.error().getMessage());
            return;
        }
        ScrapingResult result = outcome.result();
        graph.markDone(node, result);
        log.debug("[Crawl] Scraped url={} depth={}", node.getUrl(), node.getDepth());

        if (node.getDepth() >= maxDepth || result.getContent() == null) {
            return;
        }
        List<String> links = discoverer.discover(result.getContent(), node.getUrl(), node.getDepth(), maxDepth);
        node.setDiscoveredLinks(links);
        List<CrawlNode> children = links.stream()
                .filter(link -> !graph.isVisited(link))
                .map(link -> new CrawlNode(link, node.getDepth() + 1, node.getNormalizedUrl()))
                .toList();
        List<CrawlNode> accepted = strategy.enqueue(graph, children);
        if (!accepted.isEmpty()) {
            log.debug("[Crawl] Discovered {} new link(s) from {}", accepted.size(), node.getUrl());
        }
    }

    private CompletableFuture<ScrapingResult> scrapeSafely(CrawlNode node, Plan plan) {
        try {
            CompletableFuture<ScrapingResult> future = scrapeFunction.scrape(node.getUrl(), plan);
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Outcome await(CompletableFuture<ScrapingResult> future, CrawlNode node) {
        try {
            ScrapingResult result = future.get();
            if (result == null) {
                return Outcome.failed(new PageFetchException(node.getUrl(), "No result for " + node.getUrl()));
            }
            return Outcome.succeeded(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failed(new PageFetchException(node.getUrl(), "Interrupted while scraping " + node.getUrl(), e));
        } catch (ExecutionException e) {
            return Outcome.failed(toPageFetch(node, e.getCause() != null ? e.getCause() : e));
        } catch (RuntimeException e) { // NOSONAR - cancellation counts as a page failure
            return Outcome.failed(toPageFetch(node, e));
        }
    }

    private static PageFetchException toPageFetch(CrawlNode node, Throwable error) {
        if (error instanceof PageFetchException pageFetch) {
            return pageFetch;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new PageFetchException(node.getUrl(), "Failed to scrape " + node.getUrl() + ": " + message, error);
    }

    private static int remainingBudget(CrawlGraph graph, Integer maxPages) {
        if (maxPages == null) {
            return Integer.MAX_VALUE;
        }
        return maxPages - graph.getDoneCount();
    }

    private record Outcome(ScrapingResult result, PageFetchException error) {

        static Outcome succeeded(ScrapingResult result) {
            return new Outcome(result, null);
        }

        static Outcome failed(PageFetchException error) {
            return new Outcome(null, error);
        }
    }
}
