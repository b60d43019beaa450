package me.golemcore.scraper.domain.service;

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

import me.golemcore.scraper.crawl.CrawlEngine;
import me.golemcore.scraper.crawl.CrawlResult;
import me.golemcore.scraper.crawl.CrawlStrategy;
import me.golemcore.scraper.crawl.UrlNormalizer;
import me.golemcore.scraper.domain.exception.ConfigurationException;
import me.golemcore.scraper.domain.exception.PageFetchException;
import me.golemcore.scraper.domain.exception.PlanValidationException;
import me.golemcore.scraper.domain.exception.RegistryIOException;
import me.golemcore.scraper.domain.model.CrawlRequest;
import me.golemcore.scraper.domain.model.DriverConfig;
import me.golemcore.scraper.domain.model.ExecutionInput;
import me.golemcore.scraper.domain.model.PageSnapshot;
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.PlanRegistryEntry;
import me.golemcore.scraper.domain.model.PlanSaveResult;
import me.golemcore.scraper.domain.model.PlanSummary;
import me.golemcore.scraper.domain.model.ScrapeRequest;
import me.golemcore.scraper.domain.model.ScrapingResult;
import me.golemcore.scraper.infrastructure.config.ScraperProperties;
import me.golemcore.scraper.port.outbound.BrowserDriver;
import me.golemcore.scraper.port.outbound.BrowserDriverFactory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Entry point for scraping and crawling with plan caching.
 *
 * <p>
 * Plans are resolved in order: explicit plan, registry hit, generation from an
 * objective, otherwise {@link PlanValidationException}. Each call either uses
 * the session driver (session mode, between {@link #start()} and
 * {@link #stop()}) or creates, starts and always quits a fresh driver.
 *
 * <p>
 * Only {@link ConfigurationException} and {@link PlanValidationException}
 * reach callers as failed futures. Driver start failures and step errors come
 * back inside the {@link ScrapingResult}; page failures during a crawl are
 * recorded on the crawl result.
 *
 * <p>
 * The session driver is meant for sequential use. A concurrent crawl against
 * it is logged but not prevented.
 */
@Service
@Slf4j
public class ScrapingToolkit {

    static final String PLAN_EXISTS_MESSAGE = "Plan already exists. Use overwrite=true to replace.";

    private final BrowserDriverFactory driverFactory;
    private final StepExecutor stepExecutor;
    private final PlanRegistry planRegistry;
    private final PlanStore planStore;
    private final PlanGenerator planGenerator;
    private final ScraperProperties properties;
    private final DriverConfig defaultDriverConfig;
    private final ExecutorService taskExecutor;
    private final Clock clock;

    private final ReentrantLock sessionLock = new ReentrantLock();
    private volatile BrowserDriver sessionDriver;

    @SuppressWarnings("java:S107")
    public ScrapingToolkit(BrowserDriverFactory driverFactory, StepExecutor stepExecutor, PlanRegistry planRegistry,
            PlanStore planStore, PlanGenerator planGenerator, ScraperProperties properties,
            DriverConfig defaultDriverConfig, ExecutorService scraperTaskExecutor, Clock clock) {
        this.driverFactory = driverFactory;
        this.stepExecutor = stepExecutor;
        this.planRegistry = planRegistry;
        this.planStore = planStore;
        this.planGenerator = planGenerator;
        this.properties = properties;
        this.defaultDriverConfig = defaultDriverConfig;
        this.taskExecutor = scraperTaskExecutor;
        this.clock = clock;
    }

    // ==================== Lifecycle ====================

    /**
     * Starts the session driver when session mode is enabled; otherwise a no-op.
     */
    public void start() {
        if (!properties.isSessionBased()) {
            return;
        }
        sessionLock.lock();
        try {
            if (sessionDriver != null) {
                return;
            }
            BrowserDriver driver = driverFactory.create(defaultDriverConfig);
            sessionDriver = driverFactory.startWithRetry(driver, defaultDriverConfig);
            log.info("[Toolkit] Session driver started ({})", defaultDriverConfig.getDriverType());
        } finally {
            sessionLock.unlock();
        }
    }

    @PreDestroy
    public void stop() {
        sessionLock.lock();
        try {
            BrowserDriver driver = sessionDriver;
            if (driver == null) {
                return;
            }
            sessionDriver = null;
            quitQuietly(driver).join();
            log.info("[Toolkit] Session driver stopped");
        } finally {
            sessionLock.unlock();
        }
    }

    public boolean isSessionActive() {
        return sessionDriver != null;
    }

    // ==================== Plans ====================

    /**
     * Explicit plan, then registry, then generation from the objective.
     */
    public CompletableFuture<Plan> resolvePlan(String url, Plan plan, String objective) {
        if (plan != null) {
            return CompletableFuture.completedFuture(plan);
        }
        Optional<Plan> cached = loadCached(url);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        if (objective != null && !objective.isBlank()) {
            if (!planGenerator.isAvailable()) {
                return CompletableFuture.failedFuture(new PlanValidationException("No plan available for " + url
                        + " and no language model is configured to generate one from the objective"));
            }
            return planCreate(url, objective, null, true);
        }
        return CompletableFuture.failedFuture(new PlanValidationException("No plan available for " + url
                + " and no objective to generate one. Provide an explicit plan, save one, or pass an objective."));
    }

    /**
     * Returns the cached plan for the URL unless {@code forceRegenerate}, and
     * otherwise drafts a new one. The new plan is not saved.
     */
    public CompletableFuture<Plan> planCreate(String url, String objective, Map<String, Object> hints,
            boolean forceRegenerate) {
        if (!forceRegenerate) {
            Optional<Plan> cached = loadCached(url);
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(cached.get());
            }
        }
        CompletableFuture<PageSnapshot> snapshot = properties.getPlans().isSnapshotBeforeGenerate()
                ? captureSnapshot(url)
                : CompletableFuture.completedFuture(null);
        return snapshot
                .thenCompose(pageSnapshot -> planGenerator.generate(url, objective, pageSnapshot, hints))
                .thenApply(plan -> {
                    log.info("[Toolkit] Generated new plan '{}' for {}", plan.getName(), url);
                    return plan;
                });
    }

    public PlanSaveResult planSave(Plan plan, boolean overwrite) {
        if (!overwrite) {
            Optional<PlanRegistryEntry> existing = planRegistry.lookup(plan.getUrl())
                    .filter(entry -> plan.getFingerprint().equals(entry.getFingerprint()));
            if (existing.isPresent()) {
                return PlanSaveResult.builder()
                        .success(false)
                        .message(PLAN_EXISTS_MESSAGE)
                        .name(existing.get().getName())
                        .path(existing.get().getPath())
                        .fingerprint(existing.get().getFingerprint())
                        .build();
            }
        }
        try {
            String relativePath = planStore.save(plan);
            planRegistry.register(plan, relativePath);
            return PlanSaveResult.builder()
                    .success(true)
                    .message("Plan saved and registered successfully.")
                    .name(plan.getName())
                    .path(relativePath)
                    .fingerprint(plan.getFingerprint())
                    .build();
        } catch (RegistryIOException e) {
            log.error("[Toolkit] Failed to save plan '{}': {}", plan.getName(), e.getMessage());
            return PlanSaveResult.failure("Save failed: " + e.getMessage());
        }
    }

    /**
     * Loads a plan by URL (registry lookup) or by name.
     */
    public Optional<Plan> planLoad(String urlOrName) {
        if (urlOrName == null || urlOrName.isBlank()) {
            return Optional.empty();
        }
        Optional<PlanRegistryEntry> entry = UrlNormalizer.isHttp(urlOrName)
                ? planRegistry.lookup(urlOrName)
                : Optional.empty();
        if (entry.isEmpty()) {
            entry = planRegistry.getByName(urlOrName);
        }
        return entry.flatMap(this::loadEntry);
    }

    public List<PlanSummary> planList(String domainFilter, String tagFilter) {
        String domain = domainFilter != null && !domainFilter.isBlank()
                ? stripWww(domainFilter.trim().toLowerCase(Locale.ROOT))
                : null;
        return planRegistry.listAll().stream()
                .filter(entry -> domain == null || domain.equals(entry.getDomain()))
                .filter(entry -> tagFilter == null || tagFilter.isBlank()
                        || entry.getTags() != null && entry.getTags().contains(tagFilter))
                .map(PlanSummary::from)
                .toList();
    }

    /**
     * Removes a plan from the registry and optionally deletes its file.
     *
     * @return true if a plan with that name was registered
     */
    public boolean planDelete(String name, boolean deleteFile) {
        Optional<PlanRegistryEntry> entry = planRegistry.getByName(name);
        if (entry.isEmpty()) {
            return false;
        }
        if (deleteFile) {
            try {
                planStore.delete(entry.get().getPath());
                log.info("[Toolkit] Deleted plan file {}", entry.get().getPath());
            } catch (RegistryIOException e) {
                log.warn("[Toolkit] Could not delete plan file {}: {}", entry.get().getPath(), e.getMessage());
            }
        }
        return planRegistry.remove(name).isPresent();
    }

    // ==================== Scraping ====================

    /**
     * Scrapes one page, either with ad-hoc steps or with a resolved plan.
     */
    public CompletableFuture<ScrapingResult> scrape(ScrapeRequest request) {
        String url = request.getUrl();
        if (url == null || url.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("url is required"));
        }
        DriverConfig config;
        try {
            config = defaultDriverConfig.merge(request.getConfigOverrides());
        } catch (ConfigurationException e) {
            return CompletableFuture.failedFuture(e);
        }
        boolean useSession = request.getConfigOverrides() == null || request.getConfigOverrides().isEmpty();

        if (request.getSteps() != null) {
            ExecutionInput input = ExecutionInput.builder()
                    .url(url)
                    .steps(request.getSteps())
                    .selectors(request.getSelectors() != null ? request.getSelectors() : List.of())
                    .build();
            return recover(url, withDriver(config, useSession, driver -> stepExecutor.execute(driver, input, config)));
        }

        return resolvePlan(url, request.getPlan(), request.getObjective()).thenCompose(plan -> {
            ExecutionInput input = ExecutionInput.of(plan.retarget(url));
            CompletableFuture<ScrapingResult> execution = recover(url,
                    withDriver(config, useSession, driver -> stepExecutor.execute(driver, input, config)));
            return execution.thenApply(result -> {
                if (request.isSavePlan() && result.isSuccess()) {
                    PlanSaveResult saved = planSave(plan, false);
                    log.info("[Toolkit] Auto-save of plan '{}': {}", plan.getName(), saved.getMessage());
                }
                return result;
            });
        });
    }

    /**
     * Crawls from the start URL, scraping every page with the resolved plan.
     */
    public CompletableFuture<CrawlResult> crawl(CrawlRequest request) {
        String startUrl = request.getStartUrl();
        if (startUrl == null || startUrl.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("start_url is required"));
        }
        return resolvePlan(startUrl, request.getPlan(), request.getObjective()).thenCompose(plan -> {
            ScraperProperties.CrawlProperties crawl = properties.getCrawl();
            int depth = firstNonNull(request.getDepth(), plan.getMaxDepth(), crawl.getDefaultDepth());
            int concurrency = firstNonNull(request.getConcurrency(), crawl.getConcurrency());
            CrawlStrategy strategy = CrawlStrategy.fromName(
                    request.getStrategy() != null ? request.getStrategy() : crawl.getStrategy());
            if (sessionDriver != null && concurrency > 1) {
                log.warn("[Toolkit] Crawling with concurrency {} on a shared session driver; "
                        + "pages may interfere with each other", concurrency);
            }

            Plan crawlPlan = plan.toBuilder()
                    .followSelector(request.getFollowSelector() != null
                            ? request.getFollowSelector()
                            : plan.getFollowSelector())
                    .followPattern(request.getFollowPattern() != null
                            ? request.getFollowPattern()
                            : plan.getFollowPattern())
                    .build();
            CrawlEngine engine = CrawlEngine.builder()
                    .scrapeFunction((pageUrl, pagePlan) -> scrapePage(pageUrl, pagePlan, defaultDriverConfig))
                    .strategy(strategy)
                    .followSelector(crawl.getFollowSelector())
                    .allowExternal(crawl.isAllowExternal())
                    .concurrency(concurrency)
                    .executor(taskExecutor)
                    .clock(clock)
                    .build();

            return engine.run(startUrl, crawlPlan, depth, request.getMaxPages()).thenApply(result -> {
                if (request.isSavePlan() && result.getTotalPages() > 0) {
                    PlanSaveResult saved = planSave(plan, false);
                    log.info("[Toolkit] Auto-save of plan '{}': {}", plan.getName(), saved.getMessage());
                }
                return result;
            });
        });
    }

    private CompletableFuture<ScrapingResult> scrapePage(String url, Plan plan, DriverConfig config) {
        ExecutionInput input = ExecutionInput.of(plan.retarget(url));
        return withDriver(config, true, driver -> stepExecutor.execute(driver, input, config))
                .thenApply(result -> {
                    if (result.isAborted()) {
                        throw new PageFetchException(url, result.getErrorMessage());
                    }
                    return result;
                });
    }

    // ==================== Driver handling ====================

    /**
     * Runs {@code work} against the session driver, or against a fresh driver
     * that is started with retries and always quit afterwards.
     */
    <T> CompletableFuture<T> withDriver(DriverConfig config, boolean useSession,
            Function<BrowserDriver, CompletableFuture<T>> work) {
        BrowserDriver session = sessionDriver;
        if (useSession && session != null) {
            return invoke(work, session);
        }
        return CompletableFuture.supplyAsync(() -> {
            BrowserDriver driver = driverFactory.create(config);
            return driverFactory.startWithRetry(driver, config);
        }, taskExecutor).thenCompose(driver -> invoke(work, driver)
                .handle((value, error) -> quitQuietly(driver)
                        .thenCompose(ignored -> error == null
                                ? CompletableFuture.completedFuture(value)
                                : CompletableFuture.<T>failedFuture(unwrap(error))))
                .thenCompose(Function.identity()));
    }

    private CompletableFuture<PageSnapshot> captureSnapshot(String url) {
        DriverConfig config = defaultDriverConfig;
        return withDriver(config, true, driver -> driver.navigate(url, config.getDefaultTimeout())
                .thenCompose(ignored -> driver.getPageSource()))
                .thenApply(html -> PageSnapshot.fromHtml(url, html))
                .exceptionally(error -> {
                    log.warn("[Toolkit] Could not snapshot {} before plan generation: {}", url,
                            unwrap(error).getMessage());
                    return null;
                });
    }

    private Optional<Plan> loadCached(String url) {
        Optional<PlanRegistryEntry> entry = planRegistry.lookup(url);
        Optional<Plan> plan = entry.flatMap(this::loadEntry);
        plan.ifPresent(found -> log.info("[Toolkit] Plan cache hit for {} ('{}')", url, found.getName()));
        return plan;
    }

    private Optional<Plan> loadEntry(PlanRegistryEntry entry) {
        Plan plan;
        try {
            plan = planStore.load(entry.getPath());
        } catch (RegistryIOException e) {
            log.warn("[Toolkit] Cached plan '{}' unusable, treating as miss: {}", entry.getName(), e.getMessage());
            return Optional.empty();
        }
        try {
            planRegistry.touch(entry.getFingerprint());
        } catch (RegistryIOException e) {
            // usage stats only; the plan itself loaded fine
            log.warn("[Toolkit] Could not record use of plan '{}': {}", entry.getName(), e.getMessage());
        }
        return Optional.of(plan);
    }

    private CompletableFuture<ScrapingResult> recover(String url, CompletableFuture<ScrapingResult> execution) {
        return execution.handle((result, error) -> {
            if (error == null) {
                return result;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof ConfigurationException || cause instanceof PlanValidationException) {
                throw new CompletionException(cause);
            }
            log.warn("[Toolkit] Scrape of {} failed: {}", url, cause.getMessage());
            return ScrapingResult.builder()
                    .url(url)
                    .success(false)
                    .aborted(true)
                    .errorMessage(cause.getMessage())
                    .startedAt(clock.instant())
                    .finishedAt(clock.instant())
                    .build();
        });
    }

    private static <T> CompletableFuture<T> invoke(Function<BrowserDriver, CompletableFuture<T>> work,
            BrowserDriver driver) {
        try {
            return work.apply(driver);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static CompletableFuture<Void> quitQuietly(BrowserDriver driver) {
        try {
            return driver.quit().exceptionally(error -> {
                log.warn("[Toolkit] Driver quit failed: {}", unwrap(error).getMessage());
                return null;
            });
        } catch (RuntimeException e) {
            log.warn("[Toolkit] Driver quit failed: {}", e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String stripWww(String domain) {
        return domain.startsWith("www.") ? domain.substring(4) : domain;
    }
}
