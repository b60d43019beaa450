package me.golemcore.scraper.adapter.outbound.browser;

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

import me.golemcore.scraper.domain.model.DriverConfig;
import me.golemcore.scraper.port.outbound.BrowserDriver;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class for driver adapters.
 *
 * <p>
 * Each instance owns a single dispatch thread. Every backend call runs there,
 * which keeps thread-confined libraries (Playwright) on one thread and keeps
 * callers free of blocking automation calls. {@link #quit()} is terminal and
 * idempotent.
 */
@Slf4j
public abstract class AbstractBrowserDriver implements BrowserDriver {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    protected final DriverConfig config;
    private final ExecutorService dispatcher;
    private volatile boolean started;

    protected AbstractBrowserDriver(DriverConfig config) {
        this.config = config;
        String threadName = config.getDriverType() + "-driver-" + THREAD_COUNTER.incrementAndGet();
        this.dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Launches the backend. Runs on the dispatch thread.
     */
    protected abstract void doStart() throws Exception;

    /**
     * Releases backend resources, tolerating partially started state. Runs on the
     * dispatch thread.
     */
    protected abstract void doQuit();

    public DriverConfig getConfig() {
        return config;
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public CompletableFuture<Void> start() {
        if (dispatcher.isShutdown()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Driver has been quit"));
        }
        return CompletableFuture.runAsync(() -> {
            if (started) {
                return;
            }
            try {
                doStart();
                started = true;
                log.info("[Driver] {} started (browser: {}, headless: {})",
                        getDriverName(), config.getBrowser(), config.isHeadless());
            } catch (Exception e) { // NOSONAR - any launch failure leaves partial state behind
                log.warn("[Driver] {} failed to start: {}", getDriverName(), e.getMessage());
                doQuit();
                throw new CompletionException(e);
            }
        }, dispatcher);
    }

    @Override
    public CompletableFuture<Void> quit() {
        if (dispatcher.isShutdown()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            try {
                doQuit();
                log.info("[Driver] {} quit", getDriverName());
            } finally {
                started = false;
            }
        }, dispatcher).whenComplete((ignored, error) -> dispatcher.shutdown());
    }

    /**
     * Runs a backend call on the dispatch thread once the driver is started.
     */
    protected <T> CompletableFuture<T> dispatch(Callable<T> call) {
        if (dispatcher.isShutdown()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Driver has been quit"));
        }
        return CompletableFuture.supplyAsync(() -> {
            ensureStarted();
            try {
                return call.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, dispatcher);
    }

    protected CompletableFuture<Void> dispatchVoid(BackendCall call) {
        return dispatch(() -> {
            call.run();
            return null;
        });
    }

    /**
     * Runs a call on the dispatch thread whether or not the driver is started;
     * used for configuration that must precede {@link #start()}.
     */
    protected CompletableFuture<Void> dispatchUnstarted(BackendCall call) {
        if (dispatcher.isShutdown()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Driver has been quit"));
        }
        return CompletableFuture.runAsync(() -> {
            try {
                call.run();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, dispatcher);
    }

    protected void ensureStarted() {
        if (!started) {
            throw new IllegalStateException(getDriverName() + " driver is not started");
        }
    }

    protected Duration orDefault(Duration timeout) {
        return timeout != null ? timeout : config.getDefaultTimeout();
    }

    @FunctionalInterface
    protected interface BackendCall {
        void run() throws Exception;
    }
}
