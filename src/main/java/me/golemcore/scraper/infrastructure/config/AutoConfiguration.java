package me.golemcore.scraper.infrastructure.config;

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
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration wiring the scraper's shared infrastructure beans.
 *
 * <p>
 * Provides the {@link Clock}, the Jackson {@link ObjectMapper}, the default
 * {@link DriverConfig} built from {@code scraper.driver.*}, and the task
 * executor that runs step sequences and crawls off the caller's thread.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ScraperProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public DriverConfig defaultDriverConfig() {
        return toDriverConfig(properties.getDriver());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService scraperTaskExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "scraper-task-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void init() {
        ScraperProperties.DriverProperties driver = properties.getDriver();
        log.info("Scraper starting (driver: {}, browser: {}, headless: {}, session-based: {})",
                driver.getType(), driver.getBrowser(), driver.isHeadless(), properties.isSessionBased());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
    }

    static DriverConfig toDriverConfig(ScraperProperties.DriverProperties driver) {
        return DriverConfig.builder()
                .driverType(driver.getType())
                .browser(driver.getBrowser())
                .headless(driver.isHeadless())
                .mobile(driver.isMobile())
                .mobileDevice(driver.getMobileDevice())
                .autoInstall(driver.isAutoInstall())
                .defaultTimeout(driver.getDefaultTimeout())
                .retryAttempts(driver.getRetryAttempts())
                .delayBetweenActions(driver.getDelayBetweenActions())
                .overlayHousekeeping(driver.isOverlayHousekeeping())
                .disableImages(driver.isDisableImages())
                .customUserAgent(driver.getCustomUserAgent())
                .build();
    }
}
