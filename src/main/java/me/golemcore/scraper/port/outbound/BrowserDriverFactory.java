package me.golemcore.scraper.port.outbound;

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

import me.golemcore.scraper.domain.exception.ConfigurationException;
import me.golemcore.scraper.domain.model.DriverConfig;

import java.util.Map;

/**
 * Port for constructing browser drivers from configuration.
 */
public interface BrowserDriverFactory {

    /**
     * Creates an un-started driver for the given configuration.
     *
     * @throws ConfigurationException
     *             if the driver type or browser name is not supported; no
     *             browser is launched in that case
     */
    BrowserDriver create(DriverConfig config);

    /**
     * Creates an un-started driver from a plain option map applied over the
     * defaults.
     */
    default BrowserDriver create(Map<String, Object> options) {
        return create(DriverConfig.fromMap(options));
    }

    /**
     * Starts the driver, retrying up to {@code config.retryAttempts} times. A
     * failed attempt quits whatever was partially started before the next one.
     */
    BrowserDriver startWithRetry(BrowserDriver driver, DriverConfig config);
}
