package me.golemcore.scraper.domain.exception;

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

import me.golemcore.scraper.domain.model.DriverCapability;

/**
 * Raised when an extended driver capability is invoked on a backend that does
 * not provide it. Callers should prefer
 * {@link me.golemcore.scraper.port.outbound.BrowserDriver#supports} over
 * catching this.
 */
public class UnsupportedCapabilityException extends ScraperException {

    private static final long serialVersionUID = 1L;

    private final DriverCapability capability;

    public UnsupportedCapabilityException(DriverCapability capability, String driverName) {
        super(capability.getId() + " is not supported by the " + driverName + " driver");
        this.capability = capability;
    }

    public UnsupportedCapabilityException(DriverCapability capability, String driverName, String reason) {
        super(capability.getId() + " is not supported by the " + driverName + " driver: " + reason);
        this.capability = capability;
    }

    public DriverCapability getCapability() {
        return capability;
    }
}
