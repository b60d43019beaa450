package me.golemcore.scraper.domain.model;

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

/**
 * Optional driver features that are not guaranteed across backends.
 */
public enum DriverCapability {

    INTERCEPT_REQUESTS("intercept_requests"),
    RECORD_HAR("record_har"),
    SAVE_PDF("save_pdf"),
    TRACING("tracing"),
    MOCK_ROUTE("mock_route");

    private final String id;

    DriverCapability(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
