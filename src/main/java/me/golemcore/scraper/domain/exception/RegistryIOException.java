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

/**
 * Plan cache I/O failure: the registry index or a plan file is missing,
 * unreadable or corrupt. Readers treat it as a cache miss.
 */
public class RegistryIOException extends ScraperException {

    private static final long serialVersionUID = 1L;

    public RegistryIOException(String message) {
        super(message);
    }

    public RegistryIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
