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
 * A plan could not be produced: the generated JSON is malformed or
 * incomplete, or no plan source is available for a URL.
 */
public class PlanValidationException extends ScraperException {

    private static final long serialVersionUID = 1L;

    private static final int EXCERPT_LENGTH = 500;

    private final String excerpt;

    public PlanValidationException(String message) {
        super(message);
        this.excerpt = null;
    }

    public PlanValidationException(String message, String rawContent) {
        super(message + (rawContent != null ? "\nResponse excerpt: " + excerptOf(rawContent) : ""));
        this.excerpt = rawContent != null ? excerptOf(rawContent) : null;
    }

    public PlanValidationException(String message, String rawContent, Throwable cause) {
        super(message + (rawContent != null ? "\nResponse excerpt: " + excerptOf(rawContent) : ""), cause);
        this.excerpt = rawContent != null ? excerptOf(rawContent) : null;
    }

    public String getExcerpt() {
        return excerpt;
    }

    private static String excerptOf(String raw) {
        return raw.length() > EXCERPT_LENGTH ? raw.substring(0, EXCERPT_LENGTH) : raw;
    }
}
