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

/**
 * Selector dialect detection shared by the driver adapters. A selector that
 * starts with {@code /} or {@code ./} is XPath; everything else is CSS.
 */
public final class SelectorSupport {

    private SelectorSupport() {
    }

    public static boolean isXpath(String selector) {
        if (selector == null) {
            return false;
        }
        String trimmed = selector.trim();
        return trimmed.startsWith("/") || trimmed.startsWith("./");
    }

    /**
     * Playwright needs an explicit {@code xpath=} engine prefix for relative
     * XPath expressions.
     */
    public static String forPlaywright(String selector) {
        String trimmed = selector.trim();
        if (isXpath(trimmed) && !trimmed.startsWith("xpath=")) {
            return "xpath=" + trimmed;
        }
        return trimmed;
    }
}
