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

import me.golemcore.scraper.domain.model.ScrapingSelector;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies content selectors to a page source with jsoup.
 *
 * <p>
 * A selector that matches nothing yields {@code ""} (single) or an empty list
 * ({@code multiple}). A selector jsoup cannot parse yields {@code null} and a
 * warning; extraction never throws.
 */
@Component
@Slf4j
public class SelectorExtractor {

    public Map<String, Object> extract(String html, String baseUrl, List<ScrapingSelector> selectors) {
        Map<String, Object> extracted = new LinkedHashMap<>();
        if (selectors == null || selectors.isEmpty()) {
            return extracted;
        }
        Document document = Jsoup.parse(html != null ? html : "", baseUrl != null ? baseUrl : "");
        for (ScrapingSelector selector : selectors) {
            extracted.put(selector.getName(), extractOne(document, selector));
        }
        return extracted;
    }

    private Object extractOne(Document document, ScrapingSelector selector) {
        Elements elements;
        try {
            elements = select(document, selector);
        } catch (RuntimeException e) { // NOSONAR - a broken selector must not fail the page
            log.warn("[Executor] Selector '{}' ({}) could not be applied: {}",
                    selector.getName(), selector.getSelector(), e.getMessage());
            return null;
        }

        if (selector.isMultiple()) {
            return elements.stream()
                    .map(element -> value(element, selector))
                    .toList();
        }
        return elements.isEmpty() ? "" : value(elements.first(), selector);
    }

    private Elements select(Document document, ScrapingSelector selector) {
        String expression = selector.getSelector();
        String type = selector.getSelectorType() != null ? selector.getSelectorType() : ScrapingSelector.TYPE_CSS;
        return switch (type) {
        case ScrapingSelector.TYPE_XPATH -> document.selectXpath(expression);
        case ScrapingSelector.TYPE_TAG -> document.getElementsByTag(expression);
        case ScrapingSelector.TYPE_CSS -> document.select(expression);
        default -> throw new IllegalArgumentException("Unknown selector type: " + type);
        };
    }

    private String value(Element element, ScrapingSelector selector) {
        String extractType = selector.getExtractType() != null
                ? selector.getExtractType()
                : ScrapingSelector.EXTRACT_TEXT;
        return switch (extractType) {
        case ScrapingSelector.EXTRACT_HTML -> element.outerHtml();
        case ScrapingSelector.EXTRACT_ATTRIBUTE -> selector.getAttribute() != null
                ? element.attr(selector.getAttribute())
                : "";
        default -> element.text();
        };
    }
}
