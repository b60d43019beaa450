package me.golemcore.scraper.crawl;

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
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Extracts the links a crawl should follow from a page.
 *
 * <p>
 * Candidates come from {@code followSelector} (default {@code a[href]}) and are
 * resolved against the page URL. Fragments are dropped, non-http(s) schemes
 * rejected, links outside the crawl domain rejected unless external links are
 * allowed, and {@code followPattern} (when set) must be found somewhere in the
 * URL. Results are deduplicated by normalized URL in document order.
 */
@Slf4j
public class LinkDiscoverer {

    public static final String DEFAULT_FOLLOW_SELECTOR = "a[href]";

    private final String followSelector;
    private final Pattern followPattern;
    private final String baseHost;
    private final boolean allowExternal;

    /**
     * @param scopeUrl
     *            URL whose host defines the crawl domain ({@code www.} and case
     *            are ignored)
     * @throws ConfigurationException
     *             if {@code followPattern} is not a valid regular expression
     */
    public LinkDiscoverer(String followSelector, String followPattern, String scopeUrl, boolean allowExternal) {
        this.followSelector = followSelector != null && !followSelector.isBlank()
                ? followSelector
                : DEFAULT_FOLLOW_SELECTOR;
        this.followPattern = compile(followPattern);
        this.baseHost = UrlNormalizer.host(scopeUrl);
        this.allowExternal = allowExternal;
    }

    public List<String> discover(String html, String baseUrl, int currentDepth, int maxDepth) {
        if (currentDepth >= maxDepth || html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html, baseUrl != null ? baseUrl : "");
        Elements elements;
        try {
            elements = document.select(followSelector);
        } catch (Selector.SelectorParseException e) {
            log.warn("[Crawl] Invalid follow selector '{}': {}", followSelector, e.getMessage());
            return List.of();
        }

        Set<String> seen = new LinkedHashSet<>();
        List<String> links = new ArrayList<>();
        for (Element element : elements) {
            String link = stripFragment(element.absUrl("href"));
            if (!accept(link)) {
                continue;
            }
            if (seen.add(UrlNormalizer.normalize(link))) {
                links.add(link);
            }
        }
        return links;
    }

    private boolean accept(String link) {
        if (link.isEmpty() || !UrlNormalizer.isHttp(link)) {
            return false;
        }
        if (!allowExternal) {
            String host = UrlNormalizer.host(link);
            if (host == null || !host.equalsIgnoreCase(baseHost)) {
                return false;
            }
        }
        return followPattern == null || followPattern.matcher(link).find();
    }

    private static String stripFragment(String url) {
        if (url == null) {
            return "";
        }
        int hash = url.indexOf('#');
        return (hash >= 0 ? url.substring(0, hash) : url).trim();
    }

    private static Pattern compile(String followPattern) {
        if (followPattern == null || followPattern.isBlank()) {
            return null;
        }
        try {
            return Pattern.compile(followPattern);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid follow pattern '" + followPattern + "': "
                    + e.getDescription());
        }
    }
}
