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

import lombok.Builder;
import lombok.Value;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Condensed view of a live page given to plan generation: title, visible text
 * excerpt, notable form/navigation elements and a sample of links.
 */
@Value
@Builder
public class PageSnapshot {

    private static final int TEXT_EXCERPT_LENGTH = 2000;
    private static final int MAX_HINTS = 40;
    private static final int MAX_LINKS = 30;

    String url;
    String title;
    String textExcerpt;
    List<String> elementHints;
    List<String> links;

    public static PageSnapshot fromHtml(String url, String html) {
        Document document = Jsoup.parse(html != null ? html : "", url != null ? url : "");
        String text = document.body() != null ? document.body().text() : "";
        if (text.length() > TEXT_EXCERPT_LENGTH) {
            text = text.substring(0, TEXT_EXCERPT_LENGTH);
        }

        List<String> hints = new ArrayList<>();
        for (Element element : document.select("form, input, button, select, textarea, nav, [role=button]")) {
            if (hints.size() >= MAX_HINTS) {
                break;
            }
            hints.add(describe(element));
        }

        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            if (links.size() >= MAX_LINKS) {
                break;
            }
            String href = anchor.absUrl("href");
            if (!href.isEmpty()) {
                links.add(href);
            }
        }

        return PageSnapshot.builder()
                .url(url)
                .title(document.title())
                .textExcerpt(text)
                .elementHints(hints)
                .links(new ArrayList<>(links))
                .build();
    }

    private static String describe(Element element) {
        StringBuilder sb = new StringBuilder(element.tagName());
        if (!element.id().isEmpty()) {
            sb.append('#').append(element.id());
        }
        for (String className : element.classNames()) {
            sb.append('.').append(className);
        }
        for (String attribute : List.of("name", "type", "placeholder", "aria-label")) {
            if (element.hasAttr(attribute)) {
                sb.append('[').append(attribute).append("=\"").append(element.attr(attribute)).append("\"]");
            }
        }
        String ownText = element.ownText();
        if (!ownText.isBlank()) {
            sb.append(" \"").append(ownText.length() > 40 ? ownText.substring(0, 40) : ownText).append('"');
        }
        return sb.toString();
    }
}
