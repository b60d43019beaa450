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

import java.util.List;
import java.util.Locale;

/**
 * Traversal order of a crawl.
 */
public interface CrawlStrategy {

    /**
     * Next node to scrape, or null when the frontier is empty.
     */
    CrawlNode next(CrawlGraph graph);

    /**
     * Adds newly discovered children to the frontier.
     *
     * @return the nodes the graph accepted, in discovery order
     */
    List<CrawlNode> enqueue(CrawlGraph graph, List<CrawlNode> nodes);

    String getName();

    static CrawlStrategy fromName(String name) {
        String normalized = name != null ? name.trim().toLowerCase(Locale.ROOT) : BfsStrategy.NAME;
        return switch (normalized) {
        case BfsStrategy.NAME, "" -> new BfsStrategy();
        case DfsStrategy.NAME -> new DfsStrategy();
        default -> throw new ConfigurationException("Unknown crawl strategy '" + name + "'. Available: bfs, dfs");
        };
    }
}
