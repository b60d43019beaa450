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

import java.util.List;

/**
 * Breadth-first: the frontier is a FIFO queue, so all pages of depth N are
 * scraped before any page of depth N+1.
 */
public class BfsStrategy implements CrawlStrategy {

    public static final String NAME = "bfs";

    @Override
    public CrawlNode next(CrawlGraph graph) {
        return graph.pollFirst();
    }

    @Override
    public List<CrawlNode> enqueue(CrawlGraph graph, List<CrawlNode> nodes) {
        return nodes.stream()
                .filter(graph::enqueue)
                .toList();
    }

    @Override
    public String getName() {
        return NAME;
    }
}
