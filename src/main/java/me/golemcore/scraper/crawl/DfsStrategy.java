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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Depth-first: the frontier is a LIFO stack. Children are pushed in reverse
 * so the first discovered child is descended into first.
 */
public class DfsStrategy implements CrawlStrategy {

    public static final String NAME = "dfs";

    @Override
    public CrawlNode next(CrawlGraph graph) {
        return graph.pollLast();
    }

    @Override
    public List<CrawlNode> enqueue(CrawlGraph graph, List<CrawlNode> nodes) {
        List<CrawlNode> accepted = new ArrayList<>();
        for (int i = nodes.size() - 1; i >= 0; i--) {
            CrawlNode node = nodes.get(i);
            if (graph.enqueue(node)) {
                accepted.add(node);
            }
        }
        Collections.reverse(accepted);
        return accepted;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
