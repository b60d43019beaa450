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

import java.time.Instant;
import java.util.List;

/**
 * Listing view of a registered plan.
 */
@Value
@Builder
public class PlanSummary {

    String name;
    String url;
    String domain;
    String fingerprint;
    String version;
    List<String> tags;
    int useCount;
    Instant createdAt;
    Instant lastUsedAt;

    public static PlanSummary from(PlanRegistryEntry entry) {
        return PlanSummary.builder()
                .name(entry.getName())
                .url(entry.getUrl())
                .domain(entry.getDomain())
                .fingerprint(entry.getFingerprint())
                .version(entry.getVersion())
                .tags(entry.getTags() != null ? entry.getTags() : List.of())
                .useCount(entry.getUseCount())
                .createdAt(entry.getCreatedAt())
                .lastUsedAt(entry.getLastUsedAt())
                .build();
    }
}
