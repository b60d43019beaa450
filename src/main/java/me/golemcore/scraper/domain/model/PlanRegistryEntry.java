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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Registry index projection of a saved plan. {@code path} is relative to the
 * plans directory.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlanRegistryEntry {

    String name;
    String version;
    String url;
    String domain;
    String fingerprint;
    String path;
    Instant createdAt;
    Instant lastUsedAt;
    int useCount;
    List<String> tags;

    public static PlanRegistryEntry of(Plan plan, String relativePath) {
        return PlanRegistryEntry.builder()
                .name(plan.getName())
                .version(plan.getVersion())
                .url(plan.getUrl())
                .domain(plan.getDomain())
                .fingerprint(plan.getFingerprint())
                .path(relativePath)
                .createdAt(plan.getCreatedAt())
                .useCount(0)
                .tags(plan.getTags())
                .build();
    }
}
