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

import java.util.Set;

/**
 * Decides whether an outgoing browser request proceeds.
 */
@FunctionalInterface
public interface RequestInterceptor {

    InterceptDecision intercept(InterceptedRequest request);

    /**
     * Aborts every request whose resource type (image, font, media, ...) is in
     * the given set.
     */
    static RequestInterceptor blockResourceTypes(Set<String> resourceTypes) {
        return request -> resourceTypes.contains(request.getResourceType())
                ? InterceptDecision.ABORT
                : InterceptDecision.CONTINUE;
    }

    enum InterceptDecision {
        CONTINUE, ABORT
    }
}
