package me.golemcore.scraper.domain.model.action;

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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

/**
 * Waits for a condition: a selector to appear, the URL or title to contain a
 * value, or a custom script to return true. Without a condition it simply
 * pauses for the step timeout.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class WaitAction extends BrowserAction {

    public static final String TYPE = "wait";

    public static final String SELECTOR = "selector";
    public static final String URL_CONTAINS = "url_contains";
    public static final String TITLE_CONTAINS = "title_contains";
    public static final String CUSTOM = "custom";
    public static final String SIMPLE = "simple";

    private final String conditionType;

    @JsonAlias("condition_value")
    private final String condition;

    /**
     * JavaScript predicate for {@code custom} waits when {@code condition} is
     * empty.
     */
    private final String customScript;

    @Override
    public String getAction() {
        return TYPE;
    }
}
