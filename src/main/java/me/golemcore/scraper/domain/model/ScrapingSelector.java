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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Named content selector applied to the final page source after all steps ran.
 *
 * <p>
 * {@code selectorType} is one of {@code css}, {@code xpath} or {@code tag};
 * {@code extractType} is one of {@code text}, {@code html} or
 * {@code attribute} (the latter reads {@link #attribute}). With
 * {@code multiple} every match is returned as a list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScrapingSelector {

    public static final String TYPE_CSS = "css";
    public static final String TYPE_XPATH = "xpath";
    public static final String TYPE_TAG = "tag";

    public static final String EXTRACT_TEXT = "text";
    public static final String EXTRACT_HTML = "html";
    public static final String EXTRACT_ATTRIBUTE = "attribute";

    private String name;
    private String selector;
    @Builder.Default
    private String selectorType = TYPE_CSS;
    @Builder.Default
    private String extractType = EXTRACT_TEXT;
    private String attribute;
    private boolean multiple;
}
