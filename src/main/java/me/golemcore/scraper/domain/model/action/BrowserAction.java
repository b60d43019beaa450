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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Duration;

/**
 * One step of a scraping plan. Serialized as a flat JSON object whose
 * {@code action} property names the concrete type, e.g.
 * {@code {"action": "click", "selector": "#next"}}.
 *
 * <p>
 * Legacy interactive actions ({@code authenticate}, {@code loop},
 * {@code conditional}, {@code await_*}, ...) deserialize to
 * {@link LegacyAction} and are skipped at execution time.
 */
@Getter
@ToString
@EqualsAndHashCode
@SuperBuilder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "action", visible = true)
@JsonSubTypes({
        @JsonSubTypes.Type(value = NavigateAction.class, name = NavigateAction.TYPE),
        @JsonSubTypes.Type(value = ClickAction.class, name = ClickAction.TYPE),
        @JsonSubTypes.Type(value = FillAction.class, name = FillAction.TYPE),
        @JsonSubTypes.Type(value = WaitAction.class, name = WaitAction.TYPE),
        @JsonSubTypes.Type(value = ScrollAction.class, name = ScrollAction.TYPE),
        @JsonSubTypes.Type(value = EvaluateAction.class, name = EvaluateAction.TYPE),
        @JsonSubTypes.Type(value = RefreshAction.class, name = RefreshAction.TYPE),
        @JsonSubTypes.Type(value = BackAction.class, name = BackAction.TYPE),
        @JsonSubTypes.Type(value = SelectAction.class, name = SelectAction.TYPE),
        @JsonSubTypes.Type(value = PressKeyAction.class, name = PressKeyAction.TYPE),
        @JsonSubTypes.Type(value = ScreenshotAction.class, name = ScreenshotAction.TYPE),
        @JsonSubTypes.Type(value = GetCookiesAction.class, name = GetCookiesAction.TYPE),
        @JsonSubTypes.Type(value = SetCookiesAction.class, name = SetCookiesAction.TYPE),
        @JsonSubTypes.Type(value = LegacyAction.class, names = {
                LegacyAction.AUTHENTICATE, "loop", "conditional", "await_human", "await_keypress",
                "await_browser_event", "upload_file", "wait_for_download" })
})
public abstract class BrowserAction {

    private final String description;

    /**
     * Per-step timeout in seconds; the driver default applies when null.
     */
    private final Integer timeout;

    @JsonProperty("action")
    public abstract String getAction();

    /**
     * Whether a failure of this step aborts the remaining steps of the page.
     */
    @JsonIgnore
    public boolean isCritical() {
        return false;
    }

    @JsonIgnore
    public Duration timeoutOr(Duration fallback) {
        return timeout != null && timeout > 0 ? Duration.ofSeconds(timeout) : fallback;
    }
}
