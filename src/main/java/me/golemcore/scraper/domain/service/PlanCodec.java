package me.golemcore.scraper.domain.service;

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

import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.ScrapingSelector;
import me.golemcore.scraper.domain.model.action.BrowserAction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * JSON form of plans and actions. Plan files and LLM responses use snake_case
 * keys ({@code follow_selector}, {@code wait_after_click}); the shared
 * application mapper is copied and given that naming strategy.
 */
@Component
public class PlanCodec {

    private static final TypeReference<List<BrowserAction>> ACTION_LIST = new TypeReference<>() {
    };

    private static final TypeReference<List<ScrapingSelector>> SELECTOR_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public PlanCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public String toJson(Plan plan) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize plan " + plan.getName(), e);
        }
    }

    public Plan fromJson(String json) throws JsonProcessingException {
        return mapper.readValue(json, Plan.class);
    }

    /**
     * Converts an already-parsed JSON object (e.g. tool arguments) into a plan.
     *
     * @throws IllegalArgumentException
     *             if the map does not describe a valid plan
     */
    public Plan fromMap(Map<String, Object> values) {
        return mapper.convertValue(values, Plan.class);
    }

    /**
     * @throws IllegalArgumentException
     *             on an unknown action type or malformed step
     */
    public List<BrowserAction> stepsFromMaps(List<?> steps) {
        return mapper.convertValue(steps, ACTION_LIST);
    }

    public List<ScrapingSelector> selectorsFromMaps(List<?> selectors) {
        return mapper.convertValue(selectors, SELECTOR_LIST);
    }

    /**
     * Generic snake_case view of any value, used for tool output.
     */
    public Object toTree(Object value) {
        return mapper.convertValue(value, Object.class);
    }

    public String toPrettyJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    ObjectMapper mapper() {
        return mapper;
    }
}
