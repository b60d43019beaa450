package me.golemcore.scraper.tools;

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
import java.util.Locale;
import java.util.Map;

/**
 * Parameter helpers shared by the scraping tools. Agents send loosely typed
 * JSON, so numbers may arrive as strings and booleans as "true".
 */
final class ToolArguments {

    private ToolArguments() {
    }

    /**
     * Returns the URL with {@code https://} prepended when it has no scheme.
     *
     * @throws IllegalArgumentException
     *             for a blank URL or any scheme other than http and https
     */
    static String requireHttpUrl(Object value, String name) {
        String url = value instanceof String s ? s.trim() : null;
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException(name + " is required");
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return url;
        }
        if (url.contains("://") || lower.startsWith("javascript:") || lower.startsWith("data:")
                || lower.startsWith("file:")) {
            throw new IllegalArgumentException("Only http and https URLs are allowed");
        }
        return "https://" + url;
    }

    static String string(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    static Integer integer(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer", e);
        }
    }

    static boolean bool(Map<String, Object> parameters, String name, boolean defaultValue) {
        Object value = parameters.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    static List<?> list(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> items) {
            return items;
        }
        throw new IllegalArgumentException(name + " must be an array");
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> object(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException(name + " must be an object");
    }
}
