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

import me.golemcore.scraper.domain.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable browser driver configuration.
 *
 * <p>
 * Instances are never changed after construction; {@link #merge(Map)} returns
 * a fresh copy with the overrides applied. Override keys are accepted in
 * snake_case ({@code driver_type}) or camelCase ({@code driverType}); numeric
 * durations are interpreted as seconds.
 */
@Value
@Builder(toBuilder = true)
public class DriverConfig {

    @Builder.Default
    String driverType = "selenium";
    @Builder.Default
    String browser = "chrome";
    @Builder.Default
    boolean headless = true;
    boolean mobile;
    String mobileDevice;
    @Builder.Default
    boolean autoInstall = true;
    @Builder.Default
    Duration defaultTimeout = Duration.ofSeconds(10);
    @Builder.Default
    int retryAttempts = 3;
    @Builder.Default
    Duration delayBetweenActions = Duration.ofSeconds(1);
    @Builder.Default
    boolean overlayHousekeeping = true;
    boolean disableImages;
    String customUserAgent;

    public static DriverConfig defaults() {
        return DriverConfig.builder().build();
    }

    /**
     * Builds a configuration from the defaults with the given entries applied.
     */
    public static DriverConfig fromMap(Map<String, Object> values) {
        return defaults().merge(values);
    }

    /**
     * Returns a new configuration with the given overrides applied. Null or empty
     * overrides yield an equal copy.
     *
     * @throws ConfigurationException
     *             if a key is unknown or its value has the wrong type
     */
    public DriverConfig merge(Map<String, Object> overrides) {
        DriverConfigBuilder builder = toBuilder();
        if (overrides == null || overrides.isEmpty()) {
            return builder.build();
        }
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            String key = canonicalKey(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
            case "drivertype" -> builder.driverType(asString(entry.getKey(), value).toLowerCase(Locale.ROOT));
            case "browser" -> builder.browser(asString(entry.getKey(), value).toLowerCase(Locale.ROOT));
            case "headless" -> builder.headless(asBoolean(entry.getKey(), value));
            case "mobile" -> builder.mobile(asBoolean(entry.getKey(), value));
            case "mobiledevice" -> builder.mobileDevice(asNullableString(entry.getKey(), value));
            case "autoinstall" -> builder.autoInstall(asBoolean(entry.getKey(), value));
            case "defaulttimeout" -> builder.defaultTimeout(asDuration(entry.getKey(), value));
            case "retryattempts" -> builder.retryAttempts(asInt(entry.getKey(), value));
            case "delaybetweenactions" -> builder.delayBetweenActions(asDuration(entry.getKey(), value));
            case "overlayhousekeeping" -> builder.overlayHousekeeping(asBoolean(entry.getKey(), value));
            case "disableimages" -> builder.disableImages(asBoolean(entry.getKey(), value));
            case "customuseragent" -> builder.customUserAgent(asNullableString(entry.getKey(), value));
            default -> throw new ConfigurationException("Unknown driver config option: " + entry.getKey());
            }
        }
        return builder.build();
    }

    private static String canonicalKey(String key) {
        if (key == null) {
            throw new ConfigurationException("Driver config option name must not be null");
        }
        return key.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }

    private static String asString(String key, Object value) {
        if (value instanceof String s && !s.isBlank()) {
            return s.trim();
        }
        throw new ConfigurationException("Option '" + key + "' expects a non-empty string, got: " + value);
    }

    private static String asNullableString(String key, Object value) {
        if (value == null) {
            return null;
        }
        return asString(key, value);
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return Boolean.parseBoolean(s);
        }
        throw new ConfigurationException("Option '" + key + "' expects a boolean, got: " + value);
    }

    private static int asInt(String key, Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Option '" + key + "' expects an integer, got: " + value, e);
            }
        }
        throw new ConfigurationException("Option '" + key + "' expects an integer, got: " + value);
    }

    private static Duration asDuration(String key, Object value) {
        if (value instanceof Duration d) {
            return d;
        }
        if (value instanceof Number n) {
            return Duration.ofMillis(Math.round(n.doubleValue() * 1000));
        }
        if (value instanceof String s) {
            try {
                return Duration.ofMillis(Math.round(Double.parseDouble(s.trim()) * 1000));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Option '" + key + "' expects seconds, got: " + value, e);
            }
        }
        throw new ConfigurationException("Option '" + key + "' expects seconds, got: " + value);
    }
}
