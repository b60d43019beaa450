package me.golemcore.scraper.domain.model;

import me.golemcore.scraper.domain.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DriverConfigTest {

    @Test
    void shouldProvideDefaults() {
        DriverConfig config = DriverConfig.defaults();

        assertEquals("selenium", config.getDriverType());
        assertEquals("chrome", config.getBrowser());
        assertTrue(config.isHeadless());
        assertFalse(config.isMobile());
        assertEquals(Duration.ofSeconds(10), config.getDefaultTimeout());
        assertEquals(3, config.getRetryAttempts());
        assertEquals(Duration.ofSeconds(1), config.getDelayBetweenActions());
        assertTrue(config.isOverlayHousekeeping());
    }

    @Test
    void shouldMergeSnakeAndCamelCaseKeys() {
        DriverConfig base = DriverConfig.defaults();

        DriverConfig merged = base.merge(Map.of(
                "driver_type", "Playwright",
                "browser", "FIREFOX",
                "defaultTimeout", 30,
                "delay_between_actions", 0.5,
                "headless", "false",
                "retry_attempts", "5"));

        assertEquals("playwright", merged.getDriverType());
        assertEquals("firefox", merged.getBrowser());
        assertEquals(Duration.ofSeconds(30), merged.getDefaultTimeout());
        assertEquals(Duration.ofMillis(500), merged.getDelayBetweenActions());
        assertFalse(merged.isHeadless());
        assertEquals(5, merged.getRetryAttempts());
    }

    @Test
    void shouldLeaveOriginalUntouchedWhenMerging() {
        DriverConfig base = DriverConfig.defaults();

        base.merge(Map.of("browser", "firefox"));

        assertEquals("chrome", base.getBrowser());
    }

    @Test
    void shouldReturnEqualCopyForEmptyOverrides() {
        DriverConfig base = DriverConfig.builder().browser("edge").build();

        assertEquals(base, base.merge(null));
        assertEquals(base, base.merge(Map.of()));
    }

    @Test
    void shouldRejectUnknownKey() {
        DriverConfig base = DriverConfig.defaults();
        Map<String, Object> overrides = Map.of("warp_speed", true);

        ConfigurationException error = assertThrows(ConfigurationException.class, () -> base.merge(overrides));
        assertTrue(error.getMessage().contains("warp_speed"));
    }

    @Test
    void shouldRejectWrongValueTypes() {
        DriverConfig base = DriverConfig.defaults();

        assertThrows(ConfigurationException.class, () -> base.merge(Map.of("headless", "maybe")));
        assertThrows(ConfigurationException.class, () -> base.merge(Map.of("retry_attempts", "three")));
        assertThrows(ConfigurationException.class, () -> base.merge(Map.of("browser", "")));
        assertThrows(ConfigurationException.class, () -> base.merge(Map.of("default_timeout", true)));
    }

    @Test
    void shouldAllowClearingNullableStrings() {
        DriverConfig base = DriverConfig.builder().customUserAgent("bot/1.0").build();
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("custom_user_agent", null);

        assertNull(base.merge(overrides).getCustomUserAgent());
    }

    @Test
    void shouldBuildFromMap() {
        DriverConfig config = DriverConfig.fromMap(Map.of("mobile", true, "mobile_device", "iPhone 13"));

        assertTrue(config.isMobile());
        assertEquals("iPhone 13", config.getMobileDevice());
        assertEquals("chrome", config.getBrowser());
    }
}
