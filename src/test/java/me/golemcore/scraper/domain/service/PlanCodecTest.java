package me.golemcore.scraper.domain.service;

import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.ScrapingSelector;
import me.golemcore.scraper.domain.model.action.BrowserAction;
import me.golemcore.scraper.domain.model.action.ClickAction;
import me.golemcore.scraper.domain.model.action.LegacyAction;
import me.golemcore.scraper.domain.model.action.NavigateAction;
import me.golemcore.scraper.domain.model.action.WaitAction;
import me.golemcore.scraper.infrastructure.config.AutoConfiguration;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlanCodecTest {

    private PlanCodec planCodec;

    @BeforeEach
    void setUp() {
        planCodec = new PlanCodec(AutoConfiguration.objectMapper());
    }

    @Test
    void shouldReadSnakeCasePlanFile() throws JsonProcessingException {
        Plan plan = planCodec.fromJson("""
                {
                  "url": "https://shop.example.com/products",
                  "objective": "List products",
                  "follow_selector": "a.product",
                  "max_depth": 2,
                  "steps": [
                    {"action": "navigate", "url": "https://shop.example.com/products"},
                    {"action": "click", "selector": "#more", "wait_after_click": ".grid", "click_type": "double"},
                    {"action": "wait", "condition_type": "selector", "condition": ".grid", "timeout": 5},
                    {"action": "authenticate", "username": "bob"}
                  ],
                  "selectors": [
                    {"name": "titles", "selector": "h2", "multiple": true}
                  ],
                  "unknown_field": "ignored"
                }
                """);

        assertEquals("a.product", plan.getFollowSelector());
        assertEquals(2, plan.getMaxDepth());
        assertEquals(4, plan.getSteps().size());
        ClickAction click = (ClickAction) plan.getSteps().get(1);
        assertEquals(".grid", click.getWaitAfterClick());
        assertEquals("double", click.getClickType());
        WaitAction wait = (WaitAction) plan.getSteps().get(2);
        assertEquals(5, wait.getTimeout());
        LegacyAction legacy = (LegacyAction) plan.getSteps().get(3);
        assertEquals("authenticate", legacy.getAction());
        assertTrue(legacy.isCritical());
        ScrapingSelector selector = plan.getSelectors().get(0);
        assertTrue(selector.isMultiple());
        assertEquals(ScrapingSelector.TYPE_CSS, selector.getSelectorType());
    }

    @Test
    void shouldWriteSnakeCaseKeysAndActionDiscriminator() {
        Plan plan = Plan.builder()
                .url("https://example.com")
                .followPattern("/docs/")
                .steps(List.of(ClickAction.builder().selector("#go").waitAfterClick("#done").build()))
                .build();

        String json = planCodec.toJson(plan);

        assertTrue(json.contains("\"follow_pattern\" : \"/docs/\""));
        assertTrue(json.contains("\"action\" : \"click\""));
        assertTrue(json.contains("\"wait_after_click\" : \"#done\""));
        assertFalse(json.contains("relative_path"));
    }

    @Test
    void shouldPreserveStepsThroughFile() throws JsonProcessingException {
        Plan plan = Plan.builder()
                .url("https://example.com/a")
                .name("docs")
                .tags(List.of("docs"))
                .steps(List.of(
                        NavigateAction.builder().url("https://example.com/a").timeout(15).build(),
                        LegacyAction.builder().action("loop").build()))
                .build();

        Plan read = planCodec.fromJson(planCodec.toJson(plan));

        assertEquals(plan.getSteps(), read.getSteps());
        assertEquals(plan.getFingerprint(), read.getFingerprint());
        assertEquals(plan.getCreatedAt(), read.getCreatedAt());
        assertEquals("docs", read.getName());
    }

    @Test
    void shouldConvertToolArguments() {
        List<BrowserAction> steps = planCodec.stepsFromMaps(List.of(
                Map.of("action", "fill", "selector", "#q", "value", "lamp", "press_enter", true),
                Map.of("action", "scroll", "direction", "bottom")));

        assertEquals(List.of("fill", "scroll"), steps.stream().map(BrowserAction::getAction).toList());

        List<ScrapingSelector> selectors = planCodec.selectorsFromMaps(List.of(
                Map.of("name", "link", "selector", "a", "extract_type", "attribute", "attribute", "href")));
        assertEquals("href", selectors.get(0).getAttribute());
    }

    @Test
    void shouldRejectUnknownAction() {
        List<Map<String, Object>> steps = List.of(Map.of("action", "teleport"));

        assertThrows(IllegalArgumentException.class, () -> planCodec.stepsFromMaps(steps));
    }

    @Test
    void shouldRejectPlanWithoutUrl() {
        Map<String, Object> values = Map.of("objective", "nothing");

        assertThrows(IllegalArgumentException.class, () -> planCodec.fromMap(values));
    }
}
