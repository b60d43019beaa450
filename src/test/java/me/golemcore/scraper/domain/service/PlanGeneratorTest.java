package me.golemcore.scraper.domain.service;

import me.golemcore.scraper.domain.exception.PlanValidationException;
import me.golemcore.scraper.domain.model.PageSnapshot;
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.action.ClickAction;
import me.golemcore.scraper.domain.model.action.NavigateAction;
import me.golemcore.scraper.infrastructure.config.AutoConfiguration;
import me.golemcore.scraper.port.outbound.LlmCompletionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlanGeneratorTest {

    private static final String URL = "https://shop.example.com/products";
    private static final String OBJECTIVE = "Collect product names";

    private static final String PLAN_JSON = """
            {
              "steps": [
                {"action": "navigate", "url": "https://shop.example.com/products"},
                {"action": "click", "selector": "button[data-label=\\"more {items}\\"]"}
              ],
              "selectors": [{"name": "names", "selector": "h2.name", "multiple": true}],
              "follow_pattern": "/products/"
            }""";

    private LlmCompletionPort llm;
    private ObjectProvider<LlmCompletionPort> llmProvider;
    private PlanGenerator generator;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        llm = mock(LlmCompletionPort.class);
        llmProvider = mock(ObjectProvider.class);
        when(llmProvider.getIfAvailable()).thenReturn(llm);
        when(llm.isAvailable()).thenReturn(true);
        generator = new PlanGenerator(llmProvider, new PlanCodec(AutoConfiguration.objectMapper()));
    }

    // ===== response parsing =====

    @Test
    void shouldParsePlainJson() {
        Plan plan = generator.parseResponse(PLAN_JSON, URL, OBJECTIVE);

        assertEquals(URL, plan.getUrl());
        assertEquals(OBJECTIVE, plan.getObjective());
        assertEquals(Plan.SOURCE_LLM, plan.getSource());
        assertEquals("/products/", plan.getFollowPattern());
        assertInstanceOf(NavigateAction.class, plan.getSteps().get(0));
        assertEquals("button[data-label=\"more {items}\"]", ((ClickAction) plan.getSteps().get(1)).getSelector());
    }

    @Test
    void shouldParseFencedJson() {
        Plan plan = generator.parseResponse("```json\n" + PLAN_JSON + "\n```", URL, OBJECTIVE);

        assertEquals(2, plan.getSteps().size());
    }

    @Test
    void shouldParseJsonSurroundedByProse() {
        String response = "Sure! Here is the plan you asked for:\n" + PLAN_JSON
                + "\nLet me know if you need {anything} else.";

        Plan plan = generator.parseResponse(response, URL, OBJECTIVE);

        assertEquals(1, plan.getSelectors().size());
    }

    @Test
    void shouldKeepUrlAndObjectiveFromResponse() {
        String response = "{\"url\": \"https://shop.example.com/sale\", \"objective\": \"Sale items\", \"steps\": []}";

        Plan plan = generator.parseResponse(response, URL, OBJECTIVE);

        assertEquals("https://shop.example.com/sale", plan.getUrl());
        assertEquals("Sale items", plan.getObjective());
    }

    @Test
    void shouldRejectResponseWithoutSteps() {
        PlanValidationException error = assertThrows(PlanValidationException.class,
                () -> generator.parseResponse("{\"selectors\": []}", URL, OBJECTIVE));

        assertTrue(error.getMessage().contains("'steps'"));
        assertEquals("{\"selectors\": []}", error.getExcerpt());
    }

    @Test
    void shouldRejectNonJsonResponse() {
        PlanValidationException error = assertThrows(PlanValidationException.class,
                () -> generator.parseResponse("I cannot help with that.", URL, OBJECTIVE));

        assertEquals("I cannot help with that.", error.getExcerpt());
    }

    @Test
    void shouldRejectUnterminatedJsonAndBlankResponses() {
        assertThrows(PlanValidationException.class,
                () -> generator.parseResponse("{\"steps\": [", URL, OBJECTIVE));
        assertThrows(PlanValidationException.class, () -> generator.parseResponse("   ", URL, OBJECTIVE));
    }

    @Test
    void shouldRejectUnknownActions() {
        assertThrows(PlanValidationException.class, () -> generator.parseResponse(
                "{\"steps\": [{\"action\": \"teleport\"}]}", URL, OBJECTIVE));
    }

    @Test
    void shouldTruncateLongExcerpts() {
        String response = "x".repeat(2000);

        PlanValidationException error = assertThrows(PlanValidationException.class,
                () -> generator.parseResponse(response, URL, OBJECTIVE));

        assertEquals(500, error.getExcerpt().length());
    }

    @Test
    void shouldExtractFirstBalancedObject() {
        assertEquals("{\"a\": \"}\"}", PlanGenerator.extractJsonObject("prefix {\"a\": \"}\"} {\"b\": 1}"));
        assertEquals("{\"a\": {\"b\": 2}}", PlanGenerator.extractJsonObject("{\"a\": {\"b\": 2}} tail"));
    }

    // ===== generation =====

    @Test
    void shouldGeneratePlanWithSnapshotInPrompt() {
        when(llm.complete(anyString())).thenReturn(CompletableFuture.completedFuture(PLAN_JSON));
        PageSnapshot snapshot = PageSnapshot.fromHtml(URL,
                "<html><head><title>Products</title></head><body><h2 class=\"name\">Lamp</h2></body></html>");

        Plan plan = generator.generate(URL, OBJECTIVE, snapshot, Map.of("pagination", "infinite scroll")).join();

        assertEquals(Plan.SOURCE_LLM, plan.getSource());
        verify(llm).complete(argThat(prompt -> prompt.contains(URL)
                && prompt.contains(OBJECTIVE)
                && prompt.contains("Title: Products")
                && prompt.contains("infinite scroll")
                && prompt.contains("- press_key:")));
    }

    @Test
    void shouldFailGenerationWithoutLanguageModel() {
        when(llmProvider.getIfAvailable()).thenReturn(null);

        assertFalse(generator.isAvailable());
        CompletionException error = assertThrows(CompletionException.class,
                () -> generator.generate(URL, OBJECTIVE, null, null).join());
        assertInstanceOf(PlanValidationException.class, error.getCause());
    }

    @Test
    void shouldFailGenerationWhenModelReturnsGarbage() {
        when(llm.complete(anyString())).thenReturn(CompletableFuture.completedFuture("no plan here"));

        CompletionException error = assertThrows(CompletionException.class,
                () -> generator.generate(URL, OBJECTIVE, null, null).join());
        assertInstanceOf(PlanValidationException.class, error.getCause());
    }

    @Test
    void shouldDescribeMissingSnapshotInPrompt() {
        String prompt = generator.buildPrompt(URL, OBJECTIVE, null, null);

        assertTrue(prompt.contains("(not available)"));
        assertTrue(prompt.contains("HINTS: None"));
    }
}
