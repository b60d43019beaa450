package me.golemcore.scraper.crawl;

import me.golemcore.scraper.domain.model.ScrapingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CrawlGraphTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private CrawlGraph graph;

    @BeforeEach
    void setUp() {
        graph = new CrawlGraph(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRegisterRootAsVisited() {
        CrawlNode root = graph.addRoot("https://www.example.com/");

        assertEquals(0, root.getDepth());
        assertNull(root.getParentUrl());
        assertEquals(CrawlNodeStatus.PENDING, root.getStatus());
        assertTrue(graph.isVisited("https://example.com"));
        assertTrue(graph.hasPending());
    }

    @Test
    void shouldRejectDuplicateNormalizedUrls() {
        graph.addRoot("https://example.com/");

        assertTrue(graph.enqueue(new CrawlNode("https://example.com/a", 1, "https://example.com")));
        assertFalse(graph.enqueue(new CrawlNode("https://www.example.com/a/?utm=x", 1, "https://example.com")));
        assertFalse(graph.enqueue(new CrawlNode("https://EXAMPLE.com/a#section", 2, "https://example.com/a")));

        assertEquals(2, graph.visitedCount());
    }

    @Test
    void shouldPollFromBothEnds() {
        CrawlNode root = graph.addRoot("https://example.com/");
        CrawlNode child = new CrawlNode("https://example.com/a", 1, root.getNormalizedUrl());
        graph.enqueue(child);

        assertSame(child, graph.pollLast());
        assertSame(root, graph.pollFirst());
        assertNull(graph.pollFirst());
        assertFalse(graph.hasPending());
    }

    @Test
    void shouldTrackDoneAndFailedNodes() {
        CrawlNode root = graph.addRoot("https://example.com/");
        CrawlNode child = new CrawlNode("https://example.com/a", 1, root.getNormalizedUrl());
        graph.enqueue(child);

        graph.markScraping(graph.pollFirst());
        graph.markDone(root, ScrapingResult.builder().url(root.getUrl()).success(true).build());
        graph.markScraping(graph.pollFirst());
        graph.markFailed(child, "boom");

        assertEquals(CrawlNodeStatus.DONE, root.getStatus());
        assertEquals(NOW, root.getStartedAt());
        assertEquals(NOW, root.getFinishedAt());
        assertNotNull(root.getResult());
        assertEquals(CrawlNodeStatus.FAILED, child.getStatus());
        assertEquals("boom", child.getError());
        assertEquals(1, graph.getDoneCount());
        assertEquals(1, graph.getFailedNodes().size());
        assertEquals(2, graph.getProcessedNodes().size());
        assertSame(child, graph.getNode("https://www.example.com/a/"));
    }

    @Test
    void shouldRejectIllegalTransitions() {
        CrawlNode root = graph.addRoot("https://example.com/");
        ScrapingResult result = ScrapingResult.builder().success(true).build();

        assertThrows(IllegalStateException.class, () -> graph.markDone(root, result));

        graph.markScraping(root);
        assertThrows(IllegalStateException.class, () -> graph.markScraping(root));

        graph.markDone(root, result);
        assertThrows(IllegalStateException.class, () -> graph.markFailed(root, "late failure"));
        assertTrue(root.getStatus().isTerminal());
    }

    @Test
    void shouldAllowFailingPendingNode() {
        CrawlNode root = graph.addRoot("https://example.com/");

        graph.markFailed(root, "skipped");

        assertEquals(CrawlNodeStatus.FAILED, root.getStatus());
    }
}
