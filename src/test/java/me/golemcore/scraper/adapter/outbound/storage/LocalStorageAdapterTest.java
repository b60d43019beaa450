package me.golemcore.scraper.adapter.outbound.storage;

import me.golemcore.scraper.infrastructure.config.ScraperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String PLANS = "scraping_plans";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreatePlansDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve(PLANS)));
    }

    @Test
    void shouldWriteAndReadText() {
        storageAdapter.putTextAtomic(PLANS, "example.com/home_v1.0_abc.json", "{\"url\":\"x\"}", false).join();

        assertEquals("{\"url\":\"x\"}", storageAdapter.getText(PLANS, "example.com/home_v1.0_abc.json").join());
        assertTrue(storageAdapter.exists(PLANS, "example.com/home_v1.0_abc.json").join());
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(storageAdapter.getText(PLANS, "missing.json").join());
        assertFalse(storageAdapter.exists(PLANS, "missing.json").join());
    }

    @Test
    void shouldKeepBackupOfReplacedFile() throws Exception {
        storageAdapter.putTextAtomic(PLANS, "registry.json", "first", true).join();
        storageAdapter.putTextAtomic(PLANS, "registry.json", "second", true).join();

        assertEquals("second", Files.readString(tempDir.resolve(PLANS).resolve("registry.json")));
        assertEquals("first", Files.readString(tempDir.resolve(PLANS).resolve("registry.json.bak")));
        assertFalse(Files.exists(tempDir.resolve(PLANS).resolve("registry.json.tmp")));
    }

    @Test
    void shouldListFilesRecursively() {
        storageAdapter.putTextAtomic(PLANS, "a.com/one.json", "1", false).join();
        storageAdapter.putTextAtomic(PLANS, "b.com/two.json", "2", false).join();

        List<String> all = storageAdapter.listObjects(PLANS, null).join();
        List<String> onlyA = storageAdapter.listObjects(PLANS, "a.com").join();

        assertEquals(Set.of("a.com/one.json", "b.com/two.json"), new HashSet<>(all));
        assertEquals(List.of("a.com/one.json"), onlyA);
        assertTrue(storageAdapter.listObjects(PLANS, "c.com").join().isEmpty());
    }

    @Test
    void shouldDeleteFile() {
        storageAdapter.putTextAtomic(PLANS, "gone.json", "x", false).join();

        storageAdapter.deleteObject(PLANS, "gone.json").join();

        assertFalse(storageAdapter.exists(PLANS, "gone.json").join());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(PLANS, "../../etc/passwd").join());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void shouldEnsureDirectory() {
        storageAdapter.ensureDirectory("screenshots").join();

        assertTrue(Files.isDirectory(storageAdapter.resolveDirectory("screenshots")));
    }
}
