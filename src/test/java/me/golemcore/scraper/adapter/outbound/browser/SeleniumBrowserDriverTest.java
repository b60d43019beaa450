package me.golemcore.scraper.adapter.outbound.browser;

import me.golemcore.scraper.domain.exception.ConfigurationException;
import me.golemcore.scraper.domain.model.BrowserCookie;
import me.golemcore.scraper.domain.model.DriverConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openqa.selenium.By;
import org.openqa.selenium.Cookie;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Keys;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

class SeleniumBrowserDriverTest {

    @TempDir
    Path tempDir;

    private WebDriver webDriver;
    private WebDriver.Options options;
    private WebDriver.Timeouts timeouts;
    private SeleniumBrowserDriver driver;

    @BeforeEach
    void setUp() {
        webDriver = mock(WebDriver.class, withSettings()
                .extraInterfaces(JavascriptExecutor.class, TakesScreenshot.class));
        options = mock(WebDriver.Options.class);
        timeouts = mock(WebDriver.Timeouts.class);
        when(webDriver.manage()).thenReturn(options);
        when(options.timeouts()).thenReturn(timeouts);
        driver = new SeleniumBrowserDriver(DriverConfig.builder()
                .browser("chrome")
                .defaultTimeout(Duration.ofSeconds(3))
                .build(), config -> webDriver);
    }

    @AfterEach
    void tearDown() {
        driver.quit().join();
    }

    // ===== lifecycle =====

    @Test
    void shouldApplyPageLoadTimeoutOnStart() {
        driver.start().join();

        assertTrue(driver.isStarted());
        verify(timeouts).pageLoadTimeout(Duration.ofSeconds(3));
    }

    @Test
    void shouldRejectUnsupportedBrowser() {
        DriverConfig config = DriverConfig.builder().browser("webkit").build();

        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> new SeleniumBrowserDriver(config, c -> webDriver));
        assertTrue(error.getMessage().contains("Unsupported Selenium browser"));
    }

    @Test
    void shouldTolerateErrorsWhileQuitting() {
        doThrow(new WebDriverException("session already gone")).when(webDriver).quit();
        driver.start().join();

        assertDoesNotThrow(() -> driver.quit().join());
        assertFalse(driver.isStarted());
    }

    @Test
    void shouldHaveNoExtendedCapabilities() {
        assertTrue(driver.getCapabilities().isEmpty());
    }

    // ===== page operations =====

    @Test
    void shouldNavigateWithRequestedTimeout() {
        driver.start().join();

        driver.navigate("https://example.com/", Duration.ofSeconds(7)).join();

        verify(timeouts).pageLoadTimeout(Duration.ofSeconds(7));
        verify(webDriver).get("https://example.com/");
    }

    @Test
    void shouldReadPageState() {
        when(webDriver.getPageSource()).thenReturn("<html><body>hi</body></html>");
        when(webDriver.getCurrentUrl()).thenReturn("https://example.com/after");
        driver.start().join();

        assertEquals("<html><body>hi</body></html>", driver.getPageSource().join());
        assertEquals("https://example.com/after", driver.currentUrl().join());
    }

    @Test
    void shouldClickClickableElement() {
        WebElement button = mock(WebElement.class);
        when(button.isDisplayed()).thenReturn(true);
        when(button.isEnabled()).thenReturn(true);
        when(webDriver.findElement(By.cssSelector("#go"))).thenReturn(button);
        driver.start().join();

        driver.click("#go", Duration.ofSeconds(1)).join();

        verify(button).click();
    }

    @Test
    void shouldResolveXpathSelectors() {
        WebElement heading = mock(WebElement.class);
        when(heading.getText()).thenReturn("Title");
        when(webDriver.findElement(By.xpath("//h1"))).thenReturn(heading);
        driver.start().join();

        assertEquals("Title", driver.getText("//h1", Duration.ofSeconds(1)).join());
    }

    @Test
    void shouldReadLiveInputValueFromDomProperty() {
        WebElement field = mock(WebElement.class);
        when(field.getDomProperty("value")).thenReturn("foo");
        when(webDriver.findElement(By.cssSelector("#q"))).thenReturn(field);
        driver.start().join();

        assertEquals("foo", driver.getInputValue("#q", Duration.ofSeconds(1)).join());
    }

    @Test
    void shouldRunScriptsThroughJavascriptExecutor() {
        JavascriptExecutor executor = (JavascriptExecutor) webDriver;
        when(executor.executeScript("return arguments[0];", "x")).thenReturn("x");
        when(executor.executeScript("return (document.title);")).thenReturn("Home");
        driver.start().join();

        assertEquals("x", driver.executeScript("return arguments[0];", "x").join());
        assertEquals("Home", driver.evaluate("document.title").join());
    }

    @Test
    void shouldWriteScreenshotToPath() throws Exception {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        when(((TakesScreenshot) webDriver).getScreenshotAs(OutputType.BYTES)).thenReturn(png);
        driver.start().join();
        Path target = tempDir.resolve("shots").resolve("page.png");

        byte[] result = driver.screenshot(target, false).join();

        assertArrayEquals(png, result);
        assertArrayEquals(png, Files.readAllBytes(target));
    }

    @Test
    void shouldMapCookies() {
        when(options.getCookies()).thenReturn(Set.of(new Cookie("sid", "abc", "example.com", "/", null)));
        driver.start().join();

        List<BrowserCookie> cookies = driver.getCookies().join();

        assertEquals(1, cookies.size());
        assertEquals("sid", cookies.get(0).getName());
        assertEquals("example.com", cookies.get(0).getDomain());
        assertNull(cookies.get(0).getExpires());
    }

    @Test
    void shouldAddCookies() {
        driver.start().join();

        driver.setCookies(List.of(BrowserCookie.builder().name("sid").value("abc").build())).join();

        verify(options).addCookie(any(Cookie.class));
    }

    @Test
    void shouldFailWhenDriverNotStarted() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> driver.navigate("https://example.com/", null).join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    // ===== key mapping =====

    @Test
    void shouldMapKeyNames() {
        assertEquals(Keys.ENTER, SeleniumBrowserDriver.toKeys("Enter"));
        assertEquals(Keys.ARROW_DOWN, SeleniumBrowserDriver.toKeys("ArrowDown"));
        assertEquals("a", SeleniumBrowserDriver.toKeys("a"));
        assertEquals(Keys.chord(Keys.CONTROL, "a"), SeleniumBrowserDriver.toKeys("Control+a"));
        assertEquals("", SeleniumBrowserDriver.toKeys(""));
    }
}
