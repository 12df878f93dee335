package org.netpreserve.pdfharvest.browser;

import org.intellij.lang.annotations.Language;
import org.netpreserve.pdfharvest.util.Url;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.Pdf;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.print.PageSize;
import org.openqa.selenium.print.PrintOptions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

class ChromeWindow implements Window {
    private static final Logger log = LoggerFactory.getLogger(ChromeWindow.class);
    private static final PageSize A4 = new PageSize(29.7, 21.0);
    private static final Duration SCRIPT_TIMEOUT = Duration.ofSeconds(10);
    private final ChromeDriver driver;
    private final BiConsumer<ChromeDriver, Boolean> onClose;
    private boolean healthy = true;
    private boolean closed = false;

    ChromeWindow(ChromeDriver driver, BiConsumer<ChromeDriver, Boolean> onClose) {
        this.driver = driver;
        this.onClose = onClose;
    }

    @Override
    public void navigateTo(Url url, Duration timeout) throws NavigationException {
        try {
            driver.manage().timeouts().pageLoadTimeout(timeout);
            driver.get(url.toString());
        } catch (org.openqa.selenium.TimeoutException e) {
            throw new NavigationTimedOutException(url, "Timed out waiting for load event");
        } catch (NoSuchSessionException e) {
            healthy = false;
            throw new BrowserException("Chrome session lost while loading " + url, e);
        } catch (WebDriverException e) {
            throw new NavigationFailedException(url, firstLine(e.getMessage()), e);
        }
    }

    @Override
    public String title() {
        try {
            String title = driver.getTitle();
            return title == null ? "" : title;
        } catch (WebDriverException e) {
            log.debug("Unable to read title: {}", firstLine(e.getMessage()));
            return "";
        }
    }

    @Override
    public List<Url> extractLinks() {
        List<?> hrefs = (List<?>) eval("""
                const links = [];
                for (const el of document.querySelectorAll('a[href]')) {
                    let href = el.href;
                    if (href instanceof SVGAnimatedString) {
                        href = new URL(href.baseVal, el.ownerDocument.location.href).toString();
                    }
                    if (href) links.push(href);
                }
                return links;
                """);
        if (hrefs == null) return List.of();
        return hrefs.stream().map(String::valueOf).map(Url::new).toList();
    }

    @Override
    public void printToPdf(Path path, Duration timeout) throws ExportException {
        try {
            driver.executeCdpCommand("Emulation.setEmulatedMedia", Map.<String, Object>of("media", "screen"));
        } catch (WebDriverException e) {
            log.debug("Unable to emulate screen media: {}", firstLine(e.getMessage()));
        }

        var printOptions = new PrintOptions();
        printOptions.setPageSize(A4);
        printOptions.setBackground(true);

        Pdf pdf;
        try {
            Thread.sleep(300);
            var future = CompletableFuture.supplyAsync(() -> driver.print(printOptions), runnable -> {
                var thread = new Thread(runnable, "pdf-print");
                thread.setDaemon(true);
                thread.start();
            });
            try {
                pdf = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (java.util.concurrent.TimeoutException e) {
                // the driver may still be busy printing, so don't hand it to another window
                healthy = false;
                future.cancel(true);
                throw new ExportException(path, "Timed out after " + timeout.toMillis() + "ms printing page");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExportException(path, "Interrupted while printing page", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof NoSuchSessionException) healthy = false;
            throw new ExportException(path, "Failed to print page", e.getCause());
        }

        try {
            Files.write(path, Base64.getDecoder().decode(pdf.getContent()));
        } catch (IOException e) {
            throw new ExportException(path, "Failed to write PDF", e);
        }
    }

    @Override
    public boolean perform(Interaction interaction) {
        try {
            if (interaction.action() == Interaction.Action.SCROLL_TO_BOTTOM) {
                scrollToBottom();
                return true;
            }
            By by = switch (interaction.locator()) {
                case TEXT -> By.xpath(interaction.textXPath());
                case CSS -> By.cssSelector(interaction.value());
                case XPATH -> By.xpath(interaction.value());
            };
            List<WebElement> elements = driver.findElements(by);
            if (elements.isEmpty()) return false;
            elements.get(0).click();
            log.debug("Performed {}", interaction);
            return true;
        } catch (NoSuchSessionException e) {
            healthy = false;
            throw new BrowserException("Chrome session lost during " + interaction, e);
        } catch (WebDriverException e) {
            log.debug("{} failed: {}", interaction, firstLine(e.getMessage()));
            return false;
        }
    }

    private void scrollToBottom() {
        driver.manage().timeouts().scriptTimeout(SCRIPT_TIMEOUT);
        driver.executeAsyncScript("""
                const doneCallback = arguments[arguments.length - 1];
                const startTime = Date.now();
                const maxScrollTime = 5000;
                const scrollStep = window.innerHeight / 2;
                const scrollInterval = 100;

                function scroll() {
                    if (window.innerHeight + window.scrollY >= document.body.offsetHeight) {
                        doneCallback();
                        return;
                    }
                    if (Date.now() - startTime > maxScrollTime) {
                        doneCallback();
                        return;
                    }
                    window.scrollBy(0, scrollStep);
                    setTimeout(scroll, scrollInterval);
                }

                scroll();
                """);
    }

    @Override
    public void waitForIdle(Duration timeout) {
        try {
            new WebDriverWait(driver, timeout).until(d ->
                    "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
        } catch (WebDriverException e) {
            log.debug("Page did not become idle within {}ms", timeout.toMillis());
        }
    }

    private Object eval(@Language("JavaScript") String script) {
        try {
            return driver.executeScript(script);
        } catch (NoSuchSessionException e) {
            healthy = false;
            throw new BrowserException("Chrome session lost", e);
        } catch (WebDriverException e) {
            throw new BrowserException("Script failed: " + firstLine(e.getMessage()), e);
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (healthy) {
            try {
                driver.get("about:blank");
            } catch (WebDriverException e) {
                healthy = false;
            }
        }
        onClose.accept(driver, healthy);
    }

    private static String firstLine(String message) {
        if (message == null) return "unknown error";
        int i = message.indexOf('\n');
        return i == -1 ? message : message.substring(0, i);
    }
}
