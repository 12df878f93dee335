package org.netpreserve.pdfharvest.browser;

import org.jetbrains.annotations.Nullable;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.logging.Level;

/**
 * Pool of Chrome instances driven through Selenium. Each open window owns one driver; closed windows hand their
 * driver back for reuse unless it crashed, in which case it is quit and a fresh one is started on demand.
 */
public class ChromeBrowser implements Browser {
    private static final Logger log = LoggerFactory.getLogger(ChromeBrowser.class);
    private final ChromeOptions options;
    private final BlockingDeque<ChromeDriver> idleDrivers = new LinkedBlockingDeque<>();
    private final Set<ChromeDriver> allDrivers = ConcurrentHashMap.newKeySet();
    private volatile boolean closed = false;

    static {
        // suppress noisy selenium logging
        java.util.logging.Logger.getLogger("org.openqa.selenium").setLevel(Level.WARNING);
    }

    public ChromeBrowser(@Nullable String executable, List<String> arguments, @Nullable String userAgent) {
        options = new ChromeOptions();
        if (arguments != null) options.addArguments(arguments);
        if (executable != null) options.setBinary(executable);
        if (userAgent != null) options.addArguments("--user-agent=" + userAgent);
    }

    @Override
    public Window newWindow() {
        if (closed) throw new IllegalStateException("Browser is closed");
        ChromeDriver driver = idleDrivers.pollFirst();
        if (driver == null) {
            driver = startDriver();
        }
        return new ChromeWindow(driver, this::release);
    }

    private ChromeDriver startDriver() {
        try {
            var driver = new ChromeDriver(options);
            allDrivers.add(driver);
            log.debug("Started Chrome ({} running)", allDrivers.size());
            return driver;
        } catch (WebDriverException e) {
            throw new BrowserException("Failed to start Chrome", e);
        }
    }

    private void release(ChromeDriver driver, boolean healthy) {
        if (healthy && !closed) {
            idleDrivers.addFirst(driver);
        } else {
            if (!healthy) log.warn("Discarding crashed Chrome instance");
            quit(driver);
        }
    }

    private void quit(ChromeDriver driver) {
        allDrivers.remove(driver);
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.debug("Error quitting Chrome", e);
        }
    }

    @Override
    public void close() {
        closed = true;
        idleDrivers.clear();
        for (var driver : allDrivers) {
            quit(driver);
        }
    }
}
