package org.netpreserve.pdfharvest;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pdfharvest.PageOutcome.Stage;
import org.netpreserve.pdfharvest.browser.Browser;
import org.netpreserve.pdfharvest.browser.ExportException;
import org.netpreserve.pdfharvest.browser.NavigationException;
import org.netpreserve.pdfharvest.browser.NavigationTimedOutException;
import org.netpreserve.pdfharvest.browser.Window;
import org.netpreserve.pdfharvest.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Saves a single page as a PDF and returns the links found on it.
 * <p>
 * Never throws: every failure becomes a {@link PageOutcome.Err} naming the stage it happened in, so one page can't
 * take down the others in its level. The concurrency slot and the browser window are always released.
 */
public class PageProcessor {
    private static final Logger log = LoggerFactory.getLogger(PageProcessor.class);
    private final Browser browser;
    private final PolitenessController politeness;
    private final ConcurrencyLimiter limiter;
    private final HistoryStore history;
    private final LinkFilter linkFilter;
    private final @Nullable PopupDismisser popupDismisser;
    private final Path outputDir;
    private final Duration timeout;
    private final int maxDepth;

    /**
     * @param popupDismisser null to leave popups alone
     */
    public PageProcessor(Browser browser, PolitenessController politeness, ConcurrencyLimiter limiter,
                         HistoryStore history, LinkFilter linkFilter, @Nullable PopupDismisser popupDismisser,
                         Path outputDir, Duration timeout, int maxDepth) {
        this.browser = browser;
        this.politeness = politeness;
        this.limiter = limiter;
        this.history = history;
        this.linkFilter = linkFilter;
        this.popupDismisser = popupDismisser;
        this.outputDir = outputDir;
        this.timeout = timeout;
        this.maxDepth = maxDepth;
    }

    public PageOutcome process(Url url, int depth) {
        try {
            if (!politeness.allowed(url)) {
                log.atInfo().addKeyValue("url", url).log("Disallowed by robots.txt");
                return new PageOutcome.Excluded(url);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(url, Stage.INTERRUPTED, "interrupted while checking robots.txt");
        } catch (RuntimeException e) {
            log.atWarn().addKeyValue("url", url).addKeyValue("stage", Stage.ROBOTS).setCause(e)
                    .log("robots.txt check failed, allowing");
        }

        try (var permit = limiter.acquire()) {
            politeness.waitTurn(url);
            return render(url, depth);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(url, Stage.INTERRUPTED, "interrupted");
        }
    }

    private PageOutcome render(Url url, int depth) throws InterruptedException {
        Window window;
        try {
            window = browser.newWindow();
        } catch (RuntimeException e) {
            return failed(url, Stage.OPEN, e.toString());
        }
        try (window) {
            log.atInfo().addKeyValue("url", url).addKeyValue("depth", depth).log("Opening page");
            try {
                window.navigateTo(url, timeout);
            } catch (NavigationTimedOutException e) {
                log.atWarn().addKeyValue("url", url).addKeyValue("stage", Stage.NAVIGATION)
                        .log("Navigation timed out, saving what has loaded");
            } catch (NavigationException e) {
                return failed(url, Stage.NAVIGATION, e.getMessage());
            } catch (RuntimeException e) {
                return failed(url, Stage.NAVIGATION, e.toString());
            }

            if (popupDismisser != null) {
                try {
                    popupDismisser.dismiss(window, url);
                } catch (RuntimeException e) {
                    log.debug("Popup dismissal failed on {}: {}", url, e.toString());
                }
            }

            String fingerprint = ArtifactNames.fingerprint(url);
            String filename = ArtifactNames.filenameFor(window.title(), fingerprint);
            String exportError = null;
            try {
                window.printToPdf(outputDir.resolve(filename), timeout);
            } catch (ExportException e) {
                exportError = e.getMessage();
            } catch (RuntimeException e) {
                exportError = e.toString();
            }

            boolean persisted = false;
            if (exportError == null) {
                log.atInfo().addKeyValue("url", url).addKeyValue("file", filename).log("Saved PDF");
                persisted = history.record(url, filename, fingerprint);
            }

            List<Url> links = depth < maxDepth ? extractLinks(window, url) : List.of();
            if (exportError != null) {
                failed(url, Stage.EXPORT, exportError);
                return new PageOutcome.Err(url, Stage.EXPORT, exportError, links);
            }
            return new PageOutcome.Ok(url, links, persisted);
        }
    }

    private List<Url> extractLinks(Window window, Url url) {
        try {
            List<Url> links = linkFilter.filter(window.extractLinks());
            log.debug("{} new links on {}", links.size(), url);
            return links;
        } catch (RuntimeException e) {
            log.atWarn().addKeyValue("url", url).addKeyValue("stage", Stage.EXTRACT)
                    .log("Failed to extract links: {}", e.toString());
            return List.of();
        }
    }

    private static PageOutcome failed(Url url, Stage stage, String message) {
        log.atWarn().addKeyValue("url", url).addKeyValue("stage", stage).log("Page failed: {}", message);
        return new PageOutcome.Err(url, stage, message);
    }
}
