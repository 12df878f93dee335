package org.netpreserve.pdfharvest;

import org.netpreserve.pdfharvest.browser.BrowserException;
import org.netpreserve.pdfharvest.browser.Interaction;
import org.netpreserve.pdfharvest.browser.Window;
import org.netpreserve.pdfharvest.config.RefreshMode;
import org.netpreserve.pdfharvest.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Tries to make the portal show more links: scrolls to the bottom, then depending on the refresh mode clicks a
 * "next page" or "load more" control.
 */
public class RevealDriver {
    private static final Logger log = LoggerFactory.getLogger(RevealDriver.class);
    private static final Duration IDLE_TIMEOUT = Duration.ofSeconds(4);
    private final RefreshMode mode;
    private final InteractionTable table;
    private final Duration settle;
    private final Duration scrollPause;

    public RevealDriver(RefreshMode mode, InteractionTable table, Duration settle) {
        this(mode, table, settle, Duration.ofMillis(600));
    }

    RevealDriver(RefreshMode mode, InteractionTable table, Duration settle, Duration scrollPause) {
        this.mode = mode;
        this.table = table;
        this.settle = settle;
        this.scrollPause = scrollPause;
    }

    /**
     * Whether {@link #attempt} clicks a control rather than only scrolling.
     */
    public boolean clicksControls() {
        return mode != RefreshMode.NONE;
    }

    /**
     * @return true if an interaction went through. With {@link RefreshMode#NONE} the scroll alone counts, so
     * this says nothing about whether new links actually appeared.
     */
    public boolean attempt(Window window, Url portal) throws InterruptedException {
        try {
            window.perform(Interaction.scrollToBottom());
            sleep(scrollPause);
        } catch (BrowserException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Failed to scroll to bottom: {}", e.toString());
        }

        return switch (mode) {
            case NONE -> true;
            case PAGINATION -> clickFirst(window, table.nextPageFor(portal));
            case PULL -> clickFirst(window, table.loadMoreFor(portal));
        };
    }

    private boolean clickFirst(Window window, List<Interaction> candidates) throws InterruptedException {
        for (Interaction candidate : candidates) {
            try {
                if (!window.perform(candidate)) continue;
            } catch (BrowserException e) {
                throw e;
            } catch (RuntimeException e) {
                log.debug("Reveal control {} failed: {}", candidate, e.toString());
                continue;
            }
            log.info("Refresh ({}): clicked {}", mode, candidate);
            sleep(settle);
            try {
                window.waitForIdle(IDLE_TIMEOUT);
            } catch (RuntimeException e) {
                log.debug("Page did not settle: {}", e.toString());
            }
            return true;
        }
        log.debug("Refresh ({}): no control matched", mode);
        return false;
    }

    private static void sleep(Duration duration) throws InterruptedException {
        if (!duration.isZero() && !duration.isNegative()) Thread.sleep(duration.toMillis());
    }
}
