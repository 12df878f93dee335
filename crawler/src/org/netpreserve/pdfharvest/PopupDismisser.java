package org.netpreserve.pdfharvest;

import org.netpreserve.pdfharvest.browser.BrowserException;
import org.netpreserve.pdfharvest.browser.Interaction;
import org.netpreserve.pdfharvest.browser.Window;
import org.netpreserve.pdfharvest.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Clicks away cookie banners and similar overlays so they don't end up in the PDF.
 */
public class PopupDismisser {
    private static final Logger log = LoggerFactory.getLogger(PopupDismisser.class);
    private final InteractionTable table;
    private final Duration pause;

    public PopupDismisser(InteractionTable table) {
        this(table, Duration.ofMillis(300));
    }

    PopupDismisser(InteractionTable table, Duration pause) {
        this.table = table;
        this.pause = pause;
    }

    /**
     * Tries every dismiss control known for the page's origin, then the defaults.
     *
     * @return the number of controls clicked
     */
    public int dismiss(Window window, Url url) throws InterruptedException {
        int clicked = 0;
        for (Interaction interaction : table.dismissFor(url)) {
            try {
                if (window.perform(interaction)) {
                    log.debug("Dismissed popup on {} with {}", url, interaction);
                    clicked++;
                    if (!pause.isZero()) Thread.sleep(pause.toMillis());
                }
            } catch (BrowserException e) {
                throw e;
            } catch (RuntimeException e) {
                log.debug("Popup control {} failed on {}: {}", interaction, url, e.toString());
            }
        }
        return clicked;
    }
}
