package org.netpreserve.pdfharvest.browser;

import org.netpreserve.pdfharvest.util.Url;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * A single page session.
 */
public interface Window extends AutoCloseable {

    /**
     * Loads the URL. On {@link NavigationTimedOutException} the window still holds the partially loaded page.
     */
    void navigateTo(Url url, Duration timeout) throws NavigationException;

    /**
     * The document title, or the empty string if it can't be read.
     */
    String title();

    /**
     * Absolute targets of every anchor currently in the document, in document order.
     */
    List<Url> extractLinks();

    void printToPdf(Path path, Duration timeout) throws ExportException;

    /**
     * Performs the interaction against the first element it matches.
     *
     * @return true if an element was found and the action went through
     */
    boolean perform(Interaction interaction);

    void waitForIdle(Duration timeout);

    @Override
    void close();
}
