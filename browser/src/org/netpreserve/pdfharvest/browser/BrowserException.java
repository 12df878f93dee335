package org.netpreserve.pdfharvest.browser;

/**
 * The browser itself misbehaved: it could not be started, the session died, or a script failed.
 */
public class BrowserException extends RuntimeException {
    public BrowserException(String message, Throwable cause) {
        super(message, cause);
    }
}
