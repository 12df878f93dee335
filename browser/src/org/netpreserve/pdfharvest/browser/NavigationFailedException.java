package org.netpreserve.pdfharvest.browser;

import org.netpreserve.pdfharvest.util.Url;

/**
 * The browser could not load the page at all (DNS failure, connection refused, error page).
 */
public class NavigationFailedException extends NavigationException {
    private final String errorText;

    public NavigationFailedException(Url url, String errorText, Throwable cause) {
        super(url, errorText, cause);
        this.errorText = errorText;
    }

    public String errorText() {
        return errorText;
    }
}
