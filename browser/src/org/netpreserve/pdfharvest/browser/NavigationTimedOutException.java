package org.netpreserve.pdfharvest.browser;

import org.netpreserve.pdfharvest.util.Url;

/**
 * The page did not finish loading in time. The window keeps whatever had loaded so far.
 */
public class NavigationTimedOutException extends NavigationException {
    public NavigationTimedOutException(Url url, String message) {
        super(url, message);
    }
}
