package org.netpreserve.pdfharvest.browser;

import java.io.Closeable;

/**
 * A source of browser windows. Implementations must allow windows to be opened and used from
 * several threads at once, although each individual window is used by one thread at a time.
 */
public interface Browser extends Closeable {
    Window newWindow();
}
