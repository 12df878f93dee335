package org.netpreserve.pdfharvest;

import org.netpreserve.pdfharvest.util.Url;

import java.util.List;

/**
 * Result of processing one page.
 */
public sealed interface PageOutcome {
    enum Stage {
        ROBOTS, OPEN, NAVIGATION, EXPORT, PERSIST, EXTRACT, INTERRUPTED
    }

    Url url();

    /**
     * Links for the next level.
     */
    default List<Url> links() {
        return List.of();
    }

    /**
     * The PDF was written.
     *
     * @param persisted false if the history file could not be updated
     */
    record Ok(Url url, List<Url> links, boolean persisted) implements PageOutcome {
    }

    /**
     * Disallowed by robots.txt, nothing was fetched.
     */
    record Excluded(Url url) implements PageOutcome {
    }

    /**
     * @param links still followed when only the export failed
     */
    record Err(Url url, Stage stage, String message, List<Url> links) implements PageOutcome {
        public Err(Url url, Stage stage, String message) {
            this(url, stage, message, List.of());
        }
    }
}
