package org.netpreserve.pdfharvest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.pdfharvest.util.Url;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.pdfharvest.FakeBrowser.urls;

class LinkFilterTest {
    @TempDir
    Path tempDir;

    private HistoryStore emptyHistory() {
        var history = new HistoryStore(tempDir.resolve("history.json"));
        history.load();
        return history;
    }

    @Test
    void prefixAllowListRejectsOtherLinks() {
        var filter = new LinkFilter(List.of("https://x.test/a/"), emptyHistory());
        var result = filter.filter(urls("https://x.test/b/1", "https://x.test/a/1"));
        assertEquals(urls("https://x.test/a/1"), result);
        assertEquals(1, filter.seenCount());
    }

    @Test
    void emptyAllowListAcceptsEverything() {
        var filter = new LinkFilter(List.of(), emptyHistory());
        assertEquals(2, filter.filter(urls("https://x.test/b/1", "https://y.test/")).size());
    }

    @Test
    void fragmentsAreStrippedAndDuplicatesDropped() {
        var filter = new LinkFilter(List.of(), emptyHistory());
        var first = filter.filter(urls("https://x.test/page#top", "https://x.test/page#bottom", "https://x.test/page"));
        assertEquals(urls("https://x.test/page"), first);

        // a link found again on another page is not emitted twice
        assertEquals(List.of(), filter.filter(urls("https://x.test/page", "https://x.test/page#again")));
    }

    @Test
    void processedUrlsAreRejected() {
        var history = emptyHistory();
        history.record(new Url("https://x.test/done"), "done.pdf", "abc");
        var filter = new LinkFilter(List.of(), history);
        assertEquals(urls("https://x.test/new"), filter.filter(urls("https://x.test/done#frag", "https://x.test/new")));
    }

    @Test
    void nonHttpLinksAreIgnored() {
        var filter = new LinkFilter(List.of(), emptyHistory());
        var links = new ArrayList<>(urls("mailto:someone@x.test", "javascript:void(0)", "ftp://x.test/file",
                "https://x.test/ok"));
        links.add(null);
        assertEquals(urls("https://x.test/ok"), filter.filter(links));
    }

    @Test
    void markSeenPreventsEmission() {
        var filter = new LinkFilter(List.of(), emptyHistory());
        assertTrue(filter.markSeen(new Url("https://portal.test/")));
        assertFalse(filter.markSeen(new Url("https://portal.test/#x")));
        assertEquals(List.of(), filter.filter(urls("https://portal.test/")));
    }
}
