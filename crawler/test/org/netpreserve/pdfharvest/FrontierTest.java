package org.netpreserve.pdfharvest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.pdfharvest.browser.Interaction;
import org.netpreserve.pdfharvest.config.RefreshMode;
import org.netpreserve.pdfharvest.util.NamedThreadFactory;
import org.netpreserve.pdfharvest.util.Url;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.pdfharvest.FakeBrowser.urls;

class FrontierTest {
    private static final Url PORTAL = new Url("https://portal.test/");

    @TempDir
    Path tempDir;

    private FakeBrowser browser;
    private HistoryStore history;
    private ExecutorService executor;
    private LinkFilter linkFilter;

    @BeforeEach
    void setUp() {
        browser = new FakeBrowser();
        history = new HistoryStore(tempDir.resolve("history.json"));
        history.load();
        executor = Executors.newFixedThreadPool(6, new NamedThreadFactory("test-page"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Frontier frontier(int maxDepth, int noNewLimit, int concurrency, RefreshMode mode) {
        return frontier(maxDepth, noNewLimit, concurrency, mode, new InteractionTable(Map.of(), Map.of(), Map.of()));
    }

    private Frontier frontier(int maxDepth, int noNewLimit, int concurrency, RefreshMode mode,
                              InteractionTable table) {
        linkFilter = new LinkFilter(List.of(), history);
        var processor = new PageProcessor(browser, new PolitenessController(Duration.ZERO, null),
                new ConcurrencyLimiter(concurrency), history, linkFilter, null, tempDir, Duration.ofSeconds(5),
                maxDepth);
        var revealDriver = new RevealDriver(mode, table, Duration.ZERO, Duration.ZERO);
        return new Frontier(PORTAL, maxDepth, noNewLimit, Duration.ZERO, linkFilter, processor, revealDriver,
                executor);
    }

    private Progress crawlPortal(Frontier frontier) throws InterruptedException {
        try (var portal = browser.newWindow()) {
            try {
                portal.navigateTo(PORTAL, Duration.ofSeconds(5));
            } catch (Exception e) {
                fail(e);
            }
            return frontier.crawl(portal);
        }
    }

    @Test
    void emptyPortalStopsAfterNoNewLimitRounds() throws Exception {
        var portal = browser.page(PORTAL.toString(), "Portal");

        var progress = crawlPortal(frontier(1, 3, 2, RefreshMode.NONE));

        assertEquals(3, portal.extractions.get());
        assertEquals(3, progress.rounds());
        assertEquals(0, progress.discovered());
    }

    @Test
    void depthIsBounded() throws Exception {
        browser.page(PORTAL.toString(), "Portal", "https://a.test/1");
        browser.page("https://a.test/1", "One", "https://a.test/2");
        browser.page("https://a.test/2", "Two", "https://a.test/3");
        browser.page("https://a.test/3", "Three", "https://a.test/4");

        var progress = crawlPortal(frontier(2, 1, 2, RefreshMode.NONE));

        assertEquals(1, browser.navigationsTo("https://a.test/1"));
        assertEquals(1, browser.navigationsTo("https://a.test/2"));
        assertEquals(0, browser.navigationsTo("https://a.test/3"));
        assertEquals(2, progress.saved());
        assertFalse(history.contains(new Url("https://a.test/3")));
    }

    @Test
    void linksFoundTwiceAreProcessedOnce() throws Exception {
        browser.page(PORTAL.toString(), "Portal", "https://a.test/1", "https://a.test/2", "https://a.test/1#dup");
        browser.page("https://a.test/1", "One", "https://a.test/shared", "https://a.test/2", PORTAL.toString());
        browser.page("https://a.test/2", "Two", "https://a.test/shared");
        browser.page("https://a.test/shared", "Shared");

        var progress = crawlPortal(frontier(3, 1, 2, RefreshMode.NONE));

        assertEquals(1, browser.navigationsTo("https://a.test/1"));
        assertEquals(1, browser.navigationsTo("https://a.test/2"));
        assertEquals(1, browser.navigationsTo("https://a.test/shared"));
        // only the portal window itself visits the portal
        assertEquals(1, browser.navigationsTo(PORTAL.toString()));
        assertEquals(3, progress.saved());
        assertEquals(3, progress.discovered());
    }

    @Test
    void levelCompletesBeforeNextStarts() throws Exception {
        browser.renderTime = Duration.ofMillis(50);
        var level1 = new ArrayList<String>();
        for (int i = 0; i < 6; i++) {
            String url = "https://a.test/l1/" + i;
            level1.add(url);
            browser.page(url, "L1 " + i, "https://a.test/l2/" + i);
            browser.page("https://a.test/l2/" + i, "L2 " + i);
        }
        browser.page(PORTAL.toString(), "Portal", level1.toArray(new String[0]));

        var progress = crawlPortal(frontier(2, 1, 3, RefreshMode.NONE));

        List<Url> order;
        synchronized (browser.navigations) {
            order = new ArrayList<>(browser.navigations);
        }
        int lastLevel1 = -1;
        int firstLevel2 = Integer.MAX_VALUE;
        for (int i = 0; i < order.size(); i++) {
            String url = order.get(i).toString();
            if (url.contains("/l1/")) lastLevel1 = Math.max(lastLevel1, i);
            if (url.contains("/l2/")) firstLevel2 = Math.min(firstLevel2, i);
        }
        assertTrue(lastLevel1 < firstLevel2, "level 2 started before level 1 finished: " + order);
        assertEquals(12, progress.saved());
        // the portal window plus at most three page windows
        assertTrue(browser.maxOpenWindows.get() <= 4, "too many windows: " + browser.maxOpenWindows.get());
    }

    @Test
    void failedPageDoesNotAbortSiblings() throws Exception {
        browser.page(PORTAL.toString(), "Portal", "https://a.test/ok1", "https://a.test/bad", "https://a.test/ok2");
        browser.page("https://a.test/ok1", "OK 1");
        browser.page("https://a.test/bad", "Bad").failNavigation = true;
        browser.page("https://a.test/ok2", "OK 2");

        var progress = crawlPortal(frontier(1, 1, 2, RefreshMode.NONE));

        assertEquals(2, progress.saved());
        assertEquals(1, progress.failed());
        assertTrue(history.contains(new Url("https://a.test/ok1")));
        assertTrue(history.contains(new Url("https://a.test/ok2")));
        assertFalse(history.contains(new Url("https://a.test/bad")));
    }

    @Test
    void newPortalLinksAfterRevealStartAnotherRound() throws Exception {
        var portal = browser.page(PORTAL.toString(), "Portal");
        var calls = new AtomicInteger();
        portal.links = () -> switch (calls.incrementAndGet()) {
            case 1 -> urls("https://a.test/1", "https://a.test/2");
            case 2 -> urls("https://a.test/1", "https://a.test/2", "https://a.test/3");
            default -> urls("https://a.test/1", "https://a.test/2", "https://a.test/3");
        };

        var progress = crawlPortal(frontier(1, 2, 2, RefreshMode.NONE));

        assertEquals(3, progress.saved());
        assertEquals(1, browser.navigationsTo("https://a.test/1"));
        assertEquals(1, browser.navigationsTo("https://a.test/3"));
        // two rounds with links, then two empty rounds
        assertEquals(4, progress.rounds());
    }

    @Test
    void historyUrlsAreNeverDispatched() throws Exception {
        history.record(new Url("https://a.test/old"), "old.pdf", "1");
        browser.page(PORTAL.toString(), "Portal", "https://a.test/old", "https://a.test/new");
        browser.page("https://a.test/new", "New");

        crawlPortal(frontier(1, 1, 2, RefreshMode.NONE));

        assertEquals(0, browser.navigationsTo("https://a.test/old"));
        assertEquals(1, browser.navigationsTo("https://a.test/new"));
    }

    @Test
    void emptyPortalClicksLoadMoreBeforeGivingUp() throws Exception {
        var loadMore = Interaction.clickText("Load more");
        var clicked = new AtomicBoolean();
        browser.interactionResult = interaction -> {
            if (!interaction.equals(loadMore)) return false;
            clicked.set(true);
            return true;
        };
        var portal = browser.page(PORTAL.toString(), "Portal");
        portal.links = () -> clicked.get() ? urls("https://a.test/1") : List.of();
        browser.page("https://a.test/1", "One");
        var table = new InteractionTable(Map.of(), Map.of(), Map.of("*", List.of(loadMore)));

        var progress = crawlPortal(frontier(1, 1, 2, RefreshMode.PULL, table));

        assertTrue(clicked.get());
        assertTrue(browser.performed.contains(loadMore));
        assertEquals(1, progress.saved());
        assertTrue(history.contains(new Url("https://a.test/1")));
    }

    @Test
    void paginationWithoutControlStillTerminates() throws Exception {
        var next = Interaction.clickCss("a.next");
        var portal = browser.page(PORTAL.toString(), "Portal");
        var table = new InteractionTable(Map.of(), Map.of("*", List.of(next)), Map.of());

        var progress = crawlPortal(frontier(1, 2, 2, RefreshMode.PAGINATION, table));

        assertEquals(2, progress.rounds());
        assertEquals(2, portal.extractions.get());
        assertEquals(2, browser.performed.stream().filter(next::equals).count());
        assertEquals(0, progress.discovered());
    }
}
