package org.netpreserve.pdfharvest;

import org.netpreserve.pdfharvest.browser.Window;
import org.netpreserve.pdfharvest.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Level-by-level crawl driven from the portal page.
 * <p>
 * Each round extracts new links from the portal and processes them as level 1. The links those pages yield form
 * level 2, and so on up to the maximum depth. A level starts only once every page of the previous level has
 * finished. After each round the {@link RevealDriver} tries to surface more links on the portal. When an extraction
 * comes up empty in a clicking refresh mode, the next-page or load-more control is tried and the portal re-extracted
 * before the round counts as empty. The crawl ends when {@code noNewLimit} consecutive portal extractions produce
 * nothing new.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    private final Url portalUrl;
    private final int maxDepth;
    private final int noNewLimit;
    private final Duration backoff;
    private final LinkFilter linkFilter;
    private final PageProcessor processor;
    private final RevealDriver revealDriver;
    private final ExecutorService executor;

    private final AtomicLong discovered = new AtomicLong();
    private final AtomicLong saved = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong robotsExcluded = new AtomicLong();
    private final AtomicLong rounds = new AtomicLong();

    public Frontier(Url portalUrl, int maxDepth, int noNewLimit, Duration backoff, LinkFilter linkFilter,
                    PageProcessor processor, RevealDriver revealDriver, ExecutorService executor) {
        this.portalUrl = portalUrl;
        this.maxDepth = maxDepth;
        this.noNewLimit = noNewLimit;
        this.backoff = backoff;
        this.linkFilter = linkFilter;
        this.processor = processor;
        this.revealDriver = revealDriver;
        this.executor = executor;
    }

    public Progress crawl(Window portal) throws InterruptedException {
        linkFilter.markSeen(portalUrl);
        int consecutiveEmpty = 0;
        while (true) {
            long round = rounds.incrementAndGet();
            log.info("Portal collection round {}", round);
            List<Url> links = extractPortalLinks(portal);

            boolean revealed = false;
            if (links.isEmpty()) {
                consecutiveEmpty++;
                log.info("No new links on portal ({} of {})", consecutiveEmpty, noNewLimit);
                if (revealDriver.clicksControls()) {
                    revealed = revealDriver.attempt(portal, portalUrl);
                    if (revealed) links = extractPortalLinks(portal);
                }
            }

            if (links.isEmpty()) {
                if (consecutiveEmpty >= noNewLimit) {
                    log.info("Portal appears exhausted after {} empty rounds, stopping", consecutiveEmpty);
                    break;
                }
                if (!revealDriver.clicksControls()) {
                    revealed = revealDriver.attempt(portal, portalUrl);
                }
                if (!revealed && !backoff.isZero()) {
                    Thread.sleep(backoff.toMillis());
                }
                continue;
            }

            consecutiveEmpty = 0;
            List<Url> level = links;
            int depth = 1;
            while (!level.isEmpty() && depth <= maxDepth) {
                level = processLevel(level, depth);
                depth++;
            }

            if (revealDriver.attempt(portal, portalUrl)) {
                log.debug("Reveal succeeded after batch, re-extracting portal");
            }
        }
        return progress();
    }

    private List<Url> extractPortalLinks(Window portal) {
        try {
            return linkFilter.filter(portal.extractLinks());
        } catch (RuntimeException e) {
            log.atWarn().addKeyValue("url", portalUrl).addKeyValue("stage", PageOutcome.Stage.EXTRACT)
                    .log("Failed to extract portal links: {}", e.toString());
            return List.of();
        }
    }

    /**
     * Processes every URL of a level concurrently and waits for all of them.
     *
     * @return the links for the next level
     */
    List<Url> processLevel(List<Url> level, int depth) throws InterruptedException {
        log.info("Processing {} links at level {}", level.size(), depth);
        discovered.addAndGet(level.size());
        var futures = new ArrayList<CompletableFuture<PageOutcome>>(level.size());
        for (Url url : level) {
            futures.add(CompletableFuture.supplyAsync(() -> processor.process(url, depth), executor));
        }

        var nextLevel = new ArrayList<Url>();
        try {
            for (var future : futures) {
                PageOutcome outcome;
                try {
                    outcome = future.get();
                } catch (ExecutionException e) {
                    failed.incrementAndGet();
                    log.error("Page task crashed", e.getCause());
                    continue;
                }
                if (outcome instanceof PageOutcome.Ok) {
                    saved.incrementAndGet();
                } else if (outcome instanceof PageOutcome.Excluded) {
                    robotsExcluded.incrementAndGet();
                } else {
                    failed.incrementAndGet();
                }
                nextLevel.addAll(outcome.links());
            }
        } catch (InterruptedException e) {
            for (var future : futures) {
                future.cancel(true);
            }
            throw e;
        }
        return nextLevel;
    }

    public Progress progress() {
        return new Progress(discovered.get(), saved.get(), failed.get(), robotsExcluded.get(), rounds.get());
    }
}
