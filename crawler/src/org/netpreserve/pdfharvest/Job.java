package org.netpreserve.pdfharvest;

import org.netpreserve.pdfharvest.browser.Browser;
import org.netpreserve.pdfharvest.browser.NavigationException;
import org.netpreserve.pdfharvest.browser.Window;
import org.netpreserve.pdfharvest.config.JobConfig;
import org.netpreserve.pdfharvest.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * One crawl of one portal: wires up the components for a {@link JobConfig} and runs the {@link Frontier}.
 */
public class Job implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Job.class);
    private final JobConfig config;
    private final Browser browser;
    private final InteractionTable interactions;
    private final HistoryStore history;
    private final ExecutorService executor;
    private final HttpClient httpClient;

    public Job(JobConfig config, Browser browser) throws IOException {
        this(config, browser, InteractionTable.load());
    }

    public Job(JobConfig config, Browser browser, InteractionTable interactions) {
        this.config = config;
        this.browser = browser;
        this.interactions = interactions;
        this.history = new HistoryStore(config.historyPath());
        this.executor = Executors.newFixedThreadPool(Math.max(config.concurrency() * 2, 2),
                new NamedThreadFactory("page"));
        this.httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(30))
                .build();
    }

    public Progress run() throws IOException, InterruptedException {
        Files.createDirectories(config.outputDir());
        Path historyDir = config.historyPath().toAbsolutePath().getParent();
        if (historyDir != null) Files.createDirectories(historyDir);
        history.load();

        var robotsTxtChecker = config.obeyRobots() ? new RobotsTxtChecker(httpClient, config.userAgent()) : null;
        var politeness = new PolitenessController(config.delayDuration(), robotsTxtChecker);
        var limiter = new ConcurrencyLimiter(config.concurrency());
        var linkFilter = new LinkFilter(config.prefixes(), history);
        var popupDismisser = config.dealCookie() ? new PopupDismisser(interactions) : null;
        var processor = new PageProcessor(browser, politeness, limiter, history, linkFilter, popupDismisser,
                config.outputDir(), config.timeout(), config.maxDepth());
        var revealDriver = new RevealDriver(config.refreshMode(), interactions, config.settle());
        var frontier = new Frontier(config.startUrl(), config.maxDepth(), config.noNewLimit(), config.backoff(),
                linkFilter, processor, revealDriver, executor);

        try (Window portal = browser.newWindow()) {
            log.info("Opening portal {} (timeout={}ms)", config.startUrl(), config.timeout().toMillis());
            try {
                portal.navigateTo(config.startUrl(), config.timeout());
            } catch (NavigationException e) {
                log.atWarn().addKeyValue("url", config.startUrl()).addKeyValue("stage", PageOutcome.Stage.NAVIGATION)
                        .log("Error navigating to portal: {}", e.getMessage());
            }
            if (popupDismisser != null) {
                popupDismisser.dismiss(portal, config.startUrl());
            }
            Progress progress = frontier.crawl(portal);
            log.atInfo().addKeyValue("discovered", progress.discovered())
                    .addKeyValue("saved", progress.saved())
                    .addKeyValue("failed", progress.failed())
                    .addKeyValue("robotsExcluded", progress.robotsExcluded())
                    .addKeyValue("rounds", progress.rounds())
                    .log("Task completed for {}", config.startUrl());
            return progress;
        }
    }

    public HistoryStore history() {
        return history;
    }

    public JobConfig config() {
        return config;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Page tasks still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
