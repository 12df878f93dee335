package org.netpreserve.pdfharvest;

import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRules.RobotRulesMode;
import crawlercommons.robots.SimpleRobotRulesParser;
import org.netpreserve.pdfharvest.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Fetches and caches robots.txt once per origin. Any failure to fetch is treated as allow-all.
 */
public class RobotsTxtChecker {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtChecker.class);
    private static final Duration FETCH_TIMEOUT = Duration.ofSeconds(30);
    private final HttpClient httpClient;
    private final String userAgent;
    private final Map<String, CompletableFuture<RobotsTxt>> cache = new ConcurrentHashMap<>();

    public RobotsTxtChecker(HttpClient httpClient, String userAgent) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
    }

    public boolean checkAllowed(Url url) throws InterruptedException {
        if (url.host() == null) return true;
        CompletableFuture<RobotsTxt> future = new CompletableFuture<>();
        CompletableFuture<RobotsTxt> existing = cache.putIfAbsent(url.origin(), future);
        if (existing == null) {
            // first caller for this origin fetches, everyone else waits on the same future
            try {
                future.complete(fetch(url.withPath("/robots.txt")));
            } catch (InterruptedException | RuntimeException e) {
                cache.remove(url.origin(), future);
                future.completeExceptionally(e);
                throw e;
            }
            existing = future;
        }
        try {
            return existing.get().allows(url);
        } catch (ExecutionException e) {
            log.atWarn().addKeyValue("url", url).setCause(e.getCause()).log("robots.txt lookup failed, allowing");
            return true;
        }
    }

    RobotsTxt fetch(Url robotsUrl) throws InterruptedException {
        URI robotsUri;
        try {
            robotsUri = robotsUrl.toURI();
        } catch (URISyntaxException e) {
            log.debug("Error parsing robots.txt URL: {}", robotsUrl, e);
            return new RobotsTxt(robotsUrl.toString(), -1, new SimpleRobotRules(RobotRulesMode.ALLOW_ALL));
        }
        int status;
        byte[] body;
        try {
            var response = httpClient.send(HttpRequest.newBuilder(robotsUri)
                    .timeout(FETCH_TIMEOUT)
                    .header("User-Agent", userAgent)
                    .build(), HttpResponse.BodyHandlers.ofByteArray());
            status = response.statusCode();
            body = response.body();
        } catch (IOException | IllegalArgumentException e) {
            log.atWarn().addKeyValue("url", robotsUrl).addKeyValue("stage", "ROBOTS")
                    .log("Failed to fetch robots.txt, allowing all: {}", e.toString());
            return new RobotsTxt(robotsUrl.toString(), -1, new SimpleRobotRules(RobotRulesMode.ALLOW_ALL));
        }

        if (status >= 200 && status < 300) {
            var parser = new SimpleRobotRulesParser();
            var rules = parser.parseContent(robotsUrl.toString(), body, "text/plain",
                    List.of(userAgent.toLowerCase(Locale.ROOT)));
            log.debug("Fetched {} ({} bytes)", robotsUrl, body.length);
            return new RobotsTxt(robotsUrl.toString(), status, rules);
        } else if (status == 401 || status == 403) {
            log.info("robots.txt at {} returned {}, treating as disallow all", robotsUrl, status);
            return new RobotsTxt(robotsUrl.toString(), status, new SimpleRobotRules(RobotRulesMode.ALLOW_NONE));
        } else if (status >= 500) {
            log.atWarn().addKeyValue("url", robotsUrl).addKeyValue("stage", "ROBOTS")
                    .log("robots.txt returned {}, allowing all", status);
        }
        // not found or otherwise unusable, treat as blank
        return new RobotsTxt(robotsUrl.toString(), status, new SimpleRobotRules(RobotRulesMode.ALLOW_ALL));
    }
}
