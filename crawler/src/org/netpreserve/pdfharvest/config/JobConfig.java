package org.netpreserve.pdfharvest.config;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import org.netpreserve.pdfharvest.util.DurationDeserializer;
import org.netpreserve.pdfharvest.util.Url;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Configuration for one portal crawl.
 *
 * @param startUrl    the portal page whose links seed the crawl
 * @param outputDir   directory PDFs are written to
 * @param historyPath JSON file recording every URL already saved
 * @param concurrency maximum number of pages rendered at once
 * @param maxDepth    deepest link level to save, counting the portal's own links as level 1
 * @param timeout     page load timeout, also used to bound PDF export
 * @param delay       minimum seconds between two requests to the same host
 * @param prefixes    only follow links starting with one of these (empty allows everything)
 * @param refreshMode how to reveal more links once the portal yields nothing new
 * @param obeyRobots  whether to honour robots.txt
 * @param noNewLimit  consecutive empty portal rounds before giving up
 * @param dealCookie  whether to try dismissing cookie banners before saving
 * @param verbose     log at debug level while this job runs
 * @param userAgent   robots.txt agent name, also sent as the User-Agent
 * @param settle      pause after a successful reveal click
 * @param backoff     pause between empty portal rounds
 * @param browser     browser to render with
 */
public record JobConfig(
        @JsonProperty("start_url") Url startUrl,
        @JsonProperty("output_dir") @JsonSerialize(using = ToStringSerializer.class) Path outputDir,
        @JsonProperty("history_path") @JsonSerialize(using = ToStringSerializer.class) Path historyPath,
        int concurrency,
        @JsonProperty("max_depth") int maxDepth,
        @JsonDeserialize(using = DurationDeserializer.class) Duration timeout,
        double delay,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> prefixes,
        @JsonProperty("refresh_mode") RefreshMode refreshMode,
        @JsonProperty("obey_robot") boolean obeyRobots,
        @JsonProperty("no_new_limit") int noNewLimit,
        @JsonProperty("deal_cookie") boolean dealCookie,
        boolean verbose,
        @JsonProperty("user_agent") String userAgent,
        @JsonDeserialize(using = DurationDeserializer.class) Duration settle,
        @JsonDeserialize(using = DurationDeserializer.class) Duration backoff,
        BrowserConfig browser
) {
    public Duration delayDuration() {
        return Duration.ofNanos((long) (delay * 1_000_000_000L));
    }
}
