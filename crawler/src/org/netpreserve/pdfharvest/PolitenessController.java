package org.netpreserve.pdfharvest;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.pdfharvest.util.Url;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Per-host request spacing plus the robots.txt gate.
 * <p>
 * {@link #waitTurn} reserves the caller's dispatch slot under a lock and then sleeps outside it, so two callers
 * for the same host always get slots at least {@code delay} apart while callers for other hosts are not held up.
 */
public class PolitenessController {
    private final long delayNanos;
    private final @Nullable RobotsTxtChecker robotsTxtChecker;
    private final Map<String, Long> lastDispatch = new HashMap<>(); // guarded by this

    /**
     * @param robotsTxtChecker null to ignore robots.txt
     */
    public PolitenessController(Duration delay, @Nullable RobotsTxtChecker robotsTxtChecker) {
        this.delayNanos = delay.toNanos();
        this.robotsTxtChecker = robotsTxtChecker;
    }

    public boolean allowed(Url url) throws InterruptedException {
        if (robotsTxtChecker == null) return true;
        return robotsTxtChecker.checkAllowed(url);
    }

    public void waitTurn(Url url) throws InterruptedException {
        long wait = reserve(keyFor(url));
        if (wait > 0) {
            TimeUnit.NANOSECONDS.sleep(wait);
        }
    }

    /**
     * Claims the next free slot for the host and returns how long the caller must wait for it.
     */
    synchronized long reserve(String host) {
        long now = System.nanoTime();
        Long last = lastDispatch.get(host);
        long slot = last == null ? now : Math.max(now, last + delayNanos);
        lastDispatch.put(host, slot);
        return slot - now;
    }

    private static String keyFor(Url url) {
        String host = url.hostAndPort();
        return host == null ? "" : host;
    }
}
